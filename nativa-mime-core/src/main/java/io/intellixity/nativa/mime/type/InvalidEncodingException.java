package io.intellixity.nativa.mime.type;

/** Raised for a transfer encoding other than 7bit, 8bit, quoted-printable or base64. */
public final class InvalidEncodingException extends IllegalArgumentException {
  private final String encoding;

  public InvalidEncodingException(String encoding) {
    super("Invalid Encoding " + (encoding == null ? "null" : "\"" + encoding + "\""));
    this.encoding = encoding;
  }

  public String encoding() { return encoding; }
}
