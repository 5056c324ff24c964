package io.intellixity.nativa.mime.type;

/**
 * Raised when a content type string is not of the form {@code media/subtype}.
 */
public final class InvalidContentTypeException extends IllegalArgumentException {
  private final String typeString;

  public InvalidContentTypeException(String typeString) {
    super("Invalid Content-Type " + (typeString == null ? "null" : "\"" + typeString + "\""));
    this.typeString = typeString;
  }

  public String typeString() { return typeString; }
}
