package io.intellixity.nativa.mime.registry;

/** Raised by a {@link TypeLoader} when its source cannot be read or contains an invalid definition. */
public final class TypeLoadException extends RuntimeException {
  public TypeLoadException(String message) {
    super(message);
  }

  public TypeLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
