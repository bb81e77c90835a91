package io.intellixity.sqlkit.error;

/** Raised when a serialized message file is missing or cannot be parsed. */
public final class DeserializationException extends SqlkitException {
  public DeserializationException(String message) {
    super(message);
  }

  public DeserializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
