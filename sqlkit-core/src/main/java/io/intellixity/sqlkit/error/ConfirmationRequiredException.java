package io.intellixity.sqlkit.error;

/** Raised when a destructive operation is attempted without explicit confirmation. */
public final class ConfirmationRequiredException extends SqlkitException {
  public ConfirmationRequiredException(String message) {
    super(message);
  }
}
