package io.intellixity.sqlkit.error;

/** Raised when an indirect ({@code file://}) descriptor cannot be followed. */
public final class ResolutionException extends SqlkitException {
  public ResolutionException(String message) {
    super(message);
  }

  public ResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
