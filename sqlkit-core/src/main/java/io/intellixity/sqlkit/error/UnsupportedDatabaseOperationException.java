package io.intellixity.sqlkit.error;

/** Raised when an operation is not defined for the backend it was invoked on. */
public final class UnsupportedDatabaseOperationException extends SqlkitException {
  public UnsupportedDatabaseOperationException(String operation, String url) {
    super("Unsupported operation " + operation + " for database: '" + url + "'");
  }
}
