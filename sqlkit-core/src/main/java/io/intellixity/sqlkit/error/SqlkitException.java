package io.intellixity.sqlkit.error;

/**
 * Root of the sqlkit exception hierarchy.
 * <p>
 * All failures raised by this library are unchecked; callers catch the specific subtype they care about.
 */
public class SqlkitException extends RuntimeException {
  public SqlkitException(String message) {
    super(message);
  }

  public SqlkitException(String message, Throwable cause) {
    super(message, cause);
  }
}
