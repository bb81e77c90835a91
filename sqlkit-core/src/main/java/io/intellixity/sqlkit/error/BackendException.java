package io.intellixity.sqlkit.error;

import java.sql.SQLException;

/**
 * Unchecked carrier for driver failures (connection drops, constraint violations, bad SQL).
 * <p>
 * The original {@link SQLException} is always the cause; nothing is retried.
 */
public final class BackendException extends SqlkitException {
  public BackendException(String message, SQLException cause) {
    super(message + ": " + cause.getMessage(), cause);
  }

  public BackendException(SQLException cause) {
    super(cause.getMessage(), cause);
  }

  /** SQLState reported by the driver, or null. */
  public String sqlState() {
    return ((SQLException) getCause()).getSQLState();
  }
}
