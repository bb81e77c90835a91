package io.intellixity.sqlkit.error;

/**
 * Raised for a semantically invalid combination of inputs, e.g. a relative SQLite path or
 * {@code mustExist=true} on an in-memory database.
 */
public final class ConfigurationException extends SqlkitException {
  public ConfigurationException(String message) {
    super(message);
  }
}
