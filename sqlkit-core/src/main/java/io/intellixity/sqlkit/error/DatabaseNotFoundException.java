package io.intellixity.sqlkit.error;

/** Raised when {@code mustExist} is set and the target database is absent. */
public final class DatabaseNotFoundException extends SqlkitException {
  private final String url;

  public DatabaseNotFoundException(String url) {
    super("Database not found: '" + url + "'");
    this.url = url;
  }

  public String url() { return url; }
}
