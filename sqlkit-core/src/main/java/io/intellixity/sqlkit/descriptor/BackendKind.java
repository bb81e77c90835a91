package io.intellixity.sqlkit.descriptor;

/** Closed set of storage backends a descriptor can resolve to. */
public enum BackendKind {
  /** Private SQLite database living in memory for the lifetime of its engine. */
  SQLITE_MEMORY("sqlite", false),

  /** SQLite database stored in a single file at an absolute path. */
  SQLITE_FILE("sqlite", false),

  /** MySQL server; the database is one schema on the server. */
  MYSQL("mysql", true),

  /** PostgreSQL server; the database is one catalog on the server. */
  POSTGRESQL("postgresql", true);

  private final String scheme;
  private final boolean networked;

  BackendKind(String scheme, boolean networked) {
    this.scheme = scheme;
    this.networked = networked;
  }

  /** Descriptor scheme, without the {@code ://} separator. */
  public String scheme() { return scheme; }

  public boolean networked() { return networked; }
}
