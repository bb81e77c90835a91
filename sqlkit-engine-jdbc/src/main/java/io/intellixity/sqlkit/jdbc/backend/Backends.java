package io.intellixity.sqlkit.jdbc.backend;

import io.intellixity.sqlkit.descriptor.BackendKind;

/** Selects the backend implementation for a {@link BackendKind}. */
public final class Backends {
  private static final Backend SQLITE_MEMORY = new SqliteMemoryBackend();
  private static final Backend SQLITE_FILE = new SqliteFileBackend();
  private static final Backend MYSQL = new MySqlBackend();
  private static final Backend POSTGRESQL = new PostgresBackend();

  private Backends() {}

  public static Backend of(BackendKind kind) {
    return switch (kind) {
      case SQLITE_MEMORY -> SQLITE_MEMORY;
      case SQLITE_FILE -> SQLITE_FILE;
      case MYSQL -> MYSQL;
      case POSTGRESQL -> POSTGRESQL;
    };
  }
}
