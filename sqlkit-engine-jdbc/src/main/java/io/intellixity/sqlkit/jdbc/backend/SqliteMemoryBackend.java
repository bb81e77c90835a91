package io.intellixity.sqlkit.jdbc.backend;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.sqlkit.config.DatabaseOptions;
import io.intellixity.sqlkit.descriptor.BackendKind;
import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.error.ConfigurationException;
import io.intellixity.sqlkit.jdbc.dialect.SqlDialect;
import io.intellixity.sqlkit.jdbc.dialect.SqliteDialect;

/**
 * In-memory SQLite.
 * <p>
 * Every SQLite connection to {@code :memory:} opens a fresh, empty database, so the pool is pinned to one
 * connection that is never retired. A second concurrent session waits for the first to finish.
 */
final class SqliteMemoryBackend implements Backend {
  private final SqlDialect dialect = new SqliteDialect();

  @Override public BackendKind kind() { return BackendKind.SQLITE_MEMORY; }
  @Override public SqlDialect dialect() { return dialect; }
  @Override public String jdbcUrl(ResolvedDescriptor descriptor) { return "jdbc:sqlite::memory:"; }

  @Override
  public void ensureExists(ResolvedDescriptor descriptor, boolean mustExist) {
    if (mustExist) {
      throw new ConfigurationException("mustExist=true not valid for in-memory SQLite database");
    }
  }

  @Override
  public HikariConfig poolConfig(ResolvedDescriptor descriptor, DatabaseOptions options) {
    HikariConfig hc = Backend.super.poolConfig(descriptor, options);
    hc.setMaximumPoolSize(1);
    hc.setMinimumIdle(1);
    hc.setMaxLifetime(0);
    hc.setIdleTimeout(0);
    return hc;
  }

  /** The data lived in the engine's only connection, which is already closed. */
  @Override
  public void drop(ResolvedDescriptor descriptor) {
  }
}
