package io.intellixity.sqlkit.jdbc.backend;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.sqlkit.config.DatabaseOptions;
import io.intellixity.sqlkit.descriptor.BackendKind;
import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.error.DatabaseNotFoundException;
import io.intellixity.sqlkit.error.SqlkitException;
import io.intellixity.sqlkit.jdbc.dialect.SqlDialect;
import io.intellixity.sqlkit.jdbc.dialect.SqliteDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** SQLite database in a single file. The file itself is created by the first connection. */
final class SqliteFileBackend implements Backend {
  private static final Logger log = LoggerFactory.getLogger(SqliteFileBackend.class);
  private static final String BUSY_TIMEOUT_MS = "30000";
  private static final String[] SIDE_FILES = {"-journal", "-wal", "-shm"};

  private final SqlDialect dialect = new SqliteDialect();

  @Override public BackendKind kind() { return BackendKind.SQLITE_FILE; }
  @Override public SqlDialect dialect() { return dialect; }
  @Override public String jdbcUrl(ResolvedDescriptor descriptor) { return "jdbc:sqlite:" + descriptor.path(); }

  @Override
  public void ensureExists(ResolvedDescriptor descriptor, boolean mustExist) {
    Path path = descriptor.path();
    if (Files.isRegularFile(path)) return;
    if (mustExist) throw new DatabaseNotFoundException(descriptor.redactedUrl());

    Path parent = path.getParent();
    if (parent == null) return;
    try {
      Files.createDirectories(parent);
    } catch (IOException e) {
      throw new SqlkitException("Failed to create directory '" + parent + "' for SQLite database", e);
    }
  }

  @Override
  public HikariConfig poolConfig(ResolvedDescriptor descriptor, DatabaseOptions options) {
    HikariConfig hc = Backend.super.poolConfig(descriptor, options);
    // Pooled connections to one file contend for its write lock; wait instead of failing with SQLITE_BUSY.
    hc.addDataSourceProperty("busy_timeout", BUSY_TIMEOUT_MS);
    return hc;
  }

  @Override
  public void drop(ResolvedDescriptor descriptor) {
    Path path = descriptor.path();
    if (!Files.isRegularFile(path)) throw new DatabaseNotFoundException(descriptor.redactedUrl());
    try {
      Files.delete(path);
      for (String side : SIDE_FILES) {
        Files.deleteIfExists(path.resolveSibling(path.getFileName() + side));
      }
    } catch (IOException e) {
      throw new SqlkitException("Failed to delete SQLite database '" + path + "'", e);
    }
    log.info("sqlkit.drop sqlite file={}", path);
  }
}
