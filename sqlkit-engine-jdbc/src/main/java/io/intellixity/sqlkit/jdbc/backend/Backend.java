package io.intellixity.sqlkit.jdbc.backend;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.sqlkit.config.DatabaseOptions;
import io.intellixity.sqlkit.descriptor.BackendKind;
import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.error.UnsupportedDatabaseOperationException;
import io.intellixity.sqlkit.jdbc.dialect.SqlDialect;

/**
 * Everything that differs between storage backends: how to reach them, how to check for and create the
 * target database, how to destroy it, and which SQL dialect they speak.
 * <p>
 * There is exactly one implementation per {@link BackendKind}; see {@link Backends#of(BackendKind)}.
 */
public interface Backend {
  BackendKind kind();

  SqlDialect dialect();

  String jdbcUrl(ResolvedDescriptor descriptor);

  /**
   * Make sure the target database exists.
   *
   * @throws io.intellixity.sqlkit.error.DatabaseNotFoundException if absent and {@code mustExist}
   * @throws io.intellixity.sqlkit.error.ConfigurationException    if {@code mustExist} makes no sense here
   */
  void ensureExists(ResolvedDescriptor descriptor, boolean mustExist);

  /** Pool settings for the engine. Credentials come from the descriptor, never from the URL. */
  default HikariConfig poolConfig(ResolvedDescriptor descriptor, DatabaseOptions options) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(jdbcUrl(descriptor));
    if (descriptor.user() != null) hc.setUsername(descriptor.user());
    if (descriptor.password() != null) hc.setPassword(descriptor.password());
    hc.setMaximumPoolSize(options.maximumPoolSize());
    hc.setConnectionTimeout(options.connectionTimeoutMs());
    return hc;
  }

  /**
   * Irreversibly destroy the target database. The engine has already been closed when this is called.
   */
  default void drop(ResolvedDescriptor descriptor) {
    throw new UnsupportedDatabaseOperationException("DROP", descriptor.redactedUrl());
  }
}
