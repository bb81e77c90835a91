package io.intellixity.sqlkit.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import io.intellixity.sqlkit.config.DatabaseOptions;
import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.error.BackendException;
import io.intellixity.sqlkit.jdbc.backend.Backend;
import io.intellixity.sqlkit.jdbc.backend.Backends;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds a pooled {@link JdbcHandle} for a resolved descriptor.
 * <p>
 * The backend first checks for (and, unless {@code mustExist}, creates) the target database. One connection
 * is then opened and closed straight away so that lazy side effects, such as SQLite creating its file,
 * happen before the handle is returned.
 */
public final class EngineFactory {
  private static final Logger log = LoggerFactory.getLogger(EngineFactory.class);
  private static final AtomicLong SEQ = new AtomicLong();

  private final DatabaseOptions options;

  public EngineFactory() {
    this(DatabaseOptions.defaults());
  }

  public EngineFactory(DatabaseOptions options) {
    this.options = (options == null) ? DatabaseOptions.defaults() : options;
  }

  public JdbcHandle build(ResolvedDescriptor descriptor, boolean mustExist) {
    Backend backend = Backends.of(descriptor.kind());
    backend.ensureExists(descriptor, mustExist);

    String id = handleId(descriptor);
    HikariConfig hc = backend.poolConfig(descriptor, options);
    hc.setPoolName("sqlkit-" + id);
    HikariDataSource ds;
    try {
      ds = new HikariDataSource(hc);
    } catch (HikariPool.PoolInitializationException e) {
      // Hikari opens its first connection eagerly; surface driver failures like any other.
      if (e.getCause() instanceof SQLException se) {
        throw new BackendException("Failed to connect to '" + descriptor.redactedUrl() + "'", se);
      }
      throw e;
    }

    try (Connection ignored = ds.getConnection()) {
      log.debug("sqlkit.engine_probe handleId={} ok", id);
    } catch (SQLException e) {
      ds.close();
      throw new BackendException("Failed to connect to '" + descriptor.redactedUrl() + "'", e);
    }

    log.info("sqlkit.engine_created handleId={} backend={} maxPoolSize={}",
        id, descriptor.kind(), hc.getMaximumPoolSize());
    return new JdbcHandle(id, ds, descriptor, backend, options.echo());
  }

  private static String handleId(ResolvedDescriptor d) {
    String target = switch (d.kind()) {
      case SQLITE_MEMORY -> "memory";
      case SQLITE_FILE -> String.valueOf(d.path().getFileName());
      case MYSQL, POSTGRESQL -> d.host() + "/" + d.database();
    };
    return d.kind().scheme() + ":" + target + "#" + SEQ.incrementAndGet();
  }
}
