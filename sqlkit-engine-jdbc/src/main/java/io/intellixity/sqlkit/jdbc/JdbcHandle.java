package io.intellixity.sqlkit.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.exec.handle.EngineHandle;
import io.intellixity.sqlkit.jdbc.backend.Backend;
import io.intellixity.sqlkit.jdbc.dialect.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC engine handle: a HikariCP pool bound to exactly one resolved descriptor. */
public final class JdbcHandle implements EngineHandle<DataSource> {
  private static final Logger log = LoggerFactory.getLogger(JdbcHandle.class);

  private final String id;
  private final HikariDataSource client;
  private final ResolvedDescriptor descriptor;
  private final Backend backend;
  private final boolean echo;

  JdbcHandle(String id, HikariDataSource client, ResolvedDescriptor descriptor, Backend backend, boolean echo) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.echo = echo;
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public ResolvedDescriptor descriptor() { return descriptor; }
  @Override public boolean isClosed() { return client.isClosed(); }

  public Backend backend() { return backend; }
  public SqlDialect dialect() { return backend.dialect(); }

  /** True if statements should be logged at INFO rather than DEBUG. */
  public boolean echo() { return echo; }

  @Override
  public void close() {
    if (client.isClosed()) return;
    client.close();
    log.info("sqlkit.engine_closed handleId={}", id);
  }

  @Override
  public String toString() {
    return "JdbcHandle[" + id + "]";
  }
}
