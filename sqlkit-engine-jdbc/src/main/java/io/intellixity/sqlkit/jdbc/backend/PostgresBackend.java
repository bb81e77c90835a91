package io.intellixity.sqlkit.jdbc.backend;

import io.intellixity.sqlkit.descriptor.BackendKind;
import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.jdbc.dialect.PostgresDialect;
import io.intellixity.sqlkit.jdbc.dialect.SqlDialect;

/**
 * PostgreSQL server. Existence is checked in {@code pg_database} from the {@code postgres} maintenance
 * database, since the target cannot be connected to before it exists.
 */
final class PostgresBackend extends AbstractServerBackend {
  static final String MAINTENANCE_DATABASE = "postgres";

  private final SqlDialect dialect = new PostgresDialect();

  @Override public BackendKind kind() { return BackendKind.POSTGRESQL; }
  @Override public SqlDialect dialect() { return dialect; }

  @Override
  public String jdbcUrl(ResolvedDescriptor descriptor) {
    return "jdbc:postgresql://" + hostPort(descriptor) + "/" + descriptor.database() + queryString(descriptor);
  }

  @Override
  protected String serverUrl(ResolvedDescriptor descriptor) {
    return "jdbc:postgresql://" + hostPort(descriptor) + "/" + MAINTENANCE_DATABASE + queryString(descriptor);
  }

  @Override
  protected String existsSql() {
    return "SELECT 1 FROM pg_database WHERE datname = ?";
  }
}
