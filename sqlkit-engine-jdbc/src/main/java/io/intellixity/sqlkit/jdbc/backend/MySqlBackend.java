package io.intellixity.sqlkit.jdbc.backend;

import io.intellixity.sqlkit.descriptor.BackendKind;
import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.jdbc.dialect.MySqlDialect;
import io.intellixity.sqlkit.jdbc.dialect.SqlDialect;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** MySQL server. A database is a schema in {@code INFORMATION_SCHEMA.SCHEMATA}. */
final class MySqlBackend extends AbstractServerBackend {
  private final SqlDialect dialect = new MySqlDialect();

  @Override public BackendKind kind() { return BackendKind.MYSQL; }
  @Override public SqlDialect dialect() { return dialect; }

  @Override
  public String jdbcUrl(ResolvedDescriptor descriptor) {
    return "jdbc:mysql://" + hostPort(descriptor) + "/" + descriptor.database() + queryString(descriptor);
  }

  @Override
  protected String serverUrl(ResolvedDescriptor descriptor) {
    return "jdbc:mysql://" + hostPort(descriptor) + "/" + queryString(descriptor);
  }

  @Override
  protected String existsSql() {
    return "SELECT SCHEMA_NAME FROM INFORMATION_SCHEMA.SCHEMATA WHERE SCHEMA_NAME = ?";
  }

  /** {@code charset=utf8} (and utf8mb4) is spelled {@code characterEncoding=UTF-8} for Connector/J. */
  @Override
  protected Map<String, String> driverParams(ResolvedDescriptor descriptor) {
    Map<String, String> out = new LinkedHashMap<>();
    for (var e : descriptor.params().entrySet()) {
      if (e.getKey().equals("charset") && e.getValue().toLowerCase(Locale.ROOT).startsWith("utf8")) {
        out.put("characterEncoding", "UTF-8");
      } else {
        out.put(e.getKey(), e.getValue());
      }
    }
    return out;
  }
}
