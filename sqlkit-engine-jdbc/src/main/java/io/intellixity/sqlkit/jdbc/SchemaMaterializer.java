package io.intellixity.sqlkit.jdbc;

import io.intellixity.sqlkit.error.BackendException;
import io.intellixity.sqlkit.jdbc.dialect.SqlDialect;
import io.intellixity.sqlkit.schema.SchemaDefinition;
import io.intellixity.sqlkit.schema.TableDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/** Creates the tables of a schema that do not exist yet. Existing tables are never altered. */
final class SchemaMaterializer {
  private static final Logger log = LoggerFactory.getLogger(SchemaMaterializer.class);

  private SchemaMaterializer() {}

  /** Returns the names of the tables that were created. */
  static List<String> materialize(JdbcHandle handle, SchemaDefinition schema) {
    SqlDialect dialect = handle.dialect();
    List<String> created = new ArrayList<>();
    try (Connection c = handle.client().getConnection()) {
      c.setAutoCommit(true);
      for (TableDef t : schema.tables()) {
        if (dialect.tableExists(c, t.name())) continue;
        String ddl = dialect.createTable(t);
        StatementLog.sql(handle, "CREATE", ddl, List.of());
        try (Statement st = c.createStatement()) {
          st.execute(ddl);
        }
        created.add(t.name());
      }
    } catch (SQLException e) {
      throw new BackendException("Failed to materialize schema on " + handle.id(), e);
    }
    if (!created.isEmpty()) {
      log.info("sqlkit.schema_created handleId={} tables={}", handle.id(), created);
    }
    return created;
  }
}
