package io.intellixity.sqlkit.jdbc.dialect;

import io.intellixity.sqlkit.schema.ColumnDef;
import io.intellixity.sqlkit.schema.TableDef;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * MySQL dialect.
 *
 * Identifiers are quoted with backticks; unbounded text is LONGTEXT and timestamps keep milliseconds.
 */
public final class MySqlDialect extends AbstractSqlDialect {
  @Override public String id() { return "mysql"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  public String columnType(ColumnDef column) {
    return switch (column.type()) {
      case INTEGER -> "INT";
      case BIGINT -> "BIGINT";
      case BOOLEAN -> "BOOLEAN";
      case DOUBLE -> "DOUBLE";
      case TEXT -> "VARCHAR(" + column.length() + ")";
      case UNBOUNDED_TEXT -> "LONGTEXT";
      case BINARY_ARRAY -> "BINARY(" + column.length() + ")";
      case MILLISECOND_DATETIME -> "DATETIME(3)";
    };
  }

  @Override
  protected String autoIncrementColumn(ColumnDef column) {
    return quoteIdent(column.name()) + " " + columnType(column) + " NOT NULL AUTO_INCREMENT PRIMARY KEY";
  }

  @Override
  protected String insertDefaultValues(TableDef table) {
    return "INSERT INTO " + quoteIdent(table.name()) + " () VALUES ()";
  }

  @Override
  public PreparedStatement prepareInsertReturningKey(Connection c, String sql, String keyColumn) throws SQLException {
    return c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
  }
}
