package io.intellixity.sqlkit.jdbc.dialect;

import io.intellixity.sqlkit.schema.ColumnDef;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/** SQLite dialect. Types map onto SQLite's storage classes. */
public final class SqliteDialect extends AbstractSqlDialect {
  @Override public String id() { return "sqlite"; }

  @Override
  public String columnType(ColumnDef column) {
    return switch (column.type()) {
      case INTEGER, BIGINT -> "INTEGER";
      case BOOLEAN -> "BOOLEAN";
      case DOUBLE -> "REAL";
      case TEXT -> "VARCHAR(" + column.length() + ")";
      case UNBOUNDED_TEXT -> "TEXT";
      case BINARY_ARRAY -> "BLOB";
      case MILLISECOND_DATETIME -> "DATETIME";
    };
  }

  @Override
  protected String autoIncrementColumn(ColumnDef column) {
    // Only an INTEGER PRIMARY KEY aliases the rowid.
    return quoteIdent(column.name()) + " INTEGER PRIMARY KEY AUTOINCREMENT";
  }

  @Override
  public boolean tableExists(Connection c, String table) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
      ps.setString(1, table);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }

  @Override
  public PreparedStatement prepareInsertReturningKey(Connection c, String sql, String keyColumn) throws SQLException {
    return c.prepareStatement(sql);
  }

  /** Rowid of the last INSERT on this connection; sessions never share a connection. */
  @Override
  public Object generatedKey(Connection c, PreparedStatement ps) throws SQLException {
    try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
      return rs.next() ? rs.getLong(1) : null;
    }
  }
}
