package io.intellixity.sqlkit.jdbc.dialect;

import io.intellixity.sqlkit.query.SqlQuery;
import io.intellixity.sqlkit.schema.ColumnDef;
import io.intellixity.sqlkit.schema.TableDef;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - CREATE TABLE from a TableDef\n
 * - LIMIT/OFFSET paging and COUNT wrapping of an arbitrary query\n
 * - equality filters and INSERT for a single table\n
 *
 * Backend-specific dialects override hooks for quoting, column types, generated keys and empty inserts.\n
 */
public abstract class AbstractSqlDialect implements SqlDialect {

  /** Full column definition for an auto-increment key; the key is declared inline. */
  protected abstract String autoIncrementColumn(ColumnDef column);

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String createTable(TableDef table) {
    List<String> parts = new ArrayList<>();
    boolean inlineKey = false;
    for (ColumnDef c : table.columns()) {
      if (c.autoIncrement()) {
        parts.add(autoIncrementColumn(c));
        inlineKey = true;
        continue;
      }
      parts.add(quoteIdent(c.name()) + " " + columnType(c) + (c.nullable() ? "" : " NOT NULL"));
    }
    if (!inlineKey && !table.primaryKey().isEmpty()) {
      parts.add("PRIMARY KEY (" + joinIdents(table.primaryKey()) + ")");
    }
    for (List<String> uk : table.uniqueKeys()) {
      parts.add("UNIQUE (" + joinIdents(uk) + ")");
    }
    return "CREATE TABLE IF NOT EXISTS " + quoteIdent(table.name()) + " (" + String.join(", ", parts) + ")";
  }

  @Override
  public boolean tableExists(Connection c, String table) throws SQLException {
    DatabaseMetaData md = c.getMetaData();
    try (ResultSet rs = md.getTables(c.getCatalog(), c.getSchema(), table, new String[] {"TABLE"})) {
      while (rs.next()) {
        if (table.equals(rs.getString("TABLE_NAME"))) return true;
      }
      return false;
    }
  }

  @Override
  public SqlQuery applyOffsetPage(SqlQuery base, long offset, int limit) {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    return base.append(" LIMIT " + limit + " OFFSET " + offset);
  }

  @Override
  public SqlQuery count(SqlQuery base) {
    return new SqlQuery("SELECT COUNT(1) FROM (" + base.sql() + ") sqlkit_count", base.params());
  }

  @Override
  public SqlQuery selectWhere(TableDef table, Map<String, Object> filter) {
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(joinIdents(table.columnNames()))
        .append(" FROM ")
        .append(quoteIdent(table.name()));
    List<Object> params = new ArrayList<>();
    String sep = " WHERE ";
    for (var e : filter.entrySet()) {
      requireColumn(table, e.getKey());
      sql.append(sep).append(quoteIdent(e.getKey()));
      if (e.getValue() == null) {
        sql.append(" IS NULL");
      } else {
        sql.append(" = ?");
        params.add(e.getValue());
      }
      sep = " AND ";
    }
    return new SqlQuery(sql.toString(), params);
  }

  @Override
  public String insert(TableDef table, List<String> columns) {
    if (columns.isEmpty()) return insertDefaultValues(table);
    for (String c : columns) requireColumn(table, c);
    String marks = String.join(", ", columns.stream().map(c -> "?").toList());
    return "INSERT INTO " + quoteIdent(table.name()) + " (" + joinIdents(columns) + ") VALUES (" + marks + ")";
  }

  protected String insertDefaultValues(TableDef table) {
    return "INSERT INTO " + quoteIdent(table.name()) + " DEFAULT VALUES";
  }

  @Override
  public PreparedStatement prepareInsertReturningKey(Connection c, String sql, String keyColumn) throws SQLException {
    return c.prepareStatement(sql, new String[] {keyColumn});
  }

  @Override
  public Object generatedKey(Connection c, PreparedStatement ps) throws SQLException {
    try (ResultSet keys = ps.getGeneratedKeys()) {
      return (keys != null && keys.next()) ? keys.getObject(1) : null;
    }
  }

  protected final String joinIdents(List<String> idents) {
    return String.join(", ", idents.stream().map(this::quoteIdent).toList());
  }

  private static void requireColumn(TableDef table, String column) {
    if (table.column(column).isEmpty()) {
      throw new IllegalArgumentException("Unknown column '" + column + "' for table '" + table.name() + "'");
    }
  }
}
