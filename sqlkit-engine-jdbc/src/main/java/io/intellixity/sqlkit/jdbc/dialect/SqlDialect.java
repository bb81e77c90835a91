package io.intellixity.sqlkit.jdbc.dialect;

import io.intellixity.sqlkit.query.SqlQuery;
import io.intellixity.sqlkit.schema.ColumnDef;
import io.intellixity.sqlkit.schema.TableDef;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/** SQL rendering for one backend family: DDL, paging, counting and single-table DML. */
public interface SqlDialect {
  String id();

  String quoteIdent(String ident);

  /** Concrete DDL type for a column (without nullability). */
  String columnType(ColumnDef column);

  String createTable(TableDef table);

  boolean tableExists(Connection c, String table) throws SQLException;

  /** {@code base} restricted to {@code limit} rows starting at {@code offset}. */
  SqlQuery applyOffsetPage(SqlQuery base, long offset, int limit);

  /** A query returning the number of rows {@code base} would return. */
  SqlQuery count(SqlQuery base);

  /** Equality-only filter over {@code table}; null values match SQL NULL. */
  SqlQuery selectWhere(TableDef table, Map<String, Object> filter);

  String insert(TableDef table, List<String> columns);

  /** Prepare an INSERT that reports the value generated for {@code keyColumn}. */
  PreparedStatement prepareInsertReturningKey(Connection c, String sql, String keyColumn) throws SQLException;

  /** The key generated by the INSERT just executed on {@code ps}, or null if the driver reported none. */
  Object generatedKey(Connection c, PreparedStatement ps) throws SQLException;
}
