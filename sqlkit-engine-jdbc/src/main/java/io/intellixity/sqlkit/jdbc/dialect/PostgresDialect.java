package io.intellixity.sqlkit.jdbc.dialect;

import io.intellixity.sqlkit.schema.ColumnDef;
import io.intellixity.sqlkit.schema.ColumnType;

/**
 * Postgres dialect implementation.
 *
 * Keeps only Postgres-specific type and key rendering.\n
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public String columnType(ColumnDef column) {
    return switch (column.type()) {
      case INTEGER -> "INTEGER";
      case BIGINT -> "BIGINT";
      case BOOLEAN -> "BOOLEAN";
      case DOUBLE -> "DOUBLE PRECISION";
      case TEXT -> "VARCHAR(" + column.length() + ")";
      case UNBOUNDED_TEXT -> "TEXT";
      case BINARY_ARRAY -> "BYTEA";
      case MILLISECOND_DATETIME -> "TIMESTAMP(3)";
    };
  }

  @Override
  protected String autoIncrementColumn(ColumnDef column) {
    String serial = (column.type() == ColumnType.BIGINT) ? "BIGSERIAL" : "SERIAL";
    return quoteIdent(column.name()) + " " + serial + " PRIMARY KEY";
  }
}
