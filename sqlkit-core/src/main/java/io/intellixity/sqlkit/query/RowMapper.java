package io.intellixity.sqlkit.query;

/** Converts one result row into a value. */
@FunctionalInterface
public interface RowMapper<T> {
  T map(Row row);

  static RowMapper<Row> identity() {
    return row -> row;
  }
}
