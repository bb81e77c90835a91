package io.intellixity.sqlkit.schema;

/**
 * Portable column types. Each dialect decides the concrete DDL type.
 */
public enum ColumnType {
  INTEGER,
  BIGINT,
  BOOLEAN,
  DOUBLE,
  /** Bounded text; {@link ColumnDef#length()} is the maximum number of characters. */
  TEXT,
  /** Text without a practical length bound (2^31 characters on MySQL). */
  UNBOUNDED_TEXT,
  /** Fixed-size binary array; {@link ColumnDef#length()} is the size in bytes. */
  BINARY_ARRAY,
  /** Timestamp with (at least) millisecond precision. */
  MILLISECOND_DATETIME;

  /** True if DDL for this type needs a length. */
  public boolean sized() {
    return this == TEXT || this == BINARY_ARRAY;
  }
}
