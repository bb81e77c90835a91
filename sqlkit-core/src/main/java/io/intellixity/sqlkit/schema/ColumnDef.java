package io.intellixity.sqlkit.schema;

import java.util.Objects;

/**
 * A typed column of a {@link TableDef}.
 *
 * @param length        size for {@link ColumnType#sized()} types, otherwise null
 * @param autoIncrement backend-generated integer key; the column must be the table's sole primary key
 */
public record ColumnDef(String name, ColumnType type, Integer length, boolean nullable, boolean autoIncrement) {
  public static final int DEFAULT_TEXT_LENGTH = 255;

  public ColumnDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) throw new IllegalArgumentException("column name must not be blank");
    if (type.sized() && length == null) length = (type == ColumnType.TEXT) ? DEFAULT_TEXT_LENGTH : null;
    if (type.sized() && (length == null || length <= 0)) {
      throw new IllegalArgumentException("column '" + name + "' of type " + type + " needs a positive length");
    }
    if (autoIncrement && type != ColumnType.INTEGER && type != ColumnType.BIGINT) {
      throw new IllegalArgumentException("autoIncrement column '" + name + "' must be INTEGER or BIGINT");
    }
  }

  /** Nullable column with the type's default length. */
  public static ColumnDef of(String name, ColumnType type) {
    return new ColumnDef(name, type, null, true, false);
  }

  public static ColumnDef of(String name, ColumnType type, int length) {
    return new ColumnDef(name, type, length, true, false);
  }

  /** Auto-incrementing integer key column. */
  public static ColumnDef id(String name) {
    return new ColumnDef(name, ColumnType.INTEGER, null, false, true);
  }

  public ColumnDef notNull() {
    return new ColumnDef(name, type, length, false, autoIncrement);
  }
}
