package io.intellixity.sqlkit.record;

import io.intellixity.sqlkit.schema.TableDef;

import java.util.List;
import java.util.Map;

/**
 * Binds a Java type to one table of a schema.
 * <p>
 * Field maps are keyed by column name. {@link #fromFields(Map)} receives either a row read back from the
 * database (driver values, see {@link Coercions}) or constructor arguments assembled by the caller, and
 * must accept a map that omits nullable or generated columns.
 */
public interface RecordType<R> {
  TableDef table();

  R fromFields(Map<String, Object> fields);

  /** Column values of a record; generated keys that are still unset may be omitted or null. */
  Map<String, Object> toFields(R record);

  default String tableName() {
    return table().name();
  }

  /** Mapped column names in declaration order. */
  default List<String> columnNames() {
    return table().columnNames();
  }
}
