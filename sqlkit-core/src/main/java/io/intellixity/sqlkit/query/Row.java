package io.intellixity.sqlkit.query;

import io.intellixity.sqlkit.record.Coercions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A materialized result row: column label to driver value, in select order.
 * <p>
 * Typed getters smooth over driver differences (SQLite hands back {@code Integer} for small integers and
 * numbers for booleans and timestamps).
 */
public final class Row {
  private final Map<String, Object> values;

  public Row(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public boolean has(String column) { return values.containsKey(column); }
  public boolean isNull(String column) { return raw(column) == null; }
  public List<String> columns() { return List.copyOf(values.keySet()); }
  public Map<String, Object> asMap() { return values; }

  public Object raw(String column) {
    if (!values.containsKey(column)) throw new IllegalArgumentException("Unknown column label: " + column);
    return values.get(column);
  }

  public String getString(String column) { return Coercions.toText(raw(column)); }
  public Long getLong(String column) { return Coercions.toLong(raw(column)); }
  public Integer getInt(String column) { return Coercions.toInt(raw(column)); }
  public Double getDouble(String column) { return Coercions.toDouble(raw(column)); }
  public Boolean getBoolean(String column) { return Coercions.toBoolean(raw(column)); }
  public byte[] getBytes(String column) { return Coercions.toBytes(raw(column)); }
  public Instant getInstant(String column) { return Coercions.toInstant(raw(column)); }

  @Override
  public boolean equals(Object o) {
    return o instanceof Row r && values.equals(r.values);
  }

  @Override
  public int hashCode() { return values.hashCode(); }

  @Override
  public String toString() { return "Row" + values; }
}
