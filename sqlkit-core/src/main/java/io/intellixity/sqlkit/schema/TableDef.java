package io.intellixity.sqlkit.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A named table: columns in declaration order, an optional primary key and unique constraints. */
public record TableDef(String name, List<ColumnDef> columns, List<String> primaryKey, List<List<String>> uniqueKeys) {
  public TableDef {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (columns.isEmpty()) throw new IllegalArgumentException("table '" + name + "' has no columns");
    primaryKey = (primaryKey == null) ? List.of() : List.copyOf(primaryKey);
    uniqueKeys = (uniqueKeys == null) ? List.of() : uniqueKeys.stream().map(List::copyOf).toList();

    for (String pk : primaryKey) requireColumn(name, columns, pk);
    for (List<String> uk : uniqueKeys) {
      if (uk.isEmpty()) throw new IllegalArgumentException("empty unique key on table '" + name + "'");
      for (String c : uk) requireColumn(name, columns, c);
    }
    for (ColumnDef c : columns) {
      if (c.autoIncrement() && !primaryKey.equals(List.of(c.name()))) {
        throw new IllegalArgumentException(
            "autoIncrement column '" + c.name() + "' must be the sole primary key of '" + name + "'");
      }
    }
  }

  public static TableDef of(String name, ColumnDef... columns) {
    List<String> pk = new ArrayList<>();
    for (ColumnDef c : columns) if (c.autoIncrement()) pk.add(c.name());
    return new TableDef(name, List.of(columns), pk, List.of());
  }

  public TableDef withPrimaryKey(String... cols) {
    return new TableDef(name, columns, List.of(cols), uniqueKeys);
  }

  public TableDef withUnique(String... cols) {
    List<List<String>> uks = new ArrayList<>(uniqueKeys);
    uks.add(List.of(cols));
    return new TableDef(name, columns, primaryKey, uks);
  }

  public Optional<ColumnDef> column(String columnName) {
    return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnDef::name).toList();
  }

  private static void requireColumn(String table, List<ColumnDef> columns, String col) {
    if (columns.stream().noneMatch(c -> c.name().equals(col))) {
      throw new IllegalArgumentException("unknown column '" + col + "' on table '" + table + "'");
    }
  }
}
