package io.intellixity.sqlkit.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The set of tables a database is expected to contain.
 * <p>
 * Tables that are absent get created; tables that exist are left exactly as they are.
 */
public record SchemaDefinition(List<TableDef> tables) {
  public SchemaDefinition {
    tables = List.copyOf(Objects.requireNonNull(tables, "tables"));
    Set<String> seen = new HashSet<>();
    for (TableDef t : tables) {
      if (!seen.add(t.name())) throw new IllegalArgumentException("duplicate table '" + t.name() + "'");
    }
  }

  public static SchemaDefinition of(TableDef... tables) {
    return new SchemaDefinition(List.of(tables));
  }

  public static SchemaDefinition empty() {
    return new SchemaDefinition(List.of());
  }

  public Optional<TableDef> table(String name) {
    return tables.stream().filter(t -> t.name().equals(name)).findFirst();
  }
}
