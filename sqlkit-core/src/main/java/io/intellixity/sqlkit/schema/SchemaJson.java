package io.intellixity.sqlkit.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a {@link SchemaDefinition} from JSON.
 *
 * <pre>
 * {
 *   "tables": [
 *     {
 *       "name": "users",
 *       "columns": [
 *         {"name": "id", "type": "INTEGER", "autoIncrement": true},
 *         {"name": "email", "type": "TEXT", "length": 320, "nullable": false}
 *       ],
 *       "unique": [["email"]]
 *     }
 *   ]
 * }
 * </pre>
 *
 * {@code primaryKey} may be given explicitly; otherwise an autoIncrement column becomes the key.
 */
public final class SchemaJson {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SchemaJson() {}

  public static SchemaDefinition read(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in);
    }
  }

  public static SchemaDefinition read(InputStream in) throws IOException {
    return fromTree(MAPPER.readTree(in));
  }

  public static SchemaDefinition read(String json) throws IOException {
    return fromTree(MAPPER.readTree(json));
  }

  static SchemaDefinition fromTree(JsonNode root) {
    if (root == null || !root.isObject()) throw new IllegalArgumentException("Schema JSON must be an object");
    JsonNode tables = root.get("tables");
    if (tables == null || !tables.isArray()) throw new IllegalArgumentException("Schema JSON requires 'tables' array");

    List<TableDef> out = new ArrayList<>();
    for (JsonNode t : tables) out.add(parseTable(t));
    return new SchemaDefinition(out);
  }

  private static TableDef parseTable(JsonNode t) {
    String name = requiredText(t, "name", "table");
    JsonNode cols = t.get("columns");
    if (cols == null || !cols.isArray()) throw new IllegalArgumentException("Table '" + name + "' requires 'columns'");

    List<ColumnDef> columns = new ArrayList<>();
    List<String> autoKey = new ArrayList<>();
    for (JsonNode c : cols) {
      String colName = requiredText(c, "name", "column of '" + name + "'");
      ColumnType type = ColumnType.valueOf(requiredText(c, "type", "column '" + colName + "'").toUpperCase(Locale.ROOT));
      JsonNode len = c.get("length");
      Integer length = (len == null || len.isNull()) ? null : len.asInt();
      boolean nullable = c.path("nullable").asBoolean(true);
      boolean autoIncrement = c.path("autoIncrement").asBoolean(false);
      if (autoIncrement) {
        autoKey.add(colName);
        nullable = false;
      }
      columns.add(new ColumnDef(colName, type, length, nullable, autoIncrement));
    }

    List<String> pk = textList(t.get("primaryKey"));
    if (pk.isEmpty()) pk = autoKey;

    List<List<String>> unique = new ArrayList<>();
    JsonNode uks = t.get("unique");
    if (uks != null && uks.isArray()) {
      for (JsonNode uk : uks) unique.add(textList(uk));
    }
    return new TableDef(name, columns, pk, unique);
  }

  private static String requiredText(JsonNode n, String field, String what) {
    JsonNode v = n.get(field);
    if (v == null || !v.isTextual() || v.asText().isBlank()) {
      throw new IllegalArgumentException("Missing '" + field + "' for " + what);
    }
    return v.asText();
  }

  private static List<String> textList(JsonNode n) {
    List<String> out = new ArrayList<>();
    if (n == null || !n.isArray()) return out;
    for (JsonNode x : n) if (x.isTextual()) out.add(x.asText());
    return out;
  }
}
