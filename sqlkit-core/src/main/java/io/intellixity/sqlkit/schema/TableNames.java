package io.intellixity.sqlkit.schema;

import java.util.Locale;
import java.util.regex.Pattern;

/** Derive table names from record class names. */
public final class TableNames {
  private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
  private static final Pattern WORD_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

  private TableNames() {}

  /** {@code FooBar -> "foobar"} */
  public static String lowerCase(Class<?> type) {
    return type.getSimpleName().toLowerCase(Locale.ROOT);
  }

  /** {@code FooBar -> "foo_bar"}, {@code HTTPServer -> "http_server"} */
  public static String camelCapsToUnderscores(Class<?> type) {
    return camelCapsToUnderscores(type.getSimpleName());
  }

  public static String camelCapsToUnderscores(String name) {
    String s = ACRONYM_BOUNDARY.matcher(name).replaceAll("$1_$2");
    s = WORD_BOUNDARY.matcher(s).replaceAll("$1_$2");
    return s.toLowerCase(Locale.ROOT);
  }
}
