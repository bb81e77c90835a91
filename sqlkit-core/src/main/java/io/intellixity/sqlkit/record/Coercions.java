package io.intellixity.sqlkit.record;

import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Conversions from raw driver values to Java types. Null in, null out.
 */
public final class Coercions {
  private static final DateTimeFormatter SQL_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");

  private Coercions() {}

  public static String toText(Object raw) {
    if (raw == null) return null;
    if (raw instanceof String s) return s;
    if (raw instanceof byte[] b) return new String(b, StandardCharsets.UTF_8);
    if (raw instanceof Clob c) {
      try {
        return c.getSubString(1, (int) c.length());
      } catch (SQLException e) {
        throw new IllegalArgumentException("Failed to read CLOB", e);
      }
    }
    return String.valueOf(raw);
  }

  public static Long toLong(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Number n) return n.longValue();
    if (raw instanceof Boolean b) return b ? 1L : 0L;
    if (raw instanceof String s) return Long.parseLong(s.trim());
    throw new IllegalArgumentException("Expected integer but got: " + raw.getClass().getName());
  }

  public static Integer toInt(Object raw) {
    Long l = toLong(raw);
    if (l == null) return null;
    return Math.toIntExact(l);
  }

  public static Double toDouble(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Number n) return n.doubleValue();
    if (raw instanceof String s) return Double.parseDouble(s.trim());
    throw new IllegalArgumentException("Expected number but got: " + raw.getClass().getName());
  }

  public static Boolean toBoolean(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Boolean b) return b;
    if (raw instanceof Number n) return n.longValue() != 0;
    if (raw instanceof String s) {
      String t = s.trim();
      if (t.equals("1") || t.equalsIgnoreCase("true") || t.equalsIgnoreCase("t")) return true;
      if (t.equals("0") || t.equalsIgnoreCase("false") || t.equalsIgnoreCase("f")) return false;
    }
    throw new IllegalArgumentException("Expected boolean but got: " + raw);
  }

  public static byte[] toBytes(Object raw) {
    if (raw == null) return null;
    if (raw instanceof byte[] b) return b;
    if (raw instanceof Blob blob) {
      try {
        return blob.getBytes(1, (int) blob.length());
      } catch (SQLException e) {
        throw new IllegalArgumentException("Failed to read BLOB", e);
      }
    }
    if (raw instanceof String s) return s.getBytes(StandardCharsets.UTF_8);
    throw new IllegalArgumentException("Expected bytes but got: " + raw.getClass().getName());
  }

  /**
   * Driver timestamps are read in the JVM zone they were bound in; SQLite stores them as epoch milliseconds.
   * Text timestamps without an offset are taken as UTC.
   */
  public static Instant toInstant(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Instant i) return i;
    if (raw instanceof Timestamp ts) return ts.toInstant();
    if (raw instanceof LocalDateTime ldt) return ldt.atZone(ZoneId.systemDefault()).toInstant();
    if (raw instanceof OffsetDateTime odt) return odt.toInstant();
    if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());
    if (raw instanceof String s) {
      try {
        return LocalDateTime.parse(s.trim(), SQL_DATETIME).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException e) {
        return Instant.parse(s.trim());
      }
    }
    throw new IllegalArgumentException("Expected timestamp but got: " + raw.getClass().getName());
  }
}
