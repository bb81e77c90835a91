package io.intellixity.sqlkit.record;

import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class CoercionsTest {

  @Test
  void nullStaysNull() {
    assertNull(Coercions.toLong(null));
    assertNull(Coercions.toText(null));
    assertNull(Coercions.toBoolean(null));
    assertNull(Coercions.toInstant(null));
    assertNull(Coercions.toBytes(null));
  }

  @Test
  void integersWidenAndNarrow() {
    assertEquals(Long.valueOf(7L), Coercions.toLong(7));
    assertEquals(Integer.valueOf(7), Coercions.toInt(7L));
    assertThrows(ArithmeticException.class, () -> Coercions.toInt(Long.MAX_VALUE));
    assertEquals(Long.valueOf(42L), Coercions.toLong("42"));
  }

  @Test
  void booleansFromSqliteIntegers() {
    assertTrue(Coercions.toBoolean(1));
    assertFalse(Coercions.toBoolean(0L));
    assertTrue(Coercions.toBoolean("true"));
    assertThrows(IllegalArgumentException.class, () -> Coercions.toBoolean("maybe"));
  }

  @Test
  void instantsFromMillisTimestampsAndText() {
    Instant t = Instant.parse("2024-03-01T12:34:56.789Z");
    assertEquals(t, Coercions.toInstant(t.toEpochMilli()));
    assertEquals(t, Coercions.toInstant(Timestamp.from(t)));
    assertEquals(t, Coercions.toInstant("2024-03-01 12:34:56.789"));
    assertEquals(t, Coercions.toInstant("2024-03-01T12:34:56.789Z"));
  }
}
