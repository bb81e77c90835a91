package io.intellixity.sqlkit.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class DatabaseOptionsTest {

  @Test
  void missingPropertiesKeepDefaults() {
    assertEquals(DatabaseOptions.defaults(), DatabaseOptions.fromProperties(new Properties()));
    assertEquals(DatabaseOptions.defaults(), DatabaseOptions.fromProperties(null));
  }

  @Test
  void readsSqlkitKeys() {
    Properties p = new Properties();
    p.setProperty(DatabaseOptions.ECHO, "true");
    p.setProperty(DatabaseOptions.POOL_MAXIMUM_SIZE, " 4 ");
    p.setProperty(DatabaseOptions.POOL_CONNECTION_TIMEOUT_MS, "5000");

    DatabaseOptions o = DatabaseOptions.fromProperties(p);
    assertTrue(o.echo());
    assertEquals(4, o.maximumPoolSize());
    assertEquals(5000L, o.connectionTimeoutMs());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> DatabaseOptions.defaults().withMaximumPoolSize(0));
    assertThrows(IllegalArgumentException.class, () -> DatabaseOptions.defaults().withConnectionTimeoutMs(10));
  }
}
