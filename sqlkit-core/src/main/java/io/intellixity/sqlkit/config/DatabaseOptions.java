package io.intellixity.sqlkit.config;

import java.util.Properties;

/**
 * Tunables applied when a database engine is built.
 *
 * @param echo                log every statement at INFO instead of DEBUG
 * @param maximumPoolSize     connections per engine; sessions beyond this block until one is released
 * @param connectionTimeoutMs how long a session waits for a pooled connection before failing
 */
public record DatabaseOptions(boolean echo, int maximumPoolSize, long connectionTimeoutMs) {
  public static final String ECHO = "sqlkit.echo";
  public static final String POOL_MAXIMUM_SIZE = "sqlkit.pool.maximumSize";
  public static final String POOL_CONNECTION_TIMEOUT_MS = "sqlkit.pool.connectionTimeoutMs";

  public static final int DEFAULT_MAXIMUM_POOL_SIZE = 10;
  public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30_000L;

  public DatabaseOptions {
    if (maximumPoolSize <= 0) throw new IllegalArgumentException("maximumPoolSize must be > 0");
    // HikariCP rejects timeouts below 250ms.
    if (connectionTimeoutMs < 250) throw new IllegalArgumentException("connectionTimeoutMs must be >= 250");
  }

  public static DatabaseOptions defaults() {
    return new DatabaseOptions(false, DEFAULT_MAXIMUM_POOL_SIZE, DEFAULT_CONNECTION_TIMEOUT_MS);
  }

  /** Reads {@code sqlkit.*} keys; missing keys keep their defaults. */
  public static DatabaseOptions fromProperties(Properties p) {
    DatabaseOptions d = defaults();
    if (p == null) return d;
    boolean echo = Boolean.parseBoolean(p.getProperty(ECHO, String.valueOf(d.echo())));
    int max = Integer.parseInt(p.getProperty(POOL_MAXIMUM_SIZE, String.valueOf(d.maximumPoolSize())).trim());
    long timeout = Long.parseLong(
        p.getProperty(POOL_CONNECTION_TIMEOUT_MS, String.valueOf(d.connectionTimeoutMs())).trim());
    return new DatabaseOptions(echo, max, timeout);
  }

  public static DatabaseOptions fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  public DatabaseOptions withEcho(boolean value) {
    return new DatabaseOptions(value, maximumPoolSize, connectionTimeoutMs);
  }

  public DatabaseOptions withMaximumPoolSize(int value) {
    return new DatabaseOptions(echo, value, connectionTimeoutMs);
  }

  public DatabaseOptions withConnectionTimeoutMs(long value) {
    return new DatabaseOptions(echo, maximumPoolSize, value);
  }
}
