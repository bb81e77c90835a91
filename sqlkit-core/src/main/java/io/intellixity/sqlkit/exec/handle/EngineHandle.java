package io.intellixity.sqlkit.exec.handle;

import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;

/**
 * Live, pooled handle to one resolved backend.\n
 *
 * Example:\n
 * - JDBC: client() is a pooled javax.sql.DataSource\n
 */
public interface EngineHandle<TClient> extends AutoCloseable {
  /** Identifier for this handle (used in logs; never contains credentials). */
  String id();

  /** Native client used to obtain connections. */
  TClient client();

  /** The descriptor this handle was built from. */
  ResolvedDescriptor descriptor();

  boolean isClosed();

  /** Dispose of the pool. Idempotent. */
  @Override
  void close();
}
