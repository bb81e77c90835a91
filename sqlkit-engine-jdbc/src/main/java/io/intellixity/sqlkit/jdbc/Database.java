package io.intellixity.sqlkit.jdbc;

import io.intellixity.sqlkit.config.DatabaseOptions;
import io.intellixity.sqlkit.descriptor.DescriptorResolver;
import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.error.ConfirmationRequiredException;
import io.intellixity.sqlkit.schema.SchemaDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A database reached through a descriptor, with its schema guaranteed present.
 *
 * Example:
 * <pre>
 * try (Database db = new Database("sqlite:////tmp/foo.db", schema)) {
 *   db.useSession(true, s -&gt; s.getOrCreate(USERS, Map.of("email", "a@b.c")));
 * }
 * </pre>
 *
 * Construction resolves the descriptor, builds a pooled engine (creating the database unless
 * {@code mustExist}) and creates any table of {@code schema} that is missing.
 */
public final class Database implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Database.class);

  private final String url;
  private final SchemaDefinition schema;
  private final JdbcHandle engine;
  private volatile boolean dropped;

  public Database(String url, SchemaDefinition schema) {
    this(url, schema, false, DatabaseOptions.defaults());
  }

  public Database(String url, SchemaDefinition schema, boolean mustExist) {
    this(url, schema, mustExist, DatabaseOptions.defaults());
  }

  /**
   * @throws io.intellixity.sqlkit.error.UnsupportedBackendException if the scheme is not supported
   * @throws io.intellixity.sqlkit.error.DatabaseNotFoundException   if absent and {@code mustExist}
   * @throws io.intellixity.sqlkit.error.ConfigurationException      for invalid descriptor/flag combinations
   */
  public Database(String url, SchemaDefinition schema, boolean mustExist, DatabaseOptions options) {
    this.url = Objects.requireNonNull(url, "url");
    this.schema = Objects.requireNonNull(schema, "schema");
    ResolvedDescriptor descriptor = new DescriptorResolver().resolve(url);
    this.engine = new EngineFactory(options).build(descriptor, mustExist);
    try {
      SchemaMaterializer.materialize(engine, schema);
    } catch (RuntimeException e) {
      engine.close();
      throw e;
    }
  }

  /** The descriptor this database was opened with (possibly indirect). */
  public String url() { return url; }

  public SchemaDefinition schema() { return schema; }

  public JdbcHandle engine() { return engine; }

  /**
   * Check out a session. The caller must close it; closing without {@link Session#commit()} rolls back.
   * Blocks while every pooled connection is in use.
   */
  public Session openSession() {
    ensureUsable();
    return new Session(engine);
  }

  /**
   * Run {@code work} in a new session.
   * <p>
   * On normal return the transaction is committed if {@code commit} is set (otherwise anything not committed
   * by {@code work} is discarded). If {@code work} throws, the transaction is rolled back and the exception
   * propagates. The connection goes back to the pool either way.
   */
  public <T> T inSession(boolean commit, Function<Session, T> work) {
    Objects.requireNonNull(work, "work");
    Session session = openSession();
    Throwable failure = null;
    try {
      T result = work.apply(session);
      if (commit) session.commit();
      return result;
    } catch (RuntimeException | Error e) {
      failure = e;
      try {
        session.rollback();
      } catch (RuntimeException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw e;
    } finally {
      // Session.close always hands the connection back, even when its own rollback fails.
      try {
        session.close();
      } catch (RuntimeException releaseFailure) {
        if (failure == null) throw releaseFailure;
        failure.addSuppressed(releaseFailure);
      }
    }
  }

  public void useSession(boolean commit, Consumer<Session> work) {
    Objects.requireNonNull(work, "work");
    inSession(commit, s -> {
      work.accept(s);
      return null;
    });
  }

  /**
   * Drop the database, irreversibly destroying it.
   * <p>
   * Be careful with this! Afterwards no further operations can be made on this instance, and any open
   * sessions should be discarded.
   * <p>
   * The pool is disposed before the backend drop runs. If that drop fails, the instance is left closed but
   * not dropped: {@link #isDropped()} stays false and the database can be reopened with a new instance.
   *
   * @param areYouSure must be true
   * @throws ConfirmationRequiredException if {@code areYouSure} is false; the database stays usable
   * @throws io.intellixity.sqlkit.error.UnsupportedDatabaseOperationException if the backend cannot drop
   */
  public void drop(boolean areYouSure) {
    if (!areYouSure) throw new ConfirmationRequiredException("Let's take a minute to think things over");
    ensureUsable();
    engine.close();
    try {
      engine.backend().drop(engine.descriptor());
    } catch (RuntimeException e) {
      log.warn("sqlkit.drop_failed handleId={} error={}", engine.id(), e.getClass().getSimpleName());
      throw e;
    }
    dropped = true;
    log.info("sqlkit.dropped handleId={}", engine.id());
  }

  public boolean isDropped() { return dropped; }

  /** Dispose of the connection pool. Idempotent. */
  @Override
  public void close() {
    engine.close();
  }

  private void ensureUsable() {
    if (dropped) throw new IllegalStateException("Database has been dropped: " + url);
    if (engine.isClosed()) throw new IllegalStateException("Database is closed: " + url);
  }

  @Override
  public String toString() {
    return engine.descriptor().redactedUrl();
  }
}
