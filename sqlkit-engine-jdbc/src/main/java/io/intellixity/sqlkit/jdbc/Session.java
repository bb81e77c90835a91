package io.intellixity.sqlkit.jdbc;

import io.intellixity.sqlkit.error.BackendException;
import io.intellixity.sqlkit.query.Row;
import io.intellixity.sqlkit.query.RowMapper;
import io.intellixity.sqlkit.query.SqlQuery;
import io.intellixity.sqlkit.record.RecordType;
import io.intellixity.sqlkit.schema.ColumnDef;
import io.intellixity.sqlkit.schema.TableDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A unit of work bound to one pooled connection with auto-commit off.
 * <p>
 * Nothing written through a session is durable until {@link #commit()}. {@link #close()} rolls back whatever
 * was not committed and returns the connection to the pool. A session is not thread-safe and must be used by
 * one task at a time.
 */
public final class Session implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Session.class);

  private final JdbcHandle handle;
  private final Connection conn;
  private boolean closed;

  Session(JdbcHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    try {
      Connection c = handle.client().getConnection();
      try {
        c.setAutoCommit(false);
      } catch (SQLException e) {
        c.close();
        throw e;
      }
      this.conn = c;
    } catch (SQLException e) {
      throw new BackendException("Failed to open session on " + handle.id(), e);
    }
  }

  /** The underlying connection, for work this class does not cover. Do not close it. */
  public Connection connection() {
    ensureOpen();
    return conn;
  }

  public JdbcHandle handle() { return handle; }

  public boolean isOpen() { return !closed; }

  // --- Raw SQL ---

  public int execute(String sql, Object... params) {
    return execute(SqlQuery.of(sql, params));
  }

  public int execute(SqlQuery q) {
    ensureOpen();
    long start = System.nanoTime();
    StatementLog.sql(handle, "EXECUTE", q);
    try (PreparedStatement ps = conn.prepareStatement(q.sql())) {
      bindAll(ps, q.params());
      int n = ps.executeUpdate();
      StatementLog.done(handle, "EXECUTE", n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw new BackendException("EXECUTE failed", e);
    }
  }

  public List<Row> select(SqlQuery q) {
    return select(q, RowMapper.identity());
  }

  public <T> List<T> select(SqlQuery q, RowMapper<T> mapper) {
    ensureOpen();
    Objects.requireNonNull(mapper, "mapper");
    long start = System.nanoTime();
    StatementLog.sql(handle, "SELECT", q);
    try (PreparedStatement ps = conn.prepareStatement(q.sql())) {
      bindAll(ps, q.params());
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        while (rs.next()) out.add(mapper.map(readRow(rs)));
        StatementLog.done(handle, "SELECT", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new BackendException("SELECT failed", e);
    }
  }

  public <T> Optional<T> selectFirst(SqlQuery q, RowMapper<T> mapper) {
    List<T> rows = select(handle.dialect().applyOffsetPage(q, 0, 1), mapper);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public long count(SqlQuery q) {
    ensureOpen();
    SqlQuery cq = handle.dialect().count(q);
    long start = System.nanoTime();
    StatementLog.sql(handle, "COUNT", cq);
    try (PreparedStatement ps = conn.prepareStatement(cq.sql())) {
      bindAll(ps, cq.params());
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return 0;
        long v = rs.getLong(1);
        StatementLog.done(handle, "COUNT", v, System.nanoTime() - start);
        return v;
      }
    } catch (SQLException e) {
      throw new BackendException("COUNT failed", e);
    }
  }

  /**
   * Split the rows of {@code q} into windows of {@code batchSize}, starting at row {@code startAt}.
   * {@code q} should have a deterministic ORDER BY.
   */
  public <T> BatchedQuery<T> batched(SqlQuery q, RowMapper<T> mapper, int batchSize, long startAt,
                                     boolean computeTotal) {
    ensureOpen();
    return new BatchedQuery<>(this, q, mapper, batchSize, startAt, computeTotal);
  }

  public BatchedQuery<Row> batched(SqlQuery q, int batchSize) {
    return batched(q, RowMapper.identity(), batchSize, 0, false);
  }

  // --- Records ---

  /** All records of {@code type} whose columns equal {@code filter}. */
  public <R> List<R> find(RecordType<R> type, Map<String, Object> filter) {
    SqlQuery q = handle.dialect().selectWhere(type.table(), filter);
    return select(q, row -> type.fromFields(row.asMap()));
  }

  /** The first record of {@code type} whose columns equal {@code filter}, if any. */
  public <R> Optional<R> get(RecordType<R> type, Map<String, Object> filter) {
    SqlQuery q = handle.dialect().selectWhere(type.table(), filter);
    return selectFirst(q, row -> type.fromFields(row.asMap()));
  }

  /**
   * Insert a row built from {@code fields} and return it as a record, with any generated key filled in.
   * Not committed.
   */
  public <R> R insert(RecordType<R> type, Map<String, Object> fields) {
    ensureOpen();
    TableDef table = type.table();
    Map<String, Object> values = new LinkedHashMap<>(fields);
    ColumnDef generated = generatedKey(table, values);
    if (generated != null) values.remove(generated.name());

    List<String> columns = new ArrayList<>(values.keySet());
    String sql = handle.dialect().insert(table, columns);
    List<Object> params = new ArrayList<>(values.values());

    long start = System.nanoTime();
    StatementLog.sql(handle, "INSERT", sql, params);
    try (PreparedStatement ps = (generated == null)
        ? conn.prepareStatement(sql)
        : handle.dialect().prepareInsertReturningKey(conn, sql, generated.name())) {
      bindAll(ps, params);
      int n = ps.executeUpdate();
      if (generated != null) {
        Object key = handle.dialect().generatedKey(conn, ps);
        if (key != null) values.put(generated.name(), key);
      }
      StatementLog.done(handle, "INSERT", n, System.nanoTime() - start);
    } catch (SQLException e) {
      throw new BackendException("INSERT into " + table.name() + " failed", e);
    }
    return type.fromFields(values);
  }

  public <R> R add(RecordType<R> type, R record) {
    return insert(type, type.toFields(record));
  }

  /**
   * Find the record matching {@code filter}, or stage a new one built from {@code filter} plus
   * {@code defaults}. Filter values win over defaults. Nothing is committed.
   * <p>
   * Two sessions racing on the same filter may both insert unless the table has a unique key on the
   * filter columns.
   */
  public <R> R getOrCreate(RecordType<R> type, Map<String, Object> filter, Map<String, Object> defaults) {
    Optional<R> existing = get(type, filter);
    if (existing.isPresent()) return existing.get();

    Map<String, Object> params = new LinkedHashMap<>();
    if (defaults != null) params.putAll(defaults);
    params.putAll(filter);
    R created = insert(type, params);
    if (log.isDebugEnabled()) {
      log.debug("New record: {}({})", type.tableName(), params.entrySet().stream()
          .map(e -> e.getKey() + "=" + e.getValue())
          .collect(Collectors.joining(", ")));
    }
    return created;
  }

  public <R> R getOrCreate(RecordType<R> type, Map<String, Object> filter) {
    return getOrCreate(type, filter, Map.of());
  }

  // --- Transaction ---

  public void commit() {
    ensureOpen();
    try {
      conn.commit();
    } catch (SQLException e) {
      throw new BackendException("COMMIT failed", e);
    }
  }

  public void rollback() {
    ensureOpen();
    try {
      conn.rollback();
    } catch (SQLException e) {
      throw new BackendException("ROLLBACK failed", e);
    }
  }

  /** Roll back uncommitted work and return the connection to the pool. Idempotent. */
  @Override
  public void close() {
    if (closed) return;
    closed = true;
    try {
      try {
        conn.rollback();
      } finally {
        conn.close();
      }
    } catch (SQLException e) {
      throw new BackendException("Failed to release session connection", e);
    }
  }

  private void ensureOpen() {
    if (closed) throw new IllegalStateException("Session is closed");
  }

  private static ColumnDef generatedKey(TableDef table, Map<String, Object> values) {
    for (ColumnDef c : table.columns()) {
      if (c.autoIncrement() && values.get(c.name()) == null) return c;
    }
    return null;
  }

  static Row readRow(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 1; i <= md.getColumnCount(); i++) {
      values.put(md.getColumnLabel(i), rs.getObject(i));
    }
    return new Row(values);
  }

  private static void bindAll(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      Object v = params.get(i);
      int idx = i + 1;
      if (v == null) ps.setNull(idx, Types.NULL);
      else if (v instanceof Instant inst) ps.setTimestamp(idx, Timestamp.from(inst));
      else if (v instanceof byte[] b) ps.setBytes(idx, b);
      else if (v instanceof Enum<?> en) ps.setString(idx, en.name());
      else ps.setObject(idx, v);
    }
  }
}
