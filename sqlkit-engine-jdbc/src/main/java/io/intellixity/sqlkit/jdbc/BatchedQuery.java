package io.intellixity.sqlkit.jdbc;

import io.intellixity.sqlkit.query.Batch;
import io.intellixity.sqlkit.query.RowMapper;
import io.intellixity.sqlkit.query.SqlQuery;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily pages through a query with {@code LIMIT batchSize OFFSET i}.
 * <p>
 * {@code i} starts at {@code startAt} and advances by the number of rows actually returned, so a short final
 * batch needs no special handling. Iteration ends at the first empty window, which is not emitted. At most
 * one batch of rows is held at a time. If {@code computeTotal} is set, one COUNT runs before the first window
 * and its result is carried by every batch.
 * <p>
 * Single pass: {@link #iterator()} may be called once. Consume from one thread, inside the session's scope.
 */
public final class BatchedQuery<T> implements Iterable<Batch<T>> {
  private final Session session;
  private final SqlQuery query;
  private final RowMapper<T> mapper;
  private final int batchSize;
  private final long startAt;
  private final boolean computeTotal;
  private boolean iterated;

  BatchedQuery(Session session, SqlQuery query, RowMapper<T> mapper, int batchSize, long startAt,
               boolean computeTotal) {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    if (startAt < 0) throw new IllegalArgumentException("startAt must be >= 0");
    this.session = Objects.requireNonNull(session, "session");
    this.query = Objects.requireNonNull(query, "query");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.batchSize = batchSize;
    this.startAt = startAt;
    this.computeTotal = computeTotal;
  }

  @Override
  public Iterator<Batch<T>> iterator() {
    if (iterated) throw new IllegalStateException("BatchedQuery can only be iterated once");
    iterated = true;
    return new BatchIterator();
  }

  public Stream<Batch<T>> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  private final class BatchIterator implements Iterator<Batch<T>> {
    private long offset = startAt;
    private int batchNumber;
    private Long totalRows;
    private boolean started;
    private boolean exhausted;
    private Batch<T> next;

    @Override
    public boolean hasNext() {
      if (next != null) return true;
      if (exhausted) return false;
      if (!started) {
        started = true;
        if (computeTotal) totalRows = session.count(query);
      }

      List<T> rows = session.select(session.handle().dialect().applyOffsetPage(query, offset, batchSize), mapper);
      if (rows.isEmpty()) {
        exhausted = true;
        return false;
      }
      next = new Batch<>(++batchNumber, offset, offset + batchSize, totalRows, rows);
      offset += rows.size();
      return true;
    }

    @Override
    public Batch<T> next() {
      if (!hasNext()) throw new NoSuchElementException();
      Batch<T> out = next;
      next = null;
      return out;
    }
  }
}
