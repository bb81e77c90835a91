package io.intellixity.sqlkit.query;

import java.util.List;
import java.util.Objects;

/**
 * One window of an offset/limit batched query.
 *
 * @param batchNumber 1-based position of this batch in the sequence
 * @param offset      offset into the full result set of the first row in {@link #rows()}
 * @param limit       {@code offset + batchSize}: the exclusive upper bound that was requested
 * @param totalRows   row count of the whole query, or null if it was not computed
 * @param rows        between 1 and batchSize rows
 */
public record Batch<T>(int batchNumber, long offset, long limit, Long totalRows, List<T> rows) {
  public Batch {
    if (batchNumber < 1) throw new IllegalArgumentException("batchNumber must be >= 1");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit <= offset) throw new IllegalArgumentException("limit must be > offset");
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
  }

  public int size() { return rows.size(); }
}
