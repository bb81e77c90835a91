package io.intellixity.sqlkit.jdbc;

import io.intellixity.sqlkit.query.Batch;
import io.intellixity.sqlkit.query.SqlQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

final class BatchedQueryTest {
  private static final SqlQuery ALL = SqlQuery.of("SELECT id, name, weight FROM widgets ORDER BY id");

  private Database db;

  @BeforeEach
  void open() {
    db = new Database("sqlite://", Widget.SCHEMA);
  }

  @AfterEach
  void close() {
    db.close();
  }

  private void seed(int n) {
    db.useSession(true, s -> {
      for (int i = 1; i <= n; i++) s.add(Widget.TYPE, new Widget(null, "w" + i, (long) i));
    });
  }

  private List<Batch<Widget>> collect(int batchSize, long startAt, boolean computeTotal) {
    return db.inSession(false, s -> {
      List<Batch<Widget>> out = new ArrayList<>();
      for (Batch<Widget> b : s.batched(ALL, row -> Widget.TYPE.fromFields(row.asMap()), batchSize, startAt,
          computeTotal)) {
        out.add(b);
      }
      return out;
    });
  }

  @Test
  void tenRowsInBatchesOfThree() {
    seed(10);
    List<Batch<Widget>> batches = collect(3, 0, false);

    assertEquals(4, batches.size());
    assertEquals(List.of(3, 3, 3, 1), batches.stream().map(Batch::size).toList());
    assertEquals(List.of(1, 2, 3, 4), batches.stream().map(Batch::batchNumber).toList());
    assertEquals(List.of(0L, 3L, 6L, 9L), batches.stream().map(Batch::offset).toList());
    assertEquals(List.of(3L, 6L, 9L, 12L), batches.stream().map(Batch::limit).toList());
    assertTrue(batches.stream().allMatch(b -> b.totalRows() == null));

    List<Long> weights = batches.stream()
        .flatMap(b -> b.rows().stream())
        .map(Widget::weight)
        .toList();
    assertEquals(LongStream.rangeClosed(1, 10).boxed().toList(), weights);
  }

  @Test
  void concatenatedBatchesEqualTheFullResult() {
    seed(7);
    List<Widget> full = db.inSession(false, s -> s.select(ALL, row -> Widget.TYPE.fromFields(row.asMap())));
    List<Widget> batched = collect(2, 0, false).stream()
        .flatMap(b -> b.rows().stream())
        .collect(Collectors.toList());
    assertEquals(full, batched);
  }

  @Test
  void exactMultipleEndsOnEmptyWindow() {
    seed(9);
    assertEquals(3, collect(3, 0, false).size());
  }

  @Test
  void startAtSkipsLeadingRows() {
    seed(10);
    List<Batch<Widget>> batches = collect(4, 4, false);
    assertEquals(2, batches.size());
    assertEquals(4L, batches.get(0).offset());
    assertEquals(Long.valueOf(5L), batches.get(0).rows().get(0).weight());
    assertEquals(2, batches.get(1).size());
  }

  @Test
  void computeTotalIsCarriedByEveryBatch() {
    seed(5);
    List<Batch<Widget>> batches = collect(2, 0, true);
    assertEquals(3, batches.size());
    assertTrue(batches.stream().allMatch(b -> Long.valueOf(5).equals(b.totalRows())));
  }

  @Test
  void emptyResultYieldsNoBatches() {
    assertTrue(collect(3, 0, false).isEmpty());
    assertTrue(collect(3, 0, true).isEmpty());
  }

  @Test
  void startAtBeyondEndYieldsNoBatches() {
    seed(3);
    assertTrue(collect(2, 10, false).isEmpty());
  }

  @Test
  void streamAndRowDefaults() {
    seed(4);
    long rows = db.inSession(false, s -> s.batched(ALL, 3).stream().mapToLong(Batch::size).sum());
    assertEquals(4L, rows);
  }

  @Test
  void iteratesOnlyOnce() {
    seed(2);
    db.useSession(false, s -> {
      BatchedQuery<?> q = s.batched(ALL, 1);
      Iterator<?> it = q.iterator();
      assertTrue(it.hasNext());
      assertThrows(IllegalStateException.class, q::iterator);
    });
  }

  @Test
  void rejectsIllegalArguments() {
    db.useSession(false, s -> {
      assertThrows(IllegalArgumentException.class, () -> s.batched(ALL, 0));
      assertThrows(IllegalArgumentException.class,
          () -> s.batched(ALL, row -> row, 2, -1, false));
    });
  }
}
