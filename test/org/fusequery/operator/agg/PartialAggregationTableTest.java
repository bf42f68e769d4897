package org.fusequery.operator.agg;

import static org.fusequery.util.TestUtils.batch;
import static org.fusequery.util.TestUtils.row;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import org.fusequery.DbException;
import org.fusequery.EvaluationException;
import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.operator.agg.PartialAggregationTable.GroupEntry;
import org.fusequery.operator.agg.accumulator.Accumulators;
import org.fusequery.storage.Field;
import org.fusequery.storage.TupleBatch;

public class PartialAggregationTableTest {

  private static final Schema SCHEMA = Schema.ofFields("a", Type.LONG_TYPE);
  private static final List<AggregateExpression> AGGS =
      ImmutableList.of(AggregateExpression.of("count"), AggregateExpression.of("sum", "a"));
  private static final GroupKey KEY = GroupKey.copyOf(new byte[] {1});
  private static final ImmutableList<Field> KEY_VALUES = ImmutableList.of(Field.of(1L));

  private static Map<GroupKey, GroupEntry> drain(final PartialAggregationTable table) throws DbException {
    Map<GroupKey, GroupEntry> ret = new HashMap<>();
    table.drain(ret::put);
    return ret;
  }

  @Test
  public void testMissThenHit() throws Exception {
    PartialAggregationTable table = new PartialAggregationTable(Accumulators.builtIns(), 4);
    assertTrue(table.isEmpty());
    table.upsert(KEY, KEY_VALUES, AGGS, batch(SCHEMA, row(1L), row(2L)));
    table.upsert(KEY, KEY_VALUES, AGGS, batch(SCHEMA, row(3L)));
    table.upsert(GroupKey.copyOf(new byte[] {2}), ImmutableList.of(Field.of(2L)), AGGS, batch(SCHEMA, row(10L)));
    assertEquals(2, table.numGroups());

    GroupEntry entry = drain(table).get(KEY);
    assertEquals(KEY_VALUES, entry.getKeyValues());
    assertEquals(2, entry.getSlots().size());
    assertEquals("count_all", entry.getSlots().get(0).getOutputName());
    assertEquals(ImmutableList.of(Field.of(3L)), entry.getSlots().get(0).getResult());
    assertEquals(ImmutableList.of("a"), entry.getSlots().get(1).getArgumentNames());
    assertEquals(ImmutableList.of(Field.of(6L)), entry.getSlots().get(1).getResult());
    assertTrue(table.isEmpty());
  }

  @Test
  public void testFailedMissInsertsNothing() throws Exception {
    PartialAggregationTable table = new PartialAggregationTable(Accumulators.builtIns(), 4);
    List<AggregateExpression> aggs =
        ImmutableList.of(AggregateExpression.of("count"), AggregateExpression.of("sum", "missing"));
    try {
      table.upsert(KEY, KEY_VALUES, aggs, batch(SCHEMA, row(1L)));
      fail("missing argument column must fail");
    } catch (EvaluationException e) {
      assertTrue(e.getMessage().contains("missing"));
    }
    assertTrue(table.isEmpty());
  }

  @Test
  public void testFailedHitWithMissingColumnKeepsGroup() throws Exception {
    PartialAggregationTable table = new PartialAggregationTable(Accumulators.builtIns(), 4);
    table.upsert(KEY, KEY_VALUES, AGGS, batch(SCHEMA, row(1L)));
    Schema other = Schema.ofFields("b", Type.LONG_TYPE);
    try {
      table.upsert(KEY, KEY_VALUES, AGGS, batch(other, row(5L), row(6L)));
      fail("missing argument column must fail");
    } catch (EvaluationException e) {
      assertTrue(e.getMessage().contains("argument column a"));
    }

    // Nothing was folded in, not even the count.
    table.upsert(KEY, KEY_VALUES, AGGS, batch(SCHEMA, row(2L)));
    GroupEntry entry = drain(table).get(KEY);
    assertEquals(ImmutableList.of(Field.of(2L)), entry.getSlots().get(0).getResult());
    assertEquals(ImmutableList.of(Field.of(3L)), entry.getSlots().get(1).getResult());
  }

  @Test
  public void testFailedAccumulateBreaksTable() throws Exception {
    PartialAggregationTable table = new PartialAggregationTable(Accumulators.builtIns(), 4);
    table.upsert(KEY, KEY_VALUES, AGGS, batch(SCHEMA, row(1L)));
    // count accepts the batch, then sum rejects the new type of a.
    Schema doubles = Schema.ofFields("a", Type.DOUBLE_TYPE);
    EvaluationException cause = null;
    try {
      table.upsert(KEY, KEY_VALUES, AGGS, batch(doubles, row(2.0)));
      fail("type change of an argument column must fail");
    } catch (EvaluationException e) {
      cause = e;
    }

    try {
      table.upsert(GroupKey.copyOf(new byte[] {2}), ImmutableList.of(Field.of(2L)), AGGS, batch(SCHEMA, row(3L)));
      fail("a broken table must reject upserts");
    } catch (DbException e) {
      assertSame(cause, e.getCause());
    }
    try {
      drain(table);
      fail("a broken table must reject drains");
    } catch (DbException e) {
      assertSame(cause, e.getCause());
    }
    assertEquals(1, table.numGroups());
  }

  @Test(expected = DbException.class)
  public void testUnknownFunction() throws Exception {
    PartialAggregationTable table = new PartialAggregationTable(Accumulators.builtIns(), 4);
    table.upsert(KEY, KEY_VALUES, ImmutableList.of(AggregateExpression.of("median", "a")), batch(SCHEMA, row(1L)));
  }

  @Test
  public void testFailedDrainKeepsGroups() throws Exception {
    PartialAggregationTable table = new PartialAggregationTable(Accumulators.builtIns(), 4);
    table.upsert(KEY, KEY_VALUES, AGGS, batch(SCHEMA, row(1L)));
    try {
      table.drain(
          (key, entry) -> {
            throw new DbException("boom");
          });
      fail("drain must propagate the visitor error");
    } catch (DbException e) {
      assertEquals("boom", e.getMessage());
    }
    assertEquals(1, table.numGroups());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveExpectedGroups() {
    new PartialAggregationTable(Accumulators.builtIns(), 0);
  }

  @Test
  public void testConcurrentUpserts() throws Exception {
    final PartialAggregationTable table = new PartialAggregationTable(Accumulators.builtIns(), 1);
    final int numThreads = 8;
    final int perThread = 500;
    final TupleBatch one = batch(SCHEMA, row(1L));
    ExecutorService pool = Executors.newFixedThreadPool(numThreads);
    try {
      List<Future<Void>> futures = new ArrayList<>();
      for (int t = 0; t < numThreads; ++t) {
        final long group = t % 2;
        Callable<Void> task =
            () -> {
              for (int i = 0; i < perThread; ++i) {
                table.upsert(
                    GroupKey.copyOf(new byte[] {(byte) group}), ImmutableList.of(Field.of(group)), AGGS, one);
              }
              return null;
            };
        futures.add(pool.submit(task));
      }
      for (Future<Void> f : futures) {
        f.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    Map<GroupKey, GroupEntry> groups = drain(table);
    assertEquals(2, groups.size());
    long total = 0;
    for (GroupEntry entry : groups.values()) {
      long count = (Long) entry.getSlots().get(0).getResult().get(0).getObject();
      assertEquals(numThreads / 2 * perThread, count);
      total += count;
    }
    assertEquals(numThreads * perThread, total);
  }
}
