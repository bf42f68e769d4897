package org.fusequery.operator.agg;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

import org.fusequery.DbException;
import org.fusequery.EvaluationException;
import org.fusequery.column.Column;
import org.fusequery.operator.agg.accumulator.Accumulator;
import org.fusequery.operator.agg.accumulator.AccumulatorFactory;
import org.fusequery.storage.Field;
import org.fusequery.storage.TupleBatch;

/**
 * The per-operator table of groups and their running aggregates. Every {@link #upsert} is one critical section under
 * the write lock, so several producers may feed one table; {@link #drain} holds the write lock for the whole
 * iteration.
 *
 * An upsert that fails before any accumulator has changed leaves the table as it was. An accumulator that fails on an
 * existing group may have folded in part of the batch, so from then on the table is broken: every later upsert and
 * drain fails with the original error as cause.
 */
@ThreadSafe
public final class PartialAggregationTable {

  /**
   * One aggregate of one group: its accumulator and where its arguments come from.
   */
  public static final class AggregateSlot {
    /** The running state. */
    private final Accumulator accumulator;
    /** The name of the output column. */
    private final String outputName;
    /** The names of the argument columns. */
    private final ImmutableList<String> argumentNames;

    /**
     * @param accumulator the running state.
     * @param outputName the name of the output column.
     * @param argumentNames the names of the argument columns.
     */
    AggregateSlot(final Accumulator accumulator, final String outputName, final ImmutableList<String> argumentNames) {
      this.accumulator = accumulator;
      this.outputName = outputName;
      this.argumentNames = argumentNames;
    }

    /**
     * @param tb the gathered rows of a group.
     * @return the argument columns of this aggregate in <code>tb</code>, in argument order.
     * @throws EvaluationException if an argument column is missing.
     */
    ImmutableList<Column<?>> arguments(final TupleBatch tb) throws EvaluationException {
      ImmutableList.Builder<Column<?>> arguments = ImmutableList.builder();
      for (String name : argumentNames) {
        try {
          arguments.add(tb.getDataColumn(name));
        } catch (NoSuchElementException e) {
          throw new EvaluationException(
              "argument column " + name + " of " + outputName + " not found in [" + tb.getSchema() + "]", e);
        }
      }
      return arguments.build();
    }

    /**
     * Fold rows into the accumulator.
     *
     * @param arguments the argument columns, as returned by {@link #arguments}.
     * @param numRows the number of rows.
     * @throws DbException if the accumulator fails.
     */
    void accumulate(final ImmutableList<Column<?>> arguments, final int numRows) throws DbException {
      accumulator.accumulate(arguments, numRows);
    }

    /**
     * @return the partial state of the aggregate.
     */
    public ImmutableList<Field> getResult() {
      return accumulator.getResult();
    }

    /**
     * @return the name of the output column.
     */
    public String getOutputName() {
      return outputName;
    }

    /**
     * @return the names of the argument columns.
     */
    public ImmutableList<String> getArgumentNames() {
      return argumentNames;
    }
  }

  /**
   * The aggregates of one group together with the group-by values of its first row.
   */
  public static final class GroupEntry {
    /** One slot per aggregate expression, in order. */
    private final ImmutableList<AggregateSlot> slots;
    /** The group-by values. */
    private final ImmutableList<Field> keyValues;

    /**
     * @param slots one slot per aggregate expression, in order.
     * @param keyValues the group-by values.
     */
    GroupEntry(final ImmutableList<AggregateSlot> slots, final ImmutableList<Field> keyValues) {
      this.slots = slots;
      this.keyValues = keyValues;
    }

    /**
     * @return one slot per aggregate expression, in order.
     */
    public ImmutableList<AggregateSlot> getSlots() {
      return slots;
    }

    /**
     * @return the group-by values.
     */
    public ImmutableList<Field> getKeyValues() {
      return keyValues;
    }
  }

  /**
   * Receives the groups of a table being drained.
   */
  @FunctionalInterface
  public interface GroupVisitor {
    /**
     * @param key the key of the group.
     * @param entry the group.
     * @throws DbException if the group cannot be consumed; the drain stops.
     */
    void visit(GroupKey key, GroupEntry entry) throws DbException;
  }

  /** Creates the accumulators of new groups. */
  private final AccumulatorFactory factory;

  /** Guards {@link #groups}. */
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  /** The groups. */
  @GuardedBy("lock")
  private final Map<GroupKey, GroupEntry> groups;

  /** The error that left a group partially updated, or null. */
  @GuardedBy("lock")
  private Throwable broken;

  /**
   * @param factory creates the accumulators of new groups.
   * @param expectedGroups the expected number of groups, used to size the table.
   */
  public PartialAggregationTable(final AccumulatorFactory factory, final int expectedGroups) {
    this.factory = Preconditions.checkNotNull(factory, "factory");
    Preconditions.checkArgument(expectedGroups > 0, "expectedGroups must be positive, got %s", expectedGroups);
    groups = Maps.newHashMapWithExpectedSize(expectedGroups);
  }

  /**
   * Fold the rows of one group from one batch into the table. A new group is inserted only once every one of its
   * aggregates has accumulated successfully.
   *
   * @param key the group key.
   * @param keyValues the group-by values of the group.
   * @param aggregates the aggregates of the query, in output order.
   * @param gathered the rows of the group from one batch.
   * @throws DbException if an accumulator cannot be created, an argument column is missing, an accumulator fails or an
   *         earlier upsert failed part way.
   */
  public void upsert(
      final GroupKey key,
      final ImmutableList<Field> keyValues,
      final List<AggregateExpression> aggregates,
      final TupleBatch gathered)
      throws DbException {
    lock.writeLock().lock();
    try {
      checkNotBroken();
      GroupEntry entry = groups.get(key);
      if (entry != null) {
        accumulateExisting(entry, gathered);
        return;
      }
      ImmutableList.Builder<AggregateSlot> slots = ImmutableList.builder();
      for (AggregateExpression aggregate : aggregates) {
        Accumulator accumulator = factory.create(aggregate.getFunction(), aggregate.getArguments());
        AggregateSlot slot = new AggregateSlot(accumulator, aggregate.getOutputName(), aggregate.getArguments());
        slot.accumulate(slot.arguments(gathered), gathered.numTuples());
        slots.add(slot);
      }
      groups.put(key, new GroupEntry(slots.build(), keyValues));
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Fold a batch into every aggregate of an existing group. All argument columns are resolved before the first
   * accumulator changes.
   *
   * @param entry the group.
   * @param gathered the rows of the group from one batch.
   * @throws DbException if an argument column is missing or an accumulator fails.
   */
  @GuardedBy("lock")
  private void accumulateExisting(final GroupEntry entry, final TupleBatch gathered) throws DbException {
    ImmutableList<AggregateSlot> slots = entry.getSlots();
    List<ImmutableList<Column<?>>> arguments = new ArrayList<>(slots.size());
    for (AggregateSlot slot : slots) {
      arguments.add(slot.arguments(gathered));
    }
    try {
      for (int i = 0; i < slots.size(); ++i) {
        slots.get(i).accumulate(arguments.get(i), gathered.numTuples());
      }
    } catch (DbException | RuntimeException e) {
      broken = e;
      throw e;
    }
  }

  /**
   * @throws DbException if an earlier upsert left a group partially updated.
   */
  @GuardedBy("lock")
  private void checkNotBroken() throws DbException {
    if (broken != null) {
      throw new DbException("aggregation table is unusable after a failed upsert", broken);
    }
  }

  /**
   * Visit every group, then empty the table. No upsert can run during the drain. If the visitor fails, the table is
   * left unchanged.
   *
   * @param visitor receives every group.
   * @throws DbException if the visitor fails or an earlier upsert failed part way.
   */
  public void drain(final GroupVisitor visitor) throws DbException {
    lock.writeLock().lock();
    try {
      checkNotBroken();
      for (Map.Entry<GroupKey, GroupEntry> e : groups.entrySet()) {
        visitor.visit(e.getKey(), e.getValue());
      }
      groups.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @return whether the table holds no group.
   */
  public boolean isEmpty() {
    lock.readLock().lock();
    try {
      return groups.isEmpty();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return the number of groups.
   */
  public int numGroups() {
    lock.readLock().lock();
    try {
      return groups.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
