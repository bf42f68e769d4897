package org.fusequery.operator.agg.accumulator;

import com.google.common.collect.ImmutableList;

import org.fusequery.Type;
import org.fusequery.storage.Field;
import org.fusequery.storage.ReadableColumn;

/**
 * AVG. The partial state is the pair (sum, count) so partial states of different partitions can be merged; the merge
 * stage divides.
 */
public final class AvgAccumulator extends SingleColumnAccumulator {

  /** Sum of the values. */
  private final SumAccumulator sum = new SumAccumulator();
  /** Number of non-null values. */
  private long count;

  @Override
  protected boolean supports(final Type type) {
    return sum.supports(type);
  }

  @Override
  protected void addValue(final ReadableColumn column, final int row) {
    sum.addValue(column, row);
    ++count;
  }

  @Override
  public ImmutableList<Field> getResult() {
    return ImmutableList.of(sum.getSum(getInputType()), Field.of(count));
  }
}
