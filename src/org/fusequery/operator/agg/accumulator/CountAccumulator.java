package org.fusequery.operator.agg.accumulator;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.fusequery.EvaluationException;
import org.fusequery.storage.Field;
import org.fusequery.storage.ReadableColumn;

/**
 * COUNT. Without argument it counts rows; with one argument it counts the rows where the argument is not null.
 */
public final class CountAccumulator implements Accumulator {

  /** The number of arguments, 0 or 1. */
  private final int numArguments;
  /** The running count. */
  private long count;

  /**
   * @param numArguments the number of arguments, 0 or 1.
   */
  public CountAccumulator(final int numArguments) {
    Preconditions.checkArgument(numArguments == 0 || numArguments == 1, "count takes 0 or 1 arguments");
    this.numArguments = numArguments;
  }

  @Override
  public void accumulate(final List<? extends ReadableColumn> arguments, final int numRows)
      throws EvaluationException {
    if (arguments.size() != numArguments) {
      throw new EvaluationException("count expects " + numArguments + " argument columns, got " + arguments.size());
    }
    if (numArguments == 0) {
      count += numRows;
      return;
    }
    ReadableColumn column = arguments.get(0);
    for (int row = 0; row < numRows; ++row) {
      if (!column.isNull(row)) {
        ++count;
      }
    }
  }

  @Override
  public ImmutableList<Field> getResult() {
    return ImmutableList.of(Field.of(count));
  }
}
