package org.fusequery.operator.agg.accumulator;

import java.util.List;

import javax.annotation.Nullable;

import org.fusequery.DbException;
import org.fusequery.EvaluationException;
import org.fusequery.Type;
import org.fusequery.storage.ReadableColumn;

/**
 * An accumulator over the non-null values of one argument column. The type of the column is fixed by the first
 * accumulate call.
 */
public abstract class SingleColumnAccumulator implements Accumulator {

  /** The type of the argument, null until the first accumulate call. */
  @Nullable private Type inputType;

  @Override
  public final void accumulate(final List<? extends ReadableColumn> arguments, final int numRows)
      throws DbException {
    if (arguments.size() != 1) {
      throw new EvaluationException(
          getClass().getSimpleName() + " expects 1 argument column, got " + arguments.size());
    }
    ReadableColumn column = arguments.get(0);
    if (column.size() < numRows) {
      throw new EvaluationException("argument column has " + column.size() + " rows, expected " + numRows);
    }
    if (inputType == null) {
      if (!supports(column.getType())) {
        throw new EvaluationException(getClass().getSimpleName() + " does not support type " + column.getType());
      }
      inputType = column.getType();
    } else if (inputType != column.getType()) {
      throw new EvaluationException(
          "argument column changed type from " + inputType + " to " + column.getType() + " between batches");
    }
    try {
      for (int row = 0; row < numRows; ++row) {
        if (!column.isNull(row)) {
          addValue(column, row);
        }
      }
    } catch (ArithmeticException e) {
      throw new EvaluationException(getClass().getSimpleName() + " overflowed", e);
    }
  }

  /**
   * @return the type of the argument, null if nothing has been accumulated.
   */
  @Nullable
  protected final Type getInputType() {
    return inputType;
  }

  /**
   * @param type the type of an argument column.
   * @return whether this accumulator can fold values of the type.
   */
  protected abstract boolean supports(Type type);

  /**
   * Fold one non-null value into the state.
   *
   * @param column the argument column.
   * @param row the row of the value.
   * @throws ArithmeticException if the state overflows.
   */
  protected abstract void addValue(ReadableColumn column, int row);
}
