package org.fusequery.operator.agg.accumulator;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;

import org.fusequery.Type;
import org.fusequery.storage.Field;
import org.fusequery.storage.ReadableColumn;

/**
 * SUM. Integral arguments are summed into a LONG and fail on overflow; floating point arguments are summed into a
 * DOUBLE. The sum of no value is null.
 */
public final class SumAccumulator extends SingleColumnAccumulator {

  /** Running sum of integral values. */
  private long longSum;
  /** Running sum of floating point values. */
  private double doubleSum;
  /** Whether any non-null value was folded in. */
  private boolean seenValue;

  @Override
  protected boolean supports(final Type type) {
    return type == Type.INT_TYPE || type == Type.LONG_TYPE || type == Type.FLOAT_TYPE || type == Type.DOUBLE_TYPE;
  }

  @Override
  protected void addValue(final ReadableColumn column, final int row) {
    switch (column.getType()) {
      case INT_TYPE:
        longSum = LongMath.checkedAdd(longSum, column.getInt(row));
        break;
      case LONG_TYPE:
        longSum = LongMath.checkedAdd(longSum, column.getLong(row));
        break;
      case FLOAT_TYPE:
        doubleSum += column.getFloat(row);
        break;
      case DOUBLE_TYPE:
        doubleSum += column.getDouble(row);
        break;
      default:
        throw new IllegalStateException("unexpected type " + column.getType());
    }
    seenValue = true;
  }

  /**
   * @param inputType the type of the summed values, null if unknown.
   * @return the type of the sum.
   */
  static Type sumTypeOf(@Nullable final Type inputType) {
    if (inputType == Type.FLOAT_TYPE || inputType == Type.DOUBLE_TYPE) {
      return Type.DOUBLE_TYPE;
    }
    return Type.LONG_TYPE;
  }

  /**
   * @param inputType the type of the summed values, null if unknown.
   * @return the sum, a null field if no value was folded in.
   */
  Field getSum(@Nullable final Type inputType) {
    Type sumType = sumTypeOf(inputType);
    if (!seenValue) {
      return Field.nullOf(sumType);
    }
    if (sumType == Type.DOUBLE_TYPE) {
      return Field.of(doubleSum);
    }
    return Field.of(longSum);
  }

  @Override
  public ImmutableList<Field> getResult() {
    return ImmutableList.of(getSum(getInputType()));
  }
}
