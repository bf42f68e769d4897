package org.fusequery.operator.agg.accumulator;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import org.fusequery.Type;
import org.fusequery.storage.Field;
import org.fusequery.storage.ReadableColumn;

/**
 * MIN or MAX of the non-null values of any type. Values compare by their natural order; the result is null if there
 * is no value.
 */
public final class MinMaxAccumulator extends SingleColumnAccumulator {

  /** True for MAX, false for MIN. */
  private final boolean max;
  /** The extreme value so far. */
  @Nullable private Comparable<Object> extreme;

  /**
   * @param max true for MAX, false for MIN.
   */
  public MinMaxAccumulator(final boolean max) {
    this.max = max;
  }

  @Override
  protected boolean supports(final Type type) {
    return true;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected void addValue(final ReadableColumn column, final int row) {
    Comparable<Object> value = (Comparable<Object>) column.getObject(row);
    if (extreme == null) {
      extreme = value;
      return;
    }
    int cmp = value.compareTo(extreme);
    if (max ? cmp > 0 : cmp < 0) {
      extreme = value;
    }
  }

  @Override
  public ImmutableList<Field> getResult() {
    Type type = getInputType();
    if (type == null) {
      return ImmutableList.of(Field.nullOf(Type.LONG_TYPE));
    }
    return ImmutableList.of(Field.of(type, extreme));
  }
}
