package org.fusequery.column.builder;

import java.util.BitSet;

import javax.annotation.Nullable;

import org.eclipse.collections.impl.list.mutable.primitive.FloatArrayList;

import org.fusequery.Type;
import org.fusequery.column.FloatColumn;

/**
 * A growable builder of a column of Float values.
 */
public final class FloatColumnBuilder extends ColumnBuilder<Float> {
  /** The column data. */
  private final FloatArrayList data;

  /**
   * @param expectedSize initial capacity.
   */
  public FloatColumnBuilder(final int expectedSize) {
    data = new FloatArrayList(expectedSize);
  }

  @Override
  public Type getType() {
    return Type.FLOAT_TYPE;
  }

  @Override
  public FloatColumnBuilder appendFloat(final float value) {
    checkNotBuilt();
    data.add(value);
    return this;
  }

  @Override
  protected void appendPlaceholder() {
    data.add(0f);
  }

  @Override
  public int size() {
    return data.size();
  }

  @Override
  protected FloatColumn doBuild(@Nullable final BitSet nullRows) {
    return new FloatColumn(data.toArray(), nullRows, data.size());
  }
}
