package org.fusequery.column.builder;

import java.util.BitSet;

import javax.annotation.Nullable;

import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;

import org.fusequery.Type;
import org.fusequery.column.DoubleColumn;

/**
 * A growable builder of a column of Double values.
 */
public final class DoubleColumnBuilder extends ColumnBuilder<Double> {
  /** The column data. */
  private final DoubleArrayList data;

  /**
   * @param expectedSize initial capacity.
   */
  public DoubleColumnBuilder(final int expectedSize) {
    data = new DoubleArrayList(expectedSize);
  }

  @Override
  public Type getType() {
    return Type.DOUBLE_TYPE;
  }

  @Override
  public DoubleColumnBuilder appendDouble(final double value) {
    checkNotBuilt();
    data.add(value);
    return this;
  }

  @Override
  protected void appendPlaceholder() {
    data.add(0d);
  }

  @Override
  public int size() {
    return data.size();
  }

  @Override
  protected DoubleColumn doBuild(@Nullable final BitSet nullRows) {
    return new DoubleColumn(data.toArray(), nullRows, data.size());
  }
}
