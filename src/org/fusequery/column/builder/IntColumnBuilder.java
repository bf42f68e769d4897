package org.fusequery.column.builder;

import java.util.BitSet;

import javax.annotation.Nullable;

import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

import org.fusequery.Type;
import org.fusequery.column.IntArrayColumn;

/**
 * A growable builder of a column of Integer values.
 */
public final class IntColumnBuilder extends ColumnBuilder<Integer> {
  /** The column data. */
  private final IntArrayList data;

  /**
   * @param expectedSize initial capacity.
   */
  public IntColumnBuilder(final int expectedSize) {
    data = new IntArrayList(expectedSize);
  }

  @Override
  public Type getType() {
    return Type.INT_TYPE;
  }

  @Override
  public IntColumnBuilder appendInt(final int value) {
    checkNotBuilt();
    data.add(value);
    return this;
  }

  @Override
  protected void appendPlaceholder() {
    data.add(0);
  }

  @Override
  public int size() {
    return data.size();
  }

  @Override
  protected IntArrayColumn doBuild(@Nullable final BitSet nullRows) {
    return new IntArrayColumn(data.toArray(), nullRows, data.size());
  }
}
