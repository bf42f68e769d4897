package org.fusequery.column.builder;

import java.util.BitSet;

import javax.annotation.Nullable;

import org.eclipse.collections.impl.list.mutable.primitive.LongArrayList;

import org.fusequery.Type;
import org.fusequery.column.LongColumn;

/**
 * A growable builder of a column of Long values.
 */
public final class LongColumnBuilder extends ColumnBuilder<Long> {
  /** The column data. */
  private final LongArrayList data;

  /**
   * @param expectedSize initial capacity.
   */
  public LongColumnBuilder(final int expectedSize) {
    data = new LongArrayList(expectedSize);
  }

  @Override
  public Type getType() {
    return Type.LONG_TYPE;
  }

  @Override
  public LongColumnBuilder appendLong(final long value) {
    checkNotBuilt();
    data.add(value);
    return this;
  }

  @Override
  protected void appendPlaceholder() {
    data.add(0L);
  }

  @Override
  public int size() {
    return data.size();
  }

  @Override
  protected LongColumn doBuild(@Nullable final BitSet nullRows) {
    return new LongColumn(data.toArray(), nullRows, data.size());
  }
}
