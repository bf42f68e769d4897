package org.fusequery.column.builder;

import java.util.BitSet;

import javax.annotation.Nullable;

import org.eclipse.collections.impl.list.mutable.primitive.BooleanArrayList;

import org.fusequery.Type;
import org.fusequery.column.BooleanColumn;

/**
 * A growable builder of a column of Boolean values.
 */
public final class BooleanColumnBuilder extends ColumnBuilder<Boolean> {
  /** The column data. */
  private final BooleanArrayList data;

  /**
   * @param expectedSize initial capacity.
   */
  public BooleanColumnBuilder(final int expectedSize) {
    data = new BooleanArrayList(expectedSize);
  }

  @Override
  public Type getType() {
    return Type.BOOLEAN_TYPE;
  }

  @Override
  public BooleanColumnBuilder appendBoolean(final boolean value) {
    checkNotBuilt();
    data.add(value);
    return this;
  }

  @Override
  protected void appendPlaceholder() {
    data.add(false);
  }

  @Override
  public int size() {
    return data.size();
  }

  @Override
  protected BooleanColumn doBuild(@Nullable final BitSet nullRows) {
    return new BooleanColumn(data.toArray(), nullRows, data.size());
  }
}
