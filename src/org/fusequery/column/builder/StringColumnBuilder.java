package org.fusequery.column.builder;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import org.fusequery.Type;
import org.fusequery.column.StringArrayColumn;

/**
 * A growable builder of a column of String values.
 */
public final class StringColumnBuilder extends ColumnBuilder<String> {
  /** The column data. Null rows hold a null entry. */
  private final List<String> data;

  /**
   * @param expectedSize initial capacity.
   */
  public StringColumnBuilder(final int expectedSize) {
    data = new ArrayList<>(expectedSize);
  }

  @Override
  public Type getType() {
    return Type.STRING_TYPE;
  }

  @Override
  public StringColumnBuilder appendString(final String value) {
    checkNotBuilt();
    Objects.requireNonNull(value, "value");
    data.add(value);
    return this;
  }

  @Override
  protected void appendPlaceholder() {
    data.add(null);
  }

  @Override
  public int size() {
    return data.size();
  }

  @Override
  protected StringArrayColumn doBuild(@Nullable final BitSet nullRows) {
    return new StringArrayColumn(data.toArray(new String[0]), nullRows, data.size());
  }
}
