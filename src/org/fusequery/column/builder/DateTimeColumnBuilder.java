package org.fusequery.column.builder;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import org.joda.time.DateTime;

import org.fusequery.Type;
import org.fusequery.column.DateTimeColumn;

/**
 * A growable builder of a column of DateTime values.
 */
public final class DateTimeColumnBuilder extends ColumnBuilder<DateTime> {
  /** The column data. Null rows hold a null entry. */
  private final List<DateTime> data;

  /**
   * @param expectedSize initial capacity.
   */
  public DateTimeColumnBuilder(final int expectedSize) {
    data = new ArrayList<>(expectedSize);
  }

  @Override
  public Type getType() {
    return Type.DATETIME_TYPE;
  }

  @Override
  public DateTimeColumnBuilder appendDateTime(final DateTime value) {
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
  protected DateTimeColumn doBuild(@Nullable final BitSet nullRows) {
    return new DateTimeColumn(data.toArray(new DateTime[0]), nullRows, data.size());
  }
}
