package org.fusequery.column;

import java.util.BitSet;

import javax.annotation.Nullable;

import org.joda.time.DateTime;

import com.google.common.base.Preconditions;

import org.fusequery.Type;

/**
 * A column of DateTime values.
 */
public final class DateTimeColumn extends Column<DateTime> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Contains the DateTime values. The entry of a null row is unspecified. */
  private final DateTime[] data;
  /** Number of elements in this column. */
  private final int numValues;

  /**
   * Constructs a new column.
   *
   * @param data the data, of length at least <code>numValues</code>. Not copied.
   * @param nulls the null rows, or null if no row is null.
   * @param numValues number of tuples.
   */
  public DateTimeColumn(final DateTime[] data, @Nullable final BitSet nulls, final int numValues) {
    super(nulls);
    Preconditions.checkArgument(
        numValues >= 0 && numValues <= data.length, "numValues %s out of bounds", numValues);
    this.data = data;
    this.numValues = numValues;
  }

  @Override
  protected DateTime getValue(final int row) {
    return getDateTime(row);
  }

  @Override
  public DateTime getDateTime(final int row) {
    Preconditions.checkElementIndex(row, numValues);
    return data[row];
  }

  @Override
  public DateTimeColumn gather(final int[] rows) {
    DateTime[] out = new DateTime[rows.length];
    for (int i = 0; i < rows.length; ++i) {
      out[i] = data[Preconditions.checkElementIndex(rows[i], numValues)];
    }
    return new DateTimeColumn(out, gatherNulls(rows), rows.length);
  }

  @Override
  public Type getType() {
    return Type.DATETIME_TYPE;
  }

  @Override
  public int size() {
    return numValues;
  }
}
