package org.fusequery.column;

import java.util.BitSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.fusequery.Type;

/**
 * A column of String values.
 */
public final class StringArrayColumn extends Column<String> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Contains the String values. The entry of a null row is unspecified. */
  private final String[] data;
  /** Number of elements in this column. */
  private final int numValues;

  /**
   * Constructs a new column.
   *
   * @param data the data, of length at least <code>numValues</code>. Not copied.
   * @param nulls the null rows, or null if no row is null.
   * @param numValues number of tuples.
   */
  public StringArrayColumn(final String[] data, @Nullable final BitSet nulls, final int numValues) {
    super(nulls);
    Preconditions.checkArgument(
        numValues >= 0 && numValues <= data.length, "numValues %s out of bounds", numValues);
    this.data = data;
    this.numValues = numValues;
  }

  @Override
  protected String getValue(final int row) {
    return getString(row);
  }

  @Override
  public String getString(final int row) {
    Preconditions.checkElementIndex(row, numValues);
    return data[row];
  }

  @Override
  public StringArrayColumn gather(final int[] rows) {
    String[] out = new String[rows.length];
    for (int i = 0; i < rows.length; ++i) {
      out[i] = data[Preconditions.checkElementIndex(rows[i], numValues)];
    }
    return new StringArrayColumn(out, gatherNulls(rows), rows.length);
  }

  @Override
  public Type getType() {
    return Type.STRING_TYPE;
  }

  @Override
  public int size() {
    return numValues;
  }
}
