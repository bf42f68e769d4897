package org.fusequery.column;

import java.util.BitSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.fusequery.Type;

/**
 * A column of Boolean values.
 */
public final class BooleanColumn extends Column<Boolean> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Internal representation of the column data. */
  private final boolean[] data;
  /** The number of existing rows in this column. */
  private final int position;

  /**
   * Constructs a new column.
   *
   * @param data the data, of length at least <code>numData</code>. Not copied.
   * @param nulls the null rows, or null if no row is null.
   * @param numData number of tuples.
   */
  public BooleanColumn(final boolean[] data, @Nullable final BitSet nulls, final int numData) {
    super(nulls);
    Preconditions.checkArgument(numData >= 0 && numData <= data.length, "numData %s out of bounds", numData);
    this.data = data;
    position = numData;
  }

  @Override
  protected Boolean getValue(final int row) {
    return getBoolean(row);
  }

  @Override
  public boolean getBoolean(final int row) {
    Preconditions.checkElementIndex(row, position);
    return data[row];
  }

  @Override
  public BooleanColumn gather(final int[] rows) {
    boolean[] out = new boolean[rows.length];
    for (int i = 0; i < rows.length; ++i) {
      out[i] = data[Preconditions.checkElementIndex(rows[i], position)];
    }
    return new BooleanColumn(out, gatherNulls(rows), rows.length);
  }

  @Override
  public Type getType() {
    return Type.BOOLEAN_TYPE;
  }

  @Override
  public int size() {
    return position;
  }
}
