package org.fusequery.column;

import java.util.BitSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.fusequery.Type;

/**
 * A column of Float values.
 */
public final class FloatColumn extends Column<Float> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Internal representation of the column data. */
  private final float[] data;
  /** The number of existing rows in this column. */
  private final int position;

  /**
   * Constructs a new column.
   *
   * @param data the data, of length at least <code>numData</code>. Not copied.
   * @param nulls the null rows, or null if no row is null.
   * @param numData number of tuples.
   */
  public FloatColumn(final float[] data, @Nullable final BitSet nulls, final int numData) {
    super(nulls);
    Preconditions.checkArgument(numData >= 0 && numData <= data.length, "numData %s out of bounds", numData);
    this.data = data;
    position = numData;
  }

  @Override
  protected Float getValue(final int row) {
    return getFloat(row);
  }

  @Override
  public float getFloat(final int row) {
    Preconditions.checkElementIndex(row, position);
    return data[row];
  }

  @Override
  public FloatColumn gather(final int[] rows) {
    float[] out = new float[rows.length];
    for (int i = 0; i < rows.length; ++i) {
      out[i] = data[Preconditions.checkElementIndex(rows[i], position)];
    }
    return new FloatColumn(out, gatherNulls(rows), rows.length);
  }

  @Override
  public Type getType() {
    return Type.FLOAT_TYPE;
  }

  @Override
  public int size() {
    return position;
  }
}
