package org.fusequery.column;

import java.util.BitSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.fusequery.Type;

/**
 * A column of Double values.
 */
public final class DoubleColumn extends Column<Double> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Internal representation of the column data. */
  private final double[] data;
  /** The number of existing rows in this column. */
  private final int position;

  /**
   * Constructs a new column.
   *
   * @param data the data, of length at least <code>numData</code>. Not copied.
   * @param nulls the null rows, or null if no row is null.
   * @param numData number of tuples.
   */
  public DoubleColumn(final double[] data, @Nullable final BitSet nulls, final int numData) {
    super(nulls);
    Preconditions.checkArgument(numData >= 0 && numData <= data.length, "numData %s out of bounds", numData);
    this.data = data;
    position = numData;
  }

  @Override
  protected Double getValue(final int row) {
    return getDouble(row);
  }

  @Override
  public double getDouble(final int row) {
    Preconditions.checkElementIndex(row, position);
    return data[row];
  }

  @Override
  public DoubleColumn gather(final int[] rows) {
    double[] out = new double[rows.length];
    for (int i = 0; i < rows.length; ++i) {
      out[i] = data[Preconditions.checkElementIndex(rows[i], position)];
    }
    return new DoubleColumn(out, gatherNulls(rows), rows.length);
  }

  @Override
  public Type getType() {
    return Type.DOUBLE_TYPE;
  }

  @Override
  public int size() {
    return position;
  }
}
