package org.fusequery.column;

import java.nio.ByteBuffer;
import java.util.BitSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.fusequery.Type;

/**
 * A column of ByteBuffer values.
 */
public final class BytesColumn extends Column<ByteBuffer> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Contains the ByteBuffer values. The entry of a null row is unspecified. */
  private final ByteBuffer[] data;
  /** Number of elements in this column. */
  private final int numValues;

  /**
   * Constructs a new column.
   *
   * @param data the data, of length at least <code>numValues</code>. Not copied.
   * @param nulls the null rows, or null if no row is null.
   * @param numValues number of tuples.
   */
  public BytesColumn(final ByteBuffer[] data, @Nullable final BitSet nulls, final int numValues) {
    super(nulls);
    Preconditions.checkArgument(
        numValues >= 0 && numValues <= data.length, "numValues %s out of bounds", numValues);
    this.data = data;
    this.numValues = numValues;
  }

  @Override
  protected ByteBuffer getValue(final int row) {
    return getByteBuffer(row);
  }

  @Override
  public ByteBuffer getByteBuffer(final int row) {
    Preconditions.checkElementIndex(row, numValues);
    return data[row].asReadOnlyBuffer();
  }

  @Override
  public BytesColumn gather(final int[] rows) {
    ByteBuffer[] out = new ByteBuffer[rows.length];
    for (int i = 0; i < rows.length; ++i) {
      out[i] = data[Preconditions.checkElementIndex(rows[i], numValues)];
    }
    return new BytesColumn(out, gatherNulls(rows), rows.length);
  }

  @Override
  public Type getType() {
    return Type.BYTES_TYPE;
  }

  @Override
  public int size() {
    return numValues;
  }
}
