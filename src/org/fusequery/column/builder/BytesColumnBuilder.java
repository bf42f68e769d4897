package org.fusequery.column.builder;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import org.fusequery.Type;
import org.fusequery.column.BytesColumn;

/**
 * A growable builder of a column of ByteBuffer values.
 */
public final class BytesColumnBuilder extends ColumnBuilder<ByteBuffer> {
  /** The column data. Null rows hold a null entry. */
  private final List<ByteBuffer> data;

  /**
   * @param expectedSize initial capacity.
   */
  public BytesColumnBuilder(final int expectedSize) {
    data = new ArrayList<>(expectedSize);
  }

  @Override
  public Type getType() {
    return Type.BYTES_TYPE;
  }

  @Override
  public BytesColumnBuilder appendByteBuffer(final ByteBuffer value) {
    checkNotBuilt();
    Objects.requireNonNull(value, "value");
    data.add(value.asReadOnlyBuffer());
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
  protected BytesColumn doBuild(@Nullable final BitSet nullRows) {
    return new BytesColumn(data.toArray(new ByteBuffer[0]), nullRows, data.size());
  }
}
