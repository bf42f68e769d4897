package org.fusequery.column;

import java.io.Serializable;
import java.nio.ByteBuffer;
import java.util.BitSet;

import javax.annotation.Nullable;

import org.joda.time.DateTime;

import com.google.common.base.Preconditions;

import org.fusequery.Type;
import org.fusequery.column.builder.ColumnBuilder;
import org.fusequery.storage.ReadableColumn;

/**
 * An immutable column of a batch of tuples.
 *
 * @param <T> type of the objects in this column.
 */
public abstract class Column<T extends Comparable<?>> implements ReadableColumn, Serializable {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The null rows of this column, or null if no row is null. */
  @Nullable private final BitSet nulls;

  /**
   * @param nulls the null rows of this column, or null if no row is null. Not copied.
   */
  protected Column(@Nullable final BitSet nulls) {
    if (nulls == null || nulls.isEmpty()) {
      this.nulls = null;
    } else {
      this.nulls = nulls;
    }
  }

  @Override
  public final boolean isNull(final int row) {
    Preconditions.checkElementIndex(row, size());
    return nulls != null && nulls.get(row);
  }

  /**
   * @return whether any row of this column is null.
   */
  public final boolean hasNulls() {
    return nulls != null;
  }

  @Override
  public boolean getBoolean(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public ByteBuffer getByteBuffer(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public DateTime getDateTime(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public double getDouble(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public float getFloat(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public int getInt(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public long getLong(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public String getString(final int row) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  @Nullable
  public final T getObject(final int row) {
    if (isNull(row)) {
      return null;
    }
    return getValue(row);
  }

  /**
   * @param row a non-null row.
   * @return the boxed value at the row.
   */
  protected abstract T getValue(int row);

  @Override
  public abstract Type getType();

  @Override
  public abstract int size();

  /**
   * Creates a new Column containing exactly the specified rows of this column, in the given order. A row may appear
   * more than once.
   *
   * @param rows the rows to be copied.
   * @return the new column, of size <code>rows.length</code>.
   */
  public Column<?> gather(final int[] rows) {
    ColumnBuilder<?> builder = ColumnBuilder.of(getType(), rows.length);
    for (int row : rows) {
      builder.appendFrom(this, row);
    }
    return builder.build();
  }

  /**
   * @param rows the gathered rows.
   * @return the null rows of the gathered column, or null if none of them is null.
   */
  @Nullable
  protected final BitSet gatherNulls(final int[] rows) {
    if (nulls == null) {
      return null;
    }
    BitSet ret = new BitSet(rows.length);
    for (int i = 0; i < rows.length; ++i) {
      if (nulls.get(rows[i])) {
        ret.set(i);
      }
    }
    return ret;
  }

  /**
   * @param type the type of the column to be returned.
   * @return a new empty column of the specified type.
   */
  public static Column<?> emptyColumn(final Type type) {
    return ColumnBuilder.of(type, 0).build();
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append(": [");
    for (int i = 0; i < size(); ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(getType().toString(this, i));
    }
    return sb.append(']').toString();
  }
}
