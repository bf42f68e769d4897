package org.fusequery.storage;

import java.nio.ByteBuffer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.joda.time.DateTime;

/**
 * An interface for a readable object holding a single column of tuples. Every row is either null or holds a value of
 * the column's type; the typed getters must only be called on non-null rows.
 */
public interface ReadableColumn extends ColumnInterface {
  /**
   * @param row the row.
   * @return whether the value at the specified row is null.
   */
  boolean isNull(int row);

  /**
   * Returns the boolean value at the specified row in this column.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   * @throws UnsupportedOperationException if this column does not support this type.
   */
  boolean getBoolean(int row);

  /**
   * Returns the {@link ByteBuffer} value at the specified row in this column.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   * @throws UnsupportedOperationException if this column does not support this type.
   */
  @Nonnull
  ByteBuffer getByteBuffer(int row);

  /**
   * Returns the {@link DateTime} value at the specified row in this column.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   * @throws UnsupportedOperationException if this column does not support this type.
   */
  @Nonnull
  DateTime getDateTime(int row);

  /**
   * Returns the double value at the specified row in this column.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   * @throws UnsupportedOperationException if this column does not support this type.
   */
  double getDouble(int row);

  /**
   * Returns the float value at the specified row in this column.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   * @throws UnsupportedOperationException if this column does not support this type.
   */
  float getFloat(int row);

  /**
   * Returns the int value at the specified row in this column.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   * @throws UnsupportedOperationException if this column does not support this type.
   */
  int getInt(int row);

  /**
   * Returns the long value at the specified row in this column.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   * @throws UnsupportedOperationException if this column does not support this type.
   */
  long getLong(int row);

  /**
   * Returns the element at the specified row in this column, boxed.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column, or null if the row is null.
   */
  @Nullable
  Object getObject(int row);

  /**
   * Returns the {@link String} value at the specified row in this column.
   *
   * @param row row of element to return.
   * @return the element at the specified row in this column.
   * @throws UnsupportedOperationException if this column does not support this type.
   */
  @Nonnull
  String getString(int row);
}
