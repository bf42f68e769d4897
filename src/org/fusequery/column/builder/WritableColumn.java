package org.fusequery.column.builder;

import java.nio.ByteBuffer;

import javax.annotation.Nullable;

import org.joda.time.DateTime;

import org.fusequery.storage.ColumnInterface;
import org.fusequery.storage.ReadableColumn;

/**
 * An interface for a column that can be appended to. Appending a value of a type other than the column's own type
 * throws {@link UnsupportedOperationException}.
 */
public interface WritableColumn extends ColumnInterface {

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted.
   * @return this column.
   */
  WritableColumn appendBoolean(boolean value);

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted.
   * @return this column.
   */
  WritableColumn appendByteBuffer(ByteBuffer value);

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted.
   * @return this column.
   */
  WritableColumn appendDateTime(DateTime value);

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted.
   * @return this column.
   */
  WritableColumn appendDouble(double value);

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted.
   * @return this column.
   */
  WritableColumn appendFloat(float value);

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted.
   * @return this column.
   */
  WritableColumn appendInt(int value);

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted.
   * @return this column.
   */
  WritableColumn appendLong(long value);

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted.
   * @return this column.
   */
  WritableColumn appendString(String value);

  /**
   * Inserts a null at end of this column.
   *
   * @return this column.
   */
  WritableColumn appendNull();

  /**
   * Inserts the specified element at end of this column.
   *
   * @param value element to be inserted, null for a null value.
   * @return this column.
   * @throws IllegalArgumentException if the value is not of this column's type.
   */
  WritableColumn appendObject(@Nullable Object value);

  /**
   * Copy the value (or null) at a row of another column of the same type to the end of this column.
   *
   * @param column the source column.
   * @param row the source row.
   * @return this column.
   */
  WritableColumn appendFrom(ReadableColumn column, int row);
}
