package org.fusequery.storage;

import javax.annotation.Nullable;

import org.fusequery.Schema;

/**
 * An interface for objects that contain a table (2-D) of tuples that is readable.
 */
public interface ReadableTable {
  /**
   * @return the Schema of the tuples in this table.
   */
  Schema getSchema();

  /**
   * @return the number of columns in this table.
   */
  int numColumns();

  /**
   * @return the number of tuples in this table.
   */
  int numTuples();

  /**
   * @param column the index of the column.
   * @return a read-only view of the specified column.
   */
  ReadableColumn asColumn(int column);

  /**
   * @param column the column of the desired value.
   * @param row the row of the desired value.
   * @return whether the value in the specified column and row is null.
   */
  boolean isNull(int column, int row);

  /**
   * @param column the column of the desired value.
   * @param row the row of the desired value.
   * @return the value in the specified column and row, boxed, or null.
   */
  @Nullable
  Object getObject(int column, int row);
}
