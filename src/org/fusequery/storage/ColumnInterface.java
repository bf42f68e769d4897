package org.fusequery.storage;

import org.fusequery.Type;

/**
 * An interface for an object holding a single column of tuples.
 */
public interface ColumnInterface {
  /**
   * @return a {@link Type} object explaining what type of data is in this column.
   */
  Type getType();

  /**
   * Returns the number of elements in this column.
   *
   * @return the number of elements in this column.
   */
  int size();
}
