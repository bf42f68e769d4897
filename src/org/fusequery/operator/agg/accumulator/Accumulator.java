package org.fusequery.operator.agg.accumulator;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.fusequery.DbException;
import org.fusequery.storage.Field;
import org.fusequery.storage.ReadableColumn;

/**
 * The running state of one aggregate function over the rows of one group.
 *
 * Accumulating twice has the same effect as accumulating once over the concatenation of both inputs, so a group's rows
 * may arrive in any number of batches.
 */
public interface Accumulator {

  /**
   * Fold rows into the state.
   *
   * @param arguments the argument columns of the aggregate, in argument order; all have at least <code>numRows</code>
   *        rows.
   * @param numRows the number of rows to fold in.
   * @throws DbException if the arguments do not fit this aggregate or its state overflows.
   */
  void accumulate(List<? extends ReadableColumn> arguments, int numRows) throws DbException;

  /**
   * @return the partial state, as a list of typed values a merge stage can combine.
   */
  ImmutableList<Field> getResult();
}
