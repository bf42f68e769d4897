package org.fusequery.operator.agg.accumulator;

import java.util.List;

import org.fusequery.DbException;

/**
 * Creates {@link Accumulator}s by aggregate function name.
 */
public interface AccumulatorFactory {

  /**
   * @param functionName the name of the aggregate function, e.g. <code>sum</code>.
   * @param argumentNames the names of the argument columns.
   * @return a fresh accumulator.
   * @throws DbException if the function is unknown or does not take these arguments.
   */
  Accumulator create(String functionName, List<String> argumentNames) throws DbException;
}
