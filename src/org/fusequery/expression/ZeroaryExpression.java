package org.fusequery.expression;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An ExpressionOperator with no children.
 */
public abstract class ZeroaryExpression extends ExpressionOperator {
  /***/
  private static final long serialVersionUID = 1L;

  @Override
  public List<ExpressionOperator> getChildren() {
    return ImmutableList.of();
  }
}
