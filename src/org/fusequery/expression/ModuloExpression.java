package org.fusequery.expression;

import com.google.common.collect.ImmutableList;

import org.fusequery.Schema;
import org.fusequery.Type;

/**
 * Modulo of two operands in an expression tree.
 */
public class ModuloExpression extends BinaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private ModuloExpression() {}

  /**
   * Divide the two operands and take the remainder.
   *
   * @param left the left operand.
   * @param right the right operand.
   */
  public ModuloExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  public Type getOutputType(final Schema schema) {
    return checkAndReturnDefaultNumericType(schema, ImmutableList.of(Type.LONG_TYPE, Type.INT_TYPE));
  }

  @Override
  protected int applyInt(final int l, final int r) {
    return l % r;
  }

  @Override
  protected long applyLong(final long l, final long r) {
    return l % r;
  }

  @Override
  protected double applyDouble(final double l, final double r) {
    return l % r;
  }

  @Override
  protected String getInfix() {
    return "%";
  }
}
