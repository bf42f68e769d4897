package org.fusequery.expression;

import com.google.common.math.IntMath;
import com.google.common.math.LongMath;

/**
 * Multiply two operands in an expression tree.
 */
public class TimesExpression extends BinaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  @SuppressWarnings("unused")
  private TimesExpression() {}

  /**
   * Multiply the two operands together.
   *
   * @param left the left operand.
   * @param right the right operand.
   */
  public TimesExpression(final ExpressionOperator left, final ExpressionOperator right) {
    super(left, right);
  }

  @Override
  protected int applyInt(final int l, final int r) {
    return IntMath.checkedMultiply(l, r);
  }

  @Override
  protected long applyLong(final long l, final long r) {
    return LongMath.checkedMultiply(l, r);
  }

  @Override
  protected double applyDouble(final double l, final double r) {
    return l * r;
  }

  @Override
  protected String getInfix() {
    return "*";
  }
}
