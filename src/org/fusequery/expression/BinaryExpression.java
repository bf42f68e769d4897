package org.fusequery.expression;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.fusequery.EvaluationException;
import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.column.Column;
import org.fusequery.column.builder.ColumnBuilder;
import org.fusequery.storage.ReadableColumn;
import org.fusequery.storage.TupleBatch;

/**
 * An arithmetic ExpressionOperator with two numeric children. The result is null wherever either operand is null.
 */
public abstract class BinaryExpression extends ExpressionOperator {

  /***/
  private static final long serialVersionUID = 1L;

  /** Numeric types ordered by their precedence. */
  private static final List<Type> NUMERIC_TYPES =
      ImmutableList.of(Type.DOUBLE_TYPE, Type.FLOAT_TYPE, Type.LONG_TYPE, Type.INT_TYPE);

  /** The left child. */
  @JsonProperty private final ExpressionOperator left;
  /** The right child. */
  @JsonProperty private final ExpressionOperator right;

  /**
   * This is not really unused, it's used automagically by Jackson deserialization.
   */
  protected BinaryExpression() {
    left = null;
    right = null;
  }

  /**
   * @param left the left child.
   * @param right the right child.
   */
  protected BinaryExpression(final ExpressionOperator left, final ExpressionOperator right) {
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
  }

  /**
   * @return the left child;
   */
  public final ExpressionOperator getLeft() {
    return left;
  }

  /**
   * @return the right child;
   */
  public final ExpressionOperator getRight() {
    return right;
  }

  @Override
  public List<ExpressionOperator> getChildren() {
    ImmutableList.Builder<ExpressionOperator> children = ImmutableList.builder();
    return children.add(getLeft()).add(getRight()).build();
  }

  @Override
  public Type getOutputType(final Schema schema) {
    return checkAndReturnDefaultNumericType(schema, NUMERIC_TYPES);
  }

  /**
   * A function that could be used as the default type checker for a binary expression where both operands must be
   * numeric.
   *
   * @param schema the schema of the input tuples.
   * @param validTypes a list of valid types ordered by their precedence
   * @return the default numeric type, based on the types of the children and type precedence.
   */
  protected final Type checkAndReturnDefaultNumericType(final Schema schema, final List<Type> validTypes) {
    Type leftType = getLeft().getOutputType(schema);
    Type rightType = getRight().getOutputType(schema);
    int leftIdx = validTypes.indexOf(leftType);
    int rightIdx = validTypes.indexOf(rightType);
    Preconditions.checkArgument(
        leftIdx != -1, "%s cannot handle left child [%s] of Type %s", getClass().getSimpleName(), getLeft(), leftType);
    Preconditions.checkArgument(
        rightIdx != -1,
        "%s cannot handle right child [%s] of Type %s",
        getClass().getSimpleName(),
        getRight(),
        rightType);
    return validTypes.get(Math.min(leftIdx, rightIdx));
  }

  @Override
  public final Column<?> evaluate(final TupleBatch tb) throws EvaluationException {
    final Type outputType;
    try {
      outputType = getOutputType(tb.getSchema());
    } catch (IllegalArgumentException e) {
      throw new EvaluationException("cannot evaluate " + this, e);
    }
    ReadableColumn l = left.evaluate(tb);
    ReadableColumn r = right.evaluate(tb);
    ColumnBuilder<?> builder = ColumnBuilder.of(outputType, tb.numTuples());
    try {
      for (int row = 0; row < tb.numTuples(); ++row) {
        if (l.isNull(row) || r.isNull(row)) {
          builder.appendNull();
          continue;
        }
        switch (outputType) {
          case INT_TYPE:
            builder.appendInt(applyInt(l.getInt(row), r.getInt(row)));
            break;
          case LONG_TYPE:
            builder.appendLong(applyLong(readLong(l, row), readLong(r, row)));
            break;
          case FLOAT_TYPE:
            builder.appendFloat((float) applyDouble(readDouble(l, row), readDouble(r, row)));
            break;
          case DOUBLE_TYPE:
            builder.appendDouble(applyDouble(readDouble(l, row), readDouble(r, row)));
            break;
          default:
            throw new EvaluationException(getClass().getSimpleName() + " cannot produce " + outputType);
        }
      }
    } catch (ArithmeticException e) {
      throw new EvaluationException("arithmetic error evaluating " + this, e);
    }
    return builder.build();
  }

  /**
   * @param column an INT or LONG column.
   * @param row a non-null row.
   * @return the value widened to long.
   */
  private static long readLong(final ReadableColumn column, final int row) {
    if (column.getType() == Type.INT_TYPE) {
      return column.getInt(row);
    }
    return column.getLong(row);
  }

  /**
   * @param column a numeric column.
   * @param row a non-null row.
   * @return the value widened to double.
   */
  private static double readDouble(final ReadableColumn column, final int row) {
    switch (column.getType()) {
      case INT_TYPE:
        return column.getInt(row);
      case LONG_TYPE:
        return column.getLong(row);
      case FLOAT_TYPE:
        return column.getFloat(row);
      default:
        return column.getDouble(row);
    }
  }

  /**
   * @param l left operand.
   * @param r right operand.
   * @return the result.
   * @throws ArithmeticException on overflow or division by zero.
   */
  protected abstract int applyInt(int l, int r);

  /**
   * @param l left operand.
   * @param r right operand.
   * @return the result.
   * @throws ArithmeticException on overflow or division by zero.
   */
  protected abstract long applyLong(long l, long r);

  /**
   * @param l left operand.
   * @param r right operand.
   * @return the result.
   */
  protected abstract double applyDouble(double l, double r);

  /**
   * @return the infix symbol of this operator, e.g. <code>+</code>.
   */
  protected abstract String getInfix();

  @Override
  public int hashCode() {
    return Objects.hash(getClass().getCanonicalName(), left, right);
  }

  @Override
  public boolean equals(final Object other) {
    if (other == null || !getClass().equals(other.getClass())) {
      return false;
    }
    BinaryExpression otherExpr = (BinaryExpression) other;
    return Objects.equals(left, otherExpr.left) && Objects.equals(right, otherExpr.right);
  }

  @Override
  public String toString() {
    return "(" + left + " " + getInfix() + " " + right + ")";
  }
}
