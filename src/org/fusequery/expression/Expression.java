package org.fusequery.expression;

import java.io.Serializable;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.fusequery.EvaluationException;
import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.column.Column;
import org.fusequery.storage.TupleBatch;

/**
 * A named expression that can be applied to a batch of tuples. The name is the name of the column its result is
 * written to, and the name by which downstream operators find that column.
 */
public class Expression implements Serializable {

  /***/
  private static final long serialVersionUID = 1L;

  /**
   * Name of the column that the result will be written to.
   */
  @JsonProperty private final String outputName;

  /**
   * Expression encoding reference is needed to get the output type.
   */
  @JsonProperty private final ExpressionOperator rootExpressionOperator;

  /**
   * Constructs the Expression object.
   *
   * @param outputName the name of the resulting element
   * @param rootExpressionOperator the root of the AST representing this expression.
   */
  @JsonCreator
  public Expression(
      @JsonProperty(value = "outputName", required = true) final String outputName,
      @JsonProperty(value = "rootExpressionOperator", required = true)
          final ExpressionOperator rootExpressionOperator) {
    this.outputName = Objects.requireNonNull(outputName, "outputName");
    this.rootExpressionOperator = Objects.requireNonNull(rootExpressionOperator, "rootExpressionOperator");
  }

  /**
   * An expression that passes an input column through under its own name.
   *
   * @param columnName the name of the input column.
   * @return the expression.
   */
  public static Expression column(final String columnName) {
    return new Expression(columnName, new VariableExpression(columnName));
  }

  /**
   * @return the output name, i.e., the name of the column holding the result of this expression.
   */
  public String getOutputName() {
    return outputName;
  }

  /**
   * @param schema the schema of the input tuples.
   * @return the type of the output
   */
  public Type getOutputType(final Schema schema) {
    return rootExpressionOperator.getOutputType(schema);
  }

  /**
   * @param schema the schema of the input tuples.
   * @return a single-column schema describing the result of this expression.
   */
  public Schema toDataField(final Schema schema) {
    return Schema.ofFields(getOutputType(schema), outputName);
  }

  /**
   * @param tb the input tuples.
   * @return the value of this expression for every row of the input.
   * @throws EvaluationException if the expression cannot be evaluated on the input.
   */
  public Column<?> evaluate(final TupleBatch tb) throws EvaluationException {
    return rootExpressionOperator.evaluate(tb);
  }

  @Override
  public boolean equals(final Object other) {
    if (!(other instanceof Expression)) {
      return false;
    }
    Expression o = (Expression) other;
    return outputName.equals(o.outputName) && rootExpressionOperator.equals(o.rootExpressionOperator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(outputName, rootExpressionOperator);
  }

  @Override
  public String toString() {
    return outputName + " = " + rootExpressionOperator;
  }
}
