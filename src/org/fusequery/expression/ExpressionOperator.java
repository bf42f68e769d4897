package org.fusequery.expression;

import java.io.Serializable;
import java.util.List;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import org.fusequery.EvaluationException;
import org.fusequery.Schema;
import org.fusequery.column.Column;
import org.fusequery.storage.TupleBatch;

/**
 * A node of an expression tree. Expressions are interpreted a whole batch at a time: each node produces one column.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  /* Zeroary */
  @Type(name = "CONSTANT", value = ConstantExpression.class),
  @Type(name = "VARIABLE", value = VariableExpression.class),
  /* Binary */
  @Type(name = "MINUS", value = MinusExpression.class),
  @Type(name = "MODULO", value = ModuloExpression.class),
  @Type(name = "PLUS", value = PlusExpression.class),
  @Type(name = "TIMES", value = TimesExpression.class)
})
public abstract class ExpressionOperator implements Serializable {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * Get the output type of the expression which might depend on the types of the children. Also, check whether the
   * types of the children are correct.
   *
   * @param schema the schema of the input tuples.
   * @return the type of the output of this expression.
   * @throws IllegalArgumentException if the children have types this expression cannot handle.
   */
  public abstract org.fusequery.Type getOutputType(Schema schema);

  /**
   * @param tb the input tuples.
   * @return a column holding the value of this expression for every row of the input.
   * @throws EvaluationException if the expression cannot be evaluated on the input.
   */
  public abstract Column<?> evaluate(TupleBatch tb) throws EvaluationException;

  /**
   * @return all children
   */
  @Nonnull
  public abstract List<ExpressionOperator> getChildren();
}
