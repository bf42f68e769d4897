package org.fusequery.operator;

import java.util.List;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.fusequery.DbException;
import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.column.Column;
import org.fusequery.expression.Expression;
import org.fusequery.storage.TupleBatch;

/**
 * Apply operator: evaluates a list of named expressions over every input batch. Each output batch holds exactly one
 * column per expression, in order, and as many tuples as the input batch.
 */
public class Apply extends UnaryOperator {
  /***/
  private static final long serialVersionUID = 1L;

  /**
   * The logger for debug, trace, etc. messages in this class.
   */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(Apply.class);

  /**
   * List (possibly empty) of expressions that will be used to create the output.
   */
  @Nonnull private final ImmutableList<Expression> emitExpressions;

  /**
   * @param child child operator that data is fetched from
   * @param emitExpressions expression that created the output
   */
  public Apply(final Operator child, @Nonnull final List<Expression> emitExpressions) {
    super(child);
    Preconditions.checkNotNull(emitExpressions, "emitExpressions");
    this.emitExpressions = ImmutableList.copyOf(emitExpressions);
  }

  @Override
  protected TupleBatch fetchNextReady() throws DbException {
    TupleBatch inputTuples = getChild().nextReady();
    if (inputTuples == null) {
      return null;
    }
    ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
    for (Expression expr : emitExpressions) {
      columns.add(expr.evaluate(inputTuples));
    }
    LOGGER.trace("{} evaluated {} expressions over {} tuples", getOpName(), emitExpressions.size(),
        inputTuples.numTuples());
    return new TupleBatch(getSchema(), columns.build(), inputTuples.numTuples());
  }

  @Override
  protected void init(final ImmutableMap<String, Object> execEnvVars) throws DbException {
    Preconditions.checkState(getChild() != null, "%s has no child", getOpName());
    if (getSchema() == null) {
      throw new DbException(getOpName() + " cannot determine its output schema");
    }
  }

  @Override
  public Schema generateSchema() {
    Operator child = getChild();
    if (child == null) {
      return null;
    }
    Schema inputSchema = child.getSchema();
    if (inputSchema == null) {
      return null;
    }

    ImmutableList.Builder<Type> typesBuilder = ImmutableList.builder();
    ImmutableList.Builder<String> namesBuilder = ImmutableList.builder();

    for (Expression expr : emitExpressions) {
      typesBuilder.add(expr.getOutputType(inputSchema));
      namesBuilder.add(expr.getOutputName());
    }
    return new Schema(typesBuilder.build(), namesBuilder.build());
  }
}
