package org.fusequery.expression;

import java.util.NoSuchElementException;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.fusequery.EvaluationException;
import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.column.Column;
import org.fusequery.storage.TupleBatch;

/**
 * Represents a reference to a named column of the input in an expression tree.
 */
public class VariableExpression extends ZeroaryExpression {
  /***/
  private static final long serialVersionUID = 1L;

  /** The name of the input column that is referenced. */
  @JsonProperty private final String columnName;

  /**
   * A {@link VariableExpression} that references the column named <code>columnName</code> of the input.
   *
   * @param columnName the name of the column.
   */
  @JsonCreator
  public VariableExpression(@JsonProperty(value = "columnName", required = true) final String columnName) {
    this.columnName = Objects.requireNonNull(columnName, "columnName");
  }

  @Override
  public Type getOutputType(final Schema schema) {
    return schema.getColumnType(columnName);
  }

  @Override
  public Column<?> evaluate(final TupleBatch tb) throws EvaluationException {
    try {
      return tb.getDataColumn(columnName);
    } catch (NoSuchElementException e) {
      throw new EvaluationException("column " + columnName + " not found in [" + tb.getSchema() + "]", e);
    }
  }

  /**
   * @return the name of the referenced column.
   */
  public String getColumnName() {
    return columnName;
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass().getCanonicalName(), columnName);
  }

  @Override
  public boolean equals(final Object other) {
    if (!(other instanceof VariableExpression)) {
      return false;
    }
    VariableExpression otherExp = (VariableExpression) other;
    return Objects.equals(columnName, otherExp.columnName);
  }

  @Override
  public String toString() {
    return columnName;
  }
}
