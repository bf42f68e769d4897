package org.fusequery.expression;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.column.Column;
import org.fusequery.column.builder.ColumnBuilder;
import org.fusequery.storage.TupleBatch;

/**
 * An expression that returns a constant value.
 */
public class ConstantExpression extends ZeroaryExpression {

  /***/
  private static final long serialVersionUID = 1L;

  /** The type of this object. */
  @JsonProperty private final Type valueType;

  /** The value of this object, as parsed by {@link Type#fromString(String)}. */
  @JsonProperty private final String value;

  /** The parsed value. */
  private final transient Object parsed;

  /**
   * @param type the type of this object.
   * @param value the value of this constant.
   */
  @JsonCreator
  public ConstantExpression(
      @JsonProperty(value = "valueType", required = true) final Type type,
      @JsonProperty(value = "value", required = true) final String value) {
    valueType = Objects.requireNonNull(type, "type");
    this.value = Objects.requireNonNull(value, "value");
    Preconditions.checkArgument(type != Type.BYTES_TYPE, "constants of type %s are not supported", type);
    parsed = type.fromString(value);
  }

  /**
   * Construct integer constant.
   *
   * @param value the value of this constant.
   */
  public ConstantExpression(final int value) {
    this(Type.INT_TYPE, String.valueOf(value));
  }

  /**
   * Construct long constant.
   *
   * @param value the value of this constant.
   */
  public ConstantExpression(final long value) {
    this(Type.LONG_TYPE, String.valueOf(value));
  }

  /**
   * Construct double constant.
   *
   * @param value the value of this constant.
   */
  public ConstantExpression(final double value) {
    this(Type.DOUBLE_TYPE, String.valueOf(value));
  }

  /**
   * Construct string constant.
   *
   * @param value the value of this constant.
   */
  public ConstantExpression(final String value) {
    this(Type.STRING_TYPE, value);
  }

  @Override
  public Type getOutputType(final Schema schema) {
    return valueType;
  }

  @Override
  public Column<?> evaluate(final TupleBatch tb) {
    ColumnBuilder<?> builder = ColumnBuilder.of(valueType, tb.numTuples());
    Object v = parsed == null ? valueType.fromString(value) : parsed;
    for (int i = 0; i < tb.numTuples(); ++i) {
      builder.appendObject(v);
    }
    return builder.build();
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass().getCanonicalName(), valueType, value);
  }

  @Override
  public boolean equals(final Object other) {
    if (!(other instanceof ConstantExpression)) {
      return false;
    }
    ConstantExpression otherExp = (ConstantExpression) other;
    return Objects.equals(valueType, otherExp.valueType) && Objects.equals(value, otherExp.value);
  }

  /**
   * @return the value
   */
  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
