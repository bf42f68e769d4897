package org.fusequery.operator.agg;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import net.jcip.annotations.Immutable;

/**
 * One aggregate of a group-by, e.g. <code>SUM(a)</code>: the function name, the names of its argument columns and the
 * name of the output column that carries its partial state.
 */
@Immutable
public final class AggregateExpression implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The aggregate function name, resolved by an accumulator factory. */
  @JsonProperty private final String function;
  /** The names of the argument columns. */
  @JsonProperty private final ImmutableList<String> arguments;
  /** The name of the output column. */
  @JsonProperty private final String outputName;

  /**
   * @param function the aggregate function name.
   * @param arguments the names of the argument columns.
   * @param outputName the name of the output column, or null for a name derived from the function and arguments.
   */
  @JsonCreator
  public AggregateExpression(
      @JsonProperty(value = "function", required = true) final String function,
      @JsonProperty("arguments") @Nullable final List<String> arguments,
      @JsonProperty("outputName") @Nullable final String outputName) {
    this.function = Objects.requireNonNull(function, "function");
    this.arguments = arguments == null ? ImmutableList.of() : ImmutableList.copyOf(arguments);
    this.outputName = outputName == null ? defaultOutputName(function, this.arguments) : outputName;
  }

  /**
   * @param function the aggregate function name.
   * @param arguments the names of the argument columns.
   * @return the aggregate, with the default output name.
   */
  public static AggregateExpression of(final String function, final String... arguments) {
    return new AggregateExpression(function, ImmutableList.copyOf(arguments), null);
  }

  /**
   * @param function the aggregate function name.
   * @param arguments the names of the argument columns.
   * @return <code>fn_all</code> for no argument, otherwise <code>fn_arg0_arg1...</code>, lower-cased function.
   */
  private static String defaultOutputName(final String function, final List<String> arguments) {
    String fn = function.toLowerCase(Locale.ROOT);
    if (arguments.isEmpty()) {
      return fn + "_all";
    }
    return fn + "_" + Joiner.on('_').join(arguments);
  }

  /**
   * @return the aggregate function name.
   */
  public String getFunction() {
    return function;
  }

  /**
   * @return the names of the argument columns.
   */
  public ImmutableList<String> getArguments() {
    return arguments;
  }

  /**
   * @return the name of the output column.
   */
  public String getOutputName() {
    return outputName;
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof AggregateExpression)) {
      return false;
    }
    AggregateExpression other = (AggregateExpression) o;
    return function.equals(other.function) && arguments.equals(other.arguments) && outputName.equals(other.outputName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(function, arguments, outputName);
  }

  @Override
  public String toString() {
    return function + "(" + Joiner.on(", ").join(arguments) + ") AS " + outputName;
  }
}
