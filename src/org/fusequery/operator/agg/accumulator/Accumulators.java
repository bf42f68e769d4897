package org.fusequery.operator.agg.accumulator;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.base.Preconditions;

import net.jcip.annotations.ThreadSafe;

import org.fusequery.DbException;

/**
 * Registry of the aggregate functions known by name. Names are case-insensitive. The built-in functions are
 * <code>count</code>, <code>sum</code>, <code>min</code>, <code>max</code> and <code>avg</code>.
 */
@ThreadSafe
public final class Accumulators implements AccumulatorFactory {

  /**
   * Constructs an accumulator for a given list of argument names.
   */
  @FunctionalInterface
  public interface AccumulatorSupplier {
    /**
     * @param argumentNames the names of the argument columns.
     * @return a fresh accumulator.
     * @throws DbException if the arguments do not fit the function.
     */
    Accumulator get(List<String> argumentNames) throws DbException;
  }

  /** The registry holding the built-in functions. */
  private static final Accumulators BUILT_IN = withBuiltIns();

  /** Suppliers by lower-case function name. */
  private final Map<String, AccumulatorSupplier> suppliers = new ConcurrentHashMap<>();

  /**
   * @return a new registry holding only the built-in functions.
   */
  public static Accumulators withBuiltIns() {
    Accumulators ret = new Accumulators();
    ret.register("count", args -> new CountAccumulator(checkArity("count", args, 0, 1).size()));
    ret.register(
        "sum",
        args -> {
          checkArity("sum", args, 1, 1);
          return new SumAccumulator();
        });
    ret.register(
        "min",
        args -> {
          checkArity("min", args, 1, 1);
          return new MinMaxAccumulator(false);
        });
    ret.register(
        "max",
        args -> {
          checkArity("max", args, 1, 1);
          return new MinMaxAccumulator(true);
        });
    ret.register(
        "avg",
        args -> {
          checkArity("avg", args, 1, 1);
          return new AvgAccumulator();
        });
    return ret;
  }

  /**
   * @return the shared registry of built-in functions.
   */
  public static AccumulatorFactory builtIns() {
    return BUILT_IN;
  }

  /**
   * Register a function, replacing any function of the same name.
   *
   * @param functionName the name of the function.
   * @param supplier constructs accumulators of the function.
   * @return this registry.
   */
  public Accumulators register(final String functionName, final AccumulatorSupplier supplier) {
    Preconditions.checkNotNull(functionName, "functionName");
    Preconditions.checkNotNull(supplier, "supplier");
    suppliers.put(functionName.toLowerCase(Locale.ROOT), supplier);
    return this;
  }

  /**
   * @param functionName the name of a function.
   * @return whether the function is registered.
   */
  public boolean isRegistered(final String functionName) {
    return suppliers.containsKey(functionName.toLowerCase(Locale.ROOT));
  }

  @Override
  public Accumulator create(final String functionName, final List<String> argumentNames) throws DbException {
    AccumulatorSupplier supplier = suppliers.get(functionName.toLowerCase(Locale.ROOT));
    if (supplier == null) {
      throw new DbException("unknown aggregate function " + functionName);
    }
    return supplier.get(argumentNames);
  }

  /**
   * @param functionName the function, for the error message.
   * @param args the argument names.
   * @param min minimum number of arguments.
   * @param max maximum number of arguments.
   * @return args.
   * @throws DbException if the number of arguments is out of range.
   */
  private static List<String> checkArity(
      final String functionName, final List<String> args, final int min, final int max) throws DbException {
    if (args.size() < min || args.size() > max) {
      throw new DbException(
          functionName + " takes " + (min == max ? "" + min : min + " to " + max) + " arguments, got " + args);
    }
    return args;
  }
}
