package org.fusequery.util;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import org.joda.time.DateTime;

import com.google.common.base.Preconditions;

import org.fusequery.Type;

/**
 * Generic utilities for FuseQuery.
 */
public final class FuseUtils {
  /**
   * Utility classes should not be instantiated.
   */
  private FuseUtils() {}

  /**
   * Throws a {@link NullPointerException} if the specified iterable contains a null value.
   *
   * @param <T> any object type that extends Iterable
   * @param iter the iterable
   * @param message a message to be included with the exception
   * @return the iterable, if it contains no null element.
   */
  public static <T extends Iterable<?>> T checkHasNoNulls(final T iter, final String message) {
    Objects.requireNonNull(iter, message);
    int i = 0;
    for (Object o : iter) {
      Preconditions.checkNotNull(o, "%s [element %s]", message, i);
      ++i;
    }
    return iter;
  }

  /**
   * Ensure that the given object is a valid value of the given type and can be stored in a Column or a Field.
   *
   * @param type the expected type.
   * @param o the object to be tested, null for a null value.
   * @return o.
   * @throws IllegalArgumentException if the object is not a valid value of the type.
   */
  @Nullable
  public static Object ensureObjectIsValidType(final Type type, @Nullable final Object o) {
    if (o == null) {
      return null;
    }
    Preconditions.checkArgument(
        type.toJavaObjectType().isInstance(o),
        "%s of class %s is not a valid value of type %s",
        o,
        o.getClass().getName(),
        type);
    return o;
  }

  /**
   * @param value a value of one of the java types that back a {@link Type}.
   * @return the type of the value.
   * @throws IllegalArgumentException if no type is backed by the class of the value.
   */
  public static Type typeOf(final Object value) {
    Objects.requireNonNull(value, "value");
    if (value instanceof Integer) {
      return Type.INT_TYPE;
    } else if (value instanceof Long) {
      return Type.LONG_TYPE;
    } else if (value instanceof Float) {
      return Type.FLOAT_TYPE;
    } else if (value instanceof Double) {
      return Type.DOUBLE_TYPE;
    } else if (value instanceof Boolean) {
      return Type.BOOLEAN_TYPE;
    } else if (value instanceof String) {
      return Type.STRING_TYPE;
    } else if (value instanceof DateTime) {
      return Type.DATETIME_TYPE;
    } else if (value instanceof ByteBuffer) {
      return Type.BYTES_TYPE;
    }
    throw new IllegalArgumentException("No type for values of class " + value.getClass().getName());
  }

  /**
   * Read a positive integer setting from the execution environment variables.
   *
   * @param execEnvVars the execution environment variables, may be null.
   * @param key the key of the setting.
   * @param defaultValue the value used when the setting is absent.
   * @return the setting.
   * @throws IllegalArgumentException if the setting is present but not a positive integer.
   */
  public static int getPositiveInt(
      @Nullable final Map<String, Object> execEnvVars, final String key, final int defaultValue) {
    if (execEnvVars == null || !execEnvVars.containsKey(key)) {
      return defaultValue;
    }
    Object value = execEnvVars.get(key);
    int ret;
    if (value instanceof Number) {
      ret = ((Number) value).intValue();
    } else if (value instanceof String) {
      try {
        ret = Integer.parseInt((String) value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("setting " + key + " is not an integer: " + value, e);
      }
    } else {
      throw new IllegalArgumentException("setting " + key + " is not an integer: " + value);
    }
    Preconditions.checkArgument(ret > 0, "setting %s must be positive, got %s", key, ret);
    return ret;
  }
}
