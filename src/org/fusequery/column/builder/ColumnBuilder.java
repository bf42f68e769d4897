package org.fusequery.column.builder;

import java.nio.ByteBuffer;
import java.util.BitSet;

import javax.annotation.Nullable;

import org.joda.time.DateTime;

import com.google.common.base.Preconditions;

import org.fusequery.FuseConstants;
import org.fusequery.Type;
import org.fusequery.column.Column;
import org.fusequery.storage.ReadableColumn;
import org.fusequery.util.FuseUtils;

/**
 * A growable builder of a {@link Column}. A builder builds exactly one column; no further changes are allowed after
 * {@link #build()}.
 *
 * @param <T> type of the objects in this column.
 */
public abstract class ColumnBuilder<T extends Comparable<?>> implements WritableColumn {

  /** The rows appended as nulls. */
  private final BitSet nulls = new BitSet();

  /** If the builder has built the column. */
  private boolean built = false;

  /**
   * @throws IllegalStateException if the column has already been built.
   */
  protected final void checkNotBuilt() {
    Preconditions.checkState(!built, "No further changes are allowed after the builder has built the column.");
  }

  @Override
  public ColumnBuilder<T> appendBoolean(final boolean value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public ColumnBuilder<T> appendByteBuffer(final ByteBuffer value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public ColumnBuilder<T> appendDateTime(final DateTime value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public ColumnBuilder<T> appendDouble(final double value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public ColumnBuilder<T> appendFloat(final float value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public ColumnBuilder<T> appendInt(final int value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public ColumnBuilder<T> appendLong(final long value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public ColumnBuilder<T> appendString(final String value) {
    throw new UnsupportedOperationException(getClass().getName());
  }

  @Override
  public final ColumnBuilder<T> appendNull() {
    checkNotBuilt();
    nulls.set(size());
    appendPlaceholder();
    return this;
  }

  /**
   * Occupy the next row with an arbitrary value; the row is recorded as null by the caller.
   */
  protected abstract void appendPlaceholder();

  @Override
  public final ColumnBuilder<T> appendObject(@Nullable final Object value) {
    FuseUtils.ensureObjectIsValidType(getType(), value);
    if (value == null) {
      return appendNull();
    }
    switch (getType()) {
      case BOOLEAN_TYPE:
        return appendBoolean((Boolean) value);
      case BYTES_TYPE:
        return appendByteBuffer((ByteBuffer) value);
      case DATETIME_TYPE:
        return appendDateTime((DateTime) value);
      case DOUBLE_TYPE:
        return appendDouble((Double) value);
      case FLOAT_TYPE:
        return appendFloat((Float) value);
      case INT_TYPE:
        return appendInt((Integer) value);
      case LONG_TYPE:
        return appendLong((Long) value);
      case STRING_TYPE:
        return appendString((String) value);
      default:
        throw new UnsupportedOperationException("type " + getType() + " is not supported");
    }
  }

  @Override
  public final ColumnBuilder<T> appendFrom(final ReadableColumn column, final int row) {
    Preconditions.checkArgument(
        column.getType() == getType(),
        "Cannot append a value of type %s to a %s column",
        column.getType(),
        getType());
    if (column.isNull(row)) {
      return appendNull();
    }
    switch (getType()) {
      case BOOLEAN_TYPE:
        return appendBoolean(column.getBoolean(row));
      case BYTES_TYPE:
        return appendByteBuffer(column.getByteBuffer(row));
      case DATETIME_TYPE:
        return appendDateTime(column.getDateTime(row));
      case DOUBLE_TYPE:
        return appendDouble(column.getDouble(row));
      case FLOAT_TYPE:
        return appendFloat(column.getFloat(row));
      case INT_TYPE:
        return appendInt(column.getInt(row));
      case LONG_TYPE:
        return appendLong(column.getLong(row));
      case STRING_TYPE:
        return appendString(column.getString(row));
      default:
        throw new UnsupportedOperationException("type " + getType() + " is not supported");
    }
  }

  /**
   * Build the column. The builder cannot be used afterwards.
   *
   * @return the built column.
   */
  public final Column<T> build() {
    checkNotBuilt();
    built = true;
    return doBuild(nulls.isEmpty() ? null : nulls);
  }

  /**
   * @param nullRows the null rows, or null if there is none.
   * @return the built column.
   */
  protected abstract Column<T> doBuild(@Nullable BitSet nullRows);

  /**
   * @param type the type of the column to be built.
   * @return a new empty builder for a column of the specified type.
   */
  public static ColumnBuilder<?> of(final Type type) {
    return of(type, FuseConstants.DEFAULT_COLUMN_BUILDER_CAPACITY);
  }

  /**
   * @param type the type of the column to be built.
   * @param expectedSize the expected number of rows, used as initial capacity.
   * @return a new empty builder for a column of the specified type.
   */
  public static ColumnBuilder<?> of(final Type type, final int expectedSize) {
    Preconditions.checkArgument(expectedSize >= 0, "expectedSize must be non-negative");
    switch (type) {
      case BOOLEAN_TYPE:
        return new BooleanColumnBuilder(expectedSize);
      case BYTES_TYPE:
        return new BytesColumnBuilder(expectedSize);
      case DATETIME_TYPE:
        return new DateTimeColumnBuilder(expectedSize);
      case DOUBLE_TYPE:
        return new DoubleColumnBuilder(expectedSize);
      case FLOAT_TYPE:
        return new FloatColumnBuilder(expectedSize);
      case INT_TYPE:
        return new IntColumnBuilder(expectedSize);
      case LONG_TYPE:
        return new LongColumnBuilder(expectedSize);
      case STRING_TYPE:
        return new StringColumnBuilder(expectedSize);
      default:
        throw new UnsupportedOperationException("type " + type + " is not supported");
    }
  }
}
