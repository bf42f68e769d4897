package org.fusequery.storage;

import java.io.Serializable;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.jcip.annotations.ThreadSafe;

import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.column.Column;

/**
 * Container class for a batch of tuples, stored column by column. Immutable.
 */
@ThreadSafe
public class TupleBatch implements ReadableTable, Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** Schema of tuples in this batch. */
  private final Schema schema;
  /** Tuple data stored as columns in this batch. */
  private final ImmutableList<? extends Column<?>> columns;
  /** Number of tuples in this TB. */
  private final int numTuples;

  /**
   * Standard immutable TupleBatch constructor. All fields must be populated before creation and cannot be changed.
   *
   * @param schema schema of the tuples in this batch. Must match columns.
   * @param columns contains the column-stored data. Must match schema.
   * @param numTuples the number of tuples in this TupleBatch.
   */
  public TupleBatch(final Schema schema, final List<? extends Column<?>> columns, final int numTuples) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.columns = ImmutableList.copyOf(Objects.requireNonNull(columns, "columns"));
    Preconditions.checkArgument(
        columns.size() == schema.numColumns(),
        "Number of columns in data (%s) must equal the number of fields in schema (%s)",
        columns.size(),
        schema.numColumns());
    for (int i = 0; i < columns.size(); ++i) {
      Column<?> column = columns.get(i);
      Preconditions.checkArgument(
          numTuples == column.size(), "Column %s has %s tuples, expected %s", i, column.size(), numTuples);
      Preconditions.checkArgument(
          column.getType() == schema.getColumnType(i),
          "Column %s has type %s but the schema says %s",
          i,
          column.getType(),
          schema.getColumnType(i));
    }
    this.numTuples = numTuples;
  }

  /**
   * Constructor that gets the number of tuples from the columns.
   *
   * @param schema schema of the tuples in this batch. Must match columns.
   * @param columns contains the column-stored data. Must match schema, and not be empty.
   */
  public TupleBatch(final Schema schema, final List<? extends Column<?>> columns) {
    this(schema, columns, columns.get(0).size());
  }

  /**
   * @param schema the schema.
   * @return a batch of the specified schema holding no tuple.
   */
  public static TupleBatch empty(final Schema schema) {
    ImmutableList.Builder<Column<?>> b = ImmutableList.builder();
    for (Type type : schema.getColumnTypes()) {
      b.add(Column.emptyColumn(type));
    }
    return new TupleBatch(schema, b.build(), 0);
  }

  /**
   * Return a new TupleBatch that contains exactly the specified rows of this batch, in the given order. Every column
   * is carried over and the schema is unchanged. A row may be listed more than once.
   *
   * @param rows the rows to be retained, each in <code>[0, numTuples())</code>.
   * @return the gathered batch, with <code>rows.length</code> tuples.
   * @throws IndexOutOfBoundsException if a row is out of range.
   */
  public final TupleBatch gather(final int[] rows) {
    Objects.requireNonNull(rows, "rows");
    ImmutableList.Builder<Column<?>> newColumns = ImmutableList.builder();
    for (Column<?> column : columns) {
      newColumns.add(column.gather(rows));
    }
    return new TupleBatch(schema, newColumns.build(), rows.length);
  }

  /**
   * Creates a new TupleBatch with only the indicated columns.
   *
   * Internal implementation of a (non-duplicate-eliminating) PROJECT statement.
   *
   * @param remainingColumns zero-indexed array of columns to retain.
   * @return a projected TupleBatch.
   */
  public final TupleBatch selectColumns(final int[] remainingColumns) {
    Objects.requireNonNull(remainingColumns, "remainingColumns");
    final ImmutableList.Builder<Column<?>> newColumns = ImmutableList.builder();
    for (final int i : remainingColumns) {
      newColumns.add(columns.get(i));
    }
    return new TupleBatch(schema.getSubSchema(remainingColumns), newColumns.build(), numTuples);
  }

  /**
   * Construct a new TupleBatch that equals the current batch with the specified column appended.
   *
   * @param columnName the name of the column to be added.
   * @param column the column to be added.
   * @return a new TupleBatch containing the tuples of this batch plus the new column.
   */
  public TupleBatch appendColumn(final String columnName, final Column<?> column) {
    Preconditions.checkArgument(
        numTuples() == column.size(),
        "Cannot append column of size %s to batch of size %s",
        column.size(),
        numTuples());
    Schema newSchema = Schema.appendColumn(schema, column.getType(), columnName);
    List<Column<?>> newColumns = ImmutableList.<Column<?>>builder().addAll(columns).add(column).build();
    return new TupleBatch(newSchema, newColumns, numTuples);
  }

  /**
   * @param name the name of the column.
   * @return the column with the specified name.
   * @throws NoSuchElementException if no column has that name.
   */
  public final Column<?> getDataColumn(final String name) {
    return columns.get(schema.columnNameToIndex(name));
  }

  /**
   * @param index the index of the column.
   * @return the column at the specified index.
   */
  public final Column<?> getDataColumn(final int index) {
    return columns.get(index);
  }

  /**
   * @return the data columns.
   */
  public final ImmutableList<? extends Column<?>> getDataColumns() {
    return columns;
  }

  @Override
  public final Schema getSchema() {
    return schema;
  }

  @Override
  public final int numColumns() {
    return schema.numColumns();
  }

  @Override
  public final int numTuples() {
    return numTuples;
  }

  @Override
  public ReadableColumn asColumn(final int column) {
    return columns.get(column);
  }

  @Override
  public final boolean isNull(final int column, final int row) {
    return columns.get(column).isNull(row);
  }

  @Override
  @Nullable
  public final Object getObject(final int column, final int row) {
    return columns.get(column).getObject(row);
  }

  @Override
  public final String toString() {
    final List<Type> columnTypes = schema.getColumnTypes();
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < numTuples; i++) {
      sb.append("|\t");
      for (int j = 0; j < schema.numColumns(); j++) {
        sb.append(columnTypes.get(j).toString(columns.get(j), i));
        sb.append("\t|\t");
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
