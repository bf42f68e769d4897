package org.fusequery.operator.agg;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

import com.google.common.collect.ImmutableList;

import org.fusequery.EvaluationException;
import org.fusequery.TypeException;
import org.fusequery.column.Column;
import org.fusequery.storage.Field;
import org.fusequery.storage.TupleBatch;

/**
 * Splits one batch into its local groups: the rows of each distinct group key, in one pass over the batch.
 */
public final class BlockGrouper {

  /** Utility classes do not have a public constructor. */
  private BlockGrouper() {}

  /**
   * The rows of one batch that share a group key.
   */
  public static final class LocalGroup {
    /** Row indices, ascending. */
    private final IntArrayList rows = new IntArrayList();
    /** The group-by values of the first row. */
    private final ImmutableList<Field> keyValues;

    /**
     * @param keyValues the group-by values of the first row.
     */
    private LocalGroup(final ImmutableList<Field> keyValues) {
      this.keyValues = keyValues;
    }

    /**
     * @return the row indices, ascending.
     */
    public int[] getRows() {
      return rows.toArray();
    }

    /**
     * @return the number of rows.
     */
    public int numRows() {
      return rows.size();
    }

    /**
     * @return the group-by values of the first row.
     */
    public ImmutableList<Field> getKeyValues() {
      return keyValues;
    }
  }

  /**
   * @param tb the batch.
   * @param groupColumnNames the names of the group-by columns, in group-by order.
   * @return the local groups, in order of first appearance.
   * @throws EvaluationException if a group-by column is missing from the batch.
   * @throws TypeException if a group-by column has a type without key encoding.
   */
  public static Map<GroupKey, LocalGroup> group(final TupleBatch tb, final List<String> groupColumnNames)
      throws EvaluationException, TypeException {
    ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
    for (String name : groupColumnNames) {
      try {
        columns.add(tb.getDataColumn(name));
      } catch (NoSuchElementException e) {
        throw new EvaluationException("group-by column " + name + " not found in [" + tb.getSchema() + "]", e);
      }
    }
    GroupKeyEncoder encoder = new GroupKeyEncoder(columns.build());

    Map<GroupKey, LocalGroup> groups = new LinkedHashMap<>();
    for (int row = 0; row < tb.numTuples(); ++row) {
      GroupKey key = encoder.encode(row);
      LocalGroup group = groups.get(key);
      if (group == null) {
        group = new LocalGroup(encoder.keyValues(row));
        groups.put(key, group);
      }
      group.rows.add(row);
    }
    return groups;
  }
}
