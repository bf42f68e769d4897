package org.fusequery.util;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.fusequery.Schema;
import org.fusequery.column.Column;
import org.fusequery.column.builder.ColumnBuilder;
import org.fusequery.storage.Field;
import org.fusequery.storage.TupleBatch;

public final class TestUtils {

  /** Utility classes cannot be constructed. */
  private TestUtils() {}

  /**
   * Build a batch row by row.
   *
   * @param schema the schema of the batch.
   * @param rows the rows, each holding one value (or null) per column.
   * @return the batch.
   */
  public static TupleBatch batch(final Schema schema, final Object[]... rows) {
    ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
    for (int c = 0; c < schema.numColumns(); ++c) {
      ColumnBuilder<?> builder = ColumnBuilder.of(schema.getColumnType(c));
      for (Object[] row : rows) {
        Preconditions.checkArgument(row.length == schema.numColumns(), "row has %s values", row.length);
        builder.appendObject(row[c]);
      }
      columns.add(builder.build());
    }
    return new TupleBatch(schema, columns.build(), rows.length);
  }

  /**
   * @param values the values of a row.
   * @return the row.
   */
  public static Object[] row(final Object... values) {
    return values;
  }

  /**
   * @param json a JSON array of fields.
   * @return the fields.
   * @throws IOException if the JSON is invalid.
   */
  public static List<Field> parseFields(final String json) throws IOException {
    return FuseJsonMapperProvider.getMapper().readValue(json, new TypeReference<List<Field>>() {});
  }

  /**
   * @param json a JSON object from column name to field.
   * @return the fields by name.
   * @throws IOException if the JSON is invalid.
   */
  public static Map<String, Field> parseKeys(final String json) throws IOException {
    return FuseJsonMapperProvider.getMapper().readValue(json, new TypeReference<Map<String, Field>>() {});
  }
}
