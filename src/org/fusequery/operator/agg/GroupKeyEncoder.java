package org.fusequery.operator.agg;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

import org.fusequery.Type;
import org.fusequery.TypeException;
import org.fusequery.storage.Field;
import org.fusequery.storage.ReadableColumn;

/**
 * Encodes the group-by values of a row into a {@link GroupKey}.
 *
 * Each column contributes a presence byte, 0 for null or 1 for a value, followed by the value if present:
 * fixed-width types in their natural width (big-endian, FLOAT and DOUBLE as IEEE bits with NaN canonicalized,
 * BOOLEAN as one byte, DATETIME as epoch millis) and variable-width types as a 4-byte length followed by the bytes
 * (STRING in UTF-8). The encoding is injective for a fixed list of column types.
 */
public final class GroupKeyEncoder {

  /** Presence byte of a null value. */
  private static final byte NULL_MARKER = 0;
  /** Presence byte of a value. */
  private static final byte VALUE_MARKER = 1;

  /** The group-by columns. */
  private final ImmutableList<ReadableColumn> columns;
  /** Bytes taken by every row: presence bytes plus fixed widths. */
  private final int fixedSize;

  /**
   * @param columns the group-by columns, in group-by order.
   * @throws TypeException if a column has a type without key encoding.
   */
  public GroupKeyEncoder(final List<? extends ReadableColumn> columns) throws TypeException {
    Preconditions.checkNotNull(columns, "columns");
    this.columns = ImmutableList.copyOf(columns);
    int size = 0;
    for (ReadableColumn column : columns) {
      if (!isEncodable(column.getType())) {
        throw new TypeException("group-by column type " + column.getType() + " has no key encoding");
      }
      size += 1;
      if (column.getType().isFixedWidth()) {
        size += column.getType().getByteWidth();
      }
    }
    fixedSize = size;
  }

  /**
   * @param type a column type.
   * @return whether values of the type can be part of a group key.
   */
  public static boolean isEncodable(final Type type) {
    switch (type) {
      case BOOLEAN_TYPE:
      case BYTES_TYPE:
      case DATETIME_TYPE:
      case DOUBLE_TYPE:
      case FLOAT_TYPE:
      case INT_TYPE:
      case LONG_TYPE:
      case STRING_TYPE:
        return true;
      default:
        return false;
    }
  }

  /**
   * @param row the row.
   * @return the key of the row.
   */
  public GroupKey encode(final int row) {
    byte[][] variable = new byte[columns.size()][];
    int size = fixedSize;
    for (int i = 0; i < columns.size(); ++i) {
      ReadableColumn column = columns.get(i);
      if (!column.getType().isFixedWidth() && !column.isNull(row)) {
        variable[i] = variableBytes(column, row);
        size += Integer.BYTES + variable[i].length;
      }
    }

    ByteArrayDataOutput out = ByteStreams.newDataOutput(size);
    for (int i = 0; i < columns.size(); ++i) {
      ReadableColumn column = columns.get(i);
      if (column.isNull(row)) {
        out.writeByte(NULL_MARKER);
        continue;
      }
      out.writeByte(VALUE_MARKER);
      switch (column.getType()) {
        case BOOLEAN_TYPE:
          out.writeBoolean(column.getBoolean(row));
          break;
        case DATETIME_TYPE:
          out.writeLong(column.getDateTime(row).getMillis());
          break;
        case DOUBLE_TYPE:
          out.writeLong(Double.doubleToLongBits(column.getDouble(row)));
          break;
        case FLOAT_TYPE:
          out.writeInt(Float.floatToIntBits(column.getFloat(row)));
          break;
        case INT_TYPE:
          out.writeInt(column.getInt(row));
          break;
        case LONG_TYPE:
          out.writeLong(column.getLong(row));
          break;
        case BYTES_TYPE:
        case STRING_TYPE:
          out.writeInt(variable[i].length);
          out.write(variable[i]);
          break;
        default:
          throw new IllegalStateException("unexpected type " + column.getType());
      }
    }
    return new GroupKey(out.toByteArray());
  }

  /**
   * @param column a variable-width column.
   * @param row a non-null row.
   * @return the bytes of the value.
   */
  private static byte[] variableBytes(final ReadableColumn column, final int row) {
    if (column.getType() == Type.STRING_TYPE) {
      return column.getString(row).getBytes(StandardCharsets.UTF_8);
    }
    ByteBuffer bb = column.getByteBuffer(row).duplicate();
    byte[] bytes = new byte[bb.remaining()];
    bb.get(bytes);
    return bytes;
  }

  /**
   * @param row the row.
   * @return the typed group-by values of the row, in group-by order.
   */
  public ImmutableList<Field> keyValues(final int row) {
    ImmutableList.Builder<Field> values = ImmutableList.builder();
    for (ReadableColumn column : columns) {
      values.add(Field.of(column, row));
    }
    return values.build();
  }

  /**
   * @return the number of group-by columns.
   */
  public int numColumns() {
    return columns.size();
  }
}
