package org.fusequery;

import java.io.Serializable;
import java.nio.ByteBuffer;

import org.joda.time.DateTime;

import com.google.common.io.BaseEncoding;

import org.fusequery.storage.ReadableColumn;

/**
 * Class representing a type in FuseQuery. Types are static objects defined by this class; hence, the Type constructor
 * is private.
 */
public enum Type implements Serializable {
  /**
   * int type.
   * */
  INT_TYPE(Integer.BYTES) {
    @Override
    protected String valueToString(final ReadableColumn column, final int tupleIndex) {
      return "" + column.getInt(tupleIndex);
    }

    @Override
    public Integer fromString(final String str) {
      return Integer.valueOf(str);
    }

    @Override
    public Class<?> toJavaObjectType() {
      return Integer.class;
    }

    @Override
    public String getName() {
      return "Int";
    }
  },

  /**
   * float type.
   * */
  FLOAT_TYPE(Float.BYTES) {
    @Override
    protected String valueToString(final ReadableColumn column, final int tupleIndex) {
      return "" + column.getFloat(tupleIndex);
    }

    @Override
    public Float fromString(final String str) {
      return Float.valueOf(str);
    }

    @Override
    public Class<?> toJavaObjectType() {
      return Float.class;
    }

    @Override
    public String getName() {
      return "Float";
    }
  },

  /**
   * Double type.
   * */
  DOUBLE_TYPE(Double.BYTES) {
    @Override
    protected String valueToString(final ReadableColumn column, final int tupleIndex) {
      return "" + column.getDouble(tupleIndex);
    }

    @Override
    public Double fromString(final String str) {
      return Double.valueOf(str);
    }

    @Override
    public Class<?> toJavaObjectType() {
      return Double.class;
    }

    @Override
    public String getName() {
      return "Double";
    }
  },

  /**
   * Boolean type.
   * */
  BOOLEAN_TYPE(1) {
    @Override
    protected String valueToString(final ReadableColumn column, final int tupleIndex) {
      return "" + column.getBoolean(tupleIndex);
    }

    @Override
    public Boolean fromString(final String str) {
      return Boolean.valueOf(str);
    }

    @Override
    public Class<?> toJavaObjectType() {
      return Boolean.class;
    }

    @Override
    public String getName() {
      return "Boolean";
    }
  },

  /**
   * String type.
   * */
  STRING_TYPE(-1) {
    @Override
    protected String valueToString(final ReadableColumn column, final int tupleIndex) {
      return column.getString(tupleIndex);
    }

    @Override
    public String fromString(final String str) {
      return str;
    }

    @Override
    public Class<?> toJavaObjectType() {
      return String.class;
    }

    @Override
    public String getName() {
      return "String";
    }
  },

  /**
   * Long type.
   * */
  LONG_TYPE(Long.BYTES) {
    @Override
    protected String valueToString(final ReadableColumn column, final int tupleIndex) {
      return "" + column.getLong(tupleIndex);
    }

    @Override
    public Long fromString(final String str) {
      return Long.valueOf(str);
    }

    @Override
    public Class<?> toJavaObjectType() {
      return Long.class;
    }

    @Override
    public String getName() {
      return "Long";
    }
  },

  /**
   * byte array type.
   * */
  BYTES_TYPE(-1) {
    @Override
    protected String valueToString(final ReadableColumn column, final int tupleIndex) {
      ByteBuffer bb = column.getByteBuffer(tupleIndex).duplicate();
      byte[] bytes = new byte[bb.remaining()];
      bb.get(bytes);
      return BaseEncoding.base16().encode(bytes);
    }

    @Override
    public ByteBuffer fromString(final String str) {
      return ByteBuffer.wrap(BaseEncoding.base16().decode(str));
    }

    @Override
    public Class<?> toJavaObjectType() {
      return ByteBuffer.class;
    }

    @Override
    public String getName() {
      return "ByteBuffer";
    }
  },

  /**
   * date type.
   * */
  DATETIME_TYPE(Long.BYTES) {
    @Override
    protected String valueToString(final ReadableColumn column, final int tupleIndex) {
      return "" + column.getDateTime(tupleIndex);
    }

    @Override
    public DateTime fromString(final String str) {
      return DateTime.parse(str);
    }

    @Override
    public Class<?> toJavaObjectType() {
      return DateTime.class;
    }

    @Override
    public String getName() {
      return "DateTime";
    }
  };

  /** Marker width of types whose values do not all take the same number of bytes. */
  private static final int VARIABLE_WIDTH = -1;

  /** The number of bytes of one value, or {@link #VARIABLE_WIDTH}. */
  private final int byteWidth;

  /**
   * @param byteWidth the number of bytes of one value, or {@link #VARIABLE_WIDTH}.
   */
  Type(final int byteWidth) {
    this.byteWidth = byteWidth;
  }

  /**
   * @return whether every value of this type is encoded in the same number of bytes.
   */
  public boolean isFixedWidth() {
    return byteWidth != VARIABLE_WIDTH;
  }

  /**
   * @return the number of bytes of one value of this fixed-width type.
   * @throws UnsupportedOperationException if the type is not fixed-width.
   */
  public int getByteWidth() {
    if (!isFixedWidth()) {
      throw new UnsupportedOperationException(this + " is not a fixed-width type");
    }
    return byteWidth;
  }

  /**
   * @return A string representation of the #tupleIndex value in column, <code>"null"</code> for a null value.
   * @param column the columns
   * @param tupleIndex the index
   * */
  public final String toString(final ReadableColumn column, final int tupleIndex) {
    if (column.isNull(tupleIndex)) {
      return "null";
    }
    return valueToString(column, tupleIndex);
  }

  /**
   * @return A string representation of the non-null #tupleIndex value in column.
   * @param column the columns
   * @param tupleIndex the index
   * */
  protected abstract String valueToString(ReadableColumn column, int tupleIndex);

  /**
   * Create an instance of Type from a String.
   *
   * @param str The string to convert
   * @return An object of an appropriate type
   */
  public abstract Object fromString(final String str);

  /**
   * @return the java object type of values of this type, e.g. <code>Integer</code> for {@link #INT_TYPE}.
   */
  public abstract Class<?> toJavaObjectType();

  /**
   * @return the name used for this type in accessor names, e.g. <code>Int</code> for <code>getInt</code>.
   */
  public abstract String getName();
}
