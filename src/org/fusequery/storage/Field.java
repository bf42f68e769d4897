package org.fusequery.storage;

import java.io.Serializable;
import java.nio.ByteBuffer;
import java.util.Objects;

import javax.annotation.Nullable;

import org.joda.time.DateTime;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;

import net.jcip.annotations.Immutable;

import org.fusequery.Type;
import org.fusequery.util.FuseUtils;

/**
 * A single typed value, possibly null. Fields carry group key values and accumulator states out of the partial
 * aggregation, and are encoded in JSON as <code>{"type": "LONG_TYPE", "value": 3}</code>. Datetimes are encoded as ISO
 * strings and byte arrays as base64 strings.
 */
@Immutable
@JsonPropertyOrder({"type", "value"})
public final class Field implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The type of this field. */
  private final Type type;

  /** The value of this field, null for a null field. */
  @Nullable private final Object value;

  /**
   * @param type the type of this field.
   * @param value the value, an instance of {@link Type#toJavaObjectType()} of the type, or null.
   */
  private Field(final Type type, @Nullable final Object value) {
    this.type = Objects.requireNonNull(type, "type");
    this.value = FuseUtils.ensureObjectIsValidType(type, value);
  }

  /**
   * @param type the type of the field.
   * @param value the value, an instance of {@link Type#toJavaObjectType()} of the type, or null.
   * @return a field holding the value.
   */
  public static Field of(final Type type, @Nullable final Object value) {
    if (value instanceof ByteBuffer) {
      return new Field(type, ((ByteBuffer) value).asReadOnlyBuffer());
    }
    return new Field(type, value);
  }

  /**
   * @param value a non-null value; its type is derived from its class.
   * @return a field holding the value.
   */
  public static Field of(final Object value) {
    return of(FuseUtils.typeOf(value), value);
  }

  /**
   * @param type the type of the field.
   * @return a null field of the specified type.
   */
  public static Field nullOf(final Type type) {
    return new Field(type, null);
  }

  /**
   * @param column the column.
   * @param row the row.
   * @return a field holding the value (or null) at the specified row of the column.
   */
  public static Field of(final ReadableColumn column, final int row) {
    return of(column.getType(), column.getObject(row));
  }

  /**
   * Deserialize a field from its JSON form.
   *
   * @param type the type.
   * @param jsonValue the value as decoded by Jackson, or null.
   * @return the field.
   */
  @JsonCreator
  static Field fromJson(
      @JsonProperty(value = "type", required = true) final Type type,
      @JsonProperty("value") @Nullable final Object jsonValue) {
    if (jsonValue == null) {
      return nullOf(type);
    }
    switch (type) {
      case BOOLEAN_TYPE:
        return of(type, jsonValue instanceof Boolean ? jsonValue : Boolean.valueOf(jsonValue.toString()));
      case INT_TYPE:
        return of(type, toNumber(type, jsonValue).intValue());
      case LONG_TYPE:
        return of(type, toNumber(type, jsonValue).longValue());
      case FLOAT_TYPE:
        return of(type, toNumber(type, jsonValue).floatValue());
      case DOUBLE_TYPE:
        return of(type, toNumber(type, jsonValue).doubleValue());
      case STRING_TYPE:
        return of(type, jsonValue.toString());
      case DATETIME_TYPE:
        return of(type, DateTime.parse(jsonValue.toString()));
      case BYTES_TYPE:
        return of(type, ByteBuffer.wrap(BaseEncoding.base64().decode(jsonValue.toString())));
      default:
        throw new IllegalArgumentException("type " + type + " is not supported");
    }
  }

  /**
   * @param type the expected type, for the error message.
   * @param jsonValue a number, or a string such as <code>"NaN"</code>.
   * @return the number.
   */
  private static Number toNumber(final Type type, final Object jsonValue) {
    if (jsonValue instanceof Number) {
      return (Number) jsonValue;
    }
    Preconditions.checkArgument(jsonValue instanceof String, "%s is not a valid %s", jsonValue, type);
    return Double.valueOf((String) jsonValue);
  }

  /**
   * @return the type of this field.
   */
  @JsonProperty
  public Type getType() {
    return type;
  }

  /**
   * @return whether this field is null.
   */
  public boolean isNull() {
    return value == null;
  }

  /**
   * @return the value of this field, or null.
   */
  @Nullable
  public Object getObject() {
    return value;
  }

  /**
   * @return the value in the form it takes in JSON.
   */
  @JsonProperty("value")
  @Nullable
  private Object getJsonValue() {
    if (value == null) {
      return null;
    }
    switch (type) {
      case DATETIME_TYPE:
        return value.toString();
      case BYTES_TYPE:
        return BaseEncoding.base64().encode(toBytes((ByteBuffer) value));
      default:
        return value;
    }
  }

  /**
   * @param buffer a buffer.
   * @return a copy of the remaining bytes of the buffer.
   */
  private static byte[] toBytes(final ByteBuffer buffer) {
    ByteBuffer dup = buffer.duplicate();
    byte[] bytes = new byte[dup.remaining()];
    dup.get(bytes);
    return bytes;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Field)) {
      return false;
    }
    Field other = (Field) o;
    return type == other.type && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    if (value == null) {
      return "null";
    }
    if (type == Type.BYTES_TYPE) {
      return BaseEncoding.base16().encode(toBytes((ByteBuffer) value));
    }
    return value.toString();
  }
}
