package org.fusequery.operator.agg;

import java.io.Serializable;
import java.util.Arrays;

import com.google.common.io.BaseEncoding;

import net.jcip.annotations.Immutable;

/**
 * The encoded group-by values of one row. Two rows belong to the same group iff their keys are equal.
 */
@Immutable
public final class GroupKey implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The encoded bytes. Never modified. */
  private final byte[] bytes;
  /** Cached hash of the bytes. */
  private final int hash;

  /**
   * @param bytes the encoded bytes, owned by the key from now on.
   */
  GroupKey(final byte[] bytes) {
    this.bytes = bytes;
    hash = Arrays.hashCode(bytes);
  }

  /**
   * @param bytes encoded bytes.
   * @return a key holding a copy of the bytes.
   */
  public static GroupKey copyOf(final byte[] bytes) {
    return new GroupKey(bytes.clone());
  }

  /**
   * @return a copy of the encoded bytes.
   */
  public byte[] toByteArray() {
    return bytes.clone();
  }

  /**
   * @return the number of encoded bytes.
   */
  public int size() {
    return bytes.length;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupKey)) {
      return false;
    }
    GroupKey other = (GroupKey) o;
    return hash == other.hash && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return BaseEncoding.base16().encode(bytes);
  }
}
