package org.fusequery;

/** Thrown when aggregate state or group keys cannot be serialized to their JSON encoding. */
public class SerializationException extends DbException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param s a String describing the exception.
   * @param e the cause.
   */
  public SerializationException(final String s, final Throwable e) {
    super(s, e);
  }
}
