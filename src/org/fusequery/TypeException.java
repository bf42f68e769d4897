package org.fusequery;

/** Thrown when a value of some {@link Type} cannot be handled, e.g. it has no group key encoding. */
public class TypeException extends DbException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param s a String describing the exception.
   */
  public TypeException(final String s) {
    super(s);
  }
}
