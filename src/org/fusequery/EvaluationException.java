package org.fusequery;

/**
 * Thrown when an expression or an aggregate cannot be evaluated against a batch, typically because a column it needs is
 * missing or has an unexpected type.
 */
public class EvaluationException extends DbException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param s a String describing the exception.
   */
  public EvaluationException(final String s) {
    super(s);
  }

  /**
   * @param s a String describing the exception.
   * @param e the cause.
   */
  public EvaluationException(final String s, final Throwable e) {
    super(s, e);
  }
}
