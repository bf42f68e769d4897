package org.fusequery.operator;

/**
 * Simple abstract operator meant to make it easy to implement leaf operators.
 */
public abstract class LeafOperator extends Operator {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  @Override
  public final Operator[] getChildren() {
    return NO_CHILDREN;
  }

  @Override
  public final void setChildren(final Operator[] children) {
    throw new UnsupportedOperationException(getOpName() + " has no children");
  }

  @Override
  protected void checkEOS() {
    // a leaf that has nothing to return is done
    setEOS();
  }
}
