package org.fusequery.operator;

import com.google.common.base.Preconditions;

/**
 * An abstraction for a unary operator.
 */
public abstract class UnaryOperator extends Operator {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /**
   * The child.
   */
  private Operator child;

  /**
   * @param child the single child of this operator, or null if it will be connected later.
   */
  public UnaryOperator(final Operator child) {
    this.child = child;
  }

  @Override
  public final Operator[] getChildren() {
    if (child == null) {
      return null;
    }
    return new Operator[] {child};
  }

  /**
   * @return the child.
   */
  public final Operator getChild() {
    return child;
  }

  /**
   * Connect the upstream operator.
   *
   * @param child the child.
   */
  public final void setChild(final Operator child) {
    setChildren(new Operator[] {child});
  }

  @Override
  public final void setChildren(final Operator[] children) {
    Preconditions.checkState(
        child == null, "Operator %s called setChildren(), but children have already been set", getOpName());
    Preconditions.checkNotNull(children, "Unary operator %s has null children", getOpName());
    Preconditions.checkArgument(
        children.length == 1, "Operator %s setChildren() must be called with an array of length 1", getOpName());
    Preconditions.checkNotNull(children[0], "Unary operator %s has its child to be null", getOpName());
    child = children[0];
  }
}
