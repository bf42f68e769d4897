package org.fusequery.operator;

import java.io.Serializable;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

import org.fusequery.DbException;
import org.fusequery.FuseConstants;
import org.fusequery.Schema;
import org.fusequery.storage.TupleBatch;

/**
 * Abstract class for implementing operators.
 *
 * Operators are pulled: a consumer calls {@link #nextReady()} repeatedly until {@link #eos()} is set. The operator
 * api requires that each single operator instance be executed within a single thread. No multi-thread
 * synchronization is considered.
 */
public abstract class Operator implements Serializable {

  /**
   * logger for this class.
   */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(Operator.class);

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * the name of the operator, set from hand-constructed query plans. Empty means the simple class name.
   */
  private String opName = "";

  /**
   * A bit denoting whether the operator is open (initialized).
   */
  private boolean open = false;

  /**
   * The {@link Schema} of the tuples produced by this {@link Operator}.
   */
  private Schema schema;

  /**
   * End of stream (EOS). Initialized to true.
   */
  private volatile boolean eos = true;

  /**
   * Environmental variables during execution.
   */
  private ImmutableMap<String, Object> execEnvVars;

  /**
   * A simple statistic. The number of output tuples generated by this Operator.
   */
  private long numOutputTuples;

  /**
   * A simple statistic. The number of output TBs generated by this Operator.
   */
  private long numOutputTBs;

  /**
   * For use in leaf operators.
   */
  protected static final Operator[] NO_CHILDREN = new Operator[] {};

  /**
   * Closes this operator and its children.
   *
   * @throws DbException if any errors occur
   */
  public final void close() throws DbException {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "Operator {} closed, #output TBs: {}, # output tuples: {}", getOpName(), numOutputTBs, numOutputTuples);
    }
    open = false;
    eos = true;
    Exception errors = null;
    try {
      cleanup();
    } catch (DbException | RuntimeException e) {
      errors = e;
    } catch (Exception e) {
      errors = new DbException(e);
    }
    final Operator[] children = getChildren();
    if (children != null) {
      for (final Operator child : children) {
        if (child != null) {
          try {
            child.close();
          } catch (DbException | RuntimeException e) {
            if (errors != null) {
              errors.addSuppressed(e);
            } else {
              errors = e;
            }
          }
        }
      }
    }
    if (errors != null) {
      if (errors instanceof RuntimeException) {
        throw (RuntimeException) errors;
      } else {
        throw (DbException) errors;
      }
    }
  }

  /**
   * Check if EOS is set.
   *
   * This method is non-blocking.
   *
   * @return if the Operator is at EOS (End of Stream)
   */
  public final boolean eos() {
    return eos;
  }

  /**
   * @return return the children Operators of this operator. If there is only one child, return an array of only one
   *         element.
   */
  public abstract Operator[] getChildren();

  /**
   * Process EOS logic after {@link #fetchNextReady()} returned null. This is the implementation for ordinary
   * operators: EOS once every child is at EOS. Leaf operators override it.
   */
  protected void checkEOS() {
    Operator[] children = getChildren();
    if (children == null || children.length == 0) {
      return;
    }
    for (Operator child : children) {
      if (!child.eos()) {
        return;
      }
    }
    setEOS();
  }

  /**
   * Check if currently there's any TupleBatch available for pull.
   *
   * This method is non-blocking. Batches holding no tuple are never returned.
   *
   * If the thread is interrupted during the processing of nextReady, the interrupt status will be kept.
   *
   * @throws DbException if any problem
   *
   * @return the next output batch, or null if there is currently none.
   */
  public final TupleBatch nextReady() throws DbException {
    if (!open) {
      throw new DbException("Operator " + getOpName() + " not yet open");
    }
    if (eos()) {
      return null;
    }

    if (Thread.interrupted()) {
      Thread.currentThread().interrupt();
      return null;
    }

    TupleBatch result = null;
    try {
      do {
        result = fetchNextReady();
      } while (result != null && result.numTuples() <= 0);
    } catch (RuntimeException | DbException e) {
      throw e;
    } catch (Exception e) {
      throw new DbException(e);
    }
    if (result == null) {
      checkEOS();
    } else {
      numOutputTBs++;
      numOutputTuples += result.numTuples();
    }
    return result;
  }

  /**
   * open the operator and do initializations.
   *
   * @param execEnvVars the environment variables of the execution unit, may be null.
   *
   * @throws DbException if any error occurs
   */
  public final void open(@Nullable final Map<String, Object> execEnvVars) throws DbException {
    if (open) {
      throw new DbException("Operator (opName=" + getOpName() + ") already open.");
    }
    if (execEnvVars == null) {
      this.execEnvVars = null;
    } else {
      this.execEnvVars = ImmutableMap.copyOf(execEnvVars);
    }
    // open the children first
    final Operator[] children = getChildren();
    if (children != null) {
      for (final Operator child : children) {
        if (child != null) {
          child.open(execEnvVars);
        }
      }
    }
    eos = false;
    numOutputTBs = 0;
    numOutputTuples = 0;
    // do my initialization
    try {
      init(this.execEnvVars);
    } catch (DbException | RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new DbException(e);
    }
    open = true;
  }

  /**
   * @return true if this operator is open.
   */
  public final boolean isOpen() {
    return open;
  }

  /**
   * Do the initialization of this operator.
   *
   * @param execEnvVars execution environment variables, may be null.
   * @throws Exception if any error occurs
   */
  protected void init(@Nullable final ImmutableMap<String, Object> execEnvVars) throws Exception {}

  /**
   * Do the clean up, release resources.
   *
   * @throws Exception if any error occurs
   */
  protected void cleanup() throws Exception {}

  /**
   * Generate next output TupleBatch if possible. Return null immediately if currently no output can be generated.
   *
   * Do not block the execution thread in this method, including sleep, wait on locks, etc.
   *
   * @throws Exception if any error occurs
   *
   * @return next ready output TupleBatch. null if either EOS or no output TupleBatch can be generated currently.
   */
  protected abstract TupleBatch fetchNextReady() throws Exception;

  /**
   * Explicitly set EOS for this operator.
   *
   * Operators should not be able to unset an already set EOS except reopen it.
   */
  protected final void setEOS() {
    if (eos()) {
      return;
    }
    eos = true;
  }

  /**
   * Attempt to produce the {@link Schema} of the tuples generated by this operator. This function must handle cases
   * like <code>null</code> children or arguments, and return <code>null</code> if there is not enough information to
   * produce the schema.
   *
   * @return the {@link Schema} of the tuples generated by this operator, or <code>null</code> if the operator does not
   *         yet have enough information to generate the schema.
   */
  protected abstract Schema generateSchema();

  /**
   * @return return the Schema of the output tuples of this operator.
   */
  public final Schema getSchema() {
    if (schema == null) {
      schema = generateSchema();
    }
    return schema;
  }

  /**
   * @param children the Operators which are to be set as the children(child) of this operator.
   */
  public abstract void setChildren(Operator[] children);

  /**
   * set op name.
   *
   * @param name op name
   */
  public void setOpName(final String name) {
    opName = name;
  }

  /**
   * get op name.
   *
   * @return op name, the simple class name if none was set.
   */
  public String getOpName() {
    if (opName == null || opName.isEmpty()) {
      return getClass().getSimpleName();
    }
    return opName;
  }

  /**
   * @return The id of the node running this operator, or null if unknown.
   */
  @Nullable
  protected Integer getNodeID() {
    if (execEnvVars == null) {
      return null;
    }
    Object nodeId = execEnvVars.get(FuseConstants.EXEC_ENV_VAR_NODE_ID);
    if (nodeId instanceof Number) {
      return ((Number) nodeId).intValue();
    }
    return null;
  }
}
