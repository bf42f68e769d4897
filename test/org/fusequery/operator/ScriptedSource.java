package org.fusequery.operator;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.fusequery.DbException;
import org.fusequery.Schema;
import org.fusequery.storage.TupleBatch;

/**
 * A test source that replays a script. Each step serves a batch, reports that nothing is ready yet, or fails.
 */
public final class ScriptedSource extends Operator {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** One step of the script. */
  public static final class Step {
    /** The batch to serve, or null. */
    private final TupleBatch batch;
    /** The error to throw, or null. */
    private final DbException error;

    private Step(final TupleBatch batch, final DbException error) {
      this.batch = batch;
      this.error = error;
    }
  }

  /**
   * @param tb a batch.
   * @return a step serving the batch.
   */
  public static Step batch(final TupleBatch tb) {
    return new Step(tb, null);
  }

  /**
   * @return a step reporting that no batch is ready, without reaching EOS.
   */
  public static Step notReady() {
    return new Step(null, null);
  }

  /**
   * @param message the message of the error.
   * @return a step failing with a {@link DbException}.
   */
  public static Step fail(final String message) {
    return new Step(null, new DbException(message));
  }

  /** The script. */
  private final ImmutableList<Step> steps;
  /** The schema of the batches. */
  private final Schema schema;
  /** The next step. */
  private int index;

  /**
   * @param schema the schema of the batches.
   * @param steps the script.
   */
  public ScriptedSource(final Schema schema, final List<Step> steps) {
    this.schema = schema;
    this.steps = ImmutableList.copyOf(steps);
  }

  @Override
  public Operator[] getChildren() {
    return NO_CHILDREN;
  }

  @Override
  public void setChildren(final Operator[] children) {
    throw new UnsupportedOperationException();
  }

  @Override
  protected void checkEOS() {
    if (index >= steps.size()) {
      setEOS();
    }
  }

  @Override
  protected TupleBatch fetchNextReady() throws DbException {
    if (index >= steps.size()) {
      return null;
    }
    Step step = steps.get(index++);
    if (step.error != null) {
      throw step.error;
    }
    return step.batch;
  }

  @Override
  protected Schema generateSchema() {
    return schema;
  }

  @Override
  protected void init(final ImmutableMap<String, Object> execEnvVars) {
    index = 0;
  }
}
