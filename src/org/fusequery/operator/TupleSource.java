package org.fusequery.operator;

import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.fusequery.Schema;
import org.fusequery.storage.TupleBatch;

/**
 * This class creates a LeafOperator from a list of batches of tuples, served once each in order. Useful as the
 * upstream processor of a pipeline and for testing.
 */
public final class TupleSource extends LeafOperator {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** The tuples that this operator serves, exactly once. */
  private final ImmutableList<TupleBatch> data;
  /** The current TupleBatch index of this TupleSource. */
  private int index;
  /** The Schema of the tuples that this operator serves. */
  private final Schema schema;

  /**
   * Constructs a TupleSource operator that will serve the tuples in the given List. Data must contain at least one
   * TupleBatch.
   *
   * @param data the tuples that this operator will serve.
   */
  public TupleSource(final List<TupleBatch> data) {
    this(data, null);
  }

  /**
   * Constructs a TupleSource operator that will serve the tuples in the given TupleBatch.
   *
   * @param data the tuples that this operator will serve. May not be null.
   */
  public TupleSource(final TupleBatch data) {
    this(ImmutableList.of(Objects.requireNonNull(data, "data")), null);
  }

  /**
   * Constructs a TupleSource operator that will serve the tuples in the given List.
   *
   * @param data the tuples that this operator will serve.
   * @param schema the schema of the tuples, required if data is empty.
   */
  public TupleSource(final List<TupleBatch> data, @Nullable final Schema schema) {
    this.data = ImmutableList.copyOf(Objects.requireNonNull(data, "data"));
    if (data.isEmpty()) {
      this.schema =
          Objects.requireNonNull(schema, "either data.get(0) must be non-null, or schema must be supplied");
    } else {
      this.schema = data.get(0).getSchema();
      if (schema != null) {
        Preconditions.checkArgument(
            this.schema.equals(schema), "supplied schema does not match the schema in data.get(0)");
      }
    }
    for (TupleBatch tb : data) {
      Preconditions.checkArgument(
          this.schema.equals(tb.getSchema()), "all batches must have schema %s, got %s", this.schema, tb.getSchema());
    }
  }

  @Override
  protected TupleBatch fetchNextReady() {
    if (index >= data.size()) {
      setEOS();
      return null;
    }
    return data.get(index++);
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
