package org.fusequery.operator.agg;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.fusequery.DbException;
import org.fusequery.FuseConstants;
import org.fusequery.Schema;
import org.fusequery.SerializationException;
import org.fusequery.Type;
import org.fusequery.TypeException;
import org.fusequery.column.Column;
import org.fusequery.column.builder.ColumnBuilder;
import org.fusequery.expression.Expression;
import org.fusequery.operator.Operator;
import org.fusequery.operator.UnaryOperator;
import org.fusequery.operator.agg.BlockGrouper.LocalGroup;
import org.fusequery.operator.agg.PartialAggregationTable.AggregateSlot;
import org.fusequery.operator.agg.PartialAggregationTable.GroupEntry;
import org.fusequery.operator.agg.accumulator.AccumulatorFactory;
import org.fusequery.operator.agg.accumulator.Accumulators;
import org.fusequery.storage.Field;
import org.fusequery.storage.TupleBatch;
import org.fusequery.util.FuseJsonMapperProvider;
import org.fusequery.util.FuseUtils;

/**
 * The partial phase of a hash group-by. Consumes the whole child, grouping rows by the values of the group-by columns
 * and folding each group's rows into one accumulator per aggregate, then emits one row per group.
 *
 * The output has one STRING column per aggregate holding its partial state as a JSON array of fields, the STRING
 * column <code>_group_keys</code> holding the group-by values as a JSON object from column name to field, and the BYTES
 * column <code>_group_by_key</code> holding the encoded group key. All groups are emitted in a single batch; an input
 * without any row produces no batch at all.
 *
 * The group-by expressions are computed upstream, e.g. by an {@link org.fusequery.operator.Apply}; this operator finds
 * their results in the input by output name.
 */
public final class GroupByPartial extends UnaryOperator {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(GroupByPartial.class);

  /**
   * The life cycle of a group-by. {@link #FAILED} is terminal like {@link #FINISHED}.
   */
  public enum State {
    /** Constructed, nothing pulled yet. */
    IDLE,
    /** Pulling and grouping input batches. */
    STREAMING,
    /** The input is exhausted; building the output. */
    DRAINING,
    /** The output has been produced. */
    FINISHED,
    /** An error occurred. Every later pull fails. */
    FAILED
  }

  /** The group-by expressions, whose output names are the group-by columns of the input. */
  private final ImmutableList<Expression> groupExpressions;
  /** The names of the group-by columns. */
  private final ImmutableList<String> groupColumnNames;
  /** The aggregates. */
  private final ImmutableList<AggregateExpression> aggregates;
  /** Creates the accumulators. */
  private final transient AccumulatorFactory accumulatorFactory;
  /** The output schema, which does not depend on the input. */
  private final Schema outputSchema;

  /** The groups. */
  private transient PartialAggregationTable table;
  /** The types of the group-by columns, fixed by the first input batch. */
  private transient ImmutableList<Type> groupColumnTypes;
  /** Measures the streaming phase. */
  private transient Stopwatch stopwatch;
  /** Number of input tuples consumed. */
  private long numInputTuples;
  /** Where this group-by is in its life cycle. */
  private State state = State.IDLE;

  /**
   * @param child the input, may be connected later with {@link #setChild}.
   * @param groupExpressions the group-by expressions, evaluated upstream; may be empty.
   * @param aggregates the aggregates.
   */
  public GroupByPartial(
      @Nullable final Operator child,
      final List<Expression> groupExpressions,
      final List<AggregateExpression> aggregates) {
    this(child, groupExpressions, aggregates, Accumulators.builtIns());
  }

  /**
   * @param child the input, may be connected later with {@link #setChild}.
   * @param groupExpressions the group-by expressions, evaluated upstream; may be empty.
   * @param aggregates the aggregates.
   * @param accumulatorFactory creates the accumulators of the aggregates.
   */
  public GroupByPartial(
      @Nullable final Operator child,
      final List<Expression> groupExpressions,
      final List<AggregateExpression> aggregates,
      final AccumulatorFactory accumulatorFactory) {
    super(child);
    this.groupExpressions = ImmutableList.copyOf(Objects.requireNonNull(groupExpressions, "groupExpressions"));
    this.aggregates = ImmutableList.copyOf(Objects.requireNonNull(aggregates, "aggregates"));
    this.accumulatorFactory = Objects.requireNonNull(accumulatorFactory, "accumulatorFactory");
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Expression expr : groupExpressions) {
      names.add(expr.getOutputName());
    }
    groupColumnNames = names.build();
    outputSchema = buildOutputSchema(this.aggregates);
  }

  /**
   * @param aggregates the aggregates.
   * @return one STRING column per aggregate, then the group keys and the encoded group key.
   * @throws IllegalArgumentException if two aggregates share an output name or one uses a reserved name.
   */
  private static Schema buildOutputSchema(final List<AggregateExpression> aggregates) {
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (AggregateExpression aggregate : aggregates) {
      types.add(Type.STRING_TYPE);
      names.add(aggregate.getOutputName());
    }
    types.add(Type.STRING_TYPE, Type.BYTES_TYPE);
    names.add(FuseConstants.GROUP_KEYS_COLUMN_NAME, FuseConstants.GROUP_BY_KEY_COLUMN_NAME);
    return new Schema(types.build(), names.build());
  }

  @Override
  protected Schema generateSchema() {
    return outputSchema;
  }

  /**
   * @return the name and type of each group-by column, or null if the input schema is not yet known.
   * @throws java.util.NoSuchElementException if the input lacks a group-by column.
   */
  @Nullable
  public Schema getGroupKeySchema() {
    Operator child = getChild();
    if (child == null || child.getSchema() == null) {
      return null;
    }
    Schema inputSchema = child.getSchema();
    Schema ret = Schema.EMPTY_SCHEMA;
    for (Expression expr : groupExpressions) {
      Schema field = expr.toDataField(inputSchema);
      ret = Schema.appendColumn(ret, field.getColumnType(0), field.getColumnName(0));
    }
    return ret;
  }

  /**
   * @return where this group-by is in its life cycle.
   */
  public State getState() {
    return state;
  }

  @Override
  protected void init(@Nullable final ImmutableMap<String, Object> execEnvVars) throws DbException {
    if (state != State.IDLE) {
      throw new DbException(getOpName() + " cannot be reused, state is " + state);
    }
    Preconditions.checkState(getChild() != null, "%s has no child", getOpName());
    int expectedGroups =
        FuseUtils.getPositiveInt(
            execEnvVars,
            FuseConstants.EXEC_ENV_VAR_GROUPBY_EXPECTED_GROUPS,
            FuseConstants.DEFAULT_GROUPBY_EXPECTED_GROUPS);
    table = new PartialAggregationTable(accumulatorFactory, expectedGroups);
    groupColumnTypes = null;
    numInputTuples = 0;
  }

  @Override
  protected void cleanup() {
    table = null;
    groupColumnTypes = null;
  }

  @Override
  protected TupleBatch fetchNextReady() throws DbException {
    switch (state) {
      case FAILED:
        throw new DbException(getOpName() + " failed earlier");
      case FINISHED:
        return null;
      case IDLE:
        stopwatch = Stopwatch.createStarted();
        state = State.STREAMING;
        break;
      default:
        break;
    }

    try {
      final Operator child = getChild();
      TupleBatch tb = child.nextReady();
      while (tb != null) {
        consume(tb);
        tb = child.nextReady();
      }
      if (!child.eos()) {
        return null;
      }

      state = State.DRAINING;
      stopwatch.stop();
      LOGGER.info(
          "Group by partial cost: {} ({} input tuples, {} groups, node {})",
          stopwatch,
          numInputTuples,
          table.numGroups(),
          getNodeID());
      TupleBatch result = drain();
      state = State.FINISHED;
      return result;
    } catch (DbException | RuntimeException e) {
      state = State.FAILED;
      throw e;
    }
  }

  /**
   * Group one input batch and fold every local group into the table.
   *
   * @param tb the input batch.
   * @throws DbException if the batch cannot be grouped or aggregated.
   */
  private void consume(final TupleBatch tb) throws DbException {
    numInputTuples += tb.numTuples();
    Map<GroupKey, LocalGroup> localGroups = BlockGrouper.group(tb, groupColumnNames);
    checkGroupColumnTypes(tb.getSchema());
    for (Map.Entry<GroupKey, LocalGroup> e : localGroups.entrySet()) {
      LocalGroup group = e.getValue();
      TupleBatch gathered = tb.gather(group.getRows());
      table.upsert(e.getKey(), group.getKeyValues(), aggregates, gathered);
    }
    LOGGER.debug("{} grouped {} tuples into {} local groups", getOpName(), tb.numTuples(), localGroups.size());
  }

  /**
   * Group keys carry no type tag, so every batch must agree with the first one on the types of the group-by columns.
   *
   * @param schema the schema of an input batch that has every group-by column.
   * @throws TypeException if a group-by column has another type than in the first batch.
   */
  private void checkGroupColumnTypes(final Schema schema) throws TypeException {
    ImmutableList.Builder<Type> builder = ImmutableList.builder();
    for (String name : groupColumnNames) {
      builder.add(schema.getColumnType(name));
    }
    ImmutableList<Type> types = builder.build();
    if (groupColumnTypes == null) {
      groupColumnTypes = types;
      return;
    }
    for (int i = 0; i < types.size(); ++i) {
      if (types.get(i) != groupColumnTypes.get(i)) {
        throw new TypeException(
            "group column " + groupColumnNames.get(i) + " changed type from " + groupColumnTypes.get(i) + " to "
                + types.get(i));
      }
    }
  }

  /**
   * @return one row per group, or null if there is no group.
   * @throws DbException if a state cannot be serialized.
   */
  @Nullable
  private TupleBatch drain() throws DbException {
    if (table.isEmpty()) {
      return null;
    }
    final int numGroups = table.numGroups();
    final ObjectWriter writer = FuseJsonMapperProvider.getWriter();
    final List<ColumnBuilder<?>> stateBuilders = new ArrayList<>(aggregates.size());
    for (int i = 0; i < aggregates.size(); ++i) {
      stateBuilders.add(ColumnBuilder.of(Type.STRING_TYPE, numGroups));
    }
    final ColumnBuilder<?> keysBuilder = ColumnBuilder.of(Type.STRING_TYPE, numGroups);
    final ColumnBuilder<?> keyBuilder = ColumnBuilder.of(Type.BYTES_TYPE, numGroups);

    table.drain(
        (key, entry) -> {
          ImmutableList<AggregateSlot> slots = entry.getSlots();
          for (int i = 0; i < slots.size(); ++i) {
            stateBuilders.get(i).appendString(toJson(writer, slots.get(i).getResult()));
          }
          keysBuilder.appendString(toJson(writer, keysOf(entry)));
          keyBuilder.appendByteBuffer(ByteBuffer.wrap(key.toByteArray()));
        });

    ImmutableList.Builder<Column<?>> columns = ImmutableList.builder();
    for (ColumnBuilder<?> builder : stateBuilders) {
      columns.add(builder.build());
    }
    columns.add(keysBuilder.build(), keyBuilder.build());
    return new TupleBatch(outputSchema, columns.build(), numGroups);
  }

  /**
   * @param entry a group.
   * @return the group-by values of the group by column name, in group-by order.
   */
  private Map<String, Field> keysOf(final GroupEntry entry) {
    Map<String, Field> keys = new LinkedHashMap<>();
    ImmutableList<Field> values = entry.getKeyValues();
    for (int i = 0; i < groupColumnNames.size(); ++i) {
      keys.put(groupColumnNames.get(i), values.get(i));
    }
    return keys;
  }

  /**
   * @param writer the JSON writer.
   * @param value the value.
   * @return the JSON encoding of the value.
   * @throws SerializationException if the value cannot be encoded.
   */
  private static String toJson(final ObjectWriter writer, final Object value) throws SerializationException {
    try {
      return writer.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException("cannot encode " + value, e);
    }
  }
}
