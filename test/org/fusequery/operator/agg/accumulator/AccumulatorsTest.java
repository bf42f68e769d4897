package org.fusequery.operator.agg.accumulator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import org.fusequery.DbException;
import org.fusequery.EvaluationException;
import org.fusequery.Type;
import org.fusequery.column.Column;
import org.fusequery.column.builder.ColumnBuilder;
import org.fusequery.column.builder.IntColumnBuilder;
import org.fusequery.column.builder.LongColumnBuilder;
import org.fusequery.column.builder.StringColumnBuilder;
import org.fusequery.storage.Field;

public class AccumulatorsTest {

  private static List<Column<?>> column(final Type type, final Object... values) {
    ColumnBuilder<?> builder = ColumnBuilder.of(type);
    for (Object v : values) {
      builder.appendObject(v);
    }
    return ImmutableList.<Column<?>>of(builder.build());
  }

  private static Accumulator create(final String fn, final String... args) throws DbException {
    return Accumulators.builtIns().create(fn, ImmutableList.copyOf(args));
  }

  @Test
  public void testCountStar() throws Exception {
    Accumulator count = create("count");
    count.accumulate(ImmutableList.<Column<?>>of(), 3);
    count.accumulate(ImmutableList.<Column<?>>of(), 4);
    assertEquals(ImmutableList.of(Field.of(7L)), count.getResult());
  }

  @Test
  public void testCountColumnSkipsNulls() throws Exception {
    Accumulator count = create("COUNT", "a");
    count.accumulate(column(Type.STRING_TYPE, "x", null, "y"), 3);
    assertEquals(ImmutableList.of(Field.of(2L)), count.getResult());
  }

  @Test
  public void testSumOfIntsIsLong() throws Exception {
    Accumulator sum = create("sum", "a");
    sum.accumulate(column(Type.INT_TYPE, Integer.MAX_VALUE, 1, null), 3);
    sum.accumulate(column(Type.INT_TYPE, 2), 1);
    assertEquals(ImmutableList.of(Field.of((long) Integer.MAX_VALUE + 3)), sum.getResult());
  }

  @Test
  public void testSumOfFloatsIsDouble() throws Exception {
    Accumulator sum = create("sum", "a");
    sum.accumulate(column(Type.FLOAT_TYPE, 1.5f, 2.25f), 2);
    assertEquals(ImmutableList.of(Field.of(3.75d)), sum.getResult());
  }

  @Test
  public void testSumOfNothingIsNull() throws Exception {
    Accumulator sum = create("sum", "a");
    sum.accumulate(column(Type.DOUBLE_TYPE, (Object) null), 1);
    assertEquals(ImmutableList.of(Field.nullOf(Type.DOUBLE_TYPE)), sum.getResult());
    assertEquals(ImmutableList.of(Field.nullOf(Type.LONG_TYPE)), create("sum", "a").getResult());
  }

  @Test(expected = EvaluationException.class)
  public void testSumOverflow() throws Exception {
    Accumulator sum = create("sum", "a");
    sum.accumulate(ImmutableList.of(new LongColumnBuilder(2).appendLong(Long.MAX_VALUE).appendLong(1).build()), 2);
  }

  @Test(expected = EvaluationException.class)
  public void testSumOfStrings() throws Exception {
    create("sum", "a").accumulate(ImmutableList.of(new StringColumnBuilder(1).appendString("x").build()), 1);
  }

  @Test(expected = EvaluationException.class)
  public void testTypeChangeBetweenBatches() throws Exception {
    Accumulator sum = create("sum", "a");
    sum.accumulate(column(Type.INT_TYPE, 1), 1);
    sum.accumulate(column(Type.LONG_TYPE, 1L), 1);
  }

  @Test
  public void testMinMax() throws Exception {
    Accumulator min = create("min", "a");
    Accumulator max = create("max", "a");
    for (Accumulator acc : ImmutableList.of(min, max)) {
      acc.accumulate(column(Type.STRING_TYPE, "pear", null, "apple"), 3);
      acc.accumulate(column(Type.STRING_TYPE, "zucchini"), 1);
    }
    assertEquals(ImmutableList.of(Field.of("apple")), min.getResult());
    assertEquals(ImmutableList.of(Field.of("zucchini")), max.getResult());
  }

  @Test
  public void testMinOfOnlyNulls() throws Exception {
    Accumulator min = create("min", "a");
    min.accumulate(column(Type.INT_TYPE, null, null), 2);
    assertEquals(ImmutableList.of(Field.nullOf(Type.INT_TYPE)), min.getResult());
  }

  @Test
  public void testAvgState() throws Exception {
    Accumulator avg = create("avg", "a");
    avg.accumulate(column(Type.INT_TYPE, 1, 2, null), 3);
    avg.accumulate(column(Type.INT_TYPE, 6), 1);
    assertEquals(ImmutableList.of(Field.of(9L), Field.of(3L)), avg.getResult());
  }

  @Test
  public void testAvgOfDoubles() throws Exception {
    Accumulator avg = create("avg", "a");
    avg.accumulate(column(Type.DOUBLE_TYPE, 0.5d, 1.0d), 2);
    assertEquals(ImmutableList.of(Field.of(1.5d), Field.of(2L)), avg.getResult());
  }

  @Test
  public void testOnlyFirstRowsAreFolded() throws Exception {
    Accumulator sum = create("sum", "a");
    sum.accumulate(ImmutableList.of(new IntColumnBuilder(3).appendInt(1).appendInt(2).appendInt(4).build()), 2);
    assertEquals(ImmutableList.of(Field.of(3L)), sum.getResult());
  }

  @Test(expected = DbException.class)
  public void testUnknownFunction() throws Exception {
    create("median", "a");
  }

  @Test(expected = DbException.class)
  public void testWrongArity() throws Exception {
    create("sum");
  }

  @Test(expected = DbException.class)
  public void testCountTooManyArguments() throws Exception {
    create("count", "a", "b");
  }

  @Test
  public void testRegister() throws Exception {
    Accumulators registry = Accumulators.withBuiltIns();
    assertFalse(registry.isRegistered("any_value"));
    registry.register("any_value", args -> new MinMaxAccumulator(false));
    assertTrue(registry.isRegistered("ANY_VALUE"));
    Accumulator acc = registry.create("any_value", ImmutableList.of("a"));
    acc.accumulate(column(Type.LONG_TYPE, 5L), 1);
    assertEquals(ImmutableList.of(Field.of(5L)), acc.getResult());
    assertFalse(Accumulators.withBuiltIns().isRegistered("any_value"));
  }
}
