package org.fusequery.expression;

import static org.fusequery.util.TestUtils.batch;
import static org.fusequery.util.TestUtils.row;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import org.fusequery.EvaluationException;
import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.column.Column;
import org.fusequery.storage.TupleBatch;
import org.fusequery.util.FuseJsonMapperProvider;

public class ExpressionTest {

  private static final Schema SCHEMA = Schema.ofFields("a", Type.INT_TYPE, "b", Type.LONG_TYPE, "c", Type.DOUBLE_TYPE);

  private static TupleBatch sample() {
    return batch(SCHEMA, row(1, 10L, 0.5d), row(5, null, 1.5d), row(-7, 30L, 2.0d));
  }

  @Test
  public void testModulo() throws Exception {
    Expression expr =
        new Expression("k", new ModuloExpression(new VariableExpression("a"), new ConstantExpression(3)));
    assertEquals(Type.INT_TYPE, expr.getOutputType(SCHEMA));
    Column<?> k = expr.evaluate(sample());
    assertEquals(1, k.getInt(0));
    assertEquals(2, k.getInt(1));
    assertEquals(-1, k.getInt(2));
  }

  @Test
  public void testTypeWidening() throws Exception {
    Expression plus = new Expression("s", new PlusExpression(new VariableExpression("a"), new VariableExpression("b")));
    assertEquals(Type.LONG_TYPE, plus.getOutputType(SCHEMA));
    Column<?> s = plus.evaluate(sample());
    assertEquals(11L, s.getLong(0));
    assertTrue(s.isNull(1));
    assertEquals(23L, s.getLong(2));

    Expression times =
        new Expression("t", new TimesExpression(new VariableExpression("c"), new VariableExpression("a")));
    assertEquals(Type.DOUBLE_TYPE, times.getOutputType(SCHEMA));
    assertEquals(7.5, times.evaluate(sample()).getDouble(1), 0.0);
  }

  @Test
  public void testMinus() throws Exception {
    Expression expr =
        new Expression("m", new MinusExpression(new VariableExpression("b"), new ConstantExpression(1L)));
    assertEquals(29L, expr.evaluate(sample()).getLong(2));
  }

  @Test(expected = EvaluationException.class)
  public void testModuloByZero() throws Exception {
    new Expression("k", new ModuloExpression(new VariableExpression("a"), new ConstantExpression(0)))
        .evaluate(sample());
  }

  @Test(expected = EvaluationException.class)
  public void testIntegerOverflow() throws Exception {
    TupleBatch tb = batch(Schema.ofFields("a", Type.INT_TYPE), row(Integer.MAX_VALUE));
    new Expression("p", new PlusExpression(new VariableExpression("a"), new ConstantExpression(1))).evaluate(tb);
  }

  @Test(expected = EvaluationException.class)
  public void testMissingVariable() throws Exception {
    Expression.column("nope").evaluate(sample());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testModuloOfDoubles() {
    new ModuloExpression(new VariableExpression("c"), new ConstantExpression(2)).getOutputType(SCHEMA);
  }

  @Test
  public void testConstant() throws Exception {
    Column<?> col = new ConstantExpression("x").evaluate(sample());
    assertEquals(3, col.size());
    assertEquals("x", col.getString(2));
  }

  @Test
  public void testToDataField() {
    Expression expr = new Expression("k", new ModuloExpression(new VariableExpression("b"), new ConstantExpression(3)));
    assertEquals(Schema.ofFields("k", Type.LONG_TYPE), expr.toDataField(SCHEMA));
  }

  @Test
  public void testJson() throws Exception {
    Expression expr =
        new Expression("k", new ModuloExpression(new VariableExpression("a"), new ConstantExpression(3)));
    String json = FuseJsonMapperProvider.getWriter().writeValueAsString(expr);
    assertTrue(json, json.contains("\"MODULO\""));
    Expression back = FuseJsonMapperProvider.getMapper().readValue(json, Expression.class);
    assertEquals(expr, back);
  }
}
