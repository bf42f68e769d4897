package org.fusequery.operator;

import static org.fusequery.util.TestUtils.batch;
import static org.fusequery.util.TestUtils.row;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import org.fusequery.DbException;
import org.fusequery.Schema;
import org.fusequery.Type;
import org.fusequery.expression.ConstantExpression;
import org.fusequery.expression.Expression;
import org.fusequery.expression.ModuloExpression;
import org.fusequery.expression.VariableExpression;
import org.fusequery.storage.TupleBatch;
import org.fusequery.util.TestEnvVars;

public class ApplyTest {

  private static final Schema SCHEMA = Schema.ofFields("a", Type.LONG_TYPE);

  @Test
  public void testApply() throws DbException {
    TupleSource source =
        new TupleSource(ImmutableList.of(batch(SCHEMA, row(1L), row(5L)), batch(SCHEMA, row(6L))));
    Apply apply =
        new Apply(
            source,
            ImmutableList.of(
                Expression.column("a"),
                new Expression(
                    "k", new ModuloExpression(new VariableExpression("a"), new ConstantExpression(3L)))));
    assertEquals(Schema.ofFields("a", Type.LONG_TYPE, "k", Type.LONG_TYPE), apply.getSchema());

    apply.open(TestEnvVars.get());
    TupleBatch tb = apply.nextReady();
    assertEquals(2, tb.numTuples());
    assertEquals(2L, tb.getObject(1, 1));
    tb = apply.nextReady();
    assertEquals(0L, tb.getObject(1, 0));
    assertNull(apply.nextReady());
    assertTrue(apply.eos());
    apply.close();
  }

  @Test
  public void testEmptyInput() throws DbException {
    Apply apply = new Apply(EmptyRelation.of(SCHEMA), ImmutableList.of(Expression.column("a")));
    apply.open(null);
    assertNull(apply.nextReady());
    assertTrue(apply.eos());
    apply.close();
  }

  @Test(expected = DbException.class)
  public void testNotOpen() throws DbException {
    new Apply(EmptyRelation.of(SCHEMA), ImmutableList.of(Expression.column("a"))).nextReady();
  }
}
