package org.fusequery.column;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import org.fusequery.Type;
import org.fusequery.column.builder.ColumnBuilder;
import org.fusequery.column.builder.DoubleColumnBuilder;
import org.fusequery.column.builder.IntColumnBuilder;
import org.fusequery.column.builder.StringColumnBuilder;

public class ColumnBuilderTest {

  @Test
  public void testGrowsPastExpectedSize() {
    IntColumnBuilder builder = new IntColumnBuilder(1);
    for (int i = 0; i < 1000; ++i) {
      builder.appendInt(i);
    }
    assertEquals(1000, builder.size());
    Column<?> column = builder.build();
    assertEquals(1000, column.size());
    assertEquals(999, column.getInt(999));
    assertFalse(column.hasNulls());
  }

  @Test
  public void testNulls() {
    ColumnBuilder<?> builder = ColumnBuilder.of(Type.STRING_TYPE);
    builder.appendString("a").appendNull().appendObject(null);
    assertEquals(3, builder.size());
    Column<?> column = builder.build();
    assertFalse(column.isNull(0));
    assertTrue(column.isNull(1));
    assertTrue(column.isNull(2));
  }

  @Test
  public void testAppendFrom() {
    Column<?> source = new DoubleColumnBuilder(2).appendDouble(1.0).appendNull().build();
    ColumnBuilder<?> builder = ColumnBuilder.of(Type.DOUBLE_TYPE);
    builder.appendFrom(source, 1).appendFrom(source, 0);
    Column<?> column = builder.build();
    assertTrue(column.isNull(0));
    assertEquals(1.0, column.getDouble(1), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAppendFromOtherType() {
    Column<?> source = new DoubleColumnBuilder(1).appendDouble(1.0).build();
    ColumnBuilder.of(Type.LONG_TYPE).appendFrom(source, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAppendObjectOfWrongClass() {
    ColumnBuilder.of(Type.INT_TYPE).appendObject(1L);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testAppendWrongPrimitive() {
    new StringColumnBuilder(1).appendLong(1);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testWrongGetter() {
    new StringColumnBuilder(1).appendString("a").build().getLong(0);
  }

  @Test(expected = IllegalStateException.class)
  public void testBuildTwice() {
    IntColumnBuilder builder = new IntColumnBuilder(1);
    builder.build();
    builder.build();
  }

  @Test
  public void testEmptyColumn() {
    for (Type type : Type.values()) {
      Column<?> column = Column.emptyColumn(type);
      assertEquals(type, column.getType());
      assertEquals(0, column.size());
    }
  }
}
