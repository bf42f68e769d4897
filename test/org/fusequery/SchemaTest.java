package org.fusequery;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public class SchemaTest {

  @Test
  public void testConstructionWithNoNames() {
    List<Type> types = ImmutableList.of(Type.INT_TYPE, Type.LONG_TYPE);
    Schema schema = new Schema(types);
    assertEquals(types, schema.getColumnTypes());
    assertEquals(ImmutableList.of("col0", "col1"), schema.getColumnNames());
  }

  @Test(expected = NullPointerException.class)
  public void testConstructionNullTypeInTypes() {
    List<Type> types = Lists.newLinkedList();
    types.add(Type.INT_TYPE);
    types.add(null);
    new Schema(types, ImmutableList.of("a", "b"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicatedNames() {
    Schema.ofFields(Type.INT_TYPE, "a", Type.LONG_TYPE, "a");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadNameStartsNumber() {
    Schema.ofFields(Type.INT_TYPE, Type.LONG_TYPE, "0col", "Mycol1");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOfFieldsTooFewNames() {
    Schema.ofFields(Type.INT_TYPE, Type.LONG_TYPE, "Mycol0");
  }

  @Test
  public void testOfFields() {
    Schema schema = new Schema(ImmutableList.of(Type.INT_TYPE, Type.LONG_TYPE), ImmutableList.of("x", "y"));
    assertEquals(schema, Schema.ofFields(Type.INT_TYPE, Type.LONG_TYPE, "x", "y"));
    assertEquals(schema, Schema.ofFields("x", Type.INT_TYPE, "y", Type.LONG_TYPE));
  }

  @Test
  public void testReservedGroupByNamesAreValid() {
    Schema schema =
        Schema.ofFields(
            Type.STRING_TYPE,
            FuseConstants.GROUP_KEYS_COLUMN_NAME,
            Type.BYTES_TYPE,
            FuseConstants.GROUP_BY_KEY_COLUMN_NAME);
    assertEquals(1, schema.columnNameToIndex(FuseConstants.GROUP_BY_KEY_COLUMN_NAME));
  }

  @Test
  public void testLookupByName() {
    Schema schema = Schema.ofFields("a", Type.INT_TYPE, "b", Type.STRING_TYPE);
    assertEquals(Type.STRING_TYPE, schema.getColumnType("b"));
    assertTrue(schema.hasColumn("a"));
    assertFalse(schema.hasColumn("c"));
  }

  @Test(expected = NoSuchElementException.class)
  public void testMissingColumn() {
    Schema.ofFields("a", Type.INT_TYPE).columnNameToIndex("b");
  }

  @Test
  public void testSubSchemaAndAppend() {
    Schema schema = Schema.ofFields("a", Type.INT_TYPE, "b", Type.STRING_TYPE, "c", Type.DOUBLE_TYPE);
    assertEquals(Schema.ofFields("c", Type.DOUBLE_TYPE, "a", Type.INT_TYPE), schema.getSubSchema(new int[] {2, 0}));
    assertEquals(
        Schema.ofFields("a", Type.INT_TYPE, "z", Type.BOOLEAN_TYPE),
        Schema.appendColumn(Schema.ofFields("a", Type.INT_TYPE), Type.BOOLEAN_TYPE, "z"));
  }

  @Test
  public void testCompatible() {
    assertTrue(Schema.ofFields("a", Type.INT_TYPE).compatible(Schema.ofFields("b", Type.INT_TYPE)));
    assertFalse(Schema.ofFields("a", Type.INT_TYPE).compatible(Schema.ofFields("a", Type.LONG_TYPE)));
  }
}
