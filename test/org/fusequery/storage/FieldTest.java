package org.fusequery.storage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.ByteBuffer;
import java.util.List;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.fusequery.Type;
import org.fusequery.util.FuseJsonMapperProvider;
import org.fusequery.util.TestUtils;

public class FieldTest {

  @Test
  public void testJsonLayout() throws Exception {
    String json = FuseJsonMapperProvider.getWriter().writeValueAsString(Field.of(3L));
    JsonNode node = FuseJsonMapperProvider.getMapper().readTree(json);
    assertEquals("LONG_TYPE", node.get("type").asText());
    assertEquals(3L, node.get("value").asLong());
  }

  @Test
  public void testNullJson() throws Exception {
    String json = FuseJsonMapperProvider.getWriter().writeValueAsString(Field.nullOf(Type.DOUBLE_TYPE));
    JsonNode node = FuseJsonMapperProvider.getMapper().readTree(json);
    assertTrue(node.get("value").isNull());
    Field back = FuseJsonMapperProvider.getMapper().readValue(json, Field.class);
    assertTrue(back.isNull());
    assertEquals(Type.DOUBLE_TYPE, back.getType());
  }

  @Test
  public void testEveryTypeSurvivesJson() throws Exception {
    List<Field> fields =
        ImmutableList.of(
            Field.of(true),
            Field.of(ByteBuffer.wrap(new byte[] {0, 1, (byte) 0xff})),
            Field.of(new DateTime(1620000000000L, DateTimeZone.UTC)),
            Field.of(0.25d),
            Field.of(1.5f),
            Field.of(Integer.MIN_VALUE),
            Field.of(Long.MAX_VALUE),
            Field.of("héllo"),
            Field.of(Double.NaN));
    String json = FuseJsonMapperProvider.getWriter().writeValueAsString(fields);
    assertEquals(fields, TestUtils.parseFields(json));
  }

  @Test
  public void testDateTimeIsIsoString() throws Exception {
    DateTime dt = new DateTime(0L, DateTimeZone.UTC);
    String json = FuseJsonMapperProvider.getWriter().writeValueAsString(Field.of(dt));
    JsonNode node = FuseJsonMapperProvider.getMapper().readTree(json);
    assertTrue(node.get("value").isTextual());
    assertEquals(dt.getMillis(), DateTime.parse(node.get("value").asText()).getMillis());
  }

  @Test
  public void testEquality() {
    assertEquals(Field.of(1L), Field.of(Type.LONG_TYPE, 1L));
    assertNotEquals(Field.of(1L), Field.of(1));
    assertNotEquals(Field.nullOf(Type.LONG_TYPE), Field.nullOf(Type.INT_TYPE));
    assertEquals(Field.nullOf(Type.LONG_TYPE).hashCode(), Field.nullOf(Type.LONG_TYPE).hashCode());
  }

  @Test
  public void testBytesAreReadOnlyAndPrintedInHex() {
    Field f = Field.of(ByteBuffer.wrap(new byte[] {0x0a, 0x1b}));
    assertTrue(((ByteBuffer) f.getObject()).isReadOnly());
    assertEquals("0A1B", f.toString());
    assertEquals("null", Field.nullOf(Type.BYTES_TYPE).toString());
    assertNull(Field.nullOf(Type.BYTES_TYPE).getObject());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongValueClass() {
    Field.of(Type.INT_TYPE, "1");
  }
}
