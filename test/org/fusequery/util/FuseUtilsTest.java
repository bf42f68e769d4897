package org.fusequery.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.nio.ByteBuffer;
import java.util.Arrays;

import org.joda.time.DateTime;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import org.fusequery.FuseConstants;
import org.fusequery.Type;

public class FuseUtilsTest {

  @Test
  public void testTypeOf() {
    assertEquals(Type.INT_TYPE, FuseUtils.typeOf(1));
    assertEquals(Type.LONG_TYPE, FuseUtils.typeOf(1L));
    assertEquals(Type.FLOAT_TYPE, FuseUtils.typeOf(1f));
    assertEquals(Type.DOUBLE_TYPE, FuseUtils.typeOf(1d));
    assertEquals(Type.BOOLEAN_TYPE, FuseUtils.typeOf(true));
    assertEquals(Type.STRING_TYPE, FuseUtils.typeOf("a"));
    assertEquals(Type.DATETIME_TYPE, FuseUtils.typeOf(new DateTime(0L)));
    assertEquals(Type.BYTES_TYPE, FuseUtils.typeOf(ByteBuffer.allocate(1)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTypeOfUnknownClass() {
    FuseUtils.typeOf(new Object());
  }

  @Test
  public void testEnsureObjectIsValidType() {
    assertNull(FuseUtils.ensureObjectIsValidType(Type.INT_TYPE, null));
    assertEquals(3, FuseUtils.ensureObjectIsValidType(Type.INT_TYPE, 3));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEnsureObjectIsValidTypeMismatch() {
    FuseUtils.ensureObjectIsValidType(Type.INT_TYPE, 3L);
  }

  @Test(expected = NullPointerException.class)
  public void testCheckHasNoNulls() {
    FuseUtils.checkHasNoNulls(Arrays.asList("a", null), "no nulls");
  }

  @Test
  public void testGetPositiveInt() {
    String key = FuseConstants.EXEC_ENV_VAR_GROUPBY_EXPECTED_GROUPS;
    assertEquals(7, FuseUtils.getPositiveInt(null, key, 7));
    assertEquals(7, FuseUtils.getPositiveInt(ImmutableMap.<String, Object>of(), key, 7));
    assertEquals(12, FuseUtils.getPositiveInt(ImmutableMap.<String, Object>of(key, 12), key, 7));
    assertEquals(12, FuseUtils.getPositiveInt(ImmutableMap.<String, Object>of(key, "12"), key, 7));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGetPositiveIntRejectsZero() {
    String key = FuseConstants.EXEC_ENV_VAR_GROUPBY_EXPECTED_GROUPS;
    FuseUtils.getPositiveInt(ImmutableMap.<String, Object>of(key, 0), key, 7);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGetPositiveIntRejectsGarbage() {
    String key = FuseConstants.EXEC_ENV_VAR_GROUPBY_EXPECTED_GROUPS;
    FuseUtils.getPositiveInt(ImmutableMap.<String, Object>of(key, "many"), key, 7);
  }
}
