package org.fusequery;

/**
 * This class holds the constants for FuseQuery execution.
 *
 */
public final class FuseConstants {
  /**
   * The system name.
   */
  public static final String SYSTEM_NAME = "FuseQuery";

  /**
   * Node ID.
   */
  public static final String EXEC_ENV_VAR_NODE_ID = "nodeId";

  /**
   * Expected number of distinct groups seen by one partial group-by instance. Sizes the initial group table; the table
   * grows past it as needed.
   */
  public static final String EXEC_ENV_VAR_GROUPBY_EXPECTED_GROUPS = "execEnvVar.groupby.expected.groups";

  /**
   * Default for {@link #EXEC_ENV_VAR_GROUPBY_EXPECTED_GROUPS}.
   */
  public static final int DEFAULT_GROUPBY_EXPECTED_GROUPS = 1024;

  /**
   * Name of the partial group-by output column holding the typed group key values.
   */
  public static final String GROUP_KEYS_COLUMN_NAME = "_group_keys";

  /**
   * Name of the partial group-by output column holding the raw encoded group key.
   */
  public static final String GROUP_BY_KEY_COLUMN_NAME = "_group_by_key";

  /**
   * Initial capacity of growable column builders.
   */
  public static final int DEFAULT_COLUMN_BUILDER_CAPACITY = 16;

  /** Private constructor to disallow construction of this class. */
  private FuseConstants() {}
}
