package org.fusequery;

import java.io.Serializable;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.jcip.annotations.Immutable;

import org.fusequery.util.FuseUtils;

/**
 * Schema describes the named, typed columns of a batch of tuples.
 */
@Immutable
public final class Schema implements Serializable {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The regular expression specifying what names are valid. */
  public static final String VALID_NAME_REGEX = "^[a-zA-Z_]\\w*$";
  /** The regular expression matcher for {@link #VALID_NAME_REGEX}. */
  private static final Pattern VALID_NAME_PATTERN = Pattern.compile(VALID_NAME_REGEX);

  /** The empty schema. */
  public static final Schema EMPTY_SCHEMA = new Schema(ImmutableList.of(), ImmutableList.of());

  /** The types of the columns in this relation. */
  @JsonProperty private final ImmutableList<Type> columnTypes;

  /** The names of the columns in this relation. */
  @JsonProperty private final ImmutableList<String> columnNames;

  /**
   * Validate a potential column name for use in a Schema. Valid names are given by {@link #VALID_NAME_REGEX}.
   *
   * @param name the candidate column name.
   * @return the supplied name, if it is valid.
   * @throws IllegalArgumentException if the name does not match the regex {@link #VALID_NAME_REGEX}.
   */
  private static String checkName(final String name) {
    Objects.requireNonNull(name, "name");
    Preconditions.checkArgument(
        VALID_NAME_PATTERN.matcher(name).matches(),
        "supplied column name %s does not match the valid name regex %s",
        name,
        VALID_NAME_REGEX);
    return name;
  }

  /**
   * Static factory method.
   *
   * @param types the types of columns in this Schema.
   * @param names the names of the columns. If null, columns are named col0, col1, ...
   * @return a Schema representing the specified column types and names.
   */
  @JsonCreator
  public static Schema of(
      @JsonProperty(value = "columnTypes", required = true) final List<Type> types,
      @JsonProperty("columnNames") final List<String> names) {
    if (names == null) {
      return new Schema(types);
    }
    return new Schema(types, names);
  }

  /**
   * Create a Schema given a list of column types. Column names will be col0, col1, ....
   *
   * @param types the types of the columns.
   */
  public Schema(final List<Type> types) {
    this(types, generateNames(types));
  }

  /**
   * @param columnTypes the types of the columns.
   * @param columnNames the names of the columns, same length as <code>columnTypes</code>, unique.
   */
  public Schema(final List<Type> columnTypes, final List<String> columnNames) {
    Objects.requireNonNull(columnTypes, "columnTypes");
    Objects.requireNonNull(columnNames, "columnNames");
    Preconditions.checkArgument(
        columnTypes.size() == columnNames.size(),
        "Invalid Schema: %s column types but %s column names",
        columnTypes.size(),
        columnNames.size());
    FuseUtils.checkHasNoNulls(columnTypes, "columnTypes may not contain null elements");
    FuseUtils.checkHasNoNulls(columnNames, "columnNames may not contain null elements");
    HashSet<String> uniqueNames = new HashSet<>();
    for (String name : columnNames) {
      checkName(name);
      Preconditions.checkArgument(uniqueNames.add(name), "schema has duplicated column name %s", name);
    }
    this.columnTypes = ImmutableList.copyOf(columnTypes);
    this.columnNames = ImmutableList.copyOf(columnNames);
  }

  /**
   * @param types the types of the columns
   * @return names <code>col0</code> ... <code>colN-1</code>.
   */
  private static List<String> generateNames(final List<Type> types) {
    Objects.requireNonNull(types, "types");
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < types.size(); i++) {
      names.add("col" + i);
    }
    return names.build();
  }

  /**
   * Create a new Schema using an existing Schema and a new column.
   *
   * @param schema the existing schema.
   * @param type the type of the new column.
   * @param name the name of the new column.
   * @return the new Schema.
   */
  public static Schema appendColumn(final Schema schema, final Type type, final String name) {
    List<Type> types = ImmutableList.<Type>builder().addAll(schema.columnTypes).add(type).build();
    List<String> names = ImmutableList.<String>builder().addAll(schema.columnNames).add(name).build();
    return new Schema(types, names);
  }

  /**
   * Construct a Schema from a list of {@link Type} and {@link String} objects. The types and names may be interleaved
   * in any order; ordering within types and within names is preserved. If there are no {@link String} objects given,
   * then the {@link #Schema(List)} constructor is used.
   *
   * @param fields any number of {@link Type} or {@link String} objects.
   * @return the {@link Schema} containing these objects.
   */
  public static Schema ofFields(final Object... fields) {
    ImmutableList.Builder<Type> typesB = ImmutableList.builder();
    ImmutableList.Builder<String> namesB = ImmutableList.builder();
    for (Object o : fields) {
      Objects.requireNonNull(o, "field cannot be null");
      if (o instanceof Type) {
        typesB.add((Type) o);
      } else if (o instanceof String) {
        namesB.add((String) o);
      } else {
        throw new IllegalArgumentException(
            "fields must be either Type or String, not " + o.getClass().getCanonicalName());
      }
    }
    List<Type> types = typesB.build();
    List<String> names = namesB.build();
    if (names.isEmpty()) {
      return new Schema(types);
    }
    return new Schema(types, names);
  }

  /**
   * Return true if the two schema are "compatible": they have the same size and column types; column names are ignored.
   *
   * @param s2 the Schema object to compare
   * @return true if the schemas are compatible
   */
  public boolean compatible(final Schema s2) {
    return columnTypes.equals(s2.columnTypes);
  }

  /**
   * Find the index of the column with a given name.
   *
   * @param name name of the column.
   * @return the index of the column with the given name.
   * @throws NoSuchElementException if no column with a matching name is found.
   */
  public int columnNameToIndex(final String name) {
    final int ret = columnNames.indexOf(name);
    if (ret == -1) {
      throw new NoSuchElementException("No column named " + name + " found");
    }
    return ret;
  }

  /**
   * @param name name of the column.
   * @return whether this schema has a column with the given name.
   */
  public boolean hasColumn(final String name) {
    return columnNames.contains(name);
  }

  /**
   * Return a subset of the current schema.
   *
   * @param index indices to be selected.
   * @return the subschema.
   */
  public Schema getSubSchema(final int[] index) {
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i : index) {
      Preconditions.checkElementIndex(i, numColumns());
      types.add(getColumnType(i));
      names.add(getColumnName(i));
    }
    return new Schema(types.build(), names.build());
  }

  /**
   * @param index index of the column name to return. It must be a valid index.
   * @return the name of the ith column
   */
  public String getColumnName(final int index) {
    return columnNames.get(index);
  }

  /**
   * @return an immutable list containing the names of the columns in this Schema.
   */
  public List<String> getColumnNames() {
    return columnNames;
  }

  /**
   * @param index index of the column to get the type of. It must be a valid index.
   * @return the type of the ith column
   */
  public Type getColumnType(final int index) {
    return columnTypes.get(index);
  }

  /**
   * @param name the name of the column.
   * @return the type of the named column.
   * @throws NoSuchElementException if no column with a matching name is found.
   */
  public Type getColumnType(final String name) {
    return columnTypes.get(columnNameToIndex(name));
  }

  /**
   * @return an immutable list containing the types of the columns in this Schema.
   */
  public List<Type> getColumnTypes() {
    return columnTypes;
  }

  /**
   * @return the number of columns in this Schema
   */
  public int numColumns() {
    return columnTypes.size();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Schema)) {
      return false;
    }
    final Schema other = (Schema) o;
    return columnTypes.equals(other.columnTypes) && columnNames.equals(other.columnNames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columnNames, columnTypes);
  }

  /**
   * @return "columnName[0] (columnType[0]), ..., columnName[M] (columnType[M])".
   */
  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < columnTypes.size(); ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(columnNames.get(i)).append(" (").append(columnTypes.get(i)).append(')');
    }
    return sb.toString();
  }
}
