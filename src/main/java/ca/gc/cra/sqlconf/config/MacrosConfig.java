package ca.gc.cra.sqlconf.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Settings for compile-time query checking.
 *
 * <p>Maps are copied into sorted, unmodifiable maps so that rendering and equality do not depend on the order of
 * keys in the source document.</p>
 *
 * @param preferredCrates crates preferred when a column type could map to more than one
 * @param typeOverrides SQL type name to target type, applied to every column of that type
 * @param tableOverrides table name to (column name to target type)
 * @since 0.1.0
 */
public record MacrosConfig(
    @JsonProperty("preferred-crates") PreferredCrates preferredCrates,
    @JsonProperty("type-overrides") Map<String, String> typeOverrides,
    @JsonProperty("table-overrides") Map<String, Map<String, String>> tableOverrides) {

  public MacrosConfig {
    preferredCrates = preferredCrates == null ? PreferredCrates.defaults() : preferredCrates;
    typeOverrides = sortedCopy(typeOverrides);
    if (tableOverrides == null) {
      tableOverrides = Collections.emptySortedMap();
    } else {
      SortedMap<String, Map<String, String>> tables = new TreeMap<>();
      tableOverrides.forEach((table, columns) -> tables.put(table, sortedCopy(columns)));
      tableOverrides = Collections.unmodifiableSortedMap(tables);
    }
  }

  public static MacrosConfig defaults() {
    return new MacrosConfig(null, null, null);
  }

  /**
   * Looks up the override for a column, falling back to the type-wide override.
   *
   * @param table table name as written in the query
   * @param column column name
   * @param sqlType SQL type name reported by the database
   * @return target type, or {@code null} when neither a column nor a type override exists
   */
  public String overrideFor(String table, String column, String sqlType) {
    Map<String, String> columns = tableOverrides.get(table);
    if (columns != null && columns.containsKey(column)) {
      return columns.get(column);
    }
    return typeOverrides.get(sqlType);
  }

  private static SortedMap<String, String> sortedCopy(Map<String, String> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptySortedMap();
    }
    return Collections.unmodifiableSortedMap(new TreeMap<>(source));
  }

  /**
   * Preferred crates for ambiguous type mappings.
   *
   * @param dateTime date/time crate
   * @param numeric arbitrary-precision numeric crate
   */
  public record PreferredCrates(
      @JsonProperty("date-time") DateTimeCrate dateTime,
      @JsonProperty("numeric") NumericCrate numeric) {

    public PreferredCrates {
      dateTime = dateTime == null ? DateTimeCrate.INFERRED : dateTime;
      numeric = numeric == null ? NumericCrate.INFERRED : numeric;
    }

    public static PreferredCrates defaults() {
      return new PreferredCrates(null, null);
    }
  }

  /** Date/time crate choices. */
  public enum DateTimeCrate {
    /** Use whichever supported crate is enabled, preferring {@code time}. */
    @JsonProperty("inferred") INFERRED,
    @JsonProperty("chrono") CHRONO,
    @JsonProperty("time") TIME
  }

  /** Numeric crate choices. */
  public enum NumericCrate {
    /** Use whichever supported crate is enabled, preferring {@code bigdecimal}. */
    @JsonProperty("inferred") INFERRED,
    @JsonProperty("bigdecimal") BIGDECIMAL,
    @JsonProperty("rust_decimal") RUST_DECIMAL
  }
}
