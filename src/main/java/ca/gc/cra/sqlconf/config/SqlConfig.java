package ca.gc.cra.sqlconf.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * <strong>What:</strong> Parsed structure of a {@code sqlconf.toml} file.
 * <p><strong>Why:</strong> Gives query-checking and migration tooling one immutable view of the project settings,
 * fully populated even when the file, a section, or a key is missing.</p>
 * <p><strong>Role:</strong> Value published once per process by {@link ConfigLoader}.</p>
 * <p><strong>Thread-safety:</strong> Deeply immutable; safe to share without synchronization.</p>
 *
 * @param common settings shared by several components
 * @param macros settings for compile-time query checking
 * @param migrate settings for migration tooling
 * <p>Top-level tables other than these three are ignored so the file can be shared with other tools; keys
 * inside the known tables are still checked.</p>
 *
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SqlConfig(
    @JsonProperty("common") CommonConfig common,
    @JsonProperty("macros") MacrosConfig macros,
    @JsonProperty("migrate") MigrateConfig migrate) {

  private static final SqlConfig DEFAULTS = new SqlConfig(null, null, null);

  /** Replaces absent sections with their defaults. */
  public SqlConfig {
    common = common == null ? CommonConfig.defaults() : common;
    macros = macros == null ? MacrosConfig.defaults() : macros;
    migrate = migrate == null ? MigrateConfig.defaults() : migrate;
  }

  /**
   * Returns the configuration used when no file is present.
   *
   * @return configuration with every section at its defaults
   */
  public static SqlConfig defaults() {
    return DEFAULTS;
  }
}
