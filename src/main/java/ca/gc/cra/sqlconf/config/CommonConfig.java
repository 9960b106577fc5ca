package ca.gc.cra.sqlconf.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings shared by the query macros, migration tooling, and the CLI.
 *
 * @param databaseUrlVar name of the environment variable holding the database URL
 * @param drivers driver-specific settings
 * @since 0.1.0
 */
public record CommonConfig(
    @JsonProperty("database-url-var") String databaseUrlVar,
    @JsonProperty("drivers") DriversConfig drivers) {

  /** Variable consulted when {@code database-url-var} is not set. */
  public static final String DEFAULT_DATABASE_URL_VAR = "DATABASE_URL";

  public CommonConfig {
    databaseUrlVar = databaseUrlVar == null ? DEFAULT_DATABASE_URL_VAR : databaseUrlVar;
    drivers = drivers == null ? DriversConfig.defaults() : drivers;
  }

  public static CommonConfig defaults() {
    return new CommonConfig(null, null);
  }
}
