package ca.gc.cra.sqlconf.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Driver-specific settings. Only SQLite currently has options.
 *
 * @param sqlite SQLite settings
 * @since 0.1.0
 */
public record DriversConfig(@JsonProperty("sqlite") Sqlite sqlite) {

  public DriversConfig {
    sqlite = sqlite == null ? Sqlite.defaults() : sqlite;
  }

  public static DriversConfig defaults() {
    return new DriversConfig(null);
  }

  /**
   * SQLite connection settings.
   *
   * @param unsafeLoadExtensions extensions loaded on every connection; loading arbitrary extensions is unsafe,
   *     hence the name
   */
  public record Sqlite(@JsonProperty("unsafe-load-extensions") List<String> unsafeLoadExtensions) {

    public Sqlite {
      unsafeLoadExtensions = unsafeLoadExtensions == null ? List.of() : List.copyOf(unsafeLoadExtensions);
    }

    public static Sqlite defaults() {
      return new Sqlite(null);
    }
  }
}
