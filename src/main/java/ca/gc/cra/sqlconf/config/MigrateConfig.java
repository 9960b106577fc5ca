package ca.gc.cra.sqlconf.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Settings for migration tooling.
 *
 * @param tableName table recording applied migrations, optionally schema-qualified
 * @param migrationsDir directory holding migration scripts, relative to the project directory
 * @param ignoredChars characters stripped before checksumming a migration, e.g. {@code "\r"} so that line-ending
 *     conversions do not change checksums; each entry is a single Unicode code point
 * @param createSchemas schemas created before the migrations table
 * @param migrationDefaults defaults used when creating new migrations (TOML key {@code defaults})
 * @since 0.1.0
 */
public record MigrateConfig(
    @JsonProperty("table-name") String tableName,
    @JsonProperty("migrations-dir") String migrationsDir,
    @JsonProperty("ignored-chars") Set<String> ignoredChars,
    @JsonProperty("create-schemas") Set<String> createSchemas,
    @JsonProperty("defaults") MigrationDefaults migrationDefaults) {

  public static final String DEFAULT_TABLE_NAME = "_sqlx_migrations";
  public static final String DEFAULT_MIGRATIONS_DIR = "migrations";

  public MigrateConfig {
    tableName = tableName == null ? DEFAULT_TABLE_NAME : tableName;
    migrationsDir = migrationsDir == null ? DEFAULT_MIGRATIONS_DIR : migrationsDir;
    ignoredChars = sortedCopy(requireSingleCodePoints(ignoredChars));
    createSchemas = sortedCopy(createSchemas);
    migrationDefaults = migrationDefaults == null ? MigrationDefaults.defaults() : migrationDefaults;
  }

  public static MigrateConfig defaults() {
    return new MigrateConfig(null, null, null, null, null);
  }

  private static Set<String> requireSingleCodePoints(Set<String> chars) {
    if (chars != null) {
      for (String c : chars) {
        if (c == null || c.codePointCount(0, c.length()) != 1) {
          throw new IllegalArgumentException("ignored-chars entries must be single characters (was \"" + c + "\")");
        }
      }
    }
    return chars;
  }

  private static <T extends Comparable<T>> SortedSet<T> sortedCopy(Set<T> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptySortedSet();
    }
    return Collections.unmodifiableSortedSet(new TreeSet<>(source));
  }

  /**
   * Defaults applied when new migrations are created.
   *
   * @param migrationType simple or reversible scripts
   * @param migrationVersioning version prefix scheme
   */
  public record MigrationDefaults(
      @JsonProperty("migration-type") MigrationType migrationType,
      @JsonProperty("migration-versioning") MigrationVersioning migrationVersioning) {

    public MigrationDefaults {
      migrationType = migrationType == null ? MigrationType.INFERRED : migrationType;
      migrationVersioning = migrationVersioning == null ? MigrationVersioning.INFERRED : migrationVersioning;
    }

    public static MigrationDefaults defaults() {
      return new MigrationDefaults(null, null);
    }
  }

  /** Shape of new migration scripts. */
  public enum MigrationType {
    /** Follow the existing migrations, or {@link #SIMPLE} when there are none. */
    @JsonProperty("inferred") INFERRED,
    /** One {@code .sql} file per migration. */
    @JsonProperty("simple") SIMPLE,
    /** Paired {@code .up.sql} and {@code .down.sql} files. */
    @JsonProperty("reversible") REVERSIBLE
  }

  /** Version prefix scheme of new migrations. */
  public enum MigrationVersioning {
    /** Follow the existing migrations, or {@link #TIMESTAMP} when there are none. */
    @JsonProperty("inferred") INFERRED,
    @JsonProperty("timestamp") TIMESTAMP,
    @JsonProperty("sequential") SEQUENTIAL
  }
}
