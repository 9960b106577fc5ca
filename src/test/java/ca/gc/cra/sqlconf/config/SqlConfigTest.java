package ca.gc.cra.sqlconf.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SqlConfigTest {

  @Test
  void defaultsAreFullyPopulated() {
    SqlConfig config = SqlConfig.defaults();

    assertEquals("DATABASE_URL", config.common().databaseUrlVar());
    assertTrue(config.common().drivers().sqlite().unsafeLoadExtensions().isEmpty());
    assertEquals(MacrosConfig.DateTimeCrate.INFERRED, config.macros().preferredCrates().dateTime());
    assertEquals(MacrosConfig.NumericCrate.INFERRED, config.macros().preferredCrates().numeric());
    assertTrue(config.macros().typeOverrides().isEmpty());
    assertTrue(config.macros().tableOverrides().isEmpty());
    assertEquals("_sqlx_migrations", config.migrate().tableName());
    assertEquals("migrations", config.migrate().migrationsDir());
    assertEquals(MigrateConfig.MigrationType.INFERRED, config.migrate().migrationDefaults().migrationType());
    assertEquals(MigrateConfig.MigrationVersioning.INFERRED,
        config.migrate().migrationDefaults().migrationVersioning());
  }

  @Test
  void defaultsAreSharedAndEqualToNullSections() {
    assertSame(SqlConfig.defaults(), SqlConfig.defaults());
    assertEquals(SqlConfig.defaults(), new SqlConfig(null, null, null));
  }

  @Test
  void collectionsAreCopiedAndUnmodifiable() {
    List<String> extensions = new ArrayList<>(List.of("uuid"));
    Map<String, String> types = new HashMap<>(Map.of("uuid", "MyUuid"));
    Set<String> schemas = new HashSet<>(Set.of("foo"));
    SqlConfig config = new SqlConfig(
        new CommonConfig(null, new DriversConfig(new DriversConfig.Sqlite(extensions))),
        new MacrosConfig(null, types, null),
        new MigrateConfig(null, null, null, schemas, null));

    extensions.add("vsv");
    types.clear();
    schemas.add("bar");

    assertEquals(List.of("uuid"), config.common().drivers().sqlite().unsafeLoadExtensions());
    assertEquals(Map.of("uuid", "MyUuid"), config.macros().typeOverrides());
    assertEquals(Set.of("foo"), config.migrate().createSchemas());
    assertThrows(UnsupportedOperationException.class,
        () -> config.common().drivers().sqlite().unsafeLoadExtensions().add("x"));
    assertThrows(UnsupportedOperationException.class, () -> config.macros().typeOverrides().put("a", "b"));
    assertThrows(UnsupportedOperationException.class, () -> config.migrate().createSchemas().add("x"));
  }

  @Test
  void explicitStringsArePreservedAndOnlyNullIsDefaulted() {
    assertEquals("  ", new CommonConfig("  ", null).databaseUrlVar());
    assertEquals("", new MigrateConfig(null, "", null, null, null).migrationsDir());
    assertEquals(" t ", new MigrateConfig(" t ", null, null, null, null).tableName());
    assertEquals(CommonConfig.DEFAULT_DATABASE_URL_VAR, new CommonConfig(null, null).databaseUrlVar());
  }

  @Test
  void ignoredCharsMustBeSingleCodePoints() {
    Set<String> emoji = Set.of(new String(Character.toChars(0x1F600)));

    assertEquals(emoji, new MigrateConfig(null, null, emoji, null, null).ignoredChars());
    assertThrows(IllegalArgumentException.class,
        () -> new MigrateConfig(null, null, Set.of("ab"), null, null));
    assertThrows(IllegalArgumentException.class,
        () -> new MigrateConfig(null, null, Set.of(""), null, null));
  }
}
