package ca.gc.cra.sqlconf.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigPathStrategyTest {

  @Test
  void projectDirAppendsFileName() throws ConfigException {
    Map<String, String> env = Map.of("SQLCONF_PROJECT_DIR", "/work/app");

    Path path = ConfigPathStrategy.projectDir(env::get).resolve();

    assertEquals(Path.of("/work/app", "sqlconf.toml"), path);
  }

  @Test
  void projectDirWithoutVariableIsEnvironmentMissing() {
    ConfigException.EnvironmentMissing ex = assertThrows(ConfigException.EnvironmentMissing.class,
        () -> ConfigPathStrategy.projectDir(Map.<String, String>of()::get).resolve());

    assertEquals("SQLCONF_PROJECT_DIR", ex.variable());
    assertNull(ex.getCause());
  }

  @Test
  void projectDirWithBlankVariableIsEnvironmentMissing() {
    Map<String, String> env = Map.of("SQLCONF_PROJECT_DIR", "   ");

    assertThrows(ConfigException.EnvironmentMissing.class, () -> ConfigPathStrategy.projectDir(env::get).resolve());
  }

  @Test
  void projectDirWithInvalidPathIsEnvironmentMissing() {
    Map<String, String> env = Map.of("SQLCONF_PROJECT_DIR", "bad\0dir");

    ConfigException.EnvironmentMissing ex = assertThrows(ConfigException.EnvironmentMissing.class,
        () -> ConfigPathStrategy.projectDir(env::get).resolve());

    assertEquals(java.nio.file.InvalidPathException.class, ex.getCause().getClass());
  }

  @Test
  void currentDirIsRelativeFileName() throws ConfigException {
    assertEquals(Path.of("sqlconf.toml"), ConfigPathStrategy.currentDir().resolve());
  }

  @Test
  void literalReturnsPathUnchanged() throws ConfigException {
    Path path = Path.of("elsewhere", "custom.toml");

    assertEquals(path, ConfigPathStrategy.literal(path).resolve());
  }
}
