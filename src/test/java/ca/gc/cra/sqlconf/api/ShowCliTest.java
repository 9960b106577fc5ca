package ca.gc.cra.sqlconf.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sqlconf.config.ConfigLoader;
import ca.gc.cra.sqlconf.config.SqlConfig;
import ca.gc.cra.sqlconf.config.TomlConfigFormat;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShowCliTest {
  private static final Function<String, String> NO_ENV = Map.<String, String>of()::get;

  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ConfigLoader loader;

  @BeforeEach
  void setUp() {
    loader = new ConfigLoader(new TomlConfigFormat());
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingFilePrintsDefaults() {
    ExitCode code = ShowCli.run(new String[] {"config=" + tempDir.resolve("absent.toml")}, loader, NO_ENV);

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.startsWith("# source: defaults (no config file)"), out);
    assertTrue(out.contains("_sqlx_migrations"), out);
    assertEquals(SqlConfig.defaults(), loader.cached().orElseThrow());
  }

  @Test
  void existingFileIsRenderedWithSource() throws IOException {
    Path file = Files.writeString(tempDir.resolve("sqlconf.toml"), "[common]\ndatabase-url-var = \"SHOWN_URL\"\n");

    ExitCode code = ShowCli.run(new String[] {"config=" + file}, loader, NO_ENV);

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.startsWith("# source: " + file), out);
    assertTrue(out.contains("database-url-var"), out);
    assertTrue(out.contains("SHOWN_URL"), out);
    assertTrue(out.contains("migrations-dir"), out);
  }

  @Test
  void malformedFileFailsWithoutPublishing() throws IOException {
    Path file = Files.writeString(tempDir.resolve("sqlconf.toml"), "[macros.preferred-crates]\nnumeric = \"abacus\"\n");

    ExitCode code = ShowCli.run(new String[] {"config=" + file}, loader, NO_ENV);

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(buffer.toString().startsWith("FAIL error parsing config file"), buffer.toString());
    assertTrue(loader.cached().isEmpty());
  }

  @Test
  void unsetProjectDirectoryIsConfigError() {
    ExitCode code = ShowCli.run(new String[0], loader, NO_ENV);

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void invalidArgumentPrintsUsage() {
    ExitCode code = ShowCli.run(new String[] {"config="}, loader, NO_ENV);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: show"));
  }
}
