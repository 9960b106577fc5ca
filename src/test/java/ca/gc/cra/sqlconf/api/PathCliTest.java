package ca.gc.cra.sqlconf.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void reportsExistingProjectFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("sqlconf.toml"), "");
    Map<String, String> env = Map.of("SQLCONF_PROJECT_DIR", tempDir.toString());

    ExitCode code = PathCli.run(new String[0], env::get);

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(file.toAbsolutePath().normalize() + " (exists)", buffer.toString().strip());
  }

  @Test
  void reportsMissingLiteralFile() {
    Path missing = tempDir.resolve("other.toml");

    ExitCode code = PathCli.run(new String[] {"config=" + missing}, Map.<String, String>of()::get);

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(missing.toAbsolutePath().normalize() + " (missing)", buffer.toString().strip());
  }

  @Test
  void unsetProjectDirectoryIsConfigError() {
    ExitCode code = PathCli.run(new String[0], Map.<String, String>of()::get);

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void unknownArgumentIsInvalid() {
    ExitCode code = PathCli.run(new String[] {"dir=x"}, Map.<String, String>of()::get);

    assertEquals(ExitCode.INVALID_ARGS, code);
  }
}
