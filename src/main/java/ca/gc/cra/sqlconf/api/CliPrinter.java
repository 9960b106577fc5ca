package ca.gc.cra.sqlconf.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output of the {@code sqlconf} commands.
 *
 * <p>Results go to the stdout file descriptor; logging goes to stderr through Logback, so scripts can capture a
 * rendered configuration without log noise.</p>
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  static void println(String message) {
    PrintWriter writer = override != null ? override : STDOUT;
    writer.println(message);
    writer.flush();
  }

  /**
   * Prints help text or a rendered document, dropping its trailing blank lines.
   *
   * @param block multi-line text
   */
  static void printBlock(String block) {
    println(block.stripTrailing());
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }
}
