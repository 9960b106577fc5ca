package ca.gc.cra.sqlconf.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void nullBecomesPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void shortValueIsReturnedUnchanged() {
    String toml = "[common]\ndatabase-url-var = \"X\"\n";
    assertEquals(toml, Logs.truncate(toml, 4096));
  }

  @Test
  void longValueIsCutAndAnnotated() {
    String result = Logs.truncate("abcdefghij", 4);

    assertEquals("abcd... (truncated, 4 of 10 bytes)", result);
  }

  @Test
  void multiByteCharacterIsNotSplit() {
    // "é" is two bytes in UTF-8; a four byte limit cuts through the second one.
    String result = Logs.truncate("aéé", 4);

    assertTrue(result.startsWith("aé... (truncated"), result);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
