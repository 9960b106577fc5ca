package ca.gc.cra.sqlconf.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesSwitchesFromArguments() {
    CliInput input = CliInput.parse(new String[] {"check", "--VERBOSE", "config=x.toml"});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertArrayEquals(new String[] {"check", "config=x.toml"}, input.arguments());
  }

  @Test
  void helpAliasesAreRecognized() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
  }

  @Test
  void emptyInputHasNoSwitches() {
    CliInput input = CliInput.parse(new String[] {null, " "});

    assertFalse(input.verbose());
    assertFalse(input.help());
    assertArrayEquals(new String[0], input.arguments());
  }

  @Test
  void unknownOptionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> CliInput.parse(new String[] {"show", "--quiet"}));
  }

  @Test
  void argumentsAreCopied() {
    CliInput input = CliInput.parse(new String[] {"config=x.toml"});
    input.arguments()[0] = "changed";

    assertArrayEquals(new String[] {"config=x.toml"}, input.arguments());
  }
}
