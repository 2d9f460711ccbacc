package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"--verbose", "dir=.", "--HELP", " "});

    assertTrue(input.verbose());
    assertTrue(input.help());
    assertArrayEquals(new String[] {"dir=."}, input.keyValueArgs());
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertFalse(input.help());
    assertFalse(input.verbose());
    assertEquals(0, input.keyValueArgs().length);
  }

  @Test
  void unknownFlagIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> CliInput.parse(new String[] {"--dry-run"}));
  }
}
