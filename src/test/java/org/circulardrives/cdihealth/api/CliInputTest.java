package org.circulardrives.cdihealth.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void normalizesFlagAliases() {
    CliInput input = CliInput.parse(new String[] {"-h", "--DEBUG", "-q", "--Dry-Run", "workers=2"});

    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.quiet());
    assertTrue(input.hasFlag("--dry-run"));
    assertArrayEquals(new String[] {"workers=2"}, input.keyValueArgs());
  }

  @Test
  void dashedTokenWithEqualsStaysKeyValue() {
    CliInput input = CliInput.parse(new String[] {"--workers=2"});

    assertTrue(input.flags().isEmpty());
    assertArrayEquals(new String[] {"--workers=2"}, input.keyValueArgs());
  }

  @Test
  void emptyInputHasNoFlags() {
    CliInput input = CliInput.parse(null);

    assertFalse(input.help());
    assertFalse(input.hasFlag(" "));
    assertArrayEquals(new String[0], input.keyValueArgs());
  }
}
