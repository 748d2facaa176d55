package io.statebridge.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromArguments() {
    CliInput input = CliInput.parse(new String[] {"run", "--VERBOSE", "config=a.yaml", "--dry-run"});

    assertArrayEquals(new String[] {"run", "config=a.yaml"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertEquals(Set.of("--dry-run"), input.unknownFlags());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).unknownFlags().isEmpty());
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);
    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.hasFlag(" "));
  }
}
