package ca.gc.cra.trail.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsPairsAndTrailingArguments() {
    CliInput input = CliInput.parse(new String[] {
        "--Dry-Run", "storeDir=/tmp/s", "-v", "--", "claude", "--print", "{prompt_file}"});

    assertArrayEquals(new String[] {"storeDir=/tmp/s"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertEquals(List.of("claude", "--print", "{prompt_file}"), input.trailingArgs());
  }

  @Test
  void helpAliasesAreRecognized() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
  }

  @Test
  void unknownFlagsExcludeGlobalOnes() {
    CliInput input = CliInput.parse(new String[] {"--verbose", "--help", "--force", "--bogus"});

    assertEquals(List.of("--bogus"), input.unknownFlags(Set.of("--force")));
  }

  @Test
  void keyValueArgsIsDefensiveCopy() {
    CliInput input = CliInput.parse(new String[] {"a=1"});
    input.keyValueArgs()[0] = "changed";

    assertEquals("a=1", input.keyValueArgs()[0]);
  }

  @Test
  void emptyInputHasNothing() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertTrue(input.trailingArgs().isEmpty());
    assertFalse(input.hasFlag(null));
  }
}
