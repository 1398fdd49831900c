package org.sedfuse.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"in=a.txt", "--DRY-RUN", " ", null, "-v", "out=res"});

    assertArrayEquals(new String[] {"in=a.txt", "out=res"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesAreRecognised() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertFalse(CliInput.parse(null).help());
  }

  @Test
  void unsupportedFlagsExcludeHelpAndVerbose() {
    CliInput input = CliInput.parse(new String[] {"--help", "--debug", "--allow-overwrite", "--fast"});
    assertEquals(List.of("--fast"), input.unsupportedFlags(Set.of("--allow-overwrite")));
  }

  @Test
  void dashedArgumentsWithEqualsStayKeyValues() {
    CliInput input = CliInput.parse(new String[] {"--config=x.yaml"});
    assertArrayEquals(new String[] {"--config=x.yaml"}, input.keyValueArgs());
  }
}
