package org.sedfuse.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: sedfuse <fuse|template> [options]"));
  }

  @Test
  void helpFlagOrCommandPrintsHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void dispatchesWithAllRemainingArguments() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"template", "template={name}"}));
    assertTrue(buffer.toString().contains("Template valid."));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"FUSE", "--help"}));
    assertTrue(buffer.toString().contains("sedfuse fuse"));
  }
}
