package org.sedfuse.api;

import java.util.Arrays;
import java.util.Locale;
import org.sedfuse.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * sedfuse command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sedfuse <fuse|template> [options]";
  private static final String HELP_TEXT = """
      sedfuse: spectral energy distribution fusion

      Usage:
        sedfuse <command> [options]

      Commands:
        fuse        Build per-source SEDs from catalog snapshots (fuse --help for details)
        template    Validate an output template and list its fields

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches to a subcommand without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      if (safeArgs[i] != null && !safeArgs[i].isBlank() && !safeArgs[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    CliInput leading = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, Math.max(commandIndex, 0)));
    if (commandIndex < 0) {
      CliInput all = CliInput.parse(safeArgs);
      if (all.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (leading.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safeArgs, commandIndex + 1, delegateArgs, commandIndex, safeArgs.length - commandIndex - 1);

    return switch (command) {
      case "fuse" -> FuseCli.run(delegateArgs);
      case "template" -> TemplateCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
