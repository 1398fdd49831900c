package org.sedfuse.api;

import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text, dry-run plans, run summaries and template field listings.
 *
 * <p>Kept apart from logging: log lines go to the Logback console appender, while this class writes the text a
 * user asked for. Tests swap the writer to capture it.</p>
 */
public final class CliPrinter {
  private static final PrintWriter CONSOLE = new PrintWriter(
      new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)), true);
  private static volatile PrintWriter captured;

  private CliPrinter() {}

  /**
   * Prints one line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter out = out();
    out.println(message);
    out.flush();
  }

  /**
   * Prints a block of lines, such as a dry-run plan.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(String... lines) {
    if (lines == null || lines.length == 0) {
      return;
    }
    println(String.join(System.lineSeparator(), lines));
  }

  static void setWriterForTesting(PrintWriter writer) {
    captured = writer;
  }

  static void clearTestWriter() {
    captured = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = captured;
    return writer == null ? CONSOLE : writer;
  }
}
