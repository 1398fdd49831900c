package org.sedfuse.application.parse;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Turns one input line into named raw field values using an {@link InputGrammar}.
 *
 * <p>Blank lines, lines starting with {@code #}, and lines that do not match the grammar as a whole yield
 * {@link Optional#empty()}. Only fields whose matched text is non-empty appear in the result.</p>
 *
 * @since 0.1.0
 */
public final class InputLineParser {
  private final InputGrammar grammar;

  public InputLineParser(InputGrammar grammar) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
  }

  /**
   * Parses one line.
   *
   * @param line raw input line; {@code null} is treated as blank
   * @return field name to raw value in grammar order, or empty for skipped or malformed lines
   */
  public Optional<Map<String, String>> parse(String line) {
    if (isIgnorable(line)) {
      return Optional.empty();
    }
    Matcher matcher = grammar.compiled().matcher(line);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(grammar.extract(matcher));
  }

  /**
   * Indicates whether a line is blank or a {@code #} comment.
   *
   * @param line raw input line
   * @return {@code true} when the line carries no source
   */
  public static boolean isIgnorable(String line) {
    if (line == null) {
      return true;
    }
    String trimmed = line.strip();
    return trimmed.isEmpty() || trimmed.startsWith("#");
  }

  public InputGrammar grammar() {
    return grammar;
  }
}
