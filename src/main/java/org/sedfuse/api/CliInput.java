package org.sedfuse.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line arguments split into flags and {@code key=value} settings.
 *
 * <p>{@code --help} and {@code --verbose} (with their aliases) are recognised by every command; other
 * {@code -}-prefixed tokens are kept as lower-cased flags for the command to check against the flags it
 * supports.</p>
 *
 * @param settings {@code key=value} tokens in argument order
 * @param flags canonical lower-case flags
 */
public record CliInput(List<String> settings, Set<String> flags) {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";

  private static final Map<String, String> ALIASES = Map.of(
      "-h", HELP,
      "help", HELP,
      "-v", VERBOSE,
      "--debug", VERBOSE);

  public CliInput {
    settings = List.copyOf(settings);
    flags = Collections.unmodifiableSet(new LinkedHashSet<>(flags));
  }

  /**
   * Parses raw arguments; {@code null} and blank tokens are dropped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String token = raw == null ? "" : raw.trim();
        if (token.isEmpty()) {
          continue;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        String canonical = ALIASES.getOrDefault(lower, lower);
        if (canonical.equals(HELP) || (token.startsWith("-") && token.indexOf('=') < 0)) {
          flags.add(canonical);
        } else {
          settings.add(token);
        }
      }
    }
    return new CliInput(settings, flags);
  }

  /**
   * Returns the {@code key=value} tokens for {@link CliArgsParser}.
   *
   * @return fresh array in argument order
   */
  public String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains(HELP);
  }

  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  /**
   * Tells whether a flag was given, ignoring case.
   *
   * @param flag flag such as {@code --dry-run}
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Lists given flags that the command does not understand; help and verbose are always understood.
   *
   * @param supported flags the command accepts
   * @return unknown flags in argument order
   */
  public List<String> unsupportedFlags(Set<String> supported) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!flag.equals(HELP) && !flag.equals(VERBOSE) && !supported.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
