package org.sedfuse.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.sedfuse.validation.Strings;

/**
 * Turns {@code key=value} CLI arguments into a settings map.
 *
 * <p>Keys use the same dotted names as the YAML file ({@code field.z.pattern}, {@code sed.deniedRefcodes}); a
 * key given twice is rejected rather than silently overwritten. Values keep inner whitespace so templates such as
 * {@code template={name} {z:%.3f}} survive as one argument.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern SETTING_NAME = Pattern.compile("[A-Za-z0-9._-]+");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException for malformed, repeated, or control-character arguments
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      Setting setting = split(raw.trim());
      if (settings.putIfAbsent(setting.name(), setting.value()) != null) {
        throw new IllegalArgumentException("argument " + setting.name() + " given more than once");
      }
    }
    return settings;
  }

  private static Setting split(String arg) {
    int eq = arg.indexOf('=');
    String name = eq < 0 ? "" : arg.substring(0, eq).trim();
    String value = eq < 0 ? "" : arg.substring(eq + 1).trim();
    if (name.isEmpty() || value.isEmpty()) {
      throw new IllegalArgumentException("argument must be key=value (was '" + arg + "')");
    }
    if (!SETTING_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + Strings.toFileToken(name));
    }
    // requireNonBlank rejects control characters, including NUL
    return new Setting(name, Strings.requireNonBlank("argument " + name, value));
  }

  private record Setting(String name, String value) {}
}
