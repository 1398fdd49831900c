package org.sedfuse.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges embedded defaults, YAML settings, and CLI arguments; later sources win.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings map.
   *
   * @param mode CLI mode being configured
   * @param yaml flattened YAML settings, if a file was given
   * @param cli CLI key/value arguments
   * @param defaults embedded defaults
   * @param warn sink for override warnings; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("fuse".equalsIgnoreCase(mode)) {
      String plot = effective.get("plot");
      if (plot != null && !plot.isBlank() && !plot.trim().equalsIgnoreCase("true")
          && !plot.trim().equalsIgnoreCase("false")) {
        throw new IllegalArgumentException("plot must be true or false");
      }
    }
    for (String key : effective.keySet()) {
      if (key.startsWith("field.") && !key.endsWith(".pattern")) {
        throw new IllegalArgumentException("Unsupported field setting: " + key + " (expected field.<name>.pattern)");
      }
    }
  }
}
