package org.sedfuse.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.sedfuse.config.YamlConfigLoader;

/**
 * Helpers shared by the subcommands for mixing CLI flags with YAML and map based settings.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code config} (or {@code --config}) from the CLI settings so it is not merged as a run setting.
   *
   * @return the YAML path, or {@code null} when none was given
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return null;
    }
    String plain = args.remove("config");
    String dashed = args.remove("--config");
    String chosen = plain != null ? plain : dashed;
    return chosen == null || chosen.isBlank() ? null : chosen.trim();
  }

  /**
   * Loads the YAML file named by {@code configPath} for {@code mode}.
   *
   * @throws IllegalArgumentException when the file is missing or malformed
   * @throws IOException when the file cannot be read
   */
  static Optional<Map<String, String>> loadYaml(String configPath, String mode) throws IOException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
    }
    return YamlConfigLoader.load(yamlPath, mode);
  }

  /**
   * Reads a boolean switch such as {@code dryRun} from merged settings; absent or blank means {@code false}.
   */
  static boolean parseBoolean(Map<String, String> settings, String key) {
    String value = settings == null ? null : settings.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
