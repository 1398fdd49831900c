package org.sedfuse.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a YAML settings file and flattens its {@code common} and mode sections into dotted keys.
 *
 * <p>Lists of scalars are joined with commas so that, for example, {@code fields: [lat, lon, name]} becomes
 * {@code fields=lat,lon,name}. Nested mappings become dotted keys ({@code field: {z: {pattern: ...}}} becomes
 * {@code field.z.pattern}). Mode section values override {@code common} ones.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the settings that apply to {@code mode}.
   *
   * @param path YAML file
   * @param mode CLI mode whose section is merged over {@code common}
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or has an unsupported shape
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = mapping(document, "root");
    Map<String, String> settings = new LinkedHashMap<>();
    for (String section : List.of(COMMON_SECTION, mode.trim().toLowerCase(Locale.ROOT))) {
      Object body = section(sections, section);
      if (body != null) {
        flattenInto(settings, "", mapping(body, section));
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Object section(Map<String, Object> sections, String name) {
    return sections.entrySet().stream()
        .filter(entry -> entry.getKey().trim().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " section must be a mapping");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(where + " section has a blank or non-string key");
      }
      copy.put(name.trim(), value);
    });
    return copy;
  }

  private static void flattenInto(Map<String, String> settings, String prefix, Map<String, Object> node) {
    node.forEach((key, value) -> {
      String name = prefix.isEmpty() ? key : prefix + "." + key;
      if (value instanceof Map<?, ?>) {
        flattenInto(settings, name, mapping(value, name));
      } else if (value instanceof List<?> items) {
        settings.put(name, commaList(name, items));
      } else {
        settings.put(name, value == null ? "" : String.valueOf(value));
      }
    });
  }

  private static String commaList(String name, List<?> items) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException("YAML list for key " + name + " must contain only scalars");
      }
      String text = item == null ? "" : String.valueOf(item);
      if (text.indexOf(',') >= 0) {
        throw new IllegalArgumentException("YAML list entries for key " + name + " must not contain commas");
      }
      joined.add(text);
    }
    return joined.toString();
  }
}
