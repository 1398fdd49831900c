package org.sedfuse.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.sedfuse.application.normalize.ExtinctionMapNormalizer;
import org.sedfuse.application.normalize.PositionMatcher;
import org.sedfuse.application.normalize.SedRowFilter;
import org.sedfuse.application.output.OutputTemplate;
import org.sedfuse.application.parse.InputGrammar;
import org.sedfuse.validation.Numbers;
import org.sedfuse.validation.Strings;

/**
 * <strong>What:</strong> Immutable settings of one {@code fuse} batch run.
 * <p><strong>Why:</strong> Gathers file locations, the input grammar, the output template and the matching and
 * filtering knobs in one validated value so the composition root can wire a run without re-reading maps.</p>
 * <p><strong>Role:</strong> Configuration aggregate produced from the merged CLI/YAML/default map.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param input source list, one source per line
 * @param snapshots root directory of stored catalog responses
 * @param outputDirectory directory receiving the result file and plot tables
 * @param resultFile result file name inside {@code outputDirectory}
 * @param template output line template
 * @param plot whether plot tables are written
 * @param requestDelayMillis minimum delay between catalog requests
 * @param toleranceArcsec cross-match radius in arcseconds
 * @param fields input grammar field names in order
 * @param fieldPatterns per-field pattern overrides
 * @param deniedRefcodes primary catalog reference codes to reject
 * @param reddeningColumns dust map columns tried in order
 * @since 0.1.0
 */
public record FuseConfig(
    Path input,
    Path snapshots,
    Path outputDirectory,
    String resultFile,
    String template,
    boolean plot,
    long requestDelayMillis,
    double toleranceArcsec,
    List<String> fields,
    Map<String, String> fieldPatterns,
    List<String> deniedRefcodes,
    List<String> reddeningColumns) {

  /** Maximum accepted {@code requestDelayMillis}. */
  public static final long MAX_REQUEST_DELAY_MILLIS = 60_000L;
  /** Default delay between catalog requests. */
  public static final long DEFAULT_REQUEST_DELAY_MILLIS = 1_000L;
  /** Default result file name. */
  public static final String DEFAULT_RESULT_FILE = "sed.dat";

  private static final String FIELD_PATTERN_PREFIX = "field.";
  private static final String FIELD_PATTERN_SUFFIX = ".pattern";

  public FuseConfig {
    input = Objects.requireNonNull(input, "input").normalize();
    snapshots = Objects.requireNonNull(snapshots, "snapshots").normalize();
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").normalize();
    resultFile = Strings.requireNonBlank("resultFile", resultFile);
    if (resultFile.contains("/") || resultFile.contains("\\")) {
      throw new IllegalArgumentException("resultFile must be a file name, not a path");
    }
    template = Objects.requireNonNull(template, "template");
    Numbers.requireRange("requestDelayMillis", requestDelayMillis, 0, MAX_REQUEST_DELAY_MILLIS);
    Numbers.requirePositiveFinite("toleranceArcsec", toleranceArcsec);
    fields = List.copyOf(fields);
    if (fields.isEmpty()) {
      throw new IllegalArgumentException("fields must name at least one input field");
    }
    fieldPatterns = Map.copyOf(fieldPatterns);
    deniedRefcodes = List.copyOf(deniedRefcodes);
    reddeningColumns = List.copyOf(reddeningColumns);
    if (reddeningColumns.isEmpty()) {
      throw new IllegalArgumentException("reddeningColumns must name at least one column");
    }
  }

  /**
   * Builds a configuration from flattened key/value settings.
   *
   * @param options merged settings; {@code in} is required
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing, malformed, or out of range
   */
  public static FuseConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = optional(options, "in");
    if (in == null) {
      throw new IllegalArgumentException("in is required (source list file)");
    }
    String template = options.get("template");
    return new FuseConfig(
        parsePath("in", in),
        parsePath("snapshots", Objects.requireNonNullElse(optional(options, "snapshots"), "snapshots")),
        parsePath("out", Objects.requireNonNullElse(optional(options, "out"), "sedfuse-out")),
        Objects.requireNonNullElse(optional(options, "resultFile"), DEFAULT_RESULT_FILE),
        template == null || template.isBlank() ? OutputTemplate.DEFAULT_TEMPLATE : template,
        parseBoolean("plot", options.get("plot"), true),
        parseLong("requestDelayMillis", options.get("requestDelayMillis"), DEFAULT_REQUEST_DELAY_MILLIS),
        parseDouble("toleranceArcsec", options.get("toleranceArcsec"), PositionMatcher.DEFAULT_TOLERANCE_ARCSEC),
        fieldsOf(options),
        fieldPatternsOf(options),
        parseList(options.get("sed.deniedRefcodes"), SedRowFilter.DEFAULT_DENIED_REFCODES),
        parseList(options.get("reddeningColumns"), ExtinctionMapNormalizer.DEFAULT_COLUMNS));
  }

  /**
   * Reads the input grammar field list.
   *
   * @param options settings map
   * @return {@code fields} as a list, or the default field list when unset
   */
  public static List<String> fieldsOf(Map<String, String> options) {
    return parseList(options.get("fields"), InputGrammar.DEFAULT_FIELDS);
  }

  /**
   * Collects {@code field.<name>.pattern} overrides.
   *
   * @param options settings map
   * @return pattern per field name
   */
  public static Map<String, String> fieldPatternsOf(Map<String, String> options) {
    Map<String, String> patterns = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      if (key.startsWith(FIELD_PATTERN_PREFIX) && key.endsWith(FIELD_PATTERN_SUFFIX)
          && key.length() > FIELD_PATTERN_PREFIX.length() + FIELD_PATTERN_SUFFIX.length()) {
        String field = key.substring(FIELD_PATTERN_PREFIX.length(), key.length() - FIELD_PATTERN_SUFFIX.length());
        patterns.put(field, entry.getValue());
      }
    }
    return patterns;
  }

  /**
   * Returns the configuration with every optional value at its default.
   *
   * @param input source list
   * @return default configuration for {@code input}
   */
  public static FuseConfig defaults(Path input) {
    return fromMap(Map.of("in", input.toString()));
  }

  /**
   * Returns the directory receiving plot tables.
   *
   * @return {@code <out>/plots}
   */
  public Path plotDirectory() {
    return outputDirectory.resolve("plots");
  }

  private static String optional(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static Path parsePath(String name, String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  private static boolean parseBoolean(String name, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was '" + raw + "')");
    };
  }

  private static long parseLong(String name, String raw, long defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static double parseDouble(String name, String raw, double defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a number (was '" + raw + "')", ex);
    }
  }

  private static List<String> parseList(String raw, List<String> defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    List<String> values = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        values.add(trimmed);
      }
    }
    return values.isEmpty() ? defaultValue : values;
  }
}
