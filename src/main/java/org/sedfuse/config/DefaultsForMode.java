package org.sedfuse.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.sedfuse.application.normalize.ExtinctionMapNormalizer;
import org.sedfuse.application.normalize.PositionMatcher;
import org.sedfuse.application.normalize.SedRowFilter;
import org.sedfuse.application.output.OutputTemplate;
import org.sedfuse.application.parse.InputGrammar;

/**
 * Embedded defaults per CLI mode, expressed as the flat key/value map the config merger consumes.
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode}.
   *
   * @param mode CLI mode such as {@code fuse}
   * @return immutable defaults map
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "fuse" -> buildFuseDefaults();
      case "template" -> buildTemplateDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("fields", String.join(",", InputGrammar.DEFAULT_FIELDS));
    map.put("template", OutputTemplate.DEFAULT_TEMPLATE);
    return Map.copyOf(map);
  }

  private static Map<String, String> buildFuseDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("snapshots", "snapshots");
    map.put("out", "sedfuse-out");
    map.put("resultFile", FuseConfig.DEFAULT_RESULT_FILE);
    map.put("plot", "true");
    map.put("requestDelayMillis", Long.toString(FuseConfig.DEFAULT_REQUEST_DELAY_MILLIS));
    map.put("toleranceArcsec", Double.toString(PositionMatcher.DEFAULT_TOLERANCE_ARCSEC));
    map.put("sed.deniedRefcodes", String.join(",", SedRowFilter.DEFAULT_DENIED_REFCODES));
    map.put("reddeningColumns", String.join(",", ExtinctionMapNormalizer.DEFAULT_COLUMNS));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildTemplateDefaults() {
    return new LinkedHashMap<>();
  }
}
