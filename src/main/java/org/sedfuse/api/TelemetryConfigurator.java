package org.sedfuse.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.sedfuse.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies the metrics settings into the system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_KEY = "metricsExporter";
  static final String ENDPOINT_KEY = "otelEndpoint";
  static final String RESOURCE_ATTRIBUTES_KEY = "otelResourceAttributes";

  private TelemetryConfigurator() {}

  /**
   * Validates and publishes the metrics settings found in {@code settings}.
   *
   * @param settings merged settings; left unmodified
   * @return exporter name in effect ({@code otlp} or {@code none})
   * @throws IllegalArgumentException when a metrics setting is malformed
   */
  static String configureMetrics(Map<String, String> settings) {
    String exporter = trimmed(settings, EXPORTER_KEY);
    String normalized = exporter.isEmpty() ? "none" : exporter.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException(EXPORTER_KEY + " must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", normalized);

    String endpoint = trimmed(settings, ENDPOINT_KEY);
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    } else if (normalized.equals("otlp")) {
      log.info("No {} configured; the OTLP exporter uses its default endpoint", ENDPOINT_KEY);
    }

    String attributes = trimmed(settings, RESOURCE_ATTRIBUTES_KEY);
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii(RESOURCE_ATTRIBUTES_KEY, attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
    log.debug("Metrics exporter {} (endpoint={}, resource attributes set={})",
        normalized, endpoint.isEmpty() ? "<default>" : endpoint, !attributes.isEmpty());
    return normalized;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(ENDPOINT_KEY + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(ENDPOINT_KEY + " must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(ENDPOINT_KEY + " must be a valid URI", ex);
    }
  }

  private static String trimmed(Map<String, String> settings, String key) {
    String value = settings == null ? null : settings.get(key);
    return value == null ? "" : value.trim();
  }
}
