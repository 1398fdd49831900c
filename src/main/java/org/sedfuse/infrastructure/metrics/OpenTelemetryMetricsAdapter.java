package org.sedfuse.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.sedfuse.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards SEDFUSE counters and histograms to OpenTelemetry.
 *
 * <p>Per-catalog keys ({@code sed.catalog.<catalog>.<outcome>}) are folded into one instrument per outcome
 * ({@code sed.catalog.<outcome>}) tagged with a {@value #CATALOG_ATTRIBUTE_NAME} attribute. Histograms whose key
 * ends in {@code Millis} are recorded with unit {@code ms}.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final String CATALOG_ATTRIBUTE_NAME = "sed.catalog";
  private static final AttributeKey<String> CATALOG_ATTRIBUTE = AttributeKey.stringKey(CATALOG_ATTRIBUTE_NAME);
  private static final String CATALOG_PREFIX = "sed.catalog.";
  private static final String FALLBACK_METRIC_NAME = "sed.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected through system properties or the environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"),
        this::createCounter);
    instrument.instrument().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"),
        this::createHistogram);
    instrument.instrument().record(value, instrument.attributes());
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    MetricName name = MetricName.of(key);
    LongCounter counter = meter.counterBuilder(name.instrument())
        .setUnit("1")
        .setDescription("SEDFUSE counter " + name.instrument())
        .build();
    return new Instrument<>(counter, name.attributes());
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    MetricName name = MetricName.of(key);
    LongHistogram histogram = meter.histogramBuilder(name.instrument())
        .ofLongs()
        .setUnit(key.endsWith("Millis") ? "ms" : "1")
        .setDescription("SEDFUSE observation " + name.instrument())
        .build();
    return new Instrument<>(histogram, name.attributes());
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}

  /** Instrument name and attributes derived from a dotted metric key. */
  record MetricName(String instrument, Attributes attributes) {
    static MetricName of(String key) {
      if (key.startsWith(CATALOG_PREFIX)) {
        String rest = key.substring(CATALOG_PREFIX.length());
        int dot = rest.lastIndexOf('.');
        if (dot > 0 && dot < rest.length() - 1) {
          return new MetricName(sanitize(CATALOG_PREFIX + rest.substring(dot + 1)),
              Attributes.of(CATALOG_ATTRIBUTE, rest.substring(0, dot)));
        }
      }
      String sanitized = sanitize(key);
      if (!sanitized.equals(key)) {
        log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
      }
      return new MetricName(sanitized, Attributes.empty());
    }

    static String sanitize(String key) {
      if (key == null || key.isBlank()) {
        return FALLBACK_METRIC_NAME;
      }
      String trimmed = key.trim();
      StringBuilder result = new StringBuilder(trimmed.length() + 1);
      if (!Character.isLetter(trimmed.charAt(0))) {
        result.append('m');
      }
      for (int i = 0; i < trimmed.length(); i++) {
        char c = trimmed.charAt(i);
        if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
          result.append(c);
        } else {
          result.append('_');
        }
      }
      return result.toString().toLowerCase(Locale.ROOT);
    }
  }
}
