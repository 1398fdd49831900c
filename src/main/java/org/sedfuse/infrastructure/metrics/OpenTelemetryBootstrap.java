package org.sedfuse.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for a batch run.
 *
 * <p>Each setting is read from a system property ({@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint},
 * {@code otel.resource.attributes}) and then from the matching {@code OTEL_*} environment variable. The exporter is
 * {@code none} unless configured. A batch run is short, so the reader exports every ten seconds and the adapter
 * flushes once more on close.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "org.sedfuse";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final String FALLBACK_VERSION = "dev";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
  private static final Attributes SERVICE = Attributes.of(
      AttributeKey.stringKey("service.name"), "sedfuse",
      AttributeKey.stringKey("service.namespace"), "org.sedfuse");

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    return initialize(OpenTelemetryBootstrap::propertyOrEnvironment);
  }

  /**
   * Builds the provider from settings resolved through {@code lookup}.
   *
   * @param lookup maps a system property name to its configured value, or {@code null}
   * @return active result, or a noop result when disabled or misconfigured
   */
  static BootstrapResult initialize(UnaryOperator<String> lookup) {
    ExporterMode mode = ExporterMode.from(lookup.apply("otel.metrics.exporter"));
    if (mode == ExporterMode.NONE) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    String endpoint = Objects.requireNonNullElse(lookup.apply("otel.exporter.otlp.endpoint"), DEFAULT_ENDPOINT);
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      BootstrapResult result = build(reader, parseResourceAttributes(lookup.apply("otel.resource.attributes")));
      log.info("OpenTelemetry metrics exporting via OTLP to {}", endpoint);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics for {}; using noop adapter", endpoint, ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes resourceAttributes) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(SERVICE.toBuilder().put("service.version", version).build()))
        .merge(Resource.create(resourceAttributes));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(
        provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  /**
   * Parses {@code key=value} pairs separated by commas; malformed entries are logged and skipped.
   *
   * @param raw attribute list, may be {@code null}
   * @return parsed attributes
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String[] pair = entry.split("=", 2);
      String key = pair[0].trim();
      String value = pair.length == 2 ? pair[1].trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Ignoring malformed resource attribute entry: {}", entry.trim());
        }
        continue;
      }
      builder.put(key, value);
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? FALLBACK_VERSION : version;
  }

  private static String propertyOrEnvironment(String property) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(property.toUpperCase(Locale.ROOT).replace('.', '_'));
    }
    return value == null || value.isBlank() ? null : value.trim();
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("otlp")) {
        return OTLP;
      }
      if (!normalized.isEmpty() && !normalized.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
      }
      return NONE;
    }
  }

  /** Meter plus the provider that owns it; the provider is {@code null} for the noop result. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode pending, String step) {
      if (!pending.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry metrics {} did not complete within {}s", step, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
