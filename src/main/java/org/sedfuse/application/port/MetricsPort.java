package org.sedfuse.application.port;

/**
 * <strong>What:</strong> Port abstracting SEDFUSE metrics emission.
 * <p><strong>Why:</strong> Lets the fusion pipeline count lines, sources and catalog outcomes without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code sed.catalog.survey_a.failed}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code sed.lines.skipped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., milliseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
