package org.sedfuse.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> CATALOG =
      AttributeKey.stringKey(OpenTelemetryMetricsAdapter.CATALOG_ATTRIBUTE_NAME);

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }

  @Test
  void catalogOutcomesShareOneInstrumentTaggedByCatalog() {
    adapter.increment("sed.catalog.survey_a.failed");
    adapter.increment("sed.catalog.survey_a.failed");
    adapter.increment("sed.catalog.uv_survey.failed");
    adapter.forceFlush();

    MetricData failed = metric("sed.catalog.failed");
    assertEquals(MetricDataType.LONG_SUM, failed.getType());
    Map<String, Long> byCatalog = failed.getLongSumData().getPoints().stream()
        .collect(Collectors.toMap(point -> point.getAttributes().get(CATALOG), LongPointData::getValue));
    assertEquals(Map.of("survey_a", 2L, "uv_survey", 1L), byCatalog);

    assertEquals("sedfuse", failed.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("org.sedfuse", failed.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void plainCountersCarryNoAttributes() {
    adapter.increment("sed.lines.skipped");
    adapter.forceFlush();

    LongPointData point = metric("sed.lines.skipped").getLongSumData().getPoints().iterator().next();
    assertEquals(1L, point.getValue());
    assertTrue(point.getAttributes().isEmpty());
  }

  @Test
  void latencyObservationsAreMillisecondHistograms() {
    adapter.observe("sed.source.latencyMillis", 10L);
    adapter.observe("sed.source.latencyMillis", 30L);
    adapter.forceFlush();

    MetricData histogram = metric("sed.source.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40.0, point.getSum());
  }

  @Test
  void sanitizesUnusualKeys() {
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.MetricName.sanitize("9lives"));
    assertEquals("sed.a_b", OpenTelemetryMetricsAdapter.MetricName.sanitize("sed.a b"));
    assertEquals("sed.metric", OpenTelemetryMetricsAdapter.MetricName.sanitize(" "));
    assertEquals("sed.catalog.", OpenTelemetryMetricsAdapter.MetricName.of("sed.catalog.").instrument());
  }
}
