package org.sedfuse.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void lookupDecidesExporterWithoutSystemProperties() {
    OpenTelemetryBootstrap.BootstrapResult result =
        OpenTelemetryBootstrap.initialize(name -> name.equals("otel.metrics.exporter") ? "zipkin" : null);
    assertTrue(result.isNoop());
    result.forceFlush();
    result.close();
  }

  @Test
  void unknownExporterDisablesMetrics() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=test, broken, =x, team = astro");
    assertEquals(2, attributes.size());
    assertEquals("test", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("astro", attributes.get(AttributeKey.stringKey("team")));
  }
}
