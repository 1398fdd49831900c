package org.sedfuse.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void publishesValidSettings() {
    String exporter = TelemetryConfigurator.configureMetrics(Map.of(
        TelemetryConfigurator.EXPORTER_KEY, "OTLP",
        TelemetryConfigurator.ENDPOINT_KEY, "http://collector:4317",
        TelemetryConfigurator.RESOURCE_ATTRIBUTES_KEY, "env=test"));

    assertEquals("otlp", exporter);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("env=test", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void exporterDefaultsToNone() {
    assertEquals("none", TelemetryConfigurator.configureMetrics(Map.of()));
  }

  @Test
  void rejectsMalformedSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of(TelemetryConfigurator.EXPORTER_KEY, "zipkin")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of(TelemetryConfigurator.ENDPOINT_KEY, "ftp://host")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of(TelemetryConfigurator.ENDPOINT_KEY, "http://")));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(
        Map.of(TelemetryConfigurator.RESOURCE_ATTRIBUTES_KEY, "env=tést")));
  }
}
