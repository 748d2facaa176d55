package io.statebridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final List<String> PROPERTIES = List.of(
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes");

  private final Map<String, String> previous = new HashMap<>();

  TelemetryConfiguratorTest() {
    for (String property : PROPERTIES) {
      previous.put(property, System.getProperty(property));
    }
  }

  @AfterEach
  void restore() {
    for (String property : PROPERTIES) {
      String value = previous.get(property);
      if (value == null) {
        System.clearProperty(property);
      } else {
        System.setProperty(property, value);
      }
    }
  }

  @Test
  void consumesTelemetryArguments() {
    Map<String, String> args = new HashMap<>(Map.of(
        "config", "bridge.yaml",
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "site=home"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals(Map.of("config", "bridge.yaml"), args);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("site=home", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void rejectsInvalidEndpoint() {
    Map<String, String> args = new HashMap<>(Map.of("otelEndpoint", "ftp://collector"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(args));
    assertTrue(ex.getMessage().contains("http"));
  }
}
