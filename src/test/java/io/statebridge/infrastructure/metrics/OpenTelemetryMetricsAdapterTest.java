package io.statebridge.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("statebridge.metric.key");

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

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("bridge.publish.ok");
    adapter.increment("bridge.publish.ok");
    adapter.increment("bridge.publish.ok");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "bridge.publish.ok");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("bridge.publish.ok", point.getAttributes().get(METRIC_KEY));

    assertEquals("statebridge", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    String version = counter.getResource().getAttribute(AttributeKey.stringKey("service.version"));
    assertTrue(version != null && !version.isBlank(), "Service version should be provided");
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("bridge.serialize.bytes", 100);
    adapter.observe("bridge.serialize.bytes", 300);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "bridge.serialize.bytes");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(400.0, point.getSum(), 0.0001);
    assertEquals("bridge.serialize.bytes", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizesMetricNames() {
    assertEquals("bridge.events.received", OpenTelemetryMetricsAdapter.sanitizeName("bridge.events.received"));
    assertEquals("bridge.dispatch.latencynanos",
        OpenTelemetryMetricsAdapter.sanitizeName("bridge.dispatch.latencyNanos"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b_c", OpenTelemetryMetricsAdapter.sanitizeName("a b/c"));
    assertEquals("statebridge.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void noopBootstrapIgnoresRecording() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop());
    assertDoesNotThrow(() -> {
      noop.increment("bridge.publish.ok");
      noop.observe("bridge.serialize.bytes", 10);
      noop.forceFlush();
      noop.close();
    });
  }

  @Test
  void exporterNoneDisablesExport() {
    String previous = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");
    try {
      OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
      assertTrue(result.isNoop());
      result.close();
    } finally {
      if (previous == null) {
        System.clearProperty("otel.metrics.exporter");
      } else {
        System.setProperty("otel.metrics.exporter", previous);
      }
    }
  }

  @Test
  void parsesResourceAttributes() {
    var attributes = OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=lab, bad, =x,site=home");
    assertEquals(2, attributes.size());
    assertEquals("lab", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("home", attributes.get(AttributeKey.stringKey("site")));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}
