package io.statebridge.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.statebridge.application.port.MetricsPort;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards bridge counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key and cached; each carries the raw key as the
 * {@code statebridge.metric.key} attribute.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("statebridge.metric.key");
  private static final String FALLBACK_METRIC_NAME = "statebridge.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final boolean noop;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.noop = bootstrap.isNoop();
    if (noop) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    Instrument<LongCounter> instrument = counters.computeIfAbsent(key, k -> new Instrument<>(
        meter.counterBuilder(sanitizeName(k)).setUnit("1").setDescription("Bridge counter for " + k).build(),
        Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.handle().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(key, k -> new Instrument<>(
        meter.histogramBuilder(sanitizeName(k)).ofLongs().setDescription("Bridge observation for " + k).build(),
        Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.handle().record(value, instrument.attributes());
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Instrument<T>(T handle, Attributes attributes) {}
}
