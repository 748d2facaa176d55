package io.statebridge.application.port;

/**
 * <strong>What:</strong> Port abstracting bridge metrics emission.
 * <p><strong>Why:</strong> Lets the dispatcher and pipeline count events and publish outcomes without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Outbound port implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from dispatch
 * workers and producer callback threads.</p>
 *
 * @implNote Metric keys use dotted names such as {@code bridge.publish.failed}; adapters may
 * normalize them.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
