/**
 * OpenTelemetry-backed implementation of the bridge metrics port.
 * <p><strong>Configuration:</strong> {@code otel.*} system properties set by the CLI telemetry
 * options, falling back to {@code OTEL_*} environment variables.</p>
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe from dispatch
 * workers and producer callback threads.</p>
 */
package io.statebridge.infrastructure.metrics;
