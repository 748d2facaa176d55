/**
 * Offline event sources replaying recorded state-bus traffic.
 * <p><strong>Concurrency:</strong> Sources are polled from a single thread.</p>
 * <p><strong>Metrics:</strong> Malformed input is counted as {@code bridge.source.malformed}.</p>
 *
 * @since 0.1.0
 */
package io.statebridge.infrastructure.source;
