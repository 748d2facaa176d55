/**
 * Per-event routing: effective filter resolution, topic decisions and fan-out to the publisher.
 * <p><strong>Metrics:</strong> Emits {@code bridge.events.*}, {@code bridge.topic.matched},
 * {@code bridge.publish.*}, {@code bridge.serialize.bytes} and {@code bridge.dispatch.latencyNanos}.</p>
 */
package io.statebridge.application.dispatch;
