package io.statebridge.application.dispatch;

/**
 * Per-topic outcome of filter evaluation for one entity.
 *
 * @param topic topic name
 * @param matched {@code true} when the event should be published to the topic
 */
public record TopicDecision(String topic, boolean matched) {}
