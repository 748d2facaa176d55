package io.statebridge.application.port;

import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Outbound port that hands one serialized payload to one broker topic.
 * <p><strong>Role:</strong> Implemented by the Kafka adapter; owns the broker connection, its
 * reconnection and delivery acknowledgment.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls from dispatch
 * workers. Calls should not block on delivery; completion is reported through the returned
 * future.</p>
 *
 * @since 0.1.0
 */
public interface TopicPublisher extends AutoCloseable {
  /**
   * Submits the payload to the topic.
   *
   * @param topic destination topic; never {@code null}
   * @param key record key (the entity id); may be {@code null}
   * @param payload serialized event; shared between topics and must not be mutated
   * @return future completed when the broker acknowledges, or completed exceptionally on failure
   */
  CompletableFuture<Void> publish(String topic, String key, byte[] payload);

  /**
   * Flushes pending records and releases the broker connection.
   */
  @Override
  default void close() {}
}
