package io.statebridge.adapter.kafka;

import io.statebridge.application.port.TopicPublisher;
import io.statebridge.config.BrokerSettings;
import io.statebridge.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka adapter for {@link TopicPublisher} that sends each payload as one record.
 * <p>A single {@link Producer} serves every topic. Sends are asynchronous; the returned future
 * completes from the producer callback. Instances are thread-safe when the supplied producer is
 * thread-safe (the default {@link KafkaProducer} is).</p>
 *
 * @implNote Invoke {@link #close()} to flush buffered records before shutting down the pipeline.
 * @since 0.1.0
 */
public final class KafkaTopicPublisher implements TopicPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaTopicPublisher.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Producer<String, byte[]> producer;

  /**
   * Creates a publisher backed by a new {@link KafkaProducer}.
   *
   * @param broker broker connection settings
   */
  public KafkaTopicPublisher(BrokerSettings broker) {
    this(new KafkaProducer<>(KafkaClientProperties.producer(broker)));
    log.info("Kafka producer connected to {}", broker);
  }

  KafkaTopicPublisher(Producer<String, byte[]> producer) {
    this.producer = Objects.requireNonNull(producer, "producer");
  }

  /**
   * Enqueues the payload for asynchronous delivery.
   *
   * @param topic destination topic
   * @param key record key (entity id)
   * @param payload serialized state
   * @return future completed on broker acknowledgment or failure
   */
  @Override
  public CompletableFuture<Void> publish(String topic, String key, byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    String sanitized = Strings.sanitizeTopic(topic);
    CompletableFuture<Void> delivery = new CompletableFuture<>();
    producer.send(new ProducerRecord<>(sanitized, key, payload), (metadata, exception) -> {
      if (exception != null) {
        delivery.completeExceptionally(exception);
      } else {
        delivery.complete(null);
      }
    });
    return delivery;
  }

  /**
   * Flushes pending Kafka records and closes the producer.
   *
   * @implNote Waits up to five seconds for in-flight send operations to complete.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(CLOSE_TIMEOUT);
  }
}
