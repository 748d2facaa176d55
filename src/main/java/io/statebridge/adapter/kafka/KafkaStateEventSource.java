package io.statebridge.adapter.kafka;

import io.statebridge.application.port.MetricsPort;
import io.statebridge.application.port.StateEventSource;
import io.statebridge.config.BrokerSettings;
import io.statebridge.domain.entity.StateChangeEvent;
import io.statebridge.infrastructure.serialization.StateEventJsonReader;
import io.statebridge.validation.Strings;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link StateEventSource} that consumes state-change records from a Kafka
 * state-bus topic.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Subscribe to the bus topic as a member of the configured consumer group.</li>
 *   <li>Decode JSON records; malformed records are logged, counted and skipped.</li>
 *   <li>Close the consumer cleanly during shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one consumer per source.</p>
 *
 * @since 0.1.0
 */
public final class KafkaStateEventSource implements StateEventSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaStateEventSource.class);
  private static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);

  private final Consumer<String, byte[]> consumer;
  private final String topic;
  private final Duration pollTimeout;
  private final StateEventJsonReader reader = new StateEventJsonReader();
  private final MetricsPort metrics;
  private final Deque<ConsumerRecord<String, byte[]>> buffered = new ArrayDeque<>();
  private boolean subscribed;

  /**
   * Creates a source reading from the state-bus topic.
   *
   * @param broker broker connection settings
   * @param topic state-bus topic
   * @param groupId consumer group id
   * @param metrics metrics sink
   */
  public KafkaStateEventSource(BrokerSettings broker, String topic, String groupId, MetricsPort metrics) {
    this(new KafkaConsumer<>(KafkaClientProperties.consumer(broker, groupId)),
        topic, DEFAULT_POLL_TIMEOUT, metrics);
  }

  KafkaStateEventSource(
      Consumer<String, byte[]> consumer, String topic, Duration pollTimeout, MetricsPort metrics) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.topic = Strings.sanitizeTopic(topic);
    this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void start() {
    if (subscribed) {
      return;
    }
    consumer.subscribe(List.of(topic));
    subscribed = true;
    log.info("Subscribed to state-bus topic {}", topic);
  }

  @Override
  public Optional<StateChangeEvent> poll() {
    if (!subscribed) {
      throw new IllegalStateException("source not started");
    }
    if (buffered.isEmpty()) {
      ConsumerRecords<String, byte[]> records = consumer.poll(pollTimeout);
      for (ConsumerRecord<String, byte[]> record : records) {
        buffered.add(record);
      }
    }
    ConsumerRecord<String, byte[]> record;
    while ((record = buffered.poll()) != null) {
      if (record.value() == null) {
        // tombstone
        continue;
      }
      try {
        return Optional.of(reader.read(record.value()));
      } catch (IllegalArgumentException ex) {
        metrics.increment("bridge.source.malformed");
        log.warn("Skipping malformed record {}-{}@{}: {}",
            record.topic(), record.partition(), record.offset(), ex.getMessage());
      }
    }
    return Optional.empty();
  }

  /**
   * Closes the underlying Kafka consumer.
   *
   * <p>Waits up to five seconds for the consumer to close cleanly.</p>
   */
  @Override
  public void close() {
    buffered.clear();
    consumer.close(Duration.ofSeconds(5));
  }
}
