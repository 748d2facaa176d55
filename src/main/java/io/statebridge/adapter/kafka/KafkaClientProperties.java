package io.statebridge.adapter.kafka;

import io.statebridge.config.BrokerSettings;
import io.statebridge.config.SecurityProtocol;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Builds Kafka client properties from {@link BrokerSettings}.
 *
 * @since 0.1.0
 */
public final class KafkaClientProperties {
  private static final String PLAIN_LOGIN_MODULE =
      "org.apache.kafka.common.security.plain.PlainLoginModule";

  private KafkaClientProperties() {}

  /**
   * Producer properties: all-replica acks, short linger and gzip compression.
   *
   * @param broker broker settings
   * @return producer properties with String keys and byte[] values
   */
  public static Properties producer(BrokerSettings broker) {
    Properties props = common(broker);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "gzip");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return props;
  }

  /**
   * Consumer properties for reading the state bus as a member of a stable group.
   *
   * <p>Committed offsets let a restarted bridge resume where it stopped. A group with no committed
   * offset starts at the latest record, so retained history is never replayed.</p>
   *
   * @param broker broker settings
   * @param groupId consumer group id
   * @return consumer properties with String keys and byte[] values
   */
  public static Properties consumer(BrokerSettings broker, String groupId) {
    if (groupId == null || groupId.isBlank()) {
      throw new IllegalArgumentException("groupId must not be blank");
    }
    Properties props = common(broker);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
    return props;
  }

  private static Properties common(BrokerSettings broker) {
    Objects.requireNonNull(broker, "broker");
    Properties props = new Properties();
    props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, broker.bootstrapServers());
    props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, broker.securityProtocol().name());
    if (broker.securityProtocol() == SecurityProtocol.SASL_SSL) {
      props.put(SaslConfigs.SASL_MECHANISM, "PLAIN");
      props.put(SaslConfigs.SASL_JAAS_CONFIG, PLAIN_LOGIN_MODULE + " required username=\""
          + escape(broker.username()) + "\" password=\"" + escape(broker.password()) + "\";");
    }
    return props;
  }

  private static String escape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
