package io.statebridge.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.statebridge.config.BrokerSettings;
import io.statebridge.config.SecurityProtocol;
import java.util.Properties;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.junit.jupiter.api.Test;

class KafkaClientPropertiesTest {

  @Test
  void producerUsesAcknowledgedByteArrayRecords() {
    Properties props = KafkaClientProperties.producer(
        new BrokerSettings("192.168.1.10", 9092, SecurityProtocol.PLAINTEXT, null, null));

    assertEquals("192.168.1.10:9092", props.get(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG));
    assertEquals("PLAINTEXT", props.get(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG));
    assertEquals("all", props.get(ProducerConfig.ACKS_CONFIG));
    assertEquals(ByteArraySerializer.class.getName(), props.get(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG));
    assertFalse(props.containsKey(SaslConfigs.SASL_JAAS_CONFIG));
  }

  @Test
  void saslSslAddsPlainLogin() {
    Properties props = KafkaClientProperties.producer(
        new BrokerSettings("broker.lan", 9093, SecurityProtocol.SASL_SSL, "bridge", "pa\"ss"));

    assertEquals("SASL_SSL", props.get(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG));
    assertEquals("PLAIN", props.get(SaslConfigs.SASL_MECHANISM));
    assertEquals("org.apache.kafka.common.security.plain.PlainLoginModule required "
        + "username=\"bridge\" password=\"pa\\\"ss\";", props.get(SaslConfigs.SASL_JAAS_CONFIG));
  }

  @Test
  void restartedConsumerRejoinsSameGroupAtLiveEnd() {
    BrokerSettings broker = new BrokerSettings("broker.lan", 9092, SecurityProtocol.PLAINTEXT, null, null);
    Properties first = KafkaClientProperties.consumer(broker, "statebridge");
    Properties restarted = KafkaClientProperties.consumer(broker, "statebridge");

    assertEquals("statebridge", first.get(ConsumerConfig.GROUP_ID_CONFIG));
    assertEquals(first.get(ConsumerConfig.GROUP_ID_CONFIG), restarted.get(ConsumerConfig.GROUP_ID_CONFIG));
    assertEquals("latest", first.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
    assertEquals("true", first.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
  }

  @Test
  void consumerRequiresGroupId() {
    BrokerSettings broker = new BrokerSettings("broker.lan", 9092, SecurityProtocol.PLAINTEXT, null, null);

    assertThrows(IllegalArgumentException.class, () -> KafkaClientProperties.consumer(broker, " "));
    assertThrows(IllegalArgumentException.class, () -> KafkaClientProperties.consumer(broker, null));
  }
}
