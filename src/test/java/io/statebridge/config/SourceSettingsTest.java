package io.statebridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SourceSettingsTest {

  @Test
  void blankFilePathMeansStdin() {
    assertEquals(SourceSettings.stdin(), new SourceSettings(IoMode.FILE, null, " "));
  }

  @Test
  void overridesReplaceModeAndLocation() {
    SourceSettings file = new SourceSettings(IoMode.FILE, null, "/var/log/events.jsonl");

    assertEquals(file, file.withOverrides(null, null));
    assertEquals(new SourceSettings(IoMode.FILE, null, "other.jsonl"), file.withOverrides(null, "other.jsonl"));
    assertEquals(new SourceSettings(IoMode.KAFKA, "homeassistant.states", null),
        file.withOverrides(IoMode.KAFKA, "homeassistant.states"));
    assertThrows(IllegalArgumentException.class, () -> file.withOverrides(IoMode.KAFKA, null));

    SourceSettings kafka = new SourceSettings(IoMode.KAFKA, "homeassistant.states", null);
    assertEquals(SourceSettings.stdin(), kafka.withOverrides(IoMode.FILE, null));
  }

  @Test
  void parsesModesAndProtocols() {
    assertEquals(IoMode.KAFKA, IoMode.fromString(" kafka "));
    assertThrows(IllegalArgumentException.class, () -> IoMode.fromString("http"));
    assertEquals(SecurityProtocol.PLAINTEXT, SecurityProtocol.fromString(null));
    assertThrows(IllegalArgumentException.class, () -> SecurityProtocol.fromString("SSL"));
  }

  @Test
  void brokerToStringRedactsPassword() {
    BrokerSettings broker = new BrokerSettings("broker.lan", 9093, SecurityProtocol.SASL_SSL, "bridge", "s3cret");
    assertFalse(broker.toString().contains("s3cret"));
    assertTrue(broker.toString().contains("username=bridge"));
  }

  @Test
  void saslSslNeedsCredentials() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new BrokerSettings("broker.lan", 9093, SecurityProtocol.SASL_SSL, null, null));
    assertTrue(ex.getMessage().contains("SASL_SSL"));
  }

  @Test
  void kafkaGroupIdDefaultsAndSurvivesOverrides() {
    SourceSettings kafka = new SourceSettings(IoMode.KAFKA, "homeassistant.states", null);
    assertEquals(SourceSettings.DEFAULT_GROUP_ID, kafka.groupId());

    SourceSettings named = new SourceSettings(IoMode.KAFKA, "homeassistant.states", null, "bridge-a");
    assertEquals("bridge-a", named.withOverrides(null, "other.states").groupId());
    assertNull(SourceSettings.stdin().groupId());
    assertNull(new SourceSettings(IoMode.FILE, null, "x.jsonl", "ignored").groupId());
  }
}
