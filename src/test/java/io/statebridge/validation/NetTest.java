package io.statebridge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void acceptsHostnamesAndAddresses() {
    assertEquals("broker-1.lan", Net.validateHost("ip_address", "broker-1.lan"));
    assertEquals("192.168.1.10", Net.validateHost("ip_address", "192.168.1.10"));
    assertEquals("localhost", Net.validateHost("ip_address", " localhost "));
  }

  @Test
  void bracketsIpv6Literals() {
    assertEquals("[::1]", Net.validateHost("ip_address", "::1"));
    assertEquals("[fe80::1]", Net.validateHost("ip_address", "[fe80::1]"));
    assertEquals("[::1]:9092", Net.hostPort("::1", 9092));
  }

  @Test
  void rejectsMalformedHosts() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("ip_address", "256.1.1.1"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("ip_address", "-broker"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("ip_address", "broker."));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("ip_address", "bro ker"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("ip_address", " "));
  }

  @Test
  void hostPortValidatesPort() {
    assertEquals("192.168.1.10:9092", Net.hostPort("192.168.1.10", 9092));
    assertThrows(IllegalArgumentException.class, () -> Net.hostPort("192.168.1.10", 0));
  }
}
