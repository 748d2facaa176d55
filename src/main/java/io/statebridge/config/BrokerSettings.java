package io.statebridge.config;

import io.statebridge.logging.Logs;
import io.statebridge.validation.Net;
import java.util.Objects;

/**
 * Kafka broker connection settings.
 *
 * @param host broker host or IP address
 * @param port broker port
 * @param securityProtocol negotiated protocol
 * @param username SASL username; {@code null} when unset
 * @param password SASL password; {@code null} when unset, never printed by {@link #toString()}
 * @since 0.1.0
 */
public record BrokerSettings(
    String host, int port, SecurityProtocol securityProtocol, String username, String password) {

  public BrokerSettings {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(securityProtocol, "securityProtocol");
    if ((username == null) != (password == null)) {
      throw new IllegalArgumentException("username and password must be configured together");
    }
    if (username != null && securityProtocol != SecurityProtocol.SASL_SSL) {
      throw new IllegalArgumentException("username/password require security_protocol SASL_SSL");
    }
    if (username == null && securityProtocol == SecurityProtocol.SASL_SSL) {
      throw new IllegalArgumentException("security_protocol SASL_SSL requires username and password");
    }
  }

  /**
   * Returns the {@code host:port} bootstrap address.
   *
   * @return validated bootstrap address
   */
  public String bootstrapServers() {
    return Net.hostPort(host, port);
  }

  @Override
  public String toString() {
    return "BrokerSettings[bootstrap=" + host + ':' + port
        + ", securityProtocol=" + securityProtocol
        + ", username=" + (username == null ? "<none>" : username)
        + ", password=" + Logs.redact(password) + ']';
  }
}
