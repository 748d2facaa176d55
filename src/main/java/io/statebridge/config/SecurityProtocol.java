package io.statebridge.config;

import java.util.Locale;

/** Broker security protocols the bridge can negotiate. */
public enum SecurityProtocol {
  /** Unauthenticated, unencrypted connection. */
  PLAINTEXT,
  /** TLS transport with SASL PLAIN credentials. */
  SASL_SSL;

  /**
   * Parses a configured protocol name.
   *
   * @param raw configured value; {@code null} or blank selects {@link #PLAINTEXT}
   * @return parsed protocol
   * @throws IllegalArgumentException for unsupported protocols
   */
  public static SecurityProtocol fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return PLAINTEXT;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (SecurityProtocol protocol : values()) {
      if (protocol.name().equals(normalized)) {
        return protocol;
      }
    }
    throw new IllegalArgumentException("security_protocol must be PLAINTEXT or SASL_SSL (was " + raw + ")");
  }
}
