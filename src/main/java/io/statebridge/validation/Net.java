package io.statebridge.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Broker endpoint validation utilities.
 *
 * @since 0.1.0
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  // dotted-quad shape; octets are range-checked separately
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a broker host (hostname, IPv4 or IPv6 literal with or without brackets).
   *
   * @param name logical parameter name
   * @param value candidate host
   * @return normalized host; IPv6 literals are returned wrapped in brackets
   * @throws IllegalArgumentException if the host is malformed
   */
  public static String validateHost(String name, String value) {
    String host = Strings.requireNonBlank(name, value);
    if (host.startsWith("[") && host.endsWith("]")) {
      validateIpv6(host.substring(1, host.length() - 1));
      return host;
    }
    if (host.indexOf(':') >= 0) {
      validateIpv6(host);
      return '[' + host + ']';
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
      return host;
    }
    validateHostname(host);
    return host;
  }

  /**
   * Builds a {@code host:port} bootstrap address from separately configured parts.
   *
   * @param host broker host
   * @param port broker port
   * @return validated {@code host:port}
   * @throws IllegalArgumentException if either part is invalid
   */
  public static String hostPort(String host, long port) {
    return validateHost("ip_address", host) + ':' + Numbers.requirePort("port", port);
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      int dot = host.indexOf('.', start);
      int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-' || c == '_')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  private static void validateIpv6(String host) {
    try {
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
