package ca.gc.cra.docrelay.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Broker endpoint validation: {@code host:port} entries with hostnames, IPv4 or bracketed IPv6 literals.
 *
 * <p>No DNS lookups are performed; IPv6 literals are parsed by the JDK without resolution.</p>
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates and normalizes one {@code host:port} entry.
   *
   * @param value candidate endpoint such as {@code kafka-1:9092} or {@code [::1]:9092}
   * @return normalized endpoint
   * @throws IllegalArgumentException if the host or port is malformed
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("bootstrap server", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0) {
        throw new IllegalArgumentException("bootstrap server must close IPv6 literal with ']': " + sanitized);
      }
      if (close + 2 > sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("bootstrap server must include :<port> after IPv6 literal: " + sanitized);
      }
      host = sanitized.substring(1, close);
      portPart = sanitized.substring(close + 2);
      validateIpv6(host);
      host = '[' + host + ']';
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("bootstrap server must use HOST:PORT format: " + sanitized);
      }
      host = sanitized.substring(0, colon);
      portPart = sanitized.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]: " + sanitized);
      }
      if (IPV4_PATTERN.matcher(host).matches()) {
        validateIpv4(host);
      } else {
        validateHostname(host);
      }
    }
    int port = Numbers.parseInt("port", portPart, 1, 65_535);
    return host + ':' + port;
  }

  /**
   * Validates every entry of a bootstrap list, preserving order.
   *
   * @param servers endpoints to validate
   * @return normalized endpoints
   * @throws IllegalArgumentException if the list is empty or any entry is malformed
   */
  public static List<String> validateBootstrapServers(Collection<String> servers) {
    if (servers == null || servers.isEmpty()) {
      throw new IllegalArgumentException("at least one bootstrap server is required");
    }
    List<String> normalized = new ArrayList<>(servers.size());
    for (String server : servers) {
      normalized.add(validateHostPort(server));
    }
    return List.copyOf(normalized);
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    for (String label : host.split("\\.", -1)) {
      validateLabel(label);
    }
  }

  private static void validateLabel(String label) {
    int len = label.length();
    if (len == 0 || len > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + len + " (must be 1.." + MAX_LABEL_LENGTH + ')');
    }
    if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(len - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = 1; i < len - 1; i++) {
      char c = label.charAt(i);
      if (!isAsciiAlnum(c) && c != '-') {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4(String host) {
    for (String octet : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
    }
  }

  private static void validateIpv6(String host) {
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
