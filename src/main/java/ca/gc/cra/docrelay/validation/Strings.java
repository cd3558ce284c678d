package ca.gc.cra.docrelay.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String checks applied to topic names, keys and CLI values before any broker
 * client is created.
 * <p><strong>Why:</strong> A malformed topic or a stray control character surfaces as an obscure client error
 * long after start-up; rejecting it early keeps the diagnostic next to its cause.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,249}$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of ISO control characters.
   *
   * @param name label used in diagnostics; {@code null} becomes {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name using the label {@code "topic"}.
   *
   * @param topic candidate topic
   * @return trimmed topic
   * @throws IllegalArgumentException if the topic is blank, too long or uses characters Kafka rejects
   */
  public static String sanitizeTopic(String topic) {
    return sanitizeTopic("topic", topic);
  }

  /**
   * Validates a Kafka topic name with a custom diagnostic label.
   *
   * <p>Kafka accepts {@code [A-Za-z0-9._-]} up to 249 characters and reserves {@code "."} and {@code ".."}.</p>
   *
   * @param name label used in diagnostics
   * @param topic candidate topic
   * @return trimmed topic
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (".".equals(sanitized) || "..".equals(sanitized)) {
      throw new IllegalArgumentException(message(name, "must not be '.' or '..'"));
    }
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen (max 249 characters)"));
    }
    return sanitized;
  }

  /**
   * Splits a comma-separated list, trimming entries and dropping empty ones.
   *
   * @param name label used in diagnostics
   * @param csv comma-separated text
   * @return non-empty list of trimmed entries
   * @throws IllegalArgumentException if no entries remain
   */
  public static List<String> splitCsv(String name, String csv) {
    String sanitized = requireNonBlank(name, csv);
    List<String> parts = new ArrayList<>();
    for (String part : sanitized.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        parts.add(trimmed);
      }
    }
    if (parts.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must list at least one entry"));
    }
    return List.copyOf(parts);
  }

  /**
   * Ensures a value contains only printable ASCII and fits within {@code maxLength} characters.
   *
   * @param name label used in diagnostics
   * @param value candidate text
   * @param maxLength maximum length in characters
   * @return validated value
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
