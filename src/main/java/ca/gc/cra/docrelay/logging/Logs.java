package ca.gc.cra.docrelay.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * <strong>What:</strong> Logging hygiene helpers for document payloads and client credentials.
 * <p><strong>Why:</strong> Documents can be arbitrarily large and client configurations carry passwords;
 * neither belongs verbatim in operator logs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate rendered payloads to a UTF-8 byte budget.</li>
 *   <li>Decide which configuration keys hold secrets and mask their values.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so a cut in the middle of a code point is dropped.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Placeholder that replaces secret configuration values. */
  public static final String MASK = "****";

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to {@code maxBytes} UTF-8 bytes, appending the original length.
   *
   * @param value string to truncate; {@code null} renders as {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} when it fits, otherwise the truncated prefix with a {@code "(truncated, X of Y)"} suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Returns whether a client configuration key names a secret.
   *
   * <p>Every {@code sasl.*} key is secret, as is any key ending in {@code password}
   * (for example {@code ssl.keystore.password}).</p>
   *
   * @param key configuration key
   * @return {@code true} when the value must be masked in logs and renderings
   */
  public static boolean isSecretKey(String key) {
    if (key == null) {
      return false;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    return lower.startsWith("sasl.") || lower.endsWith("password");
  }

  /**
   * Returns the masked rendering of a configuration value.
   *
   * @param key configuration key
   * @param value raw value
   * @return {@link #MASK} for secret keys, otherwise {@code value}
   */
  public static Object redact(String key, Object value) {
    return isSecretKey(key) ? MASK : value;
  }
}
