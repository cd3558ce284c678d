package ca.gc.cra.docrelay.api;

import ca.gc.cra.docrelay.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a mutable lookup map split on the first {@code '='}.
 *
 * @since 0.1.0
 */
final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {
    // Utility
  }

  /**
   * Parses arguments; later duplicates win.
   *
   * @param args raw arguments; {@code null} yields an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException if an argument is not {@code key=value} or holds control characters
   */
  static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      map.put(key, Strings.requireNonBlank(key, arg.substring(idx + 1)));
    }
    return map;
  }

  /**
   * Removes and returns a required argument.
   *
   * @param args parsed arguments
   * @param key argument name
   * @return argument value
   * @throws IllegalArgumentException if the argument is missing
   */
  static String require(Map<String, String> args, String key) {
    String value = args.remove(key);
    if (value == null) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  static String optional(Map<String, String> args, String key, String defaultValue) {
    String value = args.remove(key);
    return value == null ? defaultValue : value;
  }
}
