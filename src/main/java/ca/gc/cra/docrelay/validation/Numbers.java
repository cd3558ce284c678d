package ca.gc.cra.docrelay.validation;

/**
 * Numeric range checks for CLI and configuration values such as poll timeouts and message counts.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that {@code value} lies within {@code [min, max]}.
   *
   * @param name label used in diagnostics; blank becomes {@code "value"}
   * @param value candidate
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(label(name)
          + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks it against {@code [min, max]}.
   *
   * @param name label used in diagnostics
   * @param text decimal text
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException if the text is not numeric or out of range
   */
  public static int parseInt(String name, String text, int min, int max) {
    String sanitized = Strings.requireNonBlank(name, text);
    final int value;
    try {
      value = Integer.parseInt(sanitized);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + sanitized + ")", ex);
    }
    return (int) requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
