package ca.gc.cra.lens.validation;

/**
 * Numeric parsing and range checks for settings.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures a long value falls inside an inclusive range.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures a double value is finite and inside an inclusive range.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when not finite or out of range
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer setting, falling back when blank.
   *
   * @param name logical parameter name for diagnostics
   * @param raw raw text; {@code null} or blank returns {@code fallback}
   * @param fallback default value
   * @return parsed value
   * @throws IllegalArgumentException when the text is not an integer
   */
  public static int parseInt(String name, String raw, int fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
  }

  /**
   * Parses a decimal setting, falling back when blank.
   *
   * @param name logical parameter name for diagnostics
   * @param raw raw text; {@code null} or blank returns {@code fallback}
   * @param fallback default value
   * @return parsed value
   * @throws IllegalArgumentException when the text is not a number
   */
  public static double parseDouble(String name, String raw, double fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + raw + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
