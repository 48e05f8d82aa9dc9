package ca.gc.cra.lens.logging;

import java.nio.charset.StandardCharsets;

/**
 * Keeps conversation content out of log lines.
 *
 * <p>CLI arguments such as {@code text=...} can carry message text, so error paths log them through
 * {@link #truncate(String, int)}. Code that has the text only to report on it logs {@link #describeLength} instead.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {}

  /**
   * Cuts a string to at most {@code maxBytes} UTF-8 bytes, never splitting a code point.
   *
   * @param value string to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value itself when it fits, otherwise a prefix followed by
   *     {@code "... (truncated, X of Y bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    int total = utf8Length(value);
    if (total <= maxBytes) {
      return value;
    }
    StringBuilder prefix = new StringBuilder();
    int used = 0;
    for (int i = 0; i < value.length(); ) {
      int codePoint = value.codePointAt(i);
      int width = utf8Width(codePoint);
      if (used + width > maxBytes) {
        break;
      }
      prefix.appendCodePoint(codePoint);
      used += width;
      i += Character.charCount(codePoint);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + total + " bytes)";
  }

  /**
   * Describes text by size only, e.g. {@code "[42 chars]"}.
   *
   * @param text text to describe; {@code null} yields {@code "<null>"}
   * @return placeholder safe to log
   */
  public static String describeLength(CharSequence text) {
    return text == null ? NULL_PLACEHOLDER : "[" + text.length() + " chars]";
  }

  private static int utf8Length(String value) {
    return value.getBytes(StandardCharsets.UTF_8).length;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
