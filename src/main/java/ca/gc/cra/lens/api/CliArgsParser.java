package ca.gc.cra.lens.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>Keys may carry a leading {@code --} ({@code --in=export.json}). A value wrapped in matching single or
 * double quotes is unwrapped, which keeps {@code text="..."} usable from shells that pass the quotes through.
 * An empty value ({@code pseudonymSalt=}) is kept as the empty string.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses the arguments in order.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable, insertion-ordered map
   * @throws IllegalArgumentException when an argument is not {@code key=value}, a key repeats, or a value holds
   *     a null byte
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> parsed = new LinkedHashMap<>();
    if (args == null) {
      return parsed;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int eq = arg.indexOf('=');
      if (eq < 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + arg + "')");
      }
      String key = stripDashes(arg.substring(0, eq).trim());
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: '" + key + "'");
      }
      String value = unquote(arg.substring(eq + 1).trim());
      if (value.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
      }
      if (parsed.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return parsed;
  }

  private static String stripDashes(String key) {
    return key.startsWith("--") ? key.substring(2) : key;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }
}
