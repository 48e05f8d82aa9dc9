package ca.gc.cra.lens.validation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks for text settings (paths, salts, comma lists) before they reach the pipeline. Violations raise
 * {@link IllegalArgumentException} naming the setting.
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {

  private Strings() {}

  /**
   * Trims a required setting.
   *
   * @param name setting name used in messages; {@code null} reads as {@code "value"}
   * @param value raw setting
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or holds ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String label = label(name);
    String trimmed = requireNoControl(label, Objects.requireNonNull(value, label)).trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Splits a comma list such as {@code patterns=a.yaml,b.yaml}. Empty entries and repeats are dropped.
   *
   * @param name setting name used in messages
   * @param value raw list; {@code null} or blank yields an empty list
   * @return distinct entries in first-seen order
   * @throws IllegalArgumentException if an entry holds control characters
   */
  public static List<String> splitList(String name, String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    Set<String> entries = new LinkedHashSet<>();
    for (String part : value.split(",")) {
      String entry = part.trim();
      if (!entry.isEmpty()) {
        entries.add(requireNoControl(label(name), entry));
      }
    }
    return List.copyOf(entries);
  }

  private static String requireNoControl(String label, String value) {
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label + " must not contain control characters");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
