package ca.gc.cra.lens.domain.taxonomy;

import java.util.Locale;

/**
 * Severity attached to a failure kind. Declaration order is descending severity.
 *
 * @since 0.1.0
 */
public enum Severity {
  HIGH,
  MEDIUM,
  LOW;

  /**
   * Tests whether this severity ranks above another.
   *
   * @param other severity to compare against
   * @return {@code true} when this severity is strictly higher
   */
  public boolean isHigherThan(Severity other) {
    return other == null || ordinal() < other.ordinal();
  }

  /**
   * Tests whether this severity is at least as severe as {@code floor}.
   *
   * @param floor minimum severity
   * @return {@code true} when this severity meets the floor
   */
  public boolean atLeast(Severity floor) {
    return ordinal() <= floor.ordinal();
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a severity label such as {@code high}.
   *
   * @param raw label; case-insensitive
   * @return parsed severity
   * @throws IllegalArgumentException when the label is unknown
   */
  public static Severity fromLabel(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("severity must not be blank");
    }
    try {
      return Severity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown severity: " + raw, ex);
    }
  }
}
