package ca.gc.cra.lens.domain.taxonomy;

import java.util.Locale;

/**
 * Direction of a sentiment category, used for trend scoring and confrontation detection.
 *
 * @since 0.1.0
 */
public enum Polarity {
  POSITIVE(1),
  NEUTRAL(0),
  NEGATIVE(-1);

  private final int score;

  Polarity(int score) {
    this.score = score;
  }

  /** Returns {@code +1}, {@code 0} or {@code -1}. */
  public int score() {
    return score;
  }

  public static Polarity fromLabel(String raw) {
    if (raw == null || raw.isBlank()) {
      return NEUTRAL;
    }
    try {
      return Polarity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown polarity: " + raw, ex);
    }
  }
}
