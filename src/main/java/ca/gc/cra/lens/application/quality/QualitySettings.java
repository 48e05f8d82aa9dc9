package ca.gc.cra.lens.application.quality;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds and weights used by {@link ConversationQualityAnalyzer}.
 *
 * @param quickResponse alternating replies faster than this count as quick responses
 * @param longGap adjacent messages further apart than this count as long gaps
 * @param abandonGap trailing silence longer than this is an abandonment signal
 * @param tailWindow number of trailing messages inspected for completion evidence
 * @param highCeiling collaboration scores at or below this are {@code HIGH}
 * @param mediumCeiling collaboration scores at or below this are {@code MEDIUM}
 * @param failureWeight weight of failure density in the collaboration score
 * @param negativeWeight weight of the negative-sentiment rate
 * @param interruptionWeight weight of the interruption rate
 * @param confrontationalNegativeRate negative rate that must be exceeded for {@code CONFRONTATIONAL}
 * @param confrontationalHighSeverityRate high-severity density that must be exceeded for {@code CONFRONTATIONAL}
 * @since 0.1.0
 */
public record QualitySettings(
    Duration quickResponse,
    Duration longGap,
    Duration abandonGap,
    int tailWindow,
    double highCeiling,
    double mediumCeiling,
    double failureWeight,
    double negativeWeight,
    double interruptionWeight,
    double confrontationalNegativeRate,
    double confrontationalHighSeverityRate) {

  public QualitySettings {
    Objects.requireNonNull(quickResponse, "quickResponse");
    Objects.requireNonNull(longGap, "longGap");
    Objects.requireNonNull(abandonGap, "abandonGap");
    if (quickResponse.isNegative() || longGap.isNegative() || abandonGap.isNegative()) {
      throw new IllegalArgumentException("quality durations must not be negative");
    }
    if (tailWindow < 1) {
      throw new IllegalArgumentException("tailWindow must be >= 1");
    }
    if (highCeiling > mediumCeiling) {
      throw new IllegalArgumentException("qualityHighCeiling must not exceed qualityMediumCeiling");
    }
  }

  /** Returns the stock thresholds. */
  public static QualitySettings defaults() {
    return new QualitySettings(
        Duration.ofSeconds(60),
        Duration.ofHours(1),
        Duration.ofHours(1),
        3,
        0.15,
        0.40,
        0.5,
        0.3,
        0.2,
        0.40,
        0.25);
  }
}
