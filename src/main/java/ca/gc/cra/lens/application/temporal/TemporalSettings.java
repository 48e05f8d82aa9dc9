package ca.gc.cra.lens.application.temporal;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Parameters for {@link TemporalAnalyzer}.
 *
 * @param zone zone used to derive calendar days, weekdays, and hours
 * @param trendWindow messages per trend window
 * @param trendSigma deviations from the prior window that flag a shift
 * @param trendStdFloor lower bound on the prior window's standard deviation
 * @param minStreakDays shortest run of active days reported as a streak
 * @param monthlyTopicLimit topics kept per month
 * @since 0.1.0
 */
public record TemporalSettings(
    ZoneId zone,
    int trendWindow,
    double trendSigma,
    double trendStdFloor,
    int minStreakDays,
    int monthlyTopicLimit) {

  public TemporalSettings {
    Objects.requireNonNull(zone, "zone");
    if (trendWindow < 1) {
      throw new IllegalArgumentException("trendWindow must be >= 1");
    }
    if (!(trendSigma > 0.0)) {
      throw new IllegalArgumentException("trendSigma must be positive");
    }
    if (!(trendStdFloor > 0.0)) {
      throw new IllegalArgumentException("trendStdFloor must be positive");
    }
    if (minStreakDays < 1) {
      throw new IllegalArgumentException("minStreakDays must be >= 1");
    }
    if (monthlyTopicLimit < 1) {
      throw new IllegalArgumentException("monthlyTopicLimit must be >= 1");
    }
  }

  public static TemporalSettings defaults() {
    return new TemporalSettings(ZoneId.of("UTC"), 10, 2.0, 0.1, 3, 5);
  }
}
