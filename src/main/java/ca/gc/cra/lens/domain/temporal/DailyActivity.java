package ca.gc.cra.lens.domain.temporal;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Activity rollup for one calendar day.
 *
 * @param date calendar day in the analysis zone
 * @param messages messages sent that day
 * @param conversations distinct conversations active that day
 * @param averageWords mean word count of the day's messages
 * @param engagementScore weighted score in {@code [0, 1]}
 * @since 0.1.0
 */
public record DailyActivity(
    LocalDate date, int messages, int conversations, double averageWords, double engagementScore) {
  public DailyActivity {
    Objects.requireNonNull(date, "date");
  }
}
