package ca.gc.cra.lens.domain.temporal;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Corpus-wide temporal rollup.
 * <p><strong>Role:</strong> Domain value produced once per run after every conversation is analyzed.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the histogram is copied on construction and on access.</p>
 *
 * @param histogram message counts indexed {@code [weekday][hour]}, Monday first
 * @param peakHours busiest hours of day, most active first
 * @param busiestDays weekday totals, most active first
 * @param streaks consecutive-day runs meeting the minimum length, longest first
 * @param longestStreakDays length of the longest run of active days
 * @param trendShifts detected shift points in time order
 * @param dailyActivity per-day rollups in date order
 * @param monthlyTopics top topics per {@code YYYY-MM}, in month order
 * @param monthlyQuality sentiment, failure, and length trends per month, in month order
 * @param firstMessage earliest message instant; {@code null} for an empty corpus
 * @param lastMessage latest message instant; {@code null} for an empty corpus
 * @since 0.1.0
 */
public record TemporalProfile(
    int[][] histogram,
    List<Integer> peakHours,
    Map<DayOfWeek, Integer> busiestDays,
    List<Streak> streaks,
    int longestStreakDays,
    List<TrendShift> trendShifts,
    List<DailyActivity> dailyActivity,
    Map<String, Map<String, Integer>> monthlyTopics,
    List<MonthlyQuality> monthlyQuality,
    Instant firstMessage,
    Instant lastMessage) {

  public static final int WEEKDAYS = 7;
  public static final int HOURS = 24;

  public TemporalProfile {
    Objects.requireNonNull(histogram, "histogram");
    if (histogram.length != WEEKDAYS) {
      throw new IllegalArgumentException("histogram must have 7 weekday rows");
    }
    int[][] copy = new int[WEEKDAYS][];
    for (int day = 0; day < WEEKDAYS; day++) {
      if (histogram[day].length != HOURS) {
        throw new IllegalArgumentException("histogram rows must have 24 hour buckets");
      }
      copy[day] = Arrays.copyOf(histogram[day], HOURS);
    }
    histogram = copy;
    peakHours = List.copyOf(peakHours);
    busiestDays = Collections.unmodifiableMap(new LinkedHashMap<>(busiestDays));
    streaks = List.copyOf(streaks);
    trendShifts = List.copyOf(trendShifts);
    dailyActivity = List.copyOf(dailyActivity);
    monthlyTopics = Collections.unmodifiableMap(new LinkedHashMap<>(monthlyTopics));
    monthlyQuality = List.copyOf(monthlyQuality);
  }

  @Override
  public int[][] histogram() {
    int[][] copy = new int[WEEKDAYS][];
    for (int day = 0; day < WEEKDAYS; day++) {
      copy[day] = Arrays.copyOf(histogram[day], HOURS);
    }
    return copy;
  }

  /**
   * Returns the message count for one histogram bucket.
   *
   * @param day weekday
   * @param hour hour of day, {@code 0-23}
   * @return number of messages in the bucket
   */
  public int count(DayOfWeek day, int hour) {
    return histogram[day.getValue() - 1][hour];
  }

  /** Total messages counted by the histogram. */
  public int totalMessages() {
    int total = 0;
    for (int[] row : histogram) {
      for (int value : row) {
        total += value;
      }
    }
    return total;
  }

  /**
   * Returns an empty profile for a corpus without messages.
   *
   * @return empty profile
   */
  public static TemporalProfile empty() {
    return new TemporalProfile(
        new int[WEEKDAYS][HOURS], List.of(), Map.of(), List.of(), 0, List.of(), List.of(), Map.of(), List.of(),
        null, null);
  }
}
