package ca.gc.cra.lens.application.temporal;

import ca.gc.cra.lens.domain.analysis.AnalyzedMessage;
import ca.gc.cra.lens.domain.analysis.ConversationAnalysis;
import ca.gc.cra.lens.domain.taxonomy.Polarity;
import ca.gc.cra.lens.domain.temporal.DailyActivity;
import ca.gc.cra.lens.domain.temporal.MonthlyQuality;
import ca.gc.cra.lens.domain.temporal.Streak;
import ca.gc.cra.lens.domain.temporal.TemporalProfile;
import ca.gc.cra.lens.domain.temporal.TrendMetric;
import ca.gc.cra.lens.domain.temporal.TrendShift;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the corpus-wide {@link TemporalProfile}: activity histogram, streaks,
 * trend shifts, daily engagement, and monthly topic and quality evolution.
 * <p><strong>Why:</strong> Usage patterns only show up across conversations, so this runs once every
 * conversation has been classified.</p>
 * <p><strong>Role:</strong> Global barrier stage of the analyze pipeline. Reads timestamps and labels only.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings.</p>
 * <p><strong>Performance:</strong> One sort of all messages by time; everything else is linear.</p>
 *
 * @since 0.1.0
 */
public final class TemporalAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(TemporalAnalyzer.class);

  static final int PEAK_HOURS = 3;
  private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

  private final TemporalSettings settings;

  public TemporalAnalyzer() {
    this(TemporalSettings.defaults());
  }

  public TemporalAnalyzer(TemporalSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Computes the temporal profile for the whole corpus.
   *
   * @param conversations every analyzed conversation
   * @return profile; {@link TemporalProfile#empty()} when there are no messages
   */
  public TemporalProfile analyze(List<ConversationAnalysis> conversations) {
    Objects.requireNonNull(conversations, "conversations");
    List<Point> points = new ArrayList<>();
    for (ConversationAnalysis conversation : conversations) {
      for (AnalyzedMessage message : conversation.messages()) {
        points.add(new Point(conversation.conversationId(), message,
            message.message().timestamp().atZone(settings.zone())));
      }
    }
    if (points.isEmpty()) {
      return TemporalProfile.empty();
    }
    points.sort(Comparator.comparing(Point::instant));

    int[][] histogram = new int[TemporalProfile.WEEKDAYS][TemporalProfile.HOURS];
    for (Point point : points) {
      histogram[point.local().getDayOfWeek().getValue() - 1][point.local().getHour()]++;
    }

    Set<LocalDate> activeDays = new TreeSet<>();
    points.forEach(p -> activeDays.add(p.local().toLocalDate()));
    List<Streak> runs = runs(activeDays);
    int longest = runs.stream().mapToInt(Streak::days).max().orElse(0);
    List<Streak> streaks = runs.stream()
        .filter(s -> s.days() >= settings.minStreakDays())
        .sorted(Comparator.comparingInt(Streak::days).reversed().thenComparing(Streak::start))
        .toList();

    List<TrendShift> shifts = new ArrayList<>();
    shifts.addAll(trendShifts(TrendMetric.SENTIMENT, points, p -> p.message().labels().polarity().score()));
    shifts.addAll(trendShifts(TrendMetric.FAILURE_RATE, points, p -> p.message().labels().hasFailure() ? 1 : 0));
    shifts.sort(Comparator.comparingInt(TrendShift::position).thenComparing(TrendShift::metric));

    TemporalProfile profile = new TemporalProfile(
        histogram,
        peakHours(histogram),
        busiestDays(histogram),
        streaks,
        longest,
        shifts,
        dailyActivity(points),
        monthlyTopics(points),
        monthlyQuality(points),
        points.get(0).instant(),
        points.get(points.size() - 1).instant());
    log.debug("Temporal profile: {} messages over {} active days, {} streaks, {} trend shifts",
        points.size(), activeDays.size(), streaks.size(), shifts.size());
    return profile;
  }

  private static List<Integer> peakHours(int[][] histogram) {
    int[] totals = new int[TemporalProfile.HOURS];
    for (int[] row : histogram) {
      for (int hour = 0; hour < TemporalProfile.HOURS; hour++) {
        totals[hour] += row[hour];
      }
    }
    List<Integer> hours = new ArrayList<>();
    for (int hour = 0; hour < TemporalProfile.HOURS; hour++) {
      if (totals[hour] > 0) {
        hours.add(hour);
      }
    }
    hours.sort(Comparator.comparingInt((Integer hour) -> totals[hour]).reversed()
        .thenComparing(Comparator.naturalOrder()));
    return List.copyOf(hours.subList(0, Math.min(PEAK_HOURS, hours.size())));
  }

  private static Map<DayOfWeek, Integer> busiestDays(int[][] histogram) {
    List<Map.Entry<DayOfWeek, Integer>> days = new ArrayList<>();
    for (int day = 0; day < TemporalProfile.WEEKDAYS; day++) {
      int total = 0;
      for (int value : histogram[day]) {
        total += value;
      }
      if (total > 0) {
        days.add(Map.entry(DayOfWeek.of(day + 1), total));
      }
    }
    days.sort(Map.Entry.<DayOfWeek, Integer>comparingByValue().reversed()
        .thenComparing(Map.Entry.comparingByKey()));
    Map<DayOfWeek, Integer> ordered = new LinkedHashMap<>();
    days.forEach(e -> ordered.put(e.getKey(), e.getValue()));
    return ordered;
  }

  private static List<Streak> runs(Set<LocalDate> activeDays) {
    List<Streak> runs = new ArrayList<>();
    LocalDate start = null;
    LocalDate previous = null;
    for (LocalDate day : activeDays) {
      if (previous == null || !day.equals(previous.plusDays(1))) {
        if (start != null) {
          runs.add(streak(start, previous));
        }
        start = day;
      }
      previous = day;
    }
    if (start != null) {
      runs.add(streak(start, previous));
    }
    return runs;
  }

  private static Streak streak(LocalDate start, LocalDate end) {
    return new Streak(start, end, (int) (end.toEpochDay() - start.toEpochDay()) + 1);
  }

  private List<TrendShift> trendShifts(TrendMetric metric, List<Point> points, ToDoubleFunction<Point> value) {
    int window = settings.trendWindow();
    double[] series = new double[points.size()];
    for (int i = 0; i < series.length; i++) {
      series[i] = value.applyAsDouble(points.get(i));
    }
    List<TrendShift> shifts = new ArrayList<>();
    int i = 2 * window - 1;
    while (i < series.length) {
      double previousMean = mean(series, i - 2 * window + 1, i - window + 1);
      double currentMean = mean(series, i - window + 1, i + 1);
      double std = Math.max(std(series, i - 2 * window + 1, i - window + 1, previousMean), settings.trendStdFloor());
      double deviations = Math.abs(currentMean - previousMean) / std;
      if (deviations > settings.trendSigma()) {
        shifts.add(new TrendShift(metric, i, points.get(i).instant(), previousMean, currentMean, deviations));
        i += window;
      } else {
        i++;
      }
    }
    return shifts;
  }

  private static double mean(double[] series, int from, int to) {
    double sum = 0;
    for (int i = from; i < to; i++) {
      sum += series[i];
    }
    return sum / (to - from);
  }

  private static double std(double[] series, int from, int to, double mean) {
    double sum = 0;
    for (int i = from; i < to; i++) {
      double d = series[i] - mean;
      sum += d * d;
    }
    return Math.sqrt(sum / (to - from));
  }

  private static List<DailyActivity> dailyActivity(List<Point> points) {
    Map<LocalDate, List<Point>> byDay = new TreeMap<>();
    for (Point point : points) {
      byDay.computeIfAbsent(point.local().toLocalDate(), d -> new ArrayList<>()).add(point);
    }
    List<DailyActivity> days = new ArrayList<>(byDay.size());
    byDay.forEach((date, dayPoints) -> {
      Set<String> conversations = new HashSet<>();
      long words = 0;
      for (Point point : dayPoints) {
        conversations.add(point.conversationId());
        words += point.message().message().wordCount();
      }
      int messages = dayPoints.size();
      double averageWords = (double) words / messages;
      days.add(new DailyActivity(
          date, messages, conversations.size(), averageWords,
          engagement(messages, averageWords, conversations.size())));
    });
    return days;
  }

  static double engagement(int messages, double averageWords, int conversations) {
    return 0.4 * Math.min(messages / 50.0, 1.0)
        + 0.3 * Math.min(averageWords / 200.0, 1.0)
        + 0.3 * Math.min(conversations / 10.0, 1.0);
  }

  private Map<String, Map<String, Integer>> monthlyTopics(List<Point> points) {
    Map<String, Map<String, Integer>> counts = new TreeMap<>();
    for (Point point : points) {
      Map<String, Integer> month = counts.computeIfAbsent(MONTH.format(point.local()), m -> new HashMap<>());
      for (String topic : point.message().labels().topics()) {
        month.merge(topic, 1, Integer::sum);
      }
    }
    Map<String, Map<String, Integer>> result = new LinkedHashMap<>();
    counts.forEach((month, topics) -> {
      Map<String, Integer> top = new LinkedHashMap<>();
      topics.entrySet().stream()
          .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
              .thenComparing(Map.Entry.comparingByKey()))
          .limit(settings.monthlyTopicLimit())
          .forEach(e -> top.put(e.getKey(), e.getValue()));
      result.put(month, top);
    });
    return result;
  }

  private static List<MonthlyQuality> monthlyQuality(List<Point> points) {
    Map<String, List<Point>> byMonth = points.stream()
        .collect(Collectors.groupingBy(p -> MONTH.format(p.local()), TreeMap::new, Collectors.toList()));
    List<MonthlyQuality> months = new ArrayList<>(byMonth.size());
    byMonth.forEach((month, monthPoints) -> {
      int messages = monthPoints.size();
      Map<String, Integer> sentiments = new HashMap<>();
      int positive = 0;
      int failing = 0;
      int[] words = new int[messages];
      for (int i = 0; i < messages; i++) {
        AnalyzedMessage message = monthPoints.get(i).message();
        sentiments.merge(message.labels().sentiment(), 1, Integer::sum);
        if (message.labels().polarity() == Polarity.POSITIVE) {
          positive++;
        }
        if (message.labels().hasFailure()) {
          failing++;
        }
        words[i] = message.message().wordCount();
      }
      Map<String, Double> share = new LinkedHashMap<>();
      sentiments.entrySet().stream()
          .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
              .thenComparing(Map.Entry.comparingByKey()))
          .forEach(e -> share.put(e.getKey(), (double) e.getValue() / messages));
      months.add(new MonthlyQuality(month, messages, share,
          (double) positive / messages, (double) failing / messages,
          Arrays.stream(words).average().orElse(0.0), median(words)));
    });
    return months;
  }

  static double median(int[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    int[] sorted = values.clone();
    Arrays.sort(sorted);
    int middle = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2.0;
  }

  private record Point(String conversationId, AnalyzedMessage message, ZonedDateTime local) {
    Instant instant() {
      return message.message().timestamp();
    }
  }
}
