package ca.gc.cra.lens.domain.temporal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Quality rollup for one calendar month.
 *
 * @param month {@code YYYY-MM} in the analysis zone
 * @param messages messages sent that month
 * @param sentimentShare share of the month's messages per sentiment label, largest first; sums to 1
 * @param positiveRatio share of messages whose sentiment has positive polarity
 * @param failureRate share of messages with at least one failure
 * @param meanWords mean word count
 * @param medianWords median word count
 * @since 0.1.0
 */
public record MonthlyQuality(
    String month,
    int messages,
    Map<String, Double> sentimentShare,
    double positiveRatio,
    double failureRate,
    double meanWords,
    double medianWords) {
  public MonthlyQuality {
    Objects.requireNonNull(month, "month");
    sentimentShare = Collections.unmodifiableMap(new LinkedHashMap<>(sentimentShare));
  }
}
