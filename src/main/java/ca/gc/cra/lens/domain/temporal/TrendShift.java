package ca.gc.cra.lens.domain.temporal;

import java.time.Instant;
import java.util.Objects;

/**
 * Point where a rolling window departs from the preceding window.
 *
 * @param metric series that shifted
 * @param position index of the last message in the current window, in corpus time order
 * @param timestamp timestamp of the message at {@code position}
 * @param previousMean mean of the prior window
 * @param currentMean mean of the current window
 * @param deviations absolute change expressed in prior-window standard deviations
 * @since 0.1.0
 */
public record TrendShift(
    TrendMetric metric,
    int position,
    Instant timestamp,
    double previousMean,
    double currentMean,
    double deviations) {

  public TrendShift {
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /** Returns {@code true} when the metric rose. */
  public boolean increasing() {
    return currentMean > previousMean;
  }
}
