package ca.gc.cra.lens.domain.temporal;

/**
 * Time-ordered metric series scanned for trend shifts.
 *
 * @since 0.1.0
 */
public enum TrendMetric {
  /** Sentiment polarity per message: {@code +1}, {@code 0} or {@code -1}. */
  SENTIMENT,
  /** {@code 1} when the message triggered any failure, otherwise {@code 0}. */
  FAILURE_RATE
}
