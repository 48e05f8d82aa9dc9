package ca.gc.cra.lens.application.port;

/**
 * Run statistics emitted by the analyze pipeline: {@code analyze.conversations}, {@code analyze.messages},
 * {@code analyze.redactions}, {@code analyze.failures} and {@code analyze.duration.ms}.
 *
 * <p>Worker threads call this concurrently. Keys are never {@code null}; adapters may normalize them into
 * instrument names.
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name such as {@code analyze.messages}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records a histogram observation.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, e.g. milliseconds
   */
  void observe(String key, long value);

  /** Discards every update. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
