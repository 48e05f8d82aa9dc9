package ca.gc.cra.lens.domain.taxonomy;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Classification result for one message.
 * <p><strong>Why:</strong> Carries everything the aggregators need so they never look at text again.</p>
 * <p><strong>Role:</strong> Domain value produced by the taxonomy classifier and consumed by quality,
 * temporal, and record assembly stages.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param topics matching topic names in table order; may be empty
 * @param sentiment exactly one sentiment name
 * @param polarity polarity of {@code sentiment}
 * @param failures triggered failure kinds in table order, one entry per distinct kind
 * @param signals detected text markers
 * @since 0.1.0
 */
public record LabelSet(
    Set<String> topics,
    String sentiment,
    Polarity polarity,
    List<FailureMatch> failures,
    Set<Signal> signals) {

  public LabelSet {
    topics = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(topics, "topics")));
    Objects.requireNonNull(sentiment, "sentiment");
    if (sentiment.isBlank()) {
      throw new IllegalArgumentException("sentiment must not be blank");
    }
    Objects.requireNonNull(polarity, "polarity");
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    Set<Signal> copy = EnumSet.noneOf(Signal.class);
    copy.addAll(Objects.requireNonNull(signals, "signals"));
    signals = Collections.unmodifiableSet(copy);
  }

  public int topicCount() {
    return topics.size();
  }

  /** Number of distinct failure kinds triggered. */
  public int failureCount() {
    return failures.size();
  }

  public boolean hasFailure() {
    return !failures.isEmpty();
  }

  /**
   * Returns the highest severity among triggered failures.
   *
   * @return maximum severity, empty when no failure triggered
   */
  public Optional<Severity> maxSeverity() {
    Severity max = null;
    for (FailureMatch failure : failures) {
      if (failure.severity().isHigherThan(max)) {
        max = failure.severity();
      }
    }
    return Optional.ofNullable(max);
  }

  public boolean has(Signal signal) {
    return signals.contains(signal);
  }
}
