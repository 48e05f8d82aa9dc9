package ca.gc.cra.lens.application.rules;

import ca.gc.cra.lens.domain.privacy.PiiKind;
import ca.gc.cra.lens.domain.taxonomy.Polarity;
import ca.gc.cra.lens.domain.taxonomy.Severity;
import ca.gc.cra.lens.domain.taxonomy.Signal;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable, compiled pattern tables used by the redactor and classifier.
 * <p><strong>Why:</strong> Tie-break behavior depends on table order, so every table is an explicit ordered
 * list of (name, patterns) entries rather than a map.</p>
 * <p><strong>Role:</strong> Output of {@link TaxonomyBuilder#build()}; shared read-only by all workers.</p>
 * <p><strong>Thread-safety:</strong> Immutable; compiled {@link Pattern}s are safe to share.</p>
 *
 * @param pii fixed-redaction kinds in registration order
 * @param entities pseudonymized entity kinds in registration order
 * @param topics topic categories
 * @param sentiments sentiment categories in priority order
 * @param failures failure kinds
 * @param signals marker signals
 * @since 0.1.0
 */
public record CompiledTaxonomy(
    List<PiiRule> pii,
    List<PiiRule> entities,
    List<TopicRule> topics,
    List<SentimentRule> sentiments,
    List<FailureRule> failures,
    List<SignalRule> signals) {

  /** Sentiment reported when no category matches. */
  public static final String FALLBACK_SENTIMENT = "Neutral";

  public CompiledTaxonomy {
    pii = List.copyOf(pii);
    entities = List.copyOf(entities);
    topics = List.copyOf(topics);
    sentiments = List.copyOf(sentiments);
    failures = List.copyOf(failures);
    signals = List.copyOf(signals);
  }

  /**
   * Returns the polarity registered for a sentiment name.
   *
   * @param sentiment sentiment name
   * @return registered polarity, {@link Polarity#NEUTRAL} when unknown
   */
  public Polarity polarityOf(String sentiment) {
    for (SentimentRule rule : sentiments) {
      if (rule.name().equals(sentiment)) {
        return rule.polarity();
      }
    }
    return Polarity.NEUTRAL;
  }

  /** Ordered patterns for one PII or entity kind. */
  public record PiiRule(PiiKind kind, List<Pattern> patterns) {
    public PiiRule {
      Objects.requireNonNull(kind, "kind");
      patterns = List.copyOf(patterns);
    }
  }

  /** Ordered patterns for one topic. */
  public record TopicRule(String name, List<Pattern> patterns) {
    public TopicRule {
      Objects.requireNonNull(name, "name");
      patterns = List.copyOf(patterns);
    }

    public boolean matches(CharSequence text) {
      return PatternSafety.anyMatch(patterns, text);
    }
  }

  /** Ordered patterns for one sentiment category. */
  public record SentimentRule(String name, Polarity polarity, List<Pattern> patterns) {
    public SentimentRule {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(polarity, "polarity");
      patterns = List.copyOf(patterns);
    }

    public boolean matches(CharSequence text) {
      return PatternSafety.anyMatch(patterns, text);
    }
  }

  /** Ordered patterns for one failure kind with its fixed severity. */
  public record FailureRule(String name, Severity severity, List<Pattern> patterns) {
    public FailureRule {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(severity, "severity");
      patterns = List.copyOf(patterns);
    }

    public boolean matches(CharSequence text) {
      return PatternSafety.anyMatch(patterns, text);
    }
  }

  /** Ordered patterns for one marker signal. */
  public record SignalRule(Signal signal, List<Pattern> patterns) {
    public SignalRule {
      Objects.requireNonNull(signal, "signal");
      patterns = List.copyOf(patterns);
    }

    public boolean matches(CharSequence text) {
      return PatternSafety.anyMatch(patterns, text);
    }
  }
}
