package ca.gc.cra.lens.application.classify;

import ca.gc.cra.lens.application.rules.CompiledTaxonomy;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.FailureRule;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.SentimentRule;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.SignalRule;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.TopicRule;
import ca.gc.cra.lens.domain.conversation.RedactedMessage;
import ca.gc.cra.lens.domain.taxonomy.FailureMatch;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;
import ca.gc.cra.lens.domain.taxonomy.Signal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Assigns topics, one sentiment, failure modes, and marker signals to redacted text.
 * <p><strong>Why:</strong> Aggregation works only from labels, so every text-derived fact is captured here.</p>
 * <p><strong>Role:</strong> Second per-message stage; runs on worker threads after redaction.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable taxonomy.</p>
 *
 * @since 0.1.0
 */
public final class TaxonomyClassifier {
  private final CompiledTaxonomy taxonomy;

  public TaxonomyClassifier(CompiledTaxonomy taxonomy) {
    this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy");
  }

  /**
   * Classifies one redacted message.
   *
   * @param message redacted message
   * @return labels; sentiment is always present
   */
  public LabelSet classify(RedactedMessage message) {
    Objects.requireNonNull(message, "message");
    return classifyText(message.redactedText());
  }

  /**
   * Classifies redacted text.
   *
   * @param redactedText text already passed through the redactor
   * @return labels; sentiment falls back to {@value CompiledTaxonomy#FALLBACK_SENTIMENT}
   */
  public LabelSet classifyText(String redactedText) {
    Objects.requireNonNull(redactedText, "redactedText");

    Set<String> topics = new LinkedHashSet<>();
    for (TopicRule rule : taxonomy.topics()) {
      if (rule.matches(redactedText)) {
        topics.add(rule.name());
      }
    }

    SentimentRule sentiment = null;
    for (SentimentRule rule : taxonomy.sentiments()) {
      if (rule.matches(redactedText)) {
        sentiment = rule;
        break;
      }
    }
    String sentimentName = sentiment == null ? CompiledTaxonomy.FALLBACK_SENTIMENT : sentiment.name();

    List<FailureMatch> failures = new ArrayList<>();
    for (FailureRule rule : taxonomy.failures()) {
      if (rule.matches(redactedText)) {
        failures.add(new FailureMatch(rule.name(), rule.severity()));
      }
    }

    Set<Signal> signals = EnumSet.noneOf(Signal.class);
    for (SignalRule rule : taxonomy.signals()) {
      if (rule.matches(redactedText)) {
        signals.add(rule.signal());
      }
    }

    return new LabelSet(
        topics,
        sentimentName,
        sentiment == null ? taxonomy.polarityOf(sentimentName) : sentiment.polarity(),
        failures,
        signals);
  }
}
