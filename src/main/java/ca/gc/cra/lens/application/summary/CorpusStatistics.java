package ca.gc.cra.lens.application.summary;

import ca.gc.cra.lens.domain.analysis.AnalyzedMessage;
import ca.gc.cra.lens.domain.analysis.ConversationAnalysis;
import ca.gc.cra.lens.domain.conversation.Role;
import ca.gc.cra.lens.domain.quality.ConversationQuality;
import ca.gc.cra.lens.domain.taxonomy.FailureMatch;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Corpus-level totals and label distributions written to the summary and printed by the CLI.
 *
 * <p>Distributions are ordered by descending count, then name.
 *
 * @param conversations number of conversations
 * @param messages number of messages
 * @param userMessages messages from the user
 * @param assistantMessages messages from the assistant
 * @param averageLength mean original content length in characters
 * @param averageWords mean original word count
 * @param topics messages per topic
 * @param sentiments messages per sentiment
 * @param failureTypes messages per failure kind
 * @param piiKinds messages per redacted PII kind
 * @param messagesWithFailures messages with at least one failure
 * @param failureRate {@code messagesWithFailures / messages}
 * @param collaboration conversations per collaboration bucket; empty when quality is disabled
 * @param completion conversations per completion status; empty when quality is disabled
 * @param responseEffectiveness assistant messages per effectiveness label; empty when quality is disabled
 * @since 0.1.0
 */
public record CorpusStatistics(
    int conversations,
    int messages,
    int userMessages,
    int assistantMessages,
    double averageLength,
    double averageWords,
    Map<String, Integer> topics,
    Map<String, Integer> sentiments,
    Map<String, Integer> failureTypes,
    Map<String, Integer> piiKinds,
    int messagesWithFailures,
    double failureRate,
    Map<String, Integer> collaboration,
    Map<String, Integer> completion,
    Map<String, Integer> responseEffectiveness) {

  public CorpusStatistics {
    topics = Collections.unmodifiableMap(new LinkedHashMap<>(topics));
    sentiments = Collections.unmodifiableMap(new LinkedHashMap<>(sentiments));
    failureTypes = Collections.unmodifiableMap(new LinkedHashMap<>(failureTypes));
    piiKinds = Collections.unmodifiableMap(new LinkedHashMap<>(piiKinds));
    collaboration = Collections.unmodifiableMap(new LinkedHashMap<>(collaboration));
    completion = Collections.unmodifiableMap(new LinkedHashMap<>(completion));
    responseEffectiveness = Collections.unmodifiableMap(new LinkedHashMap<>(responseEffectiveness));
  }

  /**
   * Computes statistics over analyzed conversations.
   *
   * @param analyses analyzed conversations
   * @return statistics; all zero for an empty corpus
   */
  public static CorpusStatistics compute(List<ConversationAnalysis> analyses) {
    Objects.requireNonNull(analyses, "analyses");
    int messages = 0;
    int users = 0;
    int assistants = 0;
    long length = 0;
    long words = 0;
    int withFailures = 0;
    Map<String, Integer> topics = new HashMap<>();
    Map<String, Integer> sentiments = new HashMap<>();
    Map<String, Integer> failures = new HashMap<>();
    Map<String, Integer> pii = new HashMap<>();
    Map<String, Integer> collaboration = new HashMap<>();
    Map<String, Integer> completion = new HashMap<>();
    Map<String, Integer> effectiveness = new HashMap<>();

    for (ConversationAnalysis analysis : analyses) {
      for (AnalyzedMessage analyzed : analysis.messages()) {
        messages++;
        if (analyzed.message().role() == Role.USER) {
          users++;
        } else {
          assistants++;
        }
        length += analyzed.message().contentLength();
        words += analyzed.message().wordCount();
        LabelSet labels = analyzed.labels();
        labels.topics().forEach(topic -> topics.merge(topic, 1, Integer::sum));
        sentiments.merge(labels.sentiment(), 1, Integer::sum);
        for (FailureMatch failure : labels.failures()) {
          failures.merge(failure.kind(), 1, Integer::sum);
        }
        if (labels.hasFailure()) {
          withFailures++;
        }
        analyzed.message().piiKinds().forEach(kind -> pii.merge(kind, 1, Integer::sum));
      }
      if (analysis.quality().isPresent()) {
        ConversationQuality quality = analysis.quality().get();
        collaboration.merge(quality.collaborationQuality().label(), 1, Integer::sum);
        completion.merge(quality.taskCompletionStatus().label(), 1, Integer::sum);
        quality.effectivenessCounts()
            .forEach((level, count) -> effectiveness.merge(level.label(), count, Integer::sum));
      }
    }

    return new CorpusStatistics(
        analyses.size(),
        messages,
        users,
        assistants,
        messages == 0 ? 0.0 : (double) length / messages,
        messages == 0 ? 0.0 : (double) words / messages,
        ranked(topics),
        ranked(sentiments),
        ranked(failures),
        ranked(pii),
        withFailures,
        messages == 0 ? 0.0 : (double) withFailures / messages,
        ranked(collaboration),
        ranked(completion),
        ranked(effectiveness));
  }

  private static Map<String, Integer> ranked(Map<String, Integer> counts) {
    Map<String, Integer> ordered = new LinkedHashMap<>();
    counts.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
            .thenComparing(Map.Entry.comparingByKey()))
        .forEach(e -> ordered.put(e.getKey(), e.getValue()));
    return ordered;
  }
}
