package ca.gc.cra.lens.application.summary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lens.domain.analysis.AnalyzedMessage;
import ca.gc.cra.lens.domain.analysis.ConversationAnalysis;
import ca.gc.cra.lens.domain.conversation.RedactedMessage;
import ca.gc.cra.lens.domain.conversation.Role;
import ca.gc.cra.lens.domain.quality.CollaborationQuality;
import ca.gc.cra.lens.domain.quality.CompletionStatus;
import ca.gc.cra.lens.domain.quality.ConversationQuality;
import ca.gc.cra.lens.domain.quality.ResponseAssessment;
import ca.gc.cra.lens.domain.quality.ResponseEffectiveness;
import ca.gc.cra.lens.domain.taxonomy.FailureMatch;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;
import ca.gc.cra.lens.domain.taxonomy.Polarity;
import ca.gc.cra.lens.domain.taxonomy.Severity;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CorpusStatisticsTest {
  private static final Instant T0 = Instant.parse("2024-03-04T09:00:00Z");

  @Test
  void emptyCorpusHasZeroRates() {
    CorpusStatistics stats = CorpusStatistics.compute(List.of());

    assertEquals(0, stats.conversations());
    assertEquals(0, stats.messages());
    assertEquals(0.0, stats.failureRate());
    assertEquals(0.0, stats.averageWords());
    assertTrue(stats.topics().isEmpty());
  }

  @Test
  void countsAreRankedByFrequencyThenName() {
    LabelSet infra = labels(Set.of("Infrastructure", "Debugging"), "Negative", Polarity.NEGATIVE,
        new FailureMatch("Accuracy Error", Severity.HIGH));
    LabelSet thanks = labels(Set.of("Infrastructure"), "Positive", Polarity.POSITIVE);
    LabelSet question = labels(Set.of("AI/ML"), "Questioning", Polarity.NEUTRAL);

    ConversationAnalysis first = new ConversationAnalysis("a", "A", null, T0, List.of(
        analyzed("a", 0, Role.USER, 40, 8, Set.of("email", "phone"), infra),
        analyzed("a", 1, Role.ASSISTANT, 20, 4, Set.of(), thanks)),
        Optional.of(new ConversationQuality(
            CollaborationQuality.HIGH, CompletionStatus.COMPLETED, 0.5, 1, 2, 0, 0, 0, 0, 0, 0,
            0, 0, 40.0, 20.0, List.of(new ResponseAssessment(1, ResponseEffectiveness.INEFFECTIVE, 1.0)))));
    ConversationAnalysis second = new ConversationAnalysis("b", "B", null, T0, List.of(
        analyzed("b", 0, Role.USER, 30, 6, Set.of("email"), question),
        analyzed("b", 1, Role.USER, 10, 2, Set.of(), infra)),
        Optional.empty());

    CorpusStatistics stats = CorpusStatistics.compute(List.of(first, second));

    assertEquals(2, stats.conversations());
    assertEquals(4, stats.messages());
    assertEquals(3, stats.userMessages());
    assertEquals(1, stats.assistantMessages());
    assertEquals(25.0, stats.averageLength(), 1e-9);
    assertEquals(5.0, stats.averageWords(), 1e-9);
    assertEquals(List.of("Infrastructure", "Debugging", "AI/ML"), List.copyOf(stats.topics().keySet()));
    assertEquals(3, stats.topics().get("Infrastructure"));
    assertEquals(List.of("Negative", "Positive", "Questioning"), List.copyOf(stats.sentiments().keySet()));
    assertEquals(2, stats.failureTypes().get("Accuracy Error"));
    assertEquals(List.of("email", "phone"), List.copyOf(stats.piiKinds().keySet()));
    assertEquals(2, stats.piiKinds().get("email"));
    assertEquals(2, stats.messagesWithFailures());
    assertEquals(0.5, stats.failureRate(), 1e-9);
    assertEquals(1, stats.collaboration().get("high"));
    assertEquals(1, stats.completion().get("completed"));
    assertEquals(1, stats.completion().size());
    assertEquals(Map.of("ineffective", 1), stats.responseEffectiveness());
  }

  private static LabelSet labels(Set<String> topics, String sentiment, Polarity polarity, FailureMatch... failures) {
    return new LabelSet(topics, sentiment, polarity, List.of(failures), Set.of());
  }

  private static AnalyzedMessage analyzed(
      String id, int index, Role role, int length, int words, Set<String> pii, LabelSet labels) {
    return new AnalyzedMessage(
        new RedactedMessage(id, index, role, T0.plusSeconds(index), "x", length, words, pii), labels);
  }
}
