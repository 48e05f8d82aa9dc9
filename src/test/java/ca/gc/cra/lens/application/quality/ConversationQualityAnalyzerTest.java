package ca.gc.cra.lens.application.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.lens.domain.analysis.AnalyzedMessage;
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
import ca.gc.cra.lens.domain.taxonomy.Signal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConversationQualityAnalyzerTest {
  private static final Instant T0 = Instant.parse("2024-03-04T09:00:00Z");
  private static final FailureMatch HALLUCINATION = new FailureMatch("Hallucination", Severity.HIGH);
  private static final FailureMatch MISUNDERSTANDING = new FailureMatch("Misunderstanding", Severity.MEDIUM);

  private final ConversationQualityAnalyzer analyzer = new ConversationQualityAnalyzer();

  @Test
  void emptyConversationIsMediumAndInProgress() {
    ConversationQuality quality = analyzer.analyze(List.of());

    assertEquals(CollaborationQuality.MEDIUM, quality.collaborationQuality());
    assertEquals(CompletionStatus.IN_PROGRESS, quality.taskCompletionStatus());
    assertEquals(0.0, quality.taskCompletionConfidence());
    assertEquals(0, quality.turnCount());
    assertEquals(List.of(), quality.responses());
  }

  @Test
  void repeatedUserTurnCountsOneInterruption() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, neutral()),
        message(1, Role.USER, T0.plusSeconds(10), neutral()),
        message(2, Role.ASSISTANT, T0.plusSeconds(20), neutral()));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(1, quality.flowInterruptions());
    assertEquals(0, quality.monologues());
    assertEquals(1, quality.quickResponseCount());
    assertEquals(3, quality.turnCount());
  }

  @Test
  void consecutiveAssistantTurnsAreMonologues() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, neutral()),
        message(1, Role.ASSISTANT, T0.plusSeconds(5), neutral()),
        message(2, Role.ASSISTANT, T0.plusSeconds(6), neutral()),
        message(3, Role.ASSISTANT, T0.plusSeconds(7), neutral()));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(2, quality.flowInterruptions());
    assertEquals(2, quality.monologues());
  }

  @Test
  void abruptEndOnHighSeverityFailureIsAbandoned() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, neutral()),
        message(1, Role.USER, T0.plusSeconds(60), neutral()),
        message(2, Role.USER, T0.plusSeconds(120), labels("Neutral", Polarity.NEUTRAL, List.of(HALLUCINATION))));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(CompletionStatus.ABANDONED, quality.taskCompletionStatus());
    assertEquals(2, quality.completionSignals());
    assertEquals(2.0 / 3.0, quality.taskCompletionConfidence(), 1e-9);
    assertEquals(2, quality.flowInterruptions());
  }

  @Test
  void closingAffirmationWithoutFailuresIsCompleted() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, labels("Questioning", Polarity.NEUTRAL, List.of(), Signal.QUESTION)),
        message(1, Role.ASSISTANT, T0.plusSeconds(30), labels("Neutral", Polarity.NEUTRAL, List.of(), Signal.CODE_BLOCK)),
        message(2, Role.USER, T0.plusSeconds(300),
            labels("Positive", Polarity.POSITIVE, List.of(), Signal.CLOSING_AFFIRMATION)));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(CompletionStatus.COMPLETED, quality.taskCompletionStatus());
    assertEquals(2.0 / 3.0, quality.taskCompletionConfidence(), 1e-9);
    assertEquals(CollaborationQuality.HIGH, quality.collaborationQuality());
    assertEquals(1, quality.questionCount());
    assertEquals(1, quality.codeBlockCount());
    assertEquals(1, quality.quickResponseCount());
  }

  @Test
  void blockerWithMediumFailureIsBlocked() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, neutral()),
        message(1, Role.ASSISTANT, T0.plusSeconds(20), neutral()),
        message(2, Role.USER, T0.plusSeconds(40),
            labels("Negative", Polarity.NEGATIVE, List.of(MISUNDERSTANDING), Signal.BLOCKER)),
        message(3, Role.ASSISTANT, T0.plusSeconds(60), neutral()));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(CompletionStatus.BLOCKED, quality.taskCompletionStatus());
    assertEquals(2.0 / 3.0, quality.taskCompletionConfidence(), 1e-9);
  }

  @Test
  void tieBetweenAbandonedAndCompletedFavoursAbandoned() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, neutral()),
        message(1, Role.ASSISTANT, T0.plusSeconds(20), neutral()),
        message(2, Role.USER, T0.plusSeconds(40),
            labels("Positive", Polarity.POSITIVE, List.of(), Signal.CLOSING_AFFIRMATION, Signal.ABANDONMENT)));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(CompletionStatus.ABANDONED, quality.taskCompletionStatus());
    assertEquals(2.0 / 5.0, quality.taskCompletionConfidence(), 1e-9);
  }

  @Test
  void longTrailingGapCountsAsAbandonment() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, neutral()),
        message(1, Role.ASSISTANT, T0.plusSeconds(10), neutral()),
        message(2, Role.USER, T0.plus(Duration.ofHours(2)), neutral()));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(1, quality.longGaps());
    assertEquals(CompletionStatus.ABANDONED, quality.taskCompletionStatus());
  }

  @Test
  void noSignalsLeavesConversationInProgress() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, neutral()),
        message(1, Role.ASSISTANT, T0.plusSeconds(10), neutral()));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(CompletionStatus.IN_PROGRESS, quality.taskCompletionStatus());
    assertEquals(0.0, quality.taskCompletionConfidence());
  }

  @Test
  void negativeHighSeverityConversationIsConfrontational() {
    LabelSet hostile = labels("Very Negative", Polarity.NEGATIVE, List.of(HALLUCINATION));
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, hostile),
        message(1, Role.ASSISTANT, T0.plusSeconds(10), neutral()),
        message(2, Role.USER, T0.plusSeconds(20), hostile),
        message(3, Role.ASSISTANT, T0.plusSeconds(30), neutral()));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(CollaborationQuality.CONFRONTATIONAL, quality.collaborationQuality());
  }

  @Test
  void frequentFailuresLowerCollaboration() {
    LabelSet failing = labels("Neutral", Polarity.NEUTRAL, List.of(MISUNDERSTANDING, HALLUCINATION));
    List<AnalyzedMessage> messages = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      messages.add(message(i, i % 2 == 0 ? Role.USER : Role.ASSISTANT, T0.plusSeconds(i * 10L), failing));
    }

    // density 2.0 alone puts the weighted score at 1.0
    assertEquals(CollaborationQuality.LOW, analyzer.analyze(messages).collaborationQuality());
  }

  @Test
  void assistantAnswersAreLabelledFromTheNextUserReaction() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0, neutral()),
        message(1, Role.ASSISTANT, T0.plusSeconds(10), neutral()),
        message(2, Role.USER, T0.plusSeconds(20), labels("Positive", Polarity.POSITIVE, List.of(),
            Signal.RESPONSE_ACCEPTED, Signal.RESPONSE_PRAISED)),
        message(3, Role.ASSISTANT, T0.plusSeconds(30), neutral()),
        message(4, Role.USER, T0.plusSeconds(40), labels("Negative", Polarity.NEGATIVE, List.of(),
            Signal.RESPONSE_REJECTED)),
        message(5, Role.ASSISTANT, T0.plusSeconds(50), neutral()),
        message(6, Role.ASSISTANT, T0.plusSeconds(60), neutral()));

    ConversationQuality quality = analyzer.analyze(messages);

    assertEquals(List.of(
        new ResponseAssessment(1, ResponseEffectiveness.HIGHLY_EFFECTIVE, 0.5),
        new ResponseAssessment(3, ResponseEffectiveness.INEFFECTIVE, 1.0),
        ResponseAssessment.unknown(5),
        ResponseAssessment.unknown(6)), quality.responses());
    assertEquals(Optional.empty(), quality.response(0));
    assertEquals(Map.of(
        ResponseEffectiveness.HIGHLY_EFFECTIVE, 1,
        ResponseEffectiveness.INEFFECTIVE, 1,
        ResponseEffectiveness.UNKNOWN, 2), quality.effectivenessCounts());
  }

  @Test
  void userMessageWithoutReactionLeavesAnswerUnknown() {
    ResponseAssessment assessment = ConversationQualityAnalyzer.assess(
        7, message(8, Role.USER, T0, labels("Questioning", Polarity.NEUTRAL, List.of(), Signal.QUESTION)));

    assertEquals(ResponseEffectiveness.UNKNOWN, assessment.effectiveness());
    assertEquals(0.0, assessment.confidence());
    assertEquals(7, assessment.messageIndex());
  }

  @Test
  void clarificationToolUseAndLengthsAreCountedPerRole() {
    List<AnalyzedMessage> messages = List.of(
        message(0, Role.USER, T0,
            labels("Questioning", Polarity.NEUTRAL, List.of(), Signal.CLARIFICATION_REQUEST), 10),
        message(1, Role.ASSISTANT, T0.plusSeconds(10),
            labels("Neutral", Polarity.NEUTRAL, List.of(), Signal.TOOL_USE), 100),
        message(2, Role.USER, T0.plusSeconds(20), neutral(), 30),
        message(3, Role.ASSISTANT, T0.plusSeconds(30),
            labels("Neutral", Polarity.NEUTRAL, List.of(), Signal.CLARIFICATION_REQUEST), 50));

    ConversationQuality quality = analyzer.analyze(messages);

    // clarification only counts for the user, tool use only for the assistant
    assertEquals(1, quality.clarificationRequests());
    assertEquals(1, quality.assistantToolUses());
    assertEquals(20.0, quality.averageUserLength(), 1e-9);
    assertEquals(75.0, quality.averageAssistantLength(), 1e-9);
  }

  @Test
  void userOnlyConversationHasNoAssistantLength() {
    ConversationQuality quality = analyzer.analyze(List.of(message(0, Role.USER, T0, neutral(), 12)));

    assertEquals(12.0, quality.averageUserLength(), 1e-9);
    assertEquals(0.0, quality.averageAssistantLength());
    assertEquals(List.of(), quality.responses());
  }

  @Test
  void settingsRejectInvertedCeilings() {
    QualitySettings defaults = QualitySettings.defaults();
    assertThrows(IllegalArgumentException.class, () -> new QualitySettings(
        defaults.quickResponse(), defaults.longGap(), defaults.abandonGap(), defaults.tailWindow(),
        0.5, 0.2,
        defaults.failureWeight(), defaults.negativeWeight(), defaults.interruptionWeight(),
        defaults.confrontationalNegativeRate(), defaults.confrontationalHighSeverityRate()));
  }

  private static AnalyzedMessage message(int index, Role role, Instant at, LabelSet labels) {
    return message(index, role, at, labels, 4);
  }

  private static AnalyzedMessage message(int index, Role role, Instant at, LabelSet labels, int length) {
    RedactedMessage redacted = new RedactedMessage("conv", index, role, at, "text", length, 1, Set.of());
    return new AnalyzedMessage(redacted, labels);
  }

  private static LabelSet neutral() {
    return labels("Neutral", Polarity.NEUTRAL, List.of());
  }

  private static LabelSet labels(String sentiment, Polarity polarity, List<FailureMatch> failures, Signal... signals) {
    Set<Signal> set = signals.length == 0 ? EnumSet.noneOf(Signal.class) : EnumSet.copyOf(Arrays.asList(signals));
    return new LabelSet(Set.of(), sentiment, polarity, failures, set);
  }
}
