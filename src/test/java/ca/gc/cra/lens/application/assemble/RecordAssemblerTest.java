package ca.gc.cra.lens.application.assemble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lens.domain.analysis.AnalysisRecord;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RecordAssemblerTest {
  private static final Instant T0 = Instant.parse("2024-03-05T14:00:00Z");
  private static final ConversationQuality QUALITY = new ConversationQuality(
      CollaborationQuality.HIGH, CompletionStatus.COMPLETED, 2.0 / 3.0, 2, 2, 1, 1, 0, 1, 0, 0,
      1, 0, 30.0, 10.0, List.of(new ResponseAssessment(1, ResponseEffectiveness.EFFECTIVE, 0.5)));

  @Test
  void recordsCarryLabelsWithoutQuality() {
    LabelSet failing = new LabelSet(
        new LinkedHashSet<>(List.of("Debugging", "Infrastructure")),
        "Negative",
        Polarity.NEGATIVE,
        List.of(new FailureMatch("Accuracy Error", Severity.HIGH),
            new FailureMatch("Incomplete Response", Severity.MEDIUM)),
        Set.of());
    ConversationAnalysis conversation = conversation(Optional.empty(), failing, plain());

    List<AnalysisRecord> records = new RecordAssembler(false).assemble(conversation);

    assertEquals(2, records.size());
    AnalysisRecord first = records.get(0);
    assertEquals("conv-1", first.conversationId());
    assertEquals("Support chat", first.conversationName());
    assertEquals("claude-3-opus", first.model());
    assertEquals("user", first.role());
    assertEquals(List.of("Debugging", "Infrastructure"), first.topics());
    assertEquals(2, first.topicCount());
    assertTrue(first.hasFailure());
    assertEquals(List.of("Accuracy Error", "Incomplete Response"), first.failureTypes());
    assertEquals(List.of("high", "medium"), first.failureSeverities());
    assertEquals("high", first.maxFailureSeverity());
    assertEquals(List.of("email"), first.piiKinds());
    assertNull(first.collaborationQuality());
    assertNull(first.taskCompletionConfidence());
    assertNull(first.turnCount());

    AnalysisRecord second = records.get(1);
    assertEquals("assistant", second.role());
    assertFalse(second.hasFailure());
    assertEquals(AnalysisRecord.NO_SEVERITY, second.maxFailureSeverity());
    assertEquals(0, second.failureCount());
  }

  @Test
  void qualityIsCopiedOntoEveryRecord() {
    List<AnalysisRecord> records =
        new RecordAssembler(true).assemble(conversation(Optional.of(QUALITY), plain(), plain()));

    for (AnalysisRecord record : records) {
      assertEquals("high", record.collaborationQuality());
      assertEquals("completed", record.taskCompletionStatus());
      assertEquals(2.0 / 3.0, record.taskCompletionConfidence(), 1e-9);
      assertEquals(2, record.turnCount());
      assertEquals(1, record.questionCount());
      assertEquals(1, record.codeBlockCount());
      assertEquals(0, record.flowInterruptions());
      assertEquals(1, record.quickResponseCount());
      assertEquals(1, record.clarificationRequests());
      assertEquals(0, record.assistantToolUses());
      assertEquals(30.0, record.averageUserLength(), 1e-9);
      assertEquals(10.0, record.averageAssistantLength(), 1e-9);
    }
  }

  @Test
  void effectivenessIsOnlyCarriedByAssessedAssistantRows() {
    List<AnalysisRecord> records =
        new RecordAssembler(true).assemble(conversation(Optional.of(QUALITY), plain(), plain()));

    assertNull(records.get(0).responseEffectiveness());
    assertNull(records.get(0).responseEffectivenessConfidence());
    assertEquals("effective", records.get(1).responseEffectiveness());
    assertEquals(0.5, records.get(1).responseEffectivenessConfidence(), 1e-9);
  }

  @Test
  void missingQualityWhenEnabledIsAnInvariantViolation() {
    ConversationAnalysis conversation = conversation(Optional.empty(), plain(), plain());

    assertThrows(InvariantViolationException.class, () -> new RecordAssembler(true).assemble(conversation));
  }

  @Test
  void turnCountMismatchIsAnInvariantViolation() {
    ConversationQuality threeTurns = new ConversationQuality(
        CollaborationQuality.HIGH, CompletionStatus.COMPLETED, 0.5, 1, 3, 0, 0, 0, 0, 0, 0,
        0, 0, 0.0, 0.0, List.of());
    ConversationAnalysis conversation = conversation(Optional.of(threeTurns), plain(), plain());

    assertThrows(InvariantViolationException.class, () -> new RecordAssembler(true).assemble(conversation));
  }

  @Test
  void missingLabelsIsAnInvariantViolation() {
    ConversationAnalysis conversation = conversation(Optional.empty(), plain(), null);

    assertThrows(InvariantViolationException.class, () -> new RecordAssembler(false).assemble(conversation));
  }

  @Test
  void previewKeepsShortTextAndCapsLongText() {
    String exact = "a".repeat(AnalysisRecord.PREVIEW_LIMIT);

    assertSame(exact, RecordAssembler.preview(exact));
    assertEquals(AnalysisRecord.PREVIEW_LIMIT, RecordAssembler.preview("b".repeat(1000)).length());
    assertEquals("", RecordAssembler.preview(""));
  }

  @Test
  void previewNeverSplitsSurrogatePair() {
    String text = "a".repeat(AnalysisRecord.PREVIEW_LIMIT - 1) + "😀" + "tail";

    String preview = RecordAssembler.preview(text);

    assertEquals(AnalysisRecord.PREVIEW_LIMIT - 1, preview.length());
    assertFalse(Character.isHighSurrogate(preview.charAt(preview.length() - 1)));
  }

  private static LabelSet plain() {
    return new LabelSet(Set.of(), "Neutral", Polarity.NEUTRAL, List.of(), Set.of());
  }

  private static ConversationAnalysis conversation(
      Optional<ConversationQuality> quality, LabelSet userLabels, LabelSet assistantLabels) {
    RedactedMessage user = new RedactedMessage(
        "conv-1", 0, Role.USER, T0, "mail me at [EMAIL_REDACTED]", 30, 5, Set.of("email"));
    RedactedMessage assistant = new RedactedMessage(
        "conv-1", 1, Role.ASSISTANT, T0.plusSeconds(20), "Sure thing", 10, 2, Set.of());
    return new ConversationAnalysis("conv-1", "Support chat", "claude-3-opus", T0, List.of(
        new AnalyzedMessage(user, userLabels),
        new AnalyzedMessage(assistant, assistantLabels)), quality);
  }
}
