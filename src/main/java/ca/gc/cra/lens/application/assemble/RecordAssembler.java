package ca.gc.cra.lens.application.assemble;

import ca.gc.cra.lens.domain.analysis.AnalysisRecord;
import ca.gc.cra.lens.domain.analysis.AnalyzedMessage;
import ca.gc.cra.lens.domain.analysis.ConversationAnalysis;
import ca.gc.cra.lens.domain.conversation.RedactedMessage;
import ca.gc.cra.lens.domain.quality.ConversationQuality;
import ca.gc.cra.lens.domain.quality.ResponseAssessment;
import ca.gc.cra.lens.domain.taxonomy.FailureMatch;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;
import ca.gc.cra.lens.domain.taxonomy.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges redacted messages, labels, and conversation quality into flat {@link AnalysisRecord} rows.
 *
 * <p>Pure function of its input. Quality fields are duplicated onto every row of a conversation and left
 * {@code null} when quality analysis is disabled.
 *
 * @since 0.1.0
 */
public final class RecordAssembler {
  private final boolean qualityEnabled;

  /**
   * Creates an assembler.
   *
   * @param qualityEnabled whether every conversation must carry quality metrics
   */
  public RecordAssembler(boolean qualityEnabled) {
    this.qualityEnabled = qualityEnabled;
  }

  /**
   * Builds one row per message.
   *
   * @param conversation analyzed conversation
   * @return rows in message order
   * @throws InvariantViolationException when labels or quality are missing
   */
  public List<AnalysisRecord> assemble(ConversationAnalysis conversation) {
    Objects.requireNonNull(conversation, "conversation");
    ConversationQuality quality = conversation.quality().orElse(null);
    if (qualityEnabled && quality == null) {
      throw new InvariantViolationException(
          "Quality enabled but missing for conversation " + conversation.conversationId());
    }

    List<AnalysisRecord> records = new ArrayList<>(conversation.messages().size());
    for (int position = 0; position < conversation.messages().size(); position++) {
      AnalyzedMessage analyzed = conversation.messages().get(position);
      if (analyzed == null || analyzed.message() == null) {
        throw new InvariantViolationException(
            "Missing redacted message at position " + position + " of " + conversation.conversationId());
      }
      if (analyzed.labels() == null) {
        throw new InvariantViolationException("Missing labels for "
            + conversation.conversationId() + "#" + analyzed.message().index());
      }
      records.add(toRecord(conversation, analyzed.message(), analyzed.labels(), quality));
    }
    if (quality != null && quality.turnCount() != records.size()) {
      throw new InvariantViolationException("Conversation " + conversation.conversationId()
          + " has " + records.size() + " labelled messages but quality counted " + quality.turnCount());
    }
    return List.copyOf(records);
  }

  private static AnalysisRecord toRecord(
      ConversationAnalysis conversation, RedactedMessage message, LabelSet labels, ConversationQuality quality) {
    List<String> failureTypes = new ArrayList<>(labels.failureCount());
    List<String> severities = new ArrayList<>(labels.failureCount());
    for (FailureMatch failure : labels.failures()) {
      failureTypes.add(failure.kind());
      severities.add(failure.severity().label());
    }
    ResponseAssessment response = quality == null ? null : quality.response(message.index()).orElse(null);
    return new AnalysisRecord(
        conversation.conversationId(),
        conversation.conversationName(),
        message.index(),
        message.timestamp(),
        message.role().label(),
        conversation.model(),
        preview(message.redactedText()),
        message.contentLength(),
        message.wordCount(),
        List.copyOf(labels.topics()),
        labels.topicCount(),
        labels.sentiment(),
        labels.hasFailure(),
        failureTypes,
        labels.failureCount(),
        severities,
        labels.maxSeverity().map(Severity::label).orElse(AnalysisRecord.NO_SEVERITY),
        List.copyOf(message.piiKinds()),
        quality == null ? null : quality.collaborationQuality().label(),
        quality == null ? null : quality.taskCompletionStatus().label(),
        quality == null ? null : quality.taskCompletionConfidence(),
        quality == null ? null : quality.turnCount(),
        quality == null ? null : quality.questionCount(),
        quality == null ? null : quality.codeBlockCount(),
        quality == null ? null : quality.flowInterruptions(),
        quality == null ? null : quality.quickResponseCount(),
        response == null ? null : response.effectiveness().label(),
        response == null ? null : response.confidence(),
        quality == null ? null : quality.clarificationRequests(),
        quality == null ? null : quality.assistantToolUses(),
        quality == null ? null : quality.averageUserLength(),
        quality == null ? null : quality.averageAssistantLength());
  }

  static String preview(String text) {
    if (text.length() <= AnalysisRecord.PREVIEW_LIMIT) {
      return text;
    }
    int end = AnalysisRecord.PREVIEW_LIMIT;
    // never split a surrogate pair
    if (Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end);
  }
}
