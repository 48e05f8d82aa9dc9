package ca.gc.cra.lens.domain.analysis;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Flat per-message output row handed to sinks.
 * <p><strong>Why:</strong> Tabular sinks need one self-contained row per message, so conversation metrics are
 * repeated on every row of the conversation.</p>
 * <p><strong>Role:</strong> Output schema of the record assembler.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Conversation quality fields are {@code null} when quality analysis is disabled.
 *
 * @param conversationId conversation identifier
 * @param conversationName conversation display name
 * @param messageIndex zero-based index within the conversation
 * @param timestamp message instant
 * @param role {@code user} or {@code assistant}
 * @param model model name; may be {@code null}
 * @param contentPreview first {@value #PREVIEW_LIMIT} characters of the redacted text
 * @param contentLength length of the original text
 * @param wordCount word count of the original text
 * @param topics matched topics
 * @param topicCount number of matched topics
 * @param sentiment sentiment label
 * @param hasFailure whether any failure triggered
 * @param failureTypes triggered failure kinds
 * @param failureCount number of distinct failure kinds
 * @param failureSeverities severity label per failure kind, aligned with {@code failureTypes}
 * @param maxFailureSeverity highest severity label or {@value #NO_SEVERITY}
 * @param piiKinds PII kinds redacted in this message
 * @param collaborationQuality conversation collaboration quality label
 * @param taskCompletionStatus conversation task completion label
 * @param taskCompletionConfidence conversation completion confidence
 * @param turnCount conversation message count
 * @param questionCount conversation question count
 * @param codeBlockCount conversation code block count
 * @param flowInterruptions conversation flow interruptions
 * @param quickResponseCount conversation quick responses
 * @param responseEffectiveness effectiveness label of this assistant message; {@code null} for user messages
 * @param responseEffectivenessConfidence confidence of {@code responseEffectiveness}
 * @param clarificationRequests conversation clarification requests
 * @param assistantToolUses conversation assistant tool uses
 * @param averageUserLength conversation mean user message length
 * @param averageAssistantLength conversation mean assistant message length
 * @since 0.1.0
 */
public record AnalysisRecord(
    String conversationId,
    String conversationName,
    int messageIndex,
    Instant timestamp,
    String role,
    String model,
    String contentPreview,
    int contentLength,
    int wordCount,
    List<String> topics,
    int topicCount,
    String sentiment,
    boolean hasFailure,
    List<String> failureTypes,
    int failureCount,
    List<String> failureSeverities,
    String maxFailureSeverity,
    List<String> piiKinds,
    String collaborationQuality,
    String taskCompletionStatus,
    Double taskCompletionConfidence,
    Integer turnCount,
    Integer questionCount,
    Integer codeBlockCount,
    Integer flowInterruptions,
    Integer quickResponseCount,
    String responseEffectiveness,
    Double responseEffectivenessConfidence,
    Integer clarificationRequests,
    Integer assistantToolUses,
    Double averageUserLength,
    Double averageAssistantLength) {

  public static final int PREVIEW_LIMIT = 300;
  public static final String NO_SEVERITY = "none";

  public AnalysisRecord {
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(conversationName, "conversationName");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(contentPreview, "contentPreview");
    Objects.requireNonNull(sentiment, "sentiment");
    Objects.requireNonNull(maxFailureSeverity, "maxFailureSeverity");
    if (contentPreview.length() > PREVIEW_LIMIT) {
      throw new IllegalArgumentException("contentPreview exceeds " + PREVIEW_LIMIT + " characters");
    }
    topics = List.copyOf(topics);
    failureTypes = List.copyOf(failureTypes);
    failureSeverities = List.copyOf(failureSeverities);
    piiKinds = List.copyOf(piiKinds);
  }
}
