package ca.gc.cra.lens.domain.quality;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-conversation quality and flow metrics derived from message labels.
 *
 * @param collaborationQuality bucketed collaboration quality
 * @param taskCompletionStatus inferred task outcome
 * @param taskCompletionConfidence agreement score in {@code [0, 1]}
 * @param completionSignals number of signals supporting {@code taskCompletionStatus}
 * @param turnCount number of messages
 * @param questionCount user messages that ask a question
 * @param codeBlockCount assistant messages containing fenced code
 * @param flowInterruptions adjacent pairs sharing a role
 * @param quickResponseCount adjacent alternating pairs answered under the quick-response window
 * @param monologues adjacent assistant/assistant pairs
 * @param longGaps adjacent pairs separated by more than the long-gap window
 * @param clarificationRequests user messages asking for an explanation
 * @param assistantToolUses assistant messages reporting a search or computation
 * @param averageUserLength mean original length of user messages; {@code 0} without user messages
 * @param averageAssistantLength mean original length of assistant messages; {@code 0} without any
 * @param responses one assessment per assistant message, in message order
 * @since 0.1.0
 */
public record ConversationQuality(
    CollaborationQuality collaborationQuality,
    CompletionStatus taskCompletionStatus,
    double taskCompletionConfidence,
    int completionSignals,
    int turnCount,
    int questionCount,
    int codeBlockCount,
    int flowInterruptions,
    int quickResponseCount,
    int monologues,
    int longGaps,
    int clarificationRequests,
    int assistantToolUses,
    double averageUserLength,
    double averageAssistantLength,
    List<ResponseAssessment> responses) {

  public ConversationQuality {
    Objects.requireNonNull(collaborationQuality, "collaborationQuality");
    Objects.requireNonNull(taskCompletionStatus, "taskCompletionStatus");
    if (Double.isNaN(taskCompletionConfidence)
        || taskCompletionConfidence < 0.0
        || taskCompletionConfidence > 1.0) {
      throw new IllegalArgumentException(
          "taskCompletionConfidence must be within [0, 1] (was " + taskCompletionConfidence + ")");
    }
    responses = List.copyOf(responses);
  }

  /**
   * Returns the assessment of one assistant message.
   *
   * @param messageIndex message index within the conversation
   * @return assessment, empty for user messages
   */
  public Optional<ResponseAssessment> response(int messageIndex) {
    for (ResponseAssessment response : responses) {
      if (response.messageIndex() == messageIndex) {
        return Optional.of(response);
      }
    }
    return Optional.empty();
  }

  /** Number of assistant messages per effectiveness level; levels without messages are omitted. */
  public Map<ResponseEffectiveness, Integer> effectivenessCounts() {
    Map<ResponseEffectiveness, Integer> counts = new EnumMap<>(ResponseEffectiveness.class);
    responses.forEach(r -> counts.merge(r.effectiveness(), 1, Integer::sum));
    return counts;
  }
}
