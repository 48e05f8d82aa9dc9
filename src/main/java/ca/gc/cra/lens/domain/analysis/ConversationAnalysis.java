package ca.gc.cra.lens.domain.analysis;

import ca.gc.cra.lens.domain.quality.ConversationQuality;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything computed for one conversation after its join point.
 *
 * @param conversationId conversation identifier
 * @param conversationName conversation display name
 * @param model model recorded by the export; may be {@code null}
 * @param createdAt conversation creation instant
 * @param messages analyzed messages in conversation order
 * @param quality conversation quality; empty when quality analysis is disabled
 * @since 0.1.0
 */
public record ConversationAnalysis(
    String conversationId,
    String conversationName,
    String model,
    Instant createdAt,
    List<AnalyzedMessage> messages,
    Optional<ConversationQuality> quality) {

  public ConversationAnalysis {
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(conversationName, "conversationName");
    Objects.requireNonNull(createdAt, "createdAt");
    messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
    quality = Objects.requireNonNullElse(quality, Optional.empty());
  }
}
