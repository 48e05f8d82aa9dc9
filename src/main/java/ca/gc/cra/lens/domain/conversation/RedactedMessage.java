package ca.gc.cra.lens.domain.conversation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Output of the privacy stage: loader metadata plus redacted text, with the raw text dropped.
 *
 * @param conversationId identifier of the owning conversation
 * @param index zero-based position within the conversation
 * @param role speaker
 * @param timestamp message instant
 * @param redactedText text with PII replaced; equals the raw text when privacy is disabled
 * @param contentLength length of the original text
 * @param wordCount word count of the original text
 * @param piiKinds names of the PII kinds redacted in this message, in table order
 * @since 0.1.0
 */
public record RedactedMessage(
    String conversationId,
    int index,
    Role role,
    Instant timestamp,
    String redactedText,
    int contentLength,
    int wordCount,
    Set<String> piiKinds) {

  public RedactedMessage {
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(redactedText, "redactedText");
    piiKinds = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(piiKinds, "piiKinds")));
  }

  /**
   * Builds the redacted view of a loaded message.
   *
   * @param source loaded message
   * @param redactedText redacted text
   * @param piiKinds kinds redacted
   * @return redacted message carrying the loader metadata
   */
  public static RedactedMessage from(Message source, String redactedText, Set<String> piiKinds) {
    return new RedactedMessage(
        source.conversationId(),
        source.index(),
        source.role(),
        source.timestamp(),
        redactedText,
        source.contentLength(),
        source.wordCount(),
        piiKinds);
  }
}
