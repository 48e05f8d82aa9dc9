package ca.gc.cra.lens.domain.conversation;

import java.time.Instant;
import java.util.Objects;

/**
 * A loaded message carrying its raw text.
 *
 * <p>The raw text is read only by the privacy redactor; every later stage works on
 * {@link RedactedMessage}.
 *
 * @param conversationId identifier of the owning conversation
 * @param index zero-based position within the conversation
 * @param role speaker
 * @param timestamp message instant
 * @param text raw message text as exported
 * @param contentLength length of the raw text in characters
 * @param wordCount whitespace-separated word count of the raw text
 * @since 0.1.0
 */
public record Message(
    String conversationId,
    int index,
    Role role,
    Instant timestamp,
    String text,
    int contentLength,
    int wordCount) {

  public Message {
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(text, "text");
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative");
    }
  }

  /**
   * Creates a message and derives its length metrics from the text.
   *
   * @param conversationId owning conversation id
   * @param index zero-based position
   * @param role speaker
   * @param timestamp message instant
   * @param text raw text
   * @return message with {@code contentLength} and {@code wordCount} populated
   */
  public static Message of(String conversationId, int index, Role role, Instant timestamp, String text) {
    Objects.requireNonNull(text, "text");
    return new Message(conversationId, index, role, timestamp, text, text.length(), countWords(text));
  }

  static int countWords(String text) {
    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return 0;
    }
    return trimmed.split("\\s+").length;
  }
}
