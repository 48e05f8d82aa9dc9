package ca.gc.cra.lens.domain.conversation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> A loaded conversation with its ordered messages.
 * <p><strong>Why:</strong> Gives every downstream stage the same immutable view of the export.</p>
 * <p><strong>Role:</strong> Domain aggregate produced by the conversation loader.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; message list is copied on construction.</p>
 *
 * @param id unique conversation identifier from the export
 * @param name display name; never blank
 * @param createdAt creation instant of the conversation
 * @param model model name recorded by the export; may be {@code null}
 * @param messages messages in chronological order
 * @since 0.1.0
 */
public record Conversation(
    String id, String name, Instant createdAt, String model, List<Message> messages) {

  public Conversation {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(createdAt, "createdAt");
    messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
  }
}
