package ca.gc.cra.lens.domain.conversation;

import java.util.Locale;
import java.util.Optional;

/**
 * Speaker of a conversation turn.
 *
 * @since 0.1.0
 */
public enum Role {
  /** Human participant. */
  USER("user"),
  /** Model participant. */
  ASSISTANT("assistant");

  private final String label;

  Role(String label) {
    this.label = label;
  }

  /**
   * Returns the lowercase label written to output records.
   *
   * @return wire label such as {@code user}
   */
  public String label() {
    return label;
  }

  /**
   * Normalizes an export role label.
   *
   * <p>Exports label speakers inconsistently ({@code human}, {@code bot}, {@code claude}); all known aliases
   * collapse onto the two roles. Unknown labels yield an empty result so the loader can reject the message.
   *
   * @param raw role label from the export; may be {@code null}
   * @return normalized role when recognized
   */
  public static Optional<Role> fromLabel(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "user", "human" -> Optional.of(USER);
      case "assistant", "bot", "ai", "model", "claude" -> Optional.of(ASSISTANT);
      default -> Optional.empty();
    };
  }
}
