package ca.gc.cra.lens.domain.quality;

import java.util.Locale;

/**
 * Inferred outcome of the task discussed in a conversation.
 *
 * @since 0.1.0
 */
public enum CompletionStatus {
  COMPLETED,
  IN_PROGRESS,
  ABANDONED,
  BLOCKED;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
