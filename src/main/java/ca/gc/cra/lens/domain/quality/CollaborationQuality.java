package ca.gc.cra.lens.domain.quality;

import java.util.Locale;

/**
 * Bucketed collaboration quality of a conversation.
 *
 * @since 0.1.0
 */
public enum CollaborationQuality {
  HIGH,
  MEDIUM,
  LOW,
  /** Negative sentiment and high-severity failures both dominate; overrides the other buckets. */
  CONFRONTATIONAL;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
