package ca.gc.cra.lens.domain.quality;

import java.util.Locale;

/**
 * How the user reacted to an assistant answer, read from the next user message.
 *
 * <p>Declared in tie-break order: when two levels are equally supported the earlier one wins.
 *
 * @since 0.1.0
 */
public enum ResponseEffectiveness {
  HIGHLY_EFFECTIVE,
  EFFECTIVE,
  PARTIALLY_EFFECTIVE,
  INEFFECTIVE,
  /** No following user message, or the following message carries no reaction. */
  UNKNOWN;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
