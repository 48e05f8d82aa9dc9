package ca.gc.cra.lens.domain.taxonomy;

import java.util.Locale;

/**
 * Text markers detected during classification so aggregation never has to re-read message text.
 *
 * @since 0.1.0
 */
public enum Signal {
  /** The message asks a question. */
  QUESTION,
  /** The message contains a fenced code block. */
  CODE_BLOCK,
  /** The message closes a task with thanks or confirmation. */
  CLOSING_AFFIRMATION,
  /** The speaker gives up on the task. */
  ABANDONMENT,
  /** The message states the task cannot proceed. */
  BLOCKER,
  /** The user asks for something to be explained again. */
  CLARIFICATION_REQUEST,
  /** The assistant reports searching, fetching, or computing something. */
  TOOL_USE,
  /** Reaction to the previous answer: it solved the problem outright. */
  RESPONSE_PRAISED,
  /** Reaction to the previous answer: it helped. */
  RESPONSE_ACCEPTED,
  /** Reaction to the previous answer: close, but something is missing. */
  RESPONSE_PARTIAL,
  /** Reaction to the previous answer: it missed the point. */
  RESPONSE_REJECTED;

  /**
   * Parses a table name such as {@code closing_affirmation}.
   *
   * @param raw signal name; case-insensitive, dashes allowed
   * @return parsed signal
   * @throws IllegalArgumentException when the name is unknown
   */
  public static Signal fromName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("signal name must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    try {
      return Signal.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown signal: " + raw, ex);
    }
  }
}
