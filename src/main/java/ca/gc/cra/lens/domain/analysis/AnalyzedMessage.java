package ca.gc.cra.lens.domain.analysis;

import ca.gc.cra.lens.domain.conversation.RedactedMessage;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;

/**
 * A redacted message paired with its labels.
 *
 * <p>Either component may be {@code null} only when an upstream stage misbehaved; the record assembler
 * rejects such pairs.
 *
 * @param message redacted message
 * @param labels classifier output
 * @since 0.1.0
 */
public record AnalyzedMessage(RedactedMessage message, LabelSet labels) {}
