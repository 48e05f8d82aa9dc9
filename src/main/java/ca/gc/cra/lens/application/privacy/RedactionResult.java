package ca.gc.cra.lens.application.privacy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Redacted text plus the kinds that were replaced.
 *
 * @param text redacted text
 * @param kinds kind names in order of first replacement
 * @param replacements number of spans replaced across all passes
 * @since 0.1.0
 */
public record RedactionResult(String text, Set<String> kinds, int replacements) {
  public RedactionResult {
    Objects.requireNonNull(text, "text");
    kinds = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(kinds, "kinds")));
  }

  static RedactionResult unchanged(String text) {
    return new RedactionResult(text, Set.of(), 0);
  }
}
