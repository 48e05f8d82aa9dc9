package ca.gc.cra.lens.domain.taxonomy;

import java.util.Objects;

/**
 * A triggered failure kind with its fixed severity.
 *
 * @param kind failure kind name such as {@code Hallucination}
 * @param severity severity registered for the kind
 * @since 0.1.0
 */
public record FailureMatch(String kind, Severity severity) {
  public FailureMatch {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(severity, "severity");
  }
}
