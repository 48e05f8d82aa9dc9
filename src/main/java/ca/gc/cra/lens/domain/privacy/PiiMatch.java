package ca.gc.cra.lens.domain.privacy;

import java.util.Objects;

/**
 * A detected PII span and the token that replaces it.
 *
 * <p>Transient; the original text of the span is never retained.
 *
 * @param kind detected kind
 * @param start inclusive start offset in the scanned text
 * @param end exclusive end offset in the scanned text
 * @param replacement placeholder or pseudonym token
 * @since 0.1.0
 */
public record PiiMatch(PiiKind kind, int start, int end, String replacement) {

  public PiiMatch {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(replacement, "replacement");
    if (start < 0 || end <= start) {
      throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }

  /**
   * Tests whether this span shares at least one character with another span.
   *
   * @param other candidate span
   * @return {@code true} when the spans overlap
   */
  public boolean overlaps(PiiMatch other) {
    return start < other.end && other.start < end;
  }
}
