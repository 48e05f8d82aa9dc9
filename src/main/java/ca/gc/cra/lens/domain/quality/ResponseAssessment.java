package ca.gc.cra.lens.domain.quality;

import java.util.Objects;

/**
 * Effectiveness label for one assistant message.
 *
 * @param messageIndex index of the assessed assistant message within its conversation
 * @param effectiveness reaction level
 * @param confidence share of detected reactions supporting {@code effectiveness}, in {@code [0, 1]};
 *     {@code 0} when unknown
 * @since 0.1.0
 */
public record ResponseAssessment(int messageIndex, ResponseEffectiveness effectiveness, double confidence) {

  public ResponseAssessment {
    Objects.requireNonNull(effectiveness, "effectiveness");
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be within [0, 1] (was " + confidence + ")");
    }
  }

  public static ResponseAssessment unknown(int messageIndex) {
    return new ResponseAssessment(messageIndex, ResponseEffectiveness.UNKNOWN, 0.0);
  }
}
