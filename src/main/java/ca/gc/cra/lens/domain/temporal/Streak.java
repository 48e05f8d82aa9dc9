package ca.gc.cra.lens.domain.temporal;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Run of consecutive calendar days with at least one message.
 *
 * @param start first active day
 * @param end last active day, inclusive
 * @param days number of days in the run
 * @since 0.1.0
 */
public record Streak(LocalDate start, LocalDate end, int days) {
  public Streak {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (days < 1) {
      throw new IllegalArgumentException("days must be positive");
    }
  }
}
