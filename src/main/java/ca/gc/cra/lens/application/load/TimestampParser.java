package ca.gc.cra.lens.application.load;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses export timestamps given as ISO-8601 text or epoch seconds.
 *
 * <p>Accepted forms: epoch seconds (number or numeric string, fraction allowed), ISO date-times with an
 * offset or {@code Z}, and ISO local date-times, which are taken as UTC. Anything else is reported as
 * unparsable rather than guessed.
 *
 * @since 0.1.0
 */
public final class TimestampParser {
  private static final Pattern EPOCH_PATTERN = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");

  private TimestampParser() {}

  /**
   * Parses a timestamp node from the export tree.
   *
   * @param value string or number; {@code null} yields empty
   * @return parsed instant, empty when the value cannot be interpreted
   */
  public static Optional<Instant> parse(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Number number) {
      return fromEpochSeconds(number.toString());
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return Optional.empty();
    }
    if (EPOCH_PATTERN.matcher(text).matches()) {
      return fromEpochSeconds(text);
    }
    return fromIso(text);
  }

  private static Optional<Instant> fromIso(String text) {
    try {
      TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
          .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offset) {
        return Optional.of(offset.toInstant());
      }
      return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  private static Optional<Instant> fromEpochSeconds(String raw) {
    try {
      BigDecimal seconds = new BigDecimal(raw);
      BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
      long nanos = seconds.subtract(whole).movePointRight(9).longValue();
      return Optional.of(Instant.ofEpochSecond(whole.longValueExact(), nanos));
    } catch (NumberFormatException | ArithmeticException | DateTimeException ex) {
      return Optional.empty();
    }
  }
}
