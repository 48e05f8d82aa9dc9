package ca.gc.cra.lens.application.load;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TimestampParserTest {

  @Test
  void parsesIsoWithZone() {
    assertEquals(Optional.of(Instant.parse("2024-03-04T09:00:00Z")),
        TimestampParser.parse("2024-03-04T09:00:00Z"));
    assertEquals(Optional.of(Instant.parse("2024-03-04T07:00:00Z")),
        TimestampParser.parse("2024-03-04T09:00:00+02:00"));
    assertEquals(Optional.of(Instant.parse("2024-03-04T09:00:00.123456Z")),
        TimestampParser.parse("2024-03-04T09:00:00.123456Z"));
  }

  @Test
  void zonelessIsoIsTreatedAsUtc() {
    assertEquals(Optional.of(Instant.parse("2024-03-04T09:00:00Z")),
        TimestampParser.parse("2024-03-04T09:00:00"));
  }

  @Test
  void parsesEpochSeconds() {
    Instant expected = Instant.parse("2024-03-04T09:00:00Z");

    assertEquals(Optional.of(expected), TimestampParser.parse(1709542800));
    assertEquals(Optional.of(expected), TimestampParser.parse(1709542800L));
    assertEquals(Optional.of(expected), TimestampParser.parse("1709542800"));
    assertEquals(Optional.of(expected.plusMillis(250)), TimestampParser.parse(1709542800.25d));
    assertEquals(Optional.of(expected.plusMillis(500)), TimestampParser.parse("1709542800.5"));
    assertEquals(Optional.of(Instant.ofEpochSecond(-2, 500_000_000)), TimestampParser.parse("-1.5"));
  }

  @Test
  void unparsableValuesAreEmpty() {
    assertEquals(Optional.empty(), TimestampParser.parse(null));
    assertEquals(Optional.empty(), TimestampParser.parse("   "));
    assertEquals(Optional.empty(), TimestampParser.parse("yesterday"));
    assertEquals(Optional.empty(), TimestampParser.parse("2024-13-40T99:00:00Z"));
  }
}
