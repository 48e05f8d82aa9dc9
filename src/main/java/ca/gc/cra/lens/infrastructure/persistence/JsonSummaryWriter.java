package ca.gc.cra.lens.infrastructure.persistence;

import ca.gc.cra.lens.application.port.SummaryWriterPort;
import ca.gc.cra.lens.application.summary.CorpusStatistics;
import ca.gc.cra.lens.domain.temporal.DailyActivity;
import ca.gc.cra.lens.domain.temporal.MonthlyQuality;
import ca.gc.cra.lens.domain.temporal.Streak;
import ca.gc.cra.lens.domain.temporal.TemporalProfile;
import ca.gc.cra.lens.domain.temporal.TrendShift;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@code summary.json}: effective settings, corpus statistics, and the temporal profile.
 *
 * @since 0.1.0
 */
public final class JsonSummaryWriter implements SummaryWriterPort {
  private static final Logger log = LoggerFactory.getLogger(JsonSummaryWriter.class);

  public static final String FILE_NAME = "summary.json";

  private final Path outputDirectory;
  private final JsonFactory factory = new JsonFactory();

  public JsonSummaryWriter(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  @Override
  public void write(CorpusStatistics statistics, Optional<TemporalProfile> temporal, Map<String, Object> settings)
      throws IOException {
    Objects.requireNonNull(statistics, "statistics");
    Objects.requireNonNull(temporal, "temporal");
    Files.createDirectories(outputDirectory);
    Path file = outputDirectory.resolve(FILE_NAME);
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
         JsonGenerator gen = factory.createGenerator(writer)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeFieldName("settings");
      writeObject(gen, settings == null ? Map.of() : settings);
      gen.writeFieldName("statistics");
      writeStatistics(gen, statistics);
      if (temporal.isPresent()) {
        gen.writeFieldName("temporal");
        writeTemporal(gen, temporal.get());
      }
      gen.writeEndObject();
    }
    log.info("Wrote summary to {}", file);
  }

  private static void writeStatistics(JsonGenerator gen, CorpusStatistics stats) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("conversations", stats.conversations());
    gen.writeNumberField("messages", stats.messages());
    gen.writeNumberField("userMessages", stats.userMessages());
    gen.writeNumberField("assistantMessages", stats.assistantMessages());
    gen.writeNumberField("averageLength", stats.averageLength());
    gen.writeNumberField("averageWords", stats.averageWords());
    gen.writeNumberField("messagesWithFailures", stats.messagesWithFailures());
    gen.writeNumberField("failureRate", stats.failureRate());
    writeCounts(gen, "topics", stats.topics());
    writeCounts(gen, "sentiments", stats.sentiments());
    writeCounts(gen, "failureTypes", stats.failureTypes());
    writeCounts(gen, "piiKinds", stats.piiKinds());
    writeCounts(gen, "collaborationQuality", stats.collaboration());
    writeCounts(gen, "taskCompletion", stats.completion());
    writeCounts(gen, "responseEffectiveness", stats.responseEffectiveness());
    gen.writeEndObject();
  }

  private static void writeTemporal(JsonGenerator gen, TemporalProfile profile) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("firstMessage", profile.firstMessage() == null ? null : profile.firstMessage().toString());
    gen.writeStringField("lastMessage", profile.lastMessage() == null ? null : profile.lastMessage().toString());

    gen.writeArrayFieldStart("hourWeekdayHistogram");
    for (int[] row : profile.histogram()) {
      gen.writeArray(row, 0, row.length);
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("peakHours");
    for (int hour : profile.peakHours()) {
      gen.writeNumber(hour);
    }
    gen.writeEndArray();

    gen.writeObjectFieldStart("busiestDays");
    for (Map.Entry<DayOfWeek, Integer> day : profile.busiestDays().entrySet()) {
      gen.writeNumberField(day.getKey().name(), day.getValue());
    }
    gen.writeEndObject();

    gen.writeNumberField("longestStreakDays", profile.longestStreakDays());
    gen.writeArrayFieldStart("streaks");
    for (Streak streak : profile.streaks()) {
      gen.writeStartObject();
      gen.writeStringField("start", streak.start().toString());
      gen.writeStringField("end", streak.end().toString());
      gen.writeNumberField("days", streak.days());
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("trendShifts");
    for (TrendShift shift : profile.trendShifts()) {
      gen.writeStartObject();
      gen.writeStringField("metric", shift.metric().name());
      gen.writeNumberField("position", shift.position());
      gen.writeStringField("timestamp", shift.timestamp().toString());
      gen.writeNumberField("previousMean", shift.previousMean());
      gen.writeNumberField("currentMean", shift.currentMean());
      gen.writeNumberField("deviations", shift.deviations());
      gen.writeStringField("direction", shift.increasing() ? "up" : "down");
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("dailyActivity");
    for (DailyActivity day : profile.dailyActivity()) {
      gen.writeStartObject();
      gen.writeStringField("date", day.date().toString());
      gen.writeNumberField("messages", day.messages());
      gen.writeNumberField("conversations", day.conversations());
      gen.writeNumberField("averageWords", day.averageWords());
      gen.writeNumberField("engagementScore", day.engagementScore());
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeObjectFieldStart("monthlyTopics");
    for (Map.Entry<String, Map<String, Integer>> month : profile.monthlyTopics().entrySet()) {
      writeCounts(gen, month.getKey(), month.getValue());
    }
    gen.writeEndObject();

    gen.writeArrayFieldStart("monthlyQuality");
    for (MonthlyQuality month : profile.monthlyQuality()) {
      gen.writeStartObject();
      gen.writeStringField("month", month.month());
      gen.writeNumberField("messages", month.messages());
      gen.writeObjectFieldStart("sentimentShare");
      for (Map.Entry<String, Double> share : month.sentimentShare().entrySet()) {
        gen.writeNumberField(share.getKey(), share.getValue());
      }
      gen.writeEndObject();
      gen.writeNumberField("positiveRatio", month.positiveRatio());
      gen.writeNumberField("failureRate", month.failureRate());
      gen.writeNumberField("meanWords", month.meanWords());
      gen.writeNumberField("medianWords", month.medianWords());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeCounts(JsonGenerator gen, String field, Map<String, Integer> counts) throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private static void writeObject(JsonGenerator gen, Map<String, Object> values) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      gen.writeFieldName(entry.getKey());
      writeScalar(gen, entry.getValue());
    }
    gen.writeEndObject();
  }

  private static void writeScalar(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else if (value instanceof Collection<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeScalar(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }
}
