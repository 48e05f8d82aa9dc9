package ca.gc.cra.lens.infrastructure.persistence;

import ca.gc.cra.lens.application.port.RecordSinkPort;
import ca.gc.cra.lens.domain.analysis.AnalysisRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes {@link AnalysisRecord}s as newline-delimited JSON.
 * <p><strong>Role:</strong> File adapter for {@link RecordSinkPort}.</p>
 * <p><strong>Thread-safety:</strong> Synchronized; the pipeline writes from one thread but tests may not.</p>
 * <p><strong>Observability:</strong> Logs the file location and row count on close.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRecordSinkAdapter implements RecordSinkPort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonRecordSinkAdapter.class);

  /** File name used inside the output directory. */
  public static final String FILE_NAME = "records.ndjson";

  private final Path file;
  private final JsonGenerator generator;
  private long rows;
  private boolean closed;

  /**
   * Opens {@code records.ndjson} in the output directory, replacing any previous file.
   *
   * @param outputDirectory directory to write into; created when missing
   * @throws IOException when the file cannot be opened
   */
  public NdjsonRecordSinkAdapter(Path outputDirectory) throws IOException {
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Files.createDirectories(outputDirectory);
    this.file = outputDirectory.resolve(FILE_NAME);
    Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    // one record per line; the newline is written explicitly after each object
    this.generator = new JsonFactory().setRootValueSeparator(null).createGenerator(writer);
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized void persist(AnalysisRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    if (closed) {
      throw new IllegalStateException("Sink already closed: " + file);
    }
    generator.writeStartObject();
    generator.writeStringField("conversationId", record.conversationId());
    generator.writeStringField("conversationName", record.conversationName());
    generator.writeNumberField("messageIndex", record.messageIndex());
    generator.writeStringField("timestamp", record.timestamp().toString());
    generator.writeStringField("role", record.role());
    generator.writeStringField("model", record.model());
    generator.writeStringField("contentPreview", record.contentPreview());
    generator.writeNumberField("contentLength", record.contentLength());
    generator.writeNumberField("wordCount", record.wordCount());
    writeStrings("topics", record.topics());
    generator.writeNumberField("topicCount", record.topicCount());
    generator.writeStringField("sentiment", record.sentiment());
    generator.writeBooleanField("hasFailure", record.hasFailure());
    writeStrings("failureTypes", record.failureTypes());
    generator.writeNumberField("failureCount", record.failureCount());
    writeStrings("failureSeverities", record.failureSeverities());
    generator.writeStringField("maxFailureSeverity", record.maxFailureSeverity());
    writeStrings("piiKinds", record.piiKinds());
    generator.writeStringField("collaborationQuality", record.collaborationQuality());
    generator.writeStringField("taskCompletionStatus", record.taskCompletionStatus());
    writeNullableNumber("taskCompletionConfidence", record.taskCompletionConfidence());
    writeNullableNumber("turnCount", record.turnCount());
    writeNullableNumber("questionCount", record.questionCount());
    writeNullableNumber("codeBlockCount", record.codeBlockCount());
    writeNullableNumber("flowInterruptions", record.flowInterruptions());
    writeNullableNumber("quickResponseCount", record.quickResponseCount());
    generator.writeStringField("responseEffectiveness", record.responseEffectiveness());
    writeNullableNumber("responseEffectivenessConfidence", record.responseEffectivenessConfidence());
    writeNullableNumber("clarificationRequests", record.clarificationRequests());
    writeNullableNumber("assistantToolUses", record.assistantToolUses());
    writeNullableNumber("averageUserLength", record.averageUserLength());
    writeNullableNumber("averageAssistantLength", record.averageAssistantLength());
    generator.writeEndObject();
    generator.writeRaw('\n');
    rows++;
  }

  @Override
  public synchronized void flush() throws IOException {
    if (!closed) {
      generator.flush();
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    IOException failure = null;
    try {
      generator.flush();
    } catch (IOException ex) {
      failure = ex;
    }
    try {
      generator.close();
    } catch (IOException ex) {
      if (failure == null) {
        failure = ex;
      } else {
        failure.addSuppressed(ex);
      }
    }
    if (failure != null) {
      log.error("Failed to close record sink {}", file, failure);
      throw failure;
    }
    log.info("Wrote {} records to {}", rows, file);
  }

  private void writeStrings(String field, List<String> values) throws IOException {
    generator.writeArrayFieldStart(field);
    for (String value : values) {
      generator.writeString(value);
    }
    generator.writeEndArray();
  }

  private void writeNullableNumber(String field, Number value) throws IOException {
    if (value == null) {
      generator.writeNullField(field);
    } else if (value instanceof Double d) {
      generator.writeNumberField(field, d);
    } else {
      generator.writeNumberField(field, value.intValue());
    }
  }
}
