package ca.gc.cra.lens.application.pipeline;

import ca.gc.cra.lens.application.summary.CorpusStatistics;
import ca.gc.cra.lens.domain.analysis.ConversationAnalysis;
import ca.gc.cra.lens.domain.temporal.TemporalProfile;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one analyze run, used by the CLI to print the executive summary.
 *
 * @param conversations analyzed conversations in export order
 * @param statistics corpus statistics
 * @param temporal temporal profile; empty when temporal analysis is disabled
 * @param recordsWritten rows handed to the record sink
 * @param elapsed wall-clock duration of the run
 * @since 0.1.0
 */
public record AnalysisResult(
    List<ConversationAnalysis> conversations,
    CorpusStatistics statistics,
    Optional<TemporalProfile> temporal,
    int recordsWritten,
    Duration elapsed) {

  public AnalysisResult {
    conversations = List.copyOf(Objects.requireNonNull(conversations, "conversations"));
    Objects.requireNonNull(statistics, "statistics");
    temporal = Objects.requireNonNullElse(temporal, Optional.empty());
    Objects.requireNonNull(elapsed, "elapsed");
  }
}
