package ca.gc.cra.lens.application.port;

import ca.gc.cra.lens.application.summary.CorpusStatistics;
import ca.gc.cra.lens.domain.temporal.TemporalProfile;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Writes the run-level summary document.
 *
 * @since 0.1.0
 */
public interface SummaryWriterPort {
  /**
   * Writes corpus statistics and, when computed, the temporal profile.
   *
   * @param statistics corpus statistics
   * @param temporal temporal profile; empty when temporal analysis is disabled
   * @param settings effective feature toggles recorded alongside the summary
   * @throws IOException when the summary cannot be written
   */
  void write(CorpusStatistics statistics, Optional<TemporalProfile> temporal, Map<String, Object> settings)
      throws IOException;

  SummaryWriterPort NO_OP = (statistics, temporal, settings) -> {};
}
