package ca.gc.cra.lens.config;

import ca.gc.cra.lens.application.assemble.RecordAssembler;
import ca.gc.cra.lens.application.classify.TaxonomyClassifier;
import ca.gc.cra.lens.application.load.ConversationLoader;
import ca.gc.cra.lens.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.lens.application.port.MetricsPort;
import ca.gc.cra.lens.application.privacy.PrivacyRedactor;
import ca.gc.cra.lens.application.privacy.PseudonymTable;
import ca.gc.cra.lens.application.quality.ConversationQualityAnalyzer;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy;
import ca.gc.cra.lens.application.rules.TaxonomyProvider;
import ca.gc.cra.lens.application.temporal.TemporalAnalyzer;
import ca.gc.cra.lens.infrastructure.json.JacksonExportReader;
import ca.gc.cra.lens.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.lens.infrastructure.persistence.JsonSummaryWriter;
import ca.gc.cra.lens.infrastructure.persistence.NdjsonRecordSinkAdapter;
import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the analyze use case to its concrete adapters.
 * <p><strong>Why:</strong> Keeps construction in one place so the CLI only parses settings and maps exit codes.</p>
 * <p><strong>Role:</strong> Composition root spanning load, privacy, classification, aggregation, and sinks.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; build once at startup.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and flushes it on {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final AnalyzeConfig config;
  private final OpenTelemetryMetricsAdapter metrics;

  /**
   * Creates a composition root for one analyze run.
   *
   * @param config analyze configuration
   */
  public CompositionRoot(AnalyzeConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = OpenTelemetryMetricsAdapter.create(config.metricsExporter());
  }

  /**
   * Returns the metrics port shared by all stages.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Compiles the default taxonomy plus configured pattern files.
   *
   * @return sealed taxonomy
   * @throws IOException when a pattern file cannot be read
   */
  public CompiledTaxonomy taxonomy() throws IOException {
    return new TaxonomyProvider().load(config.patternFiles());
  }

  /**
   * Builds the redactor honouring the privacy and organization toggles.
   *
   * @param taxonomy compiled taxonomy
   * @return redactor with a fresh pseudonym table
   */
  public PrivacyRedactor redactor(CompiledTaxonomy taxonomy) {
    if (!config.isEnabled(FeatureToggle.PRIVACY)) {
      return PrivacyRedactor.disabled();
    }
    return new PrivacyRedactor(
        taxonomy, new PseudonymTable(config.pseudonymSalt()), config.pseudonymizeOrganizations());
  }

  /**
   * Builds the analyze use case.
   *
   * @return use case writing into {@link AnalyzeConfig#outputDirectory()}
   * @throws IOException when pattern files cannot be read or the record sink cannot be opened
   */
  public AnalyzeUseCase analyzeUseCase() throws IOException {
    CompiledTaxonomy taxonomy = taxonomy();
    return new AnalyzeUseCase(
        config,
        new JacksonExportReader(),
        new ConversationLoader(),
        redactor(taxonomy),
        new TaxonomyClassifier(taxonomy),
        new ConversationQualityAnalyzer(config.quality()),
        new TemporalAnalyzer(config.temporal()),
        new RecordAssembler(config.isEnabled(FeatureToggle.QUALITY)),
        new NdjsonRecordSinkAdapter(config.outputDirectory()),
        new JsonSummaryWriter(config.outputDirectory()),
        metrics);
  }

  @Override
  public void close() {
    metrics.forceFlush();
    metrics.close();
  }
}
