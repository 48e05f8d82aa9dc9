package ca.gc.cra.lens.application.pipeline;

import ca.gc.cra.lens.application.assemble.RecordAssembler;
import ca.gc.cra.lens.application.classify.TaxonomyClassifier;
import ca.gc.cra.lens.application.load.ConversationLoader;
import ca.gc.cra.lens.application.port.ExportReaderPort;
import ca.gc.cra.lens.application.port.MetricsPort;
import ca.gc.cra.lens.application.port.RecordSinkPort;
import ca.gc.cra.lens.application.port.SummaryWriterPort;
import ca.gc.cra.lens.application.privacy.PrivacyRedactor;
import ca.gc.cra.lens.application.quality.ConversationQualityAnalyzer;
import ca.gc.cra.lens.application.summary.CorpusStatistics;
import ca.gc.cra.lens.application.temporal.TemporalAnalyzer;
import ca.gc.cra.lens.config.AnalyzeConfig;
import ca.gc.cra.lens.config.FeatureToggle;
import ca.gc.cra.lens.domain.analysis.AnalysisRecord;
import ca.gc.cra.lens.domain.analysis.AnalyzedMessage;
import ca.gc.cra.lens.domain.analysis.ConversationAnalysis;
import ca.gc.cra.lens.domain.conversation.Conversation;
import ca.gc.cra.lens.domain.conversation.Message;
import ca.gc.cra.lens.domain.conversation.RedactedMessage;
import ca.gc.cra.lens.domain.quality.ConversationQuality;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;
import ca.gc.cra.lens.domain.temporal.TemporalProfile;
import ca.gc.cra.lens.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs the analyze pipeline over one conversation export.
 * <p><strong>Why:</strong> Turns a raw archive into redacted, labelled rows plus corpus-level summaries.</p>
 * <p><strong>Role:</strong> Application-layer use case wiring the loader, redactor, classifier, aggregators,
 * assembler, and sinks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read and load the export sequentially.</li>
 *   <li>Redact and classify every message on a bounded worker pool.</li>
 *   <li>Join each conversation's messages before computing its quality.</li>
 *   <li>Wait for every conversation before the temporal profile.</li>
 *   <li>Assemble and persist rows, then write the summary.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once per instance.</p>
 * <p><strong>Observability:</strong> Emits {@code analyze.*} metrics and sets {@code pipeline} and
 * {@code conversationId} in the MDC. Message text is never logged.</p>
 *
 * @since 0.1.0
 */
public final class AnalyzeUseCase {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeUseCase.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  static final String MDC_PIPELINE = "pipeline";
  static final String MDC_CONVERSATION = "conversationId";

  private final AnalyzeConfig config;
  private final ExportReaderPort reader;
  private final ConversationLoader loader;
  private final PrivacyRedactor redactor;
  private final TaxonomyClassifier classifier;
  private final ConversationQualityAnalyzer qualityAnalyzer;
  private final TemporalAnalyzer temporalAnalyzer;
  private final RecordAssembler assembler;
  private final RecordSinkPort sink;
  private final SummaryWriterPort summaryWriter;
  private final MetricsPort metrics;

  /**
   * Creates an analyze use case with explicit dependencies.
   *
   * @param config run configuration; toggles decide which stages run
   * @param reader export reader
   * @param loader conversation loader
   * @param redactor privacy redactor; pass {@link PrivacyRedactor#disabled()} when privacy is off
   * @param classifier taxonomy classifier
   * @param qualityAnalyzer conversation quality analyzer
   * @param temporalAnalyzer temporal analyzer
   * @param assembler record assembler
   * @param sink record sink; closed when the run ends
   * @param summaryWriter summary writer
   * @param metrics metrics port
   */
  public AnalyzeUseCase(
      AnalyzeConfig config,
      ExportReaderPort reader,
      ConversationLoader loader,
      PrivacyRedactor redactor,
      TaxonomyClassifier classifier,
      ConversationQualityAnalyzer qualityAnalyzer,
      TemporalAnalyzer temporalAnalyzer,
      RecordAssembler assembler,
      RecordSinkPort sink,
      SummaryWriterPort summaryWriter,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.redactor = Objects.requireNonNull(redactor, "redactor");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.qualityAnalyzer = Objects.requireNonNull(qualityAnalyzer, "qualityAnalyzer");
    this.temporalAnalyzer = Objects.requireNonNull(temporalAnalyzer, "temporalAnalyzer");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.summaryWriter = Objects.requireNonNull(summaryWriter, "summaryWriter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Executes the pipeline end to end.
   *
   * @return run outcome
   * @throws Exception if reading, loading, persisting, or closing the sink fails
   */
  public AnalysisResult run() throws Exception {
    long started = System.nanoTime();
    MDC.put(MDC_PIPELINE, "analyze");
    ExecutorService pool = ExecutorFactories.newAnalysisPool(config.workers(), "lens-analyze",
        (thread, ex) -> log.error("Analyze worker {} failed", thread.getName(), ex));
    try (RecordSinkPort records = this.sink) {
      log.info("Analyze pipeline reading {} with {} workers", config.inputFile(), config.workers());
      Object tree = reader.read(config.inputFile());
      List<Conversation> conversations = loader.load(tree);

      List<ConversationAnalysis> analyses = analyzeConversations(conversations, pool);
      Optional<TemporalProfile> temporal = config.isEnabled(FeatureToggle.TEMPORAL)
          ? Optional.of(temporalAnalyzer.analyze(analyses))
          : Optional.empty();

      int written = 0;
      for (ConversationAnalysis analysis : analyses) {
        MDC.put(MDC_CONVERSATION, analysis.conversationId());
        try {
          for (AnalysisRecord record : assembler.assemble(analysis)) {
            records.persist(record);
            written++;
          }
        } finally {
          MDC.remove(MDC_CONVERSATION);
        }
      }
      records.flush();

      CorpusStatistics statistics = CorpusStatistics.compute(analyses);
      summaryWriter.write(statistics, temporal, config.summarySettings());
      if (config.isEnabled(FeatureToggle.VISUALIZATION)) {
        log.info("Visualization requested; charts are not rendered, the request is recorded in the summary");
      }

      Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
      metrics.observe("analyze.duration.ms", elapsed.toMillis());
      log.info("Analyze pipeline wrote {} records for {} conversations in {} ms",
          written, analyses.size(), elapsed.toMillis());
      return new AnalysisResult(analyses, statistics, temporal, written, elapsed);
    } catch (Exception ex) {
      log.error("Analyze pipeline failed for {}", config.inputFile(), ex);
      throw ex;
    } finally {
      shutdown(pool);
      MDC.remove(MDC_PIPELINE);
    }
  }

  /**
   * Redacts, classifies, and scores the given conversations on the supplied pool.
   *
   * <p>Every message of every conversation is submitted before any join so conversations overlap on the pool.
   *
   * @param conversations loaded conversations
   * @param pool worker pool
   * @return analyzed conversations in input order
   */
  List<ConversationAnalysis> analyzeConversations(List<Conversation> conversations, ExecutorService pool) {
    List<List<CompletableFuture<AnalyzedMessage>>> pending = new ArrayList<>(conversations.size());
    for (Conversation conversation : conversations) {
      List<CompletableFuture<AnalyzedMessage>> futures = new ArrayList<>(conversation.messages().size());
      for (Message message : conversation.messages()) {
        futures.add(CompletableFuture.supplyAsync(() -> analyzeMessage(message), pool));
      }
      pending.add(futures);
    }

    List<ConversationAnalysis> analyses = new ArrayList<>(conversations.size());
    for (int i = 0; i < conversations.size(); i++) {
      Conversation conversation = conversations.get(i);
      MDC.put(MDC_CONVERSATION, conversation.id());
      try {
        List<AnalyzedMessage> messages = join(pending.get(i));
        Optional<ConversationQuality> quality = config.isEnabled(FeatureToggle.QUALITY)
            ? Optional.of(qualityAnalyzer.analyze(messages))
            : Optional.empty();
        analyses.add(new ConversationAnalysis(
            conversation.id(),
            conversation.name(),
            conversation.model(),
            conversation.createdAt(),
            messages,
            quality));
        metrics.increment("analyze.conversations");
        log.debug("Analyzed conversation with {} messages", messages.size());
      } finally {
        MDC.remove(MDC_CONVERSATION);
      }
    }
    return analyses;
  }

  private AnalyzedMessage analyzeMessage(Message message) {
    MDC.put(MDC_CONVERSATION, message.conversationId());
    try {
      RedactedMessage redacted = redactor.redact(message);
      LabelSet labels = classifier.classify(redacted);
      metrics.increment("analyze.messages");
      for (int i = 0; i < redacted.piiKinds().size(); i++) {
        metrics.increment("analyze.redactions");
      }
      if (labels.hasFailure()) {
        metrics.increment("analyze.failures");
      }
      return new AnalyzedMessage(redacted, labels);
    } finally {
      MDC.remove(MDC_CONVERSATION);
    }
  }

  private static List<AnalyzedMessage> join(List<CompletableFuture<AnalyzedMessage>> futures) {
    try {
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw ex;
    }
    List<AnalyzedMessage> messages = new ArrayList<>(futures.size());
    for (CompletableFuture<AnalyzedMessage> future : futures) {
      messages.add(future.join());
    }
    return messages;
  }

  private void shutdown(ExecutorService pool) {
    pool.shutdown();
    boolean terminated = false;
    try {
      terminated = pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("Analyze workers active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        pool.shutdownNow();
        terminated = pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Analyze workers failed to terminate cleanly");
    }
  }
}
