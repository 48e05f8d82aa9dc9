package ca.gc.cra.lens.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lens.application.assemble.RecordAssembler;
import ca.gc.cra.lens.application.classify.TaxonomyClassifier;
import ca.gc.cra.lens.application.load.ConversationLoader;
import ca.gc.cra.lens.application.load.MalformedMessageException;
import ca.gc.cra.lens.application.port.MetricsPort;
import ca.gc.cra.lens.application.port.RecordSinkPort;
import ca.gc.cra.lens.application.port.SummaryWriterPort;
import ca.gc.cra.lens.application.privacy.PrivacyRedactor;
import ca.gc.cra.lens.application.privacy.PseudonymTable;
import ca.gc.cra.lens.application.quality.ConversationQualityAnalyzer;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy;
import ca.gc.cra.lens.application.rules.TaxonomyBuilder;
import ca.gc.cra.lens.application.temporal.TemporalAnalyzer;
import ca.gc.cra.lens.config.AnalyzeConfig;
import ca.gc.cra.lens.domain.analysis.AnalysisRecord;
import ca.gc.cra.lens.domain.analysis.ConversationAnalysis;
import ca.gc.cra.lens.domain.quality.CompletionStatus;
import ca.gc.cra.lens.infrastructure.json.JacksonExportReader;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class AnalyzeUseCaseTest {
  private static CompiledTaxonomy taxonomy;

  @TempDir Path dir;

  @BeforeAll
  static void loadDefaults() throws Exception {
    taxonomy = TaxonomyBuilder.withDefaults().build();
  }

  @Test
  void analyzesSampleExportEndToEnd() throws Exception {
    RecordingSink sink = new RecordingSink();
    RecordingMetrics metrics = new RecordingMetrics();
    AnalyzeUseCase useCase = useCase(config("/exports/sample-export.json", "2"), sink, metrics);

    AnalysisResult result = useCase.run();

    assertEquals(2, result.conversations().size());
    assertEquals(6, result.recordsWritten());
    assertEquals(6, sink.records.size());
    assertTrue(sink.closed.get());

    AnalysisRecord first = sink.records.get(0);
    assertEquals("conv-deploy", first.conversationId());
    assertEquals(0, first.messageIndex());
    assertTrue(first.contentPreview().contains("[EMAIL_REDACTED]"));
    assertFalse(first.contentPreview().contains("jane@example.com"));
    assertEquals(List.of("email"), first.piiKinds());

    assertEquals(List.of("conv-deploy", "conv-deploy", "conv-deploy",
            "conv-atlantis", "conv-atlantis", "conv-atlantis"),
        sink.records.stream().map(AnalysisRecord::conversationId).toList());

    ConversationAnalysis deploy = result.conversations().get(0);
    ConversationAnalysis atlantis = result.conversations().get(1);
    assertEquals(CompletionStatus.COMPLETED, deploy.quality().orElseThrow().taskCompletionStatus());
    assertEquals(CompletionStatus.ABANDONED, atlantis.quality().orElseThrow().taskCompletionStatus());
    assertEquals("completed", sink.records.get(2).taskCompletionStatus());
    assertEquals("highly_effective", sink.records.get(1).responseEffectiveness());
    assertEquals(0.5, sink.records.get(1).responseEffectivenessConfidence(), 1e-9);
    assertEquals("unknown", sink.records.get(4).responseEffectiveness());
    assertNull(sink.records.get(2).responseEffectiveness());

    assertTrue(result.temporal().isPresent());
    assertEquals(6, result.temporal().get().totalMessages());
    assertEquals(2, result.statistics().conversations());

    assertEquals(2L, metrics.count("analyze.conversations"));
    assertEquals(6L, metrics.count("analyze.messages"));
    assertEquals(1L, metrics.count("analyze.redactions"));
    assertTrue(metrics.count("analyze.failures") >= 1L);
    assertTrue(metrics.observed.containsKey("analyze.duration.ms"));

    assertNull(MDC.get(AnalyzeUseCase.MDC_PIPELINE));
    assertNull(MDC.get(AnalyzeUseCase.MDC_CONVERSATION));
  }

  @Test
  void disabledStagesLeaveQualityAndTemporalEmpty() throws Exception {
    RecordingSink sink = new RecordingSink();
    AnalyzeConfig config = AnalyzeConfig.fromMap(Map.of(
        "in", resource("/exports/sample-export.json").toString(),
        "out", dir.toString(),
        "qualityEnabled", "false",
        "temporalEnabled", "false",
        "privacyEnabled", "false"));
    AnalyzeUseCase useCase = new AnalyzeUseCase(
        config,
        new JacksonExportReader(),
        new ConversationLoader(),
        PrivacyRedactor.disabled(),
        new TaxonomyClassifier(taxonomy),
        new ConversationQualityAnalyzer(),
        new TemporalAnalyzer(),
        new RecordAssembler(false),
        sink,
        SummaryWriterPort.NO_OP,
        MetricsPort.NO_OP);

    AnalysisResult result = useCase.run();

    assertTrue(result.temporal().isEmpty());
    assertTrue(result.conversations().stream().allMatch(c -> c.quality().isEmpty()));
    AnalysisRecord first = sink.records.get(0);
    assertTrue(first.contentPreview().contains("jane@example.com"));
    assertTrue(first.piiKinds().isEmpty());
    assertNull(first.collaborationQuality());
    assertEquals(AnalysisRecord.NO_SEVERITY, first.maxFailureSeverity());
  }

  @Test
  void summaryReceivesStatisticsAndSettings() throws Exception {
    AtomicBoolean written = new AtomicBoolean();
    SummaryWriterPort summary = (statistics, temporal, settings) -> {
      assertEquals(6, statistics.messages());
      assertTrue(temporal.isPresent());
      assertEquals(Boolean.TRUE, settings.get("privacyEnabled"));
      written.set(true);
    };
    AnalyzeUseCase useCase = new AnalyzeUseCase(
        config("/exports/sample-export.json", "1"),
        new JacksonExportReader(),
        new ConversationLoader(),
        new PrivacyRedactor(taxonomy, new PseudonymTable(), true),
        new TaxonomyClassifier(taxonomy),
        new ConversationQualityAnalyzer(),
        new TemporalAnalyzer(),
        new RecordAssembler(true),
        new RecordingSink(),
        summary,
        MetricsPort.NO_OP);

    useCase.run();

    assertTrue(written.get());
  }

  @Test
  void malformedMessageFailsTheRunAndClosesSink() throws Exception {
    RecordingSink sink = new RecordingSink();
    AnalyzeUseCase useCase = useCase(config("/exports/missing-role-export.json", "2"), sink, new RecordingMetrics());

    assertThrows(MalformedMessageException.class, useCase::run);

    assertTrue(sink.records.isEmpty());
    assertTrue(sink.closed.get());
    assertNull(MDC.get(AnalyzeUseCase.MDC_PIPELINE));
  }

  @Test
  void messagesOfManyConversationsKeepInputOrder() throws Exception {
    AnalyzeUseCase useCase = useCase(config("/exports/sample-export.json", "4"), new RecordingSink(),
        MetricsPort.NO_OP);
    ConversationLoader loader = new ConversationLoader();
    JacksonExportReader reader = new JacksonExportReader();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<ConversationAnalysis> analyses = useCase.analyzeConversations(
          loader.load(reader.read(resource("/exports/sample-export.json"))), pool);

      for (ConversationAnalysis analysis : analyses) {
        for (int i = 0; i < analysis.messages().size(); i++) {
          assertEquals(i, analysis.messages().get(i).message().index());
          assertEquals(analysis.conversationId(), analysis.messages().get(i).message().conversationId());
        }
      }
    } finally {
      pool.shutdownNow();
    }
  }

  private AnalyzeUseCase useCase(AnalyzeConfig config, RecordSinkPort sink, MetricsPort metrics) {
    return new AnalyzeUseCase(
        config,
        new JacksonExportReader(),
        new ConversationLoader(),
        new PrivacyRedactor(taxonomy, new PseudonymTable(), true),
        new TaxonomyClassifier(taxonomy),
        new ConversationQualityAnalyzer(),
        new TemporalAnalyzer(),
        new RecordAssembler(true),
        sink,
        SummaryWriterPort.NO_OP,
        metrics);
  }

  private AnalyzeConfig config(String export, String workers) throws Exception {
    return AnalyzeConfig.fromMap(Map.of(
        "in", resource(export).toString(),
        "out", dir.toString(),
        "workers", workers));
  }

  private static Path resource(String name) throws Exception {
    return Path.of(Objects.requireNonNull(AnalyzeUseCaseTest.class.getResource(name), name).toURI());
  }

  private static final class RecordingSink implements RecordSinkPort {
    final List<AnalysisRecord> records = new CopyOnWriteArrayList<>();
    final AtomicBoolean closed = new AtomicBoolean();

    @Override
    public void persist(AnalysisRecord record) {
      records.add(record);
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }

  private static final class RecordingMetrics implements MetricsPort {
    final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    final Map<String, Long> observed = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void observe(String key, long value) {
      observed.put(key, value);
    }

    long count(String key) {
      AtomicLong counter = counters.get(key);
      return counter == null ? 0L : counter.get();
    }
  }
}
