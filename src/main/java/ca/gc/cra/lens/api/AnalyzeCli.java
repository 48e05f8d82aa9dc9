package ca.gc.cra.lens.api;

import ca.gc.cra.lens.application.load.MalformedExportException;
import ca.gc.cra.lens.application.pipeline.AnalysisResult;
import ca.gc.cra.lens.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.lens.application.rules.InvalidPatternException;
import ca.gc.cra.lens.application.summary.CorpusStatistics;
import ca.gc.cra.lens.config.AnalyzeConfig;
import ca.gc.cra.lens.config.CompositionRoot;
import ca.gc.cra.lens.config.FeatureToggle;
import ca.gc.cra.lens.infrastructure.persistence.JsonSummaryWriter;
import ca.gc.cra.lens.infrastructure.persistence.NdjsonRecordSinkAdapter;
import ca.gc.cra.lens.logging.Logs;
import ca.gc.cra.lens.logging.LoggingConfigurator;
import ca.gc.cra.lens.validation.Paths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code analyze} pipeline.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final int TOP_N = 5;
  private static final int MAX_LOGGED_ARGUMENT_BYTES = 256;
  private static final String SUMMARY_USAGE =
      "usage: analyze in=PATH [out=DIR] [patterns=A.yaml,B.yaml] [workers=N] [config=PATH] "
          + "[--no-privacy] [--no-quality] [--no-temporal] [--no-viz] [--dry-run] [metricsExporter=none|logging]";
  private static final String HELP_TEXT = """
      LENS analyze pipeline

      Usage:
        analyze in=./conversations.json out=./lens-out [options]

      Required:
        in=PATH                     Conversation export (JSON object with 'conversations' or a bare array)

      Optional:
        out=DIR                     Output directory for records.ndjson and summary.json (default ./lens-out)
        patterns=A.yaml,B.yaml      Custom taxonomy files layered over the built-in tables
        workers=N                   Worker threads for redaction and classification (default CPUs)
        config=PATH                 YAML settings with 'common' and 'analyze' sections
        pseudonymSalt=TEXT          Salt mixed into pseudonym tokens
        pseudonymizeOrganizations=true|false
        timezone=ZONE               Zone for calendar days and hours (default UTC)
        metricsExporter=none|logging
        --no-privacy                Skip PII redaction
        --no-quality                Skip conversation quality metrics
        --no-temporal               Skip the temporal profile
        --no-viz                    Record that charts were not requested
        --dry-run                   Validate settings and print the plan
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Thresholds (quickResponseSeconds, longGapSeconds, abandonGapSeconds, tailWindow, qualityHighCeiling,
      qualityMediumCeiling, failureWeight, negativeWeight, interruptionWeight, confrontationalNegativeRate,
      confrontationalHighSeverityRate, trendWindow, trendSigma, trendStdFloor, minStreakDays) accept key=value.
      """;

  private AnalyzeCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    log.info("analyze finished with {}", exit);
    System.exit(exit.code());
  }

  /**
   * Runs the analyze CLI and maps failures to exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    AnalyzeConfig config;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveSettings("analyze", input, log);
      config = AnalyzeConfig.fromMap(effective);
      Paths.requireReadableFile("in", config.inputFile());
      for (Path pattern : config.patternFiles()) {
        Paths.requireReadableFile("patterns", pattern);
      }
      Paths.requireWritableDirectory(config.outputDirectory(), !config.dryRun());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", Logs.truncate(ex.getMessage(), MAX_LOGGED_ARGUMENT_BYTES));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      AnalyzeUseCase useCase = root.analyzeUseCase();
      AnalysisResult result = useCase.run();
      printExecutiveSummary(config, result);
      return ExitCode.SUCCESS;
    } catch (MalformedExportException | InvalidPatternException ex) {
      log.error("Analyze input rejected: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Analyze configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException | UncheckedIOException ex) {
      log.error("Analyze pipeline I/O failure while processing {}", config.inputFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analyze pipeline interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in analyze pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in analyze pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(AnalyzeConfig config) {
    Map<String, Object> plan = new LinkedHashMap<>();
    plan.put("Input", config.inputFile());
    plan.put("Output directory", config.outputDirectory());
    plan.put("Pattern files", config.patternFiles().isEmpty() ? "<built-in only>" : config.patternFiles());
    plan.put("Workers", config.workers());
    for (FeatureToggle toggle : FeatureToggle.values()) {
      plan.put(toggle.label(), onOff(config.isEnabled(toggle)));
    }
    plan.put("Organizations", config.pseudonymizeOrganizations() ? "pseudonymized" : "kept");
    plan.put("Timezone", config.temporal().zone().getId());
    plan.put("Metrics exporter", config.metricsExporter());
    CliPrinter.printBlock("Analyze dry-run: no files will be produced.", plan);
    CliPrinter.println(" Re-run without --dry-run to analyze the export.");
  }

  private static void printExecutiveSummary(AnalyzeConfig config, AnalysisResult result) {
    CorpusStatistics stats = result.statistics();
    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Conversations", stats.conversations());
    rows.put("Messages", stats.messages()
        + " (user " + stats.userMessages() + ", assistant " + stats.assistantMessages() + ")");
    rows.put("Average words", String.format(Locale.ROOT, "%.1f", stats.averageWords()));
    rows.put("Failure rate", String.format(Locale.ROOT, "%.1f%% (%d messages)",
        stats.failureRate() * 100.0, stats.messagesWithFailures()));
    rows.put("Top topics", top(stats.topics()));
    rows.put("Sentiment", top(stats.sentiments()));
    rows.put("Failure types", top(stats.failureTypes()));
    if (config.isEnabled(FeatureToggle.PRIVACY)) {
      rows.put("PII redacted", top(stats.piiKinds()));
    }
    if (config.isEnabled(FeatureToggle.QUALITY)) {
      rows.put("Collaboration", top(stats.collaboration()));
      rows.put("Task completion", top(stats.completion()));
      rows.put("Response effectiveness", top(stats.responseEffectiveness()));
    }
    result.temporal().ifPresent(temporal -> {
      rows.put("Peak hours", temporal.peakHours().isEmpty() ? null : temporal.peakHours());
      rows.put("Longest streak", temporal.longestStreakDays() + " days");
      rows.put("Trend shifts", temporal.trendShifts().size());
    });
    rows.put("Records", result.recordsWritten() + " -> "
        + config.outputDirectory().resolve(NdjsonRecordSinkAdapter.FILE_NAME));
    rows.put("Summary", config.outputDirectory().resolve(JsonSummaryWriter.FILE_NAME));
    rows.put("Elapsed", result.elapsed().toMillis() + " ms");
    CliPrinter.printBlock("LENS analysis complete", rows);
  }

  private static String top(Map<String, Integer> counts) {
    if (counts.isEmpty()) {
      return "<none>";
    }
    return counts.entrySet().stream()
        .limit(TOP_N)
        .map(e -> e.getKey() + " (" + e.getValue() + ")")
        .collect(Collectors.joining(", "));
  }

  private static String onOff(boolean enabled) {
    return enabled ? "on" : "off";
  }
}
