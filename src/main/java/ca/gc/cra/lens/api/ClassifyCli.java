package ca.gc.cra.lens.api;

import ca.gc.cra.lens.application.classify.TaxonomyClassifier;
import ca.gc.cra.lens.application.privacy.PrivacyRedactor;
import ca.gc.cra.lens.application.privacy.PseudonymTable;
import ca.gc.cra.lens.application.privacy.RedactionResult;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy;
import ca.gc.cra.lens.application.rules.InvalidPatternException;
import ca.gc.cra.lens.application.rules.TaxonomyProvider;
import ca.gc.cra.lens.domain.taxonomy.Severity;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;
import ca.gc.cra.lens.logging.Logs;
import ca.gc.cra.lens.logging.LoggingConfigurator;
import ca.gc.cra.lens.validation.Paths;
import ca.gc.cra.lens.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redacts and classifies a single string so pattern files can be tried without an export.
 *
 * @since 0.1.0
 */
public final class ClassifyCli {
  private static final Logger log = LoggerFactory.getLogger(ClassifyCli.class);
  private static final int MAX_LOGGED_ARGUMENT_BYTES = 256;
  private static final String SUMMARY_USAGE =
      "usage: classify text=\"...\" [patterns=A.yaml,B.yaml] [pseudonymSalt=TEXT] [config=PATH] [--no-privacy]";
  private static final String HELP_TEXT = """
      LENS classify dry run

      Usage:
        classify text="Contact me at a@b.com" [options]

      Required:
        text=TEXT                   Text to redact and classify

      Optional:
        patterns=A.yaml,B.yaml      Custom taxonomy files layered over the built-in tables
        pseudonymSalt=TEXT          Salt mixed into pseudonym tokens
        pseudonymizeOrganizations=true|false
        config=PATH                 YAML settings with 'common' and 'classify' sections
        --no-privacy                Classify the raw text
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private ClassifyCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the classify CLI.
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

    String text;
    List<Path> patterns = new ArrayList<>();
    boolean privacy;
    boolean organizations;
    String salt;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveSettings("classify", input, log);
      text = Strings.requireNonBlank("text", effective.getOrDefault("text", ""));
      for (String entry : Strings.splitList("patterns", effective.get("patterns"))) {
        patterns.add(Paths.requireReadableFile("patterns", Path.of(entry)));
      }
      privacy = ConfigCliUtils.parseBoolean(effective, "privacyEnabled", true);
      organizations = ConfigCliUtils.parseBoolean(effective, "pseudonymizeOrganizations", true);
      salt = effective.getOrDefault("pseudonymSalt", "");
    } catch (IllegalArgumentException ex) {
      log.error("Invalid classify arguments: {}", Logs.truncate(ex.getMessage(), MAX_LOGGED_ARGUMENT_BYTES));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      CompiledTaxonomy taxonomy = new TaxonomyProvider().load(patterns);
      PrivacyRedactor redactor = privacy
          ? new PrivacyRedactor(taxonomy, new PseudonymTable(salt), organizations)
          : PrivacyRedactor.disabled();
      RedactionResult redacted = redactor.redactText(text);
      LabelSet labels = new TaxonomyClassifier(taxonomy).classifyText(redacted.text());
      print(redacted, labels, privacy);
      return ExitCode.SUCCESS;
    } catch (InvalidPatternException ex) {
      log.error("Pattern rejected: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Taxonomy configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read pattern files {}", patterns, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in classify", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void print(RedactionResult redacted, LabelSet labels, boolean privacy) {
    String failures = labels.failures().isEmpty()
        ? "<none>"
        : labels.failures().stream()
            .map(f -> f.kind() + " (" + f.severity().label() + ")")
            .collect(Collectors.joining(", "));
    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Redacted text", redacted.text());
    rows.put("PII kinds", privacy ? joinOrNone(redacted.kinds()) : "<privacy disabled>");
    rows.put("Topics", joinOrNone(labels.topics()));
    rows.put("Sentiment", labels.sentiment());
    rows.put("Failures", failures);
    rows.put("Max severity", labels.maxSeverity().map(Severity::label).orElse("none"));
    rows.put("Signals", joinOrNone(labels.signals()));
    CliPrinter.printBlock(null, rows);
  }

  private static String joinOrNone(Iterable<?> values) {
    List<String> parts = new ArrayList<>();
    for (Object value : values) {
      parts.add(String.valueOf(value));
    }
    return parts.isEmpty() ? "<none>" : String.join(", ", parts);
  }
}
