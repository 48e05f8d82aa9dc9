package ca.gc.cra.lens.config;

import ca.gc.cra.lens.application.quality.QualitySettings;
import ca.gc.cra.lens.application.temporal.TemporalSettings;
import ca.gc.cra.lens.validation.Numbers;
import ca.gc.cra.lens.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for one {@code analyze} run.
 * <p><strong>Why:</strong> Consolidates CLI keys, YAML sections, and defaults so runs stay reproducible.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param inputFile export file to analyze
 * @param outputDirectory directory receiving {@code records.ndjson} and {@code summary.json}
 * @param patternFiles custom taxonomy YAML files layered over the defaults, in order
 * @param workers size of the per-message worker pool
 * @param privacyEnabled whether PII is redacted
 * @param qualityEnabled whether conversation quality is computed
 * @param temporalEnabled whether the temporal profile is computed
 * @param visualizationEnabled whether chart generation was requested
 * @param pseudonymizeOrganizations whether organization names are pseudonymized
 * @param pseudonymSalt salt mixed into pseudonym digests; may be empty
 * @param quality quality thresholds and weights
 * @param temporal temporal analysis parameters
 * @param metricsExporter {@code none} or {@code logging}
 * @param dryRun whether to print the plan without processing
 * @since 0.1.0
 * @see ca.gc.cra.lens.application.pipeline.AnalyzeUseCase
 */
public record AnalyzeConfig(
    Path inputFile,
    Path outputDirectory,
    List<Path> patternFiles,
    int workers,
    boolean privacyEnabled,
    boolean qualityEnabled,
    boolean temporalEnabled,
    boolean visualizationEnabled,
    boolean pseudonymizeOrganizations,
    String pseudonymSalt,
    QualitySettings quality,
    TemporalSettings temporal,
    String metricsExporter,
    boolean dryRun) {

  static final int MAX_WORKERS = 256;

  public AnalyzeConfig {
    inputFile = normalizePath("in", inputFile);
    outputDirectory = normalizePath("out", outputDirectory);
    patternFiles = List.copyOf(Objects.requireNonNull(patternFiles, "patternFiles"));
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    pseudonymSalt = pseudonymSalt == null ? "" : pseudonymSalt;
    Objects.requireNonNull(quality, "quality");
    Objects.requireNonNull(temporal, "temporal");
    metricsExporter = parseExporter(metricsExporter);
  }

  /**
   * Returns a baseline configuration reading {@code ./conversations.json}.
   *
   * @return default analyze configuration
   */
  public static AnalyzeConfig defaults() {
    return new AnalyzeConfig(
        Path.of("conversations.json"),
        Path.of("lens-out"),
        List.of(),
        Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors())),
        true,
        true,
        true,
        false,
        true,
        "",
        QualitySettings.defaults(),
        TemporalSettings.defaults(),
        "none",
        false);
  }

  /**
   * Creates a configuration from flattened key/value settings.
   *
   * @param options settings such as {@code in}, {@code out}, {@code workers}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is invalid or {@code in} is missing
   */
  public static AnalyzeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    AnalyzeConfig defaults = defaults();
    QualitySettings q = defaults.quality();
    TemporalSettings t = defaults.temporal();

    Path input = parsePath("in", Strings.requireNonBlank("in", Objects.requireNonNullElse(options.get("in"), "")));
    String outRaw = options.get("out");
    Path output = outRaw == null || outRaw.isBlank() ? defaults.outputDirectory() : parsePath("out", outRaw);
    List<Path> patterns = new ArrayList<>();
    for (String entry : Strings.splitList("patterns", options.get("patterns"))) {
      patterns.add(parsePath("patterns", entry));
    }

    QualitySettings quality = new QualitySettings(
        seconds(options, "quickResponseSeconds", q.quickResponse()),
        seconds(options, "longGapSeconds", q.longGap()),
        seconds(options, "abandonGapSeconds", q.abandonGap()),
        (int) Numbers.requireRange("tailWindow",
            Numbers.parseInt("tailWindow", options.get("tailWindow"), q.tailWindow()), 1, 1_000),
        fraction(options, "qualityHighCeiling", q.highCeiling()),
        fraction(options, "qualityMediumCeiling", q.mediumCeiling()),
        fraction(options, "failureWeight", q.failureWeight()),
        fraction(options, "negativeWeight", q.negativeWeight()),
        fraction(options, "interruptionWeight", q.interruptionWeight()),
        fraction(options, "confrontationalNegativeRate", q.confrontationalNegativeRate()),
        fraction(options, "confrontationalHighSeverityRate", q.confrontationalHighSeverityRate()));

    TemporalSettings temporal = new TemporalSettings(
        parseZone(options.get("timezone"), t.zone()),
        (int) Numbers.requireRange("trendWindow",
            Numbers.parseInt("trendWindow", options.get("trendWindow"), t.trendWindow()), 1, 100_000),
        Numbers.requireRange("trendSigma",
            Numbers.parseDouble("trendSigma", options.get("trendSigma"), t.trendSigma()), 0.01, 100.0),
        Numbers.requireRange("trendStdFloor",
            Numbers.parseDouble("trendStdFloor", options.get("trendStdFloor"), t.trendStdFloor()), 0.0001, 10.0),
        (int) Numbers.requireRange("minStreakDays",
            Numbers.parseInt("minStreakDays", options.get("minStreakDays"), t.minStreakDays()), 1, 366),
        t.monthlyTopicLimit());

    return new AnalyzeConfig(
        input,
        output,
        patterns,
        Numbers.parseInt("workers", options.get("workers"), defaults.workers()),
        parseBoolean(options.get("privacyEnabled"), defaults.privacyEnabled()),
        parseBoolean(options.get("qualityEnabled"), defaults.qualityEnabled()),
        parseBoolean(options.get("temporalEnabled"), defaults.temporalEnabled()),
        parseBoolean(options.get("visualizationEnabled"), defaults.visualizationEnabled()),
        parseBoolean(options.get("pseudonymizeOrganizations"), defaults.pseudonymizeOrganizations()),
        Objects.requireNonNullElse(options.get("pseudonymSalt"), defaults.pseudonymSalt()),
        quality,
        temporal,
        Objects.requireNonNullElse(options.get("metricsExporter"), defaults.metricsExporter()),
        parseBoolean(options.get("dryRun"), defaults.dryRun()));
  }

  /**
   * Tests a feature toggle.
   *
   * @param toggle feature to test
   * @return whether the feature is on
   */
  public boolean isEnabled(FeatureToggle toggle) {
    return switch (toggle) {
      case PRIVACY -> privacyEnabled;
      case QUALITY -> qualityEnabled;
      case TEMPORAL -> temporalEnabled;
      case VISUALIZATION -> visualizationEnabled;
    };
  }

  /**
   * Returns the toggles and key thresholds recorded in the summary document.
   *
   * @return ordered settings map
   */
  public Map<String, Object> summarySettings() {
    Map<String, Object> settings = new LinkedHashMap<>();
    for (FeatureToggle toggle : FeatureToggle.values()) {
      settings.put(toggle.key(), isEnabled(toggle));
    }
    settings.put("pseudonymizeOrganizations", pseudonymizeOrganizations);
    settings.put("pseudonymSalted", !pseudonymSalt.isEmpty());
    settings.put("timezone", temporal.zone().getId());
    settings.put("patterns", patternFiles.stream().map(Path::toString).toList());
    return settings;
  }

  private static Duration seconds(Map<String, String> options, String key, Duration fallback) {
    long value = Numbers.parseInt(key, options.get(key), (int) fallback.toSeconds());
    return Duration.ofSeconds(Numbers.requireRange(key, value, 0, 31L * 24 * 3600));
  }

  private static double fraction(Map<String, String> options, String key, double fallback) {
    return Numbers.requireRange(key, Numbers.parseDouble(key, options.get(key), fallback), 0.0, 1.0);
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static ZoneId parseZone(String value, ZoneId fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return ZoneId.of(value.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("timezone is not a valid zone id: " + value, ex);
    }
  }

  private static String parseExporter(String value) {
    String normalized = value == null || value.isBlank() ? "none" : value.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("none") && !normalized.equals("logging")) {
      throw new IllegalArgumentException("metricsExporter must be none or logging (was " + value + ")");
    }
    return normalized;
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}
