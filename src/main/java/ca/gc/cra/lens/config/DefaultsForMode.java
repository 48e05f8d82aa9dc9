package ca.gc.cra.lens.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each LENS subcommand.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a subcommand merged over the common defaults.
   *
   * @param mode subcommand ({@code analyze} or {@code classify})
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "analyze" -> buildAnalyzeDefaults();
      case "classify" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    AnalyzeConfig defaults = AnalyzeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("patterns", "");
    map.put("privacyEnabled", Boolean.toString(defaults.privacyEnabled()));
    map.put("pseudonymizeOrganizations", Boolean.toString(defaults.pseudonymizeOrganizations()));
    map.put("pseudonymSalt", defaults.pseudonymSalt());
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAnalyzeDefaults() {
    AnalyzeConfig defaults = AnalyzeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", defaults.outputDirectory().toString());
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("qualityEnabled", Boolean.toString(defaults.qualityEnabled()));
    map.put("temporalEnabled", Boolean.toString(defaults.temporalEnabled()));
    map.put("visualizationEnabled", Boolean.toString(defaults.visualizationEnabled()));
    map.put("quickResponseSeconds", Long.toString(defaults.quality().quickResponse().toSeconds()));
    map.put("longGapSeconds", Long.toString(defaults.quality().longGap().toSeconds()));
    map.put("abandonGapSeconds", Long.toString(defaults.quality().abandonGap().toSeconds()));
    map.put("tailWindow", Integer.toString(defaults.quality().tailWindow()));
    map.put("qualityHighCeiling", Double.toString(defaults.quality().highCeiling()));
    map.put("qualityMediumCeiling", Double.toString(defaults.quality().mediumCeiling()));
    map.put("failureWeight", Double.toString(defaults.quality().failureWeight()));
    map.put("negativeWeight", Double.toString(defaults.quality().negativeWeight()));
    map.put("interruptionWeight", Double.toString(defaults.quality().interruptionWeight()));
    map.put("confrontationalNegativeRate", Double.toString(defaults.quality().confrontationalNegativeRate()));
    map.put("confrontationalHighSeverityRate",
        Double.toString(defaults.quality().confrontationalHighSeverityRate()));
    map.put("timezone", defaults.temporal().zone().getId());
    map.put("trendWindow", Integer.toString(defaults.temporal().trendWindow()));
    map.put("trendSigma", Double.toString(defaults.temporal().trendSigma()));
    map.put("trendStdFloor", Double.toString(defaults.temporal().trendStdFloor()));
    map.put("minStreakDays", Integer.toString(defaults.temporal().minStreakDays()));
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("dryRun", "false");
    return map;
  }
}
