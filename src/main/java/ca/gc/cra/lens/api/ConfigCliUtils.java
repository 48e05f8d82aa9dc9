package ca.gc.cra.lens.api;

import ca.gc.cra.lens.config.ConfigMerger;
import ca.gc.cra.lens.config.DefaultsForMode;
import ca.gc.cra.lens.config.FeatureToggle;
import ca.gc.cra.lens.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Merges CLI arguments, flags, and an optional {@code config=PATH} YAML file into effective settings.
 */
final class ConfigCliUtils {
  private static final String ANALYZE = "analyze";
  private static final String DRY_RUN_FLAG = "--dry-run";

  private ConfigCliUtils() {}

  /**
   * Builds the effective settings for a subcommand.
   *
   * @param command {@code analyze} or {@code classify}
   * @param input parsed CLI input
   * @param log logger receiving override warnings
   * @return merged settings
   * @throws IllegalArgumentException when arguments, the YAML file, or merged settings are invalid
   * @throws IOException when the YAML file cannot be read
   */
  static Map<String, String> effectiveSettings(String command, CliInput input, Logger log) throws IOException {
    Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, command);
    }
    List<String> accepted = new ArrayList<>();
    for (FeatureToggle toggle : togglesFor(command)) {
      accepted.add(toggle.disableFlag());
      if (input.hasFlag(toggle.disableFlag())) {
        kv.put(toggle.key(), "false");
      }
    }
    if (ANALYZE.equals(command)) {
      accepted.add(DRY_RUN_FLAG);
      if (input.hasFlag(DRY_RUN_FLAG)) {
        kv.put("dryRun", "true");
      }
    }
    for (String flag : input.unknownFlags(accepted)) {
      log.warn("Ignoring unknown flag {} for {}", flag, command);
    }
    return ConfigMerger.buildEffectiveConfig(command, yaml, kv, DefaultsForMode.asFlatMap(command), log::warn);
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  private static Set<FeatureToggle> togglesFor(String command) {
    return ANALYZE.equals(command) ? EnumSet.allOf(FeatureToggle.class) : EnumSet.of(FeatureToggle.PRIVACY);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
