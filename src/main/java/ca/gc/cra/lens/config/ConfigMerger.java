package ca.gc.cra.lens.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Layers command settings: embedded defaults, then the YAML file, then CLI arguments.
 *
 * <p>A {@code null} CLI value leaves the lower layer in place. Cross-key checks that only make sense on the
 * merged result live here; per-value parsing is left to {@link AnalyzeConfig}.
 */
public final class ConfigMerger {
  private static final Set<String> EXPORTERS = Set.of("none", "logging");

  private ConfigMerger() {}

  /**
   * Builds the effective settings map.
   *
   * @param command active subcommand
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be {@code null})
   * @param defaults embedded defaults for the command (may be {@code null})
   * @param warn receives a note for each key the CLI takes over from YAML; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> notes = warn == null ? message -> { } : warn;
    Map<String, String> fromYaml = yaml.orElse(Map.of());

    Map<String, String> merged = new LinkedHashMap<>();
    overlay(merged, defaults);
    overlay(merged, fromYaml);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (value == null) {
          return;
        }
        if (fromYaml.containsKey(key)) {
          notes.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, value);
      });
    }

    checkMerged(command.trim().toLowerCase(Locale.ROOT), merged);
    return Map.copyOf(merged);
  }

  private static void overlay(Map<String, String> target, Map<String, String> layer) {
    if (layer != null) {
      layer.forEach((key, value) -> {
        if (value != null) {
          target.put(key, value);
        }
      });
    }
  }

  private static void checkMerged(String command, Map<String, String> merged) {
    if (command.equals("analyze") && blank(merged.get("in"))) {
      throw new IllegalArgumentException("in is required for analyze");
    }
    String exporter = merged.get("metricsExporter");
    if (!blank(exporter) && !EXPORTERS.contains(exporter.trim().toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException("metricsExporter must be none or logging (was " + exporter.trim() + ")");
    }
  }

  private static boolean blank(String value) {
    return value == null || value.isBlank();
  }
}
