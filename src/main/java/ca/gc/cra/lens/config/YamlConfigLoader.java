package ca.gc.cra.lens.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a LENS YAML file into the flat {@code key=value} form the CLI uses.
 *
 * <p>The {@code common} section applies to every command and the section named after the command is laid over
 * it. Nested mappings become dotted keys, scalar lists are joined with commas, and {@code ${NAME}} or
 * {@code ${NAME:-fallback}} inside a scalar is replaced from the environment. Only standard YAML types are
 * constructed.
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";
  private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}");

  private YamlConfigLoader() {}

  /**
   * Loads settings for {@code command} from {@code path}.
   *
   * @param path YAML file
   * @param command command section to read, matched case-insensitively
   * @return flat settings; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed, has the wrong shape, or names an unset
   *     environment variable without a fallback
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    return load(path, command, System::getenv);
  }

  static Optional<Map<String, String>> load(Path path, String command, UnaryOperator<String> environment)
      throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(environment, "environment");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, String> settings = new LinkedHashMap<>();
    Map<?, ?> root = requireMapping(document, "top level");
    String wanted = command.trim().toLowerCase(Locale.ROOT);
    for (String name : new String[] {COMMON_SECTION, wanted}) {
      Object section = section(root, name);
      if (section != null) {
        flattenInto(settings, "", requireMapping(section, name), environment);
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Object section(Map<?, ?> root, String name) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && key.trim().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static Map<?, ?> requireMapping(Object node, String where) {
    if (node instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(where + " section must be a mapping");
  }

  private static void flattenInto(Map<String, String> settings, String prefix, Map<?, ?> node,
      UnaryOperator<String> environment) {
    node.forEach((rawKey, value) -> {
      if (!(rawKey instanceof String key)) {
        throw new IllegalArgumentException("YAML key " + rawKey + " under '" + prefix + "' is not a string");
      }
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String path = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flattenInto(settings, path, nested, environment);
      } else if (value instanceof Iterable<?> items) {
        settings.put(path, joinScalars(path, items, environment));
      } else {
        settings.put(path, value == null ? "" : interpolate(path, value.toString(), environment));
      }
    });
  }

  private static String joinScalars(String path, Iterable<?> items, UnaryOperator<String> environment) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + path + " must contain scalars");
      }
      joined.add(interpolate(path, String.valueOf(item), environment));
    }
    return joined.toString();
  }

  static String interpolate(String path, String value, UnaryOperator<String> environment) {
    if (value.indexOf("${") < 0) {
      return value;
    }
    Matcher matcher = ENV_REFERENCE.matcher(value);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String resolved = environment.apply(matcher.group(1));
      if (resolved == null) {
        resolved = matcher.group(2);
      }
      if (resolved == null) {
        throw new IllegalArgumentException(
            "Environment variable " + matcher.group(1) + " referenced by " + path + " is not set");
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(resolved));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
