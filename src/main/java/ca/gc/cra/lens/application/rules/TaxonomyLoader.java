package ca.gc.cra.lens.application.rules;

import ca.gc.cra.lens.application.rules.TaxonomyDefinitions.GroupDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads taxonomy YAML documents into uncompiled {@link TaxonomyDefinitions}.
 *
 * <p>Document layout (every section optional):
 * <pre>
 * version: 1
 * pii:        [{kind, patterns, ignoreCase?}]
 * entities:   [{kind, patterns, ignoreCase?}]
 * topics:     [{name, patterns, ignoreCase?}]
 * sentiments: [{name, polarity?, patterns, ignoreCase?}]
 * failures:   [{name, severity, patterns, ignoreCase?}]
 * signals:    [{name, patterns, ignoreCase?}]
 * </pre>
 *
 * @since 0.1.0
 */
final class TaxonomyLoader {
  private static final List<String> SECTIONS =
      List.of("pii", "entities", "topics", "sentiments", "failures", "signals");

  TaxonomyDefinitions load(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("Taxonomy file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  TaxonomyDefinitions loadResource(String resource) throws IOException {
    InputStream in = TaxonomyLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new IOException("Taxonomy resource not found on classpath: " + resource);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return parse(reader, "classpath:" + resource);
    }
  }

  TaxonomyDefinitions parse(Reader reader, String source) {
    try {
      Object rootObj = new Yaml().load(reader);
      if (rootObj == null) {
        return TaxonomyDefinitions.empty();
      }
      Map<String, Object> root = asMap(rootObj, "root");

      int version = toInt(root.get("version"), "version");
      if (version != 1) {
        throw new IllegalArgumentException("Unsupported taxonomy version " + version + " in " + source);
      }
      for (String key : root.keySet()) {
        if (!key.equals("version") && !SECTIONS.contains(key)) {
          throw new IllegalArgumentException("Unknown taxonomy section '" + key + "' in " + source);
        }
      }

      return new TaxonomyDefinitions(
          parseSection(root.get("pii"), "pii", "kind"),
          parseSection(root.get("entities"), "entities", "kind"),
          parseSection(root.get("topics"), "topics", "name"),
          parseSection(root.get("sentiments"), "sentiments", "name"),
          parseSection(root.get("failures"), "failures", "name"),
          parseSection(root.get("signals"), "signals", "name"));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse taxonomy YAML at " + source, ex);
    }
  }

  private List<GroupDefinition> parseSection(Object node, String section, String nameKey) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof Iterable<?> entries)) {
      throw new IllegalArgumentException(section + " must be a list");
    }
    List<GroupDefinition> groups = new ArrayList<>();
    Set<String> names = new LinkedHashSet<>();
    for (Object entry : entries) {
      Map<String, Object> map = asMap(entry, section + " entry");
      String name = requireString(map, nameKey, section);
      if (!names.add(name.toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException("Duplicate " + section + " entry: " + name);
      }
      List<String> patterns = parsePatterns(map.get("patterns"), section, name);
      Boolean ignoreCase = map.containsKey("ignoreCase") ? toBoolean(map.get("ignoreCase"), "ignoreCase") : null;
      groups.add(new GroupDefinition(
          name,
          patterns,
          ignoreCase,
          toOptionalString(map.get("severity")),
          toOptionalString(map.get("polarity"))));
    }
    return List.copyOf(groups);
  }

  private List<String> parsePatterns(Object node, String section, String name) {
    if (node == null) {
      throw new IllegalArgumentException(section + " entry '" + name + "' has no patterns");
    }
    List<String> patterns = new ArrayList<>();
    if (node instanceof String single) {
      patterns.add(single);
    } else if (node instanceof Iterable<?> iterable) {
      for (Object value : iterable) {
        if (value == null || value.toString().isEmpty()) {
          throw new IllegalArgumentException(section + " entry '" + name + "' contains an empty pattern");
        }
        patterns.add(value.toString());
      }
    } else {
      throw new IllegalArgumentException(section + " entry '" + name + "' patterns must be a string or list");
    }
    return List.copyOf(patterns);
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object keyObj = entry.getKey();
      if (!(keyObj instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private String requireString(Map<String, Object> map, String key, String context) {
    Object value = map.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException(context + " entry is missing required field: " + key);
    }
    return value.toString().trim();
  }

  private String toOptionalString(Object value) {
    if (value == null) {
      return null;
    }
    String str = value.toString();
    return str.isBlank() ? null : str.trim();
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }

  private boolean toBoolean(Object value, String context) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      return Boolean.parseBoolean(str.trim());
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }
}
