package ca.gc.cra.lens.application.rules;

import ca.gc.cra.lens.application.rules.CompiledTaxonomy.FailureRule;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.PiiRule;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.SentimentRule;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.SignalRule;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.TopicRule;
import ca.gc.cra.lens.application.rules.TaxonomyDefinitions.GroupDefinition;
import ca.gc.cra.lens.domain.privacy.PiiKind;
import ca.gc.cra.lens.domain.taxonomy.Polarity;
import ca.gc.cra.lens.domain.taxonomy.Severity;
import ca.gc.cra.lens.domain.taxonomy.Signal;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Mutable registry of PII, entity, topic, sentiment, failure, and signal patterns.
 * <p><strong>Why:</strong> Callers extend the built-in tables with their own categories without editing the
 * packaged YAML; patterns are compiled on registration so a bad table fails at startup.</p>
 * <p><strong>Role:</strong> Configuration-phase object; {@link #build()} produces the immutable
 * {@link CompiledTaxonomy} read by every worker.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep registration order; a repeated name keeps its position and gains the new patterns.</li>
 *   <li>Reject conflicting severities or polarities for an existing name.</li>
 *   <li>Refuse registrations once sealed by {@link #build()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; configure from one thread before building.</p>
 *
 * @since 0.1.0
 */
public final class TaxonomyBuilder {
  private static final Logger log = LoggerFactory.getLogger(TaxonomyBuilder.class);

  /** Classpath location of the built-in tables. */
  public static final String DEFAULT_RESOURCE = "taxonomy/default-taxonomy.yaml";

  private static final int IGNORE_CASE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private final TaxonomyLoader loader = new TaxonomyLoader();
  private final Map<String, Group> pii = new LinkedHashMap<>();
  private final Map<String, Group> entities = new LinkedHashMap<>();
  private final Map<String, Group> topics = new LinkedHashMap<>();
  private final Map<String, Group> sentiments = new LinkedHashMap<>();
  private final Map<String, Group> failures = new LinkedHashMap<>();
  private final Map<Signal, Group> signals = new LinkedHashMap<>();
  private boolean sealed;

  /** Creates a builder with empty tables. */
  public static TaxonomyBuilder empty() {
    return new TaxonomyBuilder();
  }

  /**
   * Creates a builder pre-populated with the packaged tables.
   *
   * @return builder holding the default taxonomy
   * @throws IOException when the packaged resource cannot be read
   */
  public static TaxonomyBuilder withDefaults() throws IOException {
    TaxonomyBuilder builder = new TaxonomyBuilder();
    builder.apply(builder.loader.loadResource(DEFAULT_RESOURCE));
    return builder;
  }

  /**
   * Registers every table found in a taxonomy YAML file.
   *
   * @param path taxonomy file
   * @return this builder
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is invalid
   */
  public TaxonomyBuilder load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    ensureOpen();
    apply(loader.load(path));
    log.info("Loaded taxonomy extensions from {}", path);
    return this;
  }

  public TaxonomyBuilder registerPii(String kind, List<String> patterns) {
    return registerPii(kind, patterns, true);
  }

  /**
   * Registers fixed-placeholder PII patterns.
   *
   * @param kind PII kind name
   * @param patterns regular expressions
   * @param ignoreCase whether matching ignores case
   * @return this builder
   * @throws InvalidPatternException when a pattern does not compile
   */
  public TaxonomyBuilder registerPii(String kind, List<String> patterns, boolean ignoreCase) {
    PiiKind parsed = PiiKind.of(kind);
    register(pii, "pii", parsed.name(), parsed.name(), patterns, ignoreCase, null);
    return this;
  }

  public TaxonomyBuilder registerEntity(String kind, List<String> patterns) {
    return registerEntity(kind, patterns, false);
  }

  /**
   * Registers pseudonymized entity patterns such as person or organization names.
   *
   * @param kind entity kind name
   * @param patterns regular expressions
   * @param ignoreCase whether matching ignores case
   * @return this builder
   */
  public TaxonomyBuilder registerEntity(String kind, List<String> patterns, boolean ignoreCase) {
    PiiKind parsed = PiiKind.of(kind);
    register(entities, "entities", parsed.name(), parsed.name(), patterns, ignoreCase, null);
    return this;
  }

  public TaxonomyBuilder registerTopic(String name, List<String> patterns) {
    register(topics, "topics", requireName(name), name.trim(), patterns, true, null);
    return this;
  }

  /**
   * Registers a sentiment category. New categories join the end of the priority order, except that
   * {@value CompiledTaxonomy#FALLBACK_SENTIMENT} is always evaluated last.
   *
   * @param name category name
   * @param polarity category direction
   * @param patterns regular expressions
   * @return this builder
   * @throws IllegalArgumentException when the name exists with a different polarity
   */
  public TaxonomyBuilder registerSentiment(String name, Polarity polarity, List<String> patterns) {
    Objects.requireNonNull(polarity, "polarity");
    register(sentiments, "sentiments", requireName(name), name.trim(), patterns, true, polarity);
    return this;
  }

  /**
   * Registers a failure kind.
   *
   * @param name failure kind name
   * @param severity fixed severity of the kind
   * @param patterns regular expressions
   * @return this builder
   * @throws IllegalArgumentException when the name exists with a different severity
   */
  public TaxonomyBuilder registerFailure(String name, Severity severity, List<String> patterns) {
    Objects.requireNonNull(severity, "severity");
    register(failures, "failures", requireName(name), name.trim(), patterns, true, severity);
    return this;
  }

  public TaxonomyBuilder registerSignal(Signal signal, List<String> patterns) {
    Objects.requireNonNull(signal, "signal");
    register(signals, "signals", signal, signal.name(), patterns, true, null);
    return this;
  }

  /**
   * Seals the builder and returns the compiled tables.
   *
   * @return immutable taxonomy
   * @throws IllegalStateException when already built
   */
  public CompiledTaxonomy build() {
    ensureOpen();
    sealed = true;
    List<PiiRule> piiRules = new ArrayList<>(pii.size());
    pii.values().forEach(g -> piiRules.add(new PiiRule(PiiKind.of(g.name), g.patterns)));
    List<PiiRule> entityRules = new ArrayList<>(entities.size());
    entities.values().forEach(g -> entityRules.add(new PiiRule(PiiKind.of(g.name), g.patterns)));
    List<TopicRule> topicRules = new ArrayList<>(topics.size());
    topics.values().forEach(g -> topicRules.add(new TopicRule(g.name, g.patterns)));
    List<SentimentRule> sentimentRules = new ArrayList<>(sentiments.size());
    sentiments.values().forEach(g -> sentimentRules.add(
        new SentimentRule(g.name, (Polarity) g.attribute, g.patterns)));
    sentimentRules.sort(Comparator.comparing(
        (SentimentRule rule) -> rule.name().equals(CompiledTaxonomy.FALLBACK_SENTIMENT)));
    List<FailureRule> failureRules = new ArrayList<>(failures.size());
    failures.values().forEach(g -> failureRules.add(
        new FailureRule(g.name, (Severity) g.attribute, g.patterns)));
    List<SignalRule> signalRules = new ArrayList<>(signals.size());
    signals.forEach((signal, g) -> signalRules.add(new SignalRule(signal, g.patterns)));

    CompiledTaxonomy taxonomy = new CompiledTaxonomy(
        piiRules, entityRules, topicRules, sentimentRules, failureRules, signalRules);
    log.debug("Built taxonomy: pii={} entities={} topics={} sentiments={} failures={} signals={}",
        piiRules.size(), entityRules.size(), topicRules.size(),
        sentimentRules.size(), failureRules.size(), signalRules.size());
    return taxonomy;
  }

  /** Returns {@code true} once {@link #build()} has been called. */
  public boolean isSealed() {
    return sealed;
  }

  private void apply(TaxonomyDefinitions definitions) {
    for (GroupDefinition def : definitions.pii()) {
      registerPii(def.name(), def.patterns(), flag(def.ignoreCase(), true));
    }
    for (GroupDefinition def : definitions.entities()) {
      registerEntity(def.name(), def.patterns(), flag(def.ignoreCase(), false));
    }
    for (GroupDefinition def : definitions.topics()) {
      String name = requireName(def.name());
      register(topics, "topics", name, def.name().trim(), def.patterns(), flag(def.ignoreCase(), true), null);
    }
    for (GroupDefinition def : definitions.sentiments()) {
      Polarity polarity = Polarity.fromLabel(def.polarity());
      register(sentiments, "sentiments", requireName(def.name()), def.name().trim(),
          def.patterns(), flag(def.ignoreCase(), true), polarity);
    }
    for (GroupDefinition def : definitions.failures()) {
      if (def.severity() == null) {
        throw new IllegalArgumentException("Failure kind '" + def.name() + "' is missing a severity");
      }
      register(failures, "failures", requireName(def.name()), def.name().trim(),
          def.patterns(), flag(def.ignoreCase(), true), Severity.fromLabel(def.severity()));
    }
    for (GroupDefinition def : definitions.signals()) {
      Signal signal = Signal.fromName(def.name());
      register(signals, "signals", signal, signal.name(), def.patterns(), flag(def.ignoreCase(), true), null);
    }
  }

  private <K> void register(
      Map<K, Group> table,
      String tableName,
      K key,
      String displayName,
      List<String> patterns,
      boolean ignoreCase,
      Object attribute) {
    ensureOpen();
    Objects.requireNonNull(patterns, "patterns");
    if (patterns.isEmpty()) {
      throw new IllegalArgumentException(tableName + " entry '" + displayName + "' has no patterns");
    }
    List<Pattern> compiled = new ArrayList<>(patterns.size());
    for (String source : patterns) {
      compiled.add(compile(tableName, displayName, source, ignoreCase));
    }

    Group existing = table.get(key);
    if (existing == null) {
      table.put(key, new Group(displayName, attribute, compiled));
      return;
    }
    if (!Objects.equals(existing.attribute, attribute)) {
      throw new IllegalArgumentException("Conflicting " + tableName + " definition for '" + displayName
          + "': " + existing.attribute + " vs " + attribute);
    }
    existing.patterns.addAll(compiled);
  }

  private static Pattern compile(String table, String name, String source, boolean ignoreCase) {
    if (source == null || source.isEmpty()) {
      throw new InvalidPatternException(table, name, String.valueOf(source), null);
    }
    try {
      return Pattern.compile(source, ignoreCase ? IGNORE_CASE_FLAGS : 0);
    } catch (PatternSyntaxException ex) {
      throw new InvalidPatternException(table, name, source, ex);
    }
  }

  private void ensureOpen() {
    if (sealed) {
      throw new IllegalStateException("Taxonomy already built; registrations are closed");
    }
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    return name.trim().toLowerCase(Locale.ROOT);
  }

  private static boolean flag(Boolean value, boolean fallback) {
    return value == null ? fallback : value;
  }

  private static final class Group {
    private final String name;
    private final Object attribute;
    private final List<Pattern> patterns;

    private Group(String name, Object attribute, List<Pattern> patterns) {
      this.name = name;
      this.attribute = attribute;
      this.patterns = new ArrayList<>(patterns);
    }
  }
}
