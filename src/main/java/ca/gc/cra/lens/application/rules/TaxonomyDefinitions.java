package ca.gc.cra.lens.application.rules;

import java.util.List;
import java.util.Objects;

/**
 * Uncompiled pattern tables as read from one YAML document.
 *
 * @param pii fixed-redaction PII kinds
 * @param entities pseudonymized entity kinds
 * @param topics topic categories
 * @param sentiments sentiment categories in priority order
 * @param failures failure kinds
 * @param signals text marker signals
 * @since 0.1.0
 */
record TaxonomyDefinitions(
    List<GroupDefinition> pii,
    List<GroupDefinition> entities,
    List<GroupDefinition> topics,
    List<GroupDefinition> sentiments,
    List<GroupDefinition> failures,
    List<GroupDefinition> signals) {

  TaxonomyDefinitions {
    pii = List.copyOf(pii);
    entities = List.copyOf(entities);
    topics = List.copyOf(topics);
    sentiments = List.copyOf(sentiments);
    failures = List.copyOf(failures);
    signals = List.copyOf(signals);
  }

  static TaxonomyDefinitions empty() {
    return new TaxonomyDefinitions(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
  }

  /**
   * One named pattern group.
   *
   * @param name kind or category name
   * @param patterns regular expressions in declaration order
   * @param ignoreCase case-insensitive matching override; {@code null} uses the table default
   * @param severity failure severity label; only meaningful for failures
   * @param polarity sentiment polarity label; only meaningful for sentiments
   */
  record GroupDefinition(
      String name, List<String> patterns, Boolean ignoreCase, String severity, String polarity) {
    GroupDefinition {
      Objects.requireNonNull(name, "name");
      patterns = List.copyOf(patterns);
    }
  }
}
