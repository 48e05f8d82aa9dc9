package ca.gc.cra.lens.application.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lens.application.rules.CompiledTaxonomy.FailureRule;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.TopicRule;
import ca.gc.cra.lens.domain.taxonomy.Polarity;
import ca.gc.cra.lens.domain.taxonomy.Severity;
import ca.gc.cra.lens.domain.taxonomy.Signal;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaxonomyBuilderTest {

  @TempDir
  Path tempDir;

  @Test
  void buildSealsTheBuilder() {
    TaxonomyBuilder builder = TaxonomyBuilder.empty().registerTopic("Cooking", List.of("\\bpasta\\b"));

    builder.build();

    assertTrue(builder.isSealed());
    assertThrows(IllegalStateException.class,
        () -> builder.registerTopic("Gardening", List.of("\\btomato\\b")));
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void repeatedNameKeepsPositionAndGainsPatterns() {
    CompiledTaxonomy taxonomy = TaxonomyBuilder.empty()
        .registerTopic("Cooking", List.of("\\bpasta\\b"))
        .registerTopic("Travel", List.of("\\bflight\\b"))
        .registerTopic("cooking", List.of("\\brisotto\\b"))
        .build();

    List<TopicRule> topics = taxonomy.topics();
    assertEquals(2, topics.size());
    assertEquals("Cooking", topics.get(0).name());
    assertEquals(2, topics.get(0).patterns().size());
    assertTrue(topics.get(0).matches("Risotto tonight"));
  }

  @Test
  void conflictingSeverityIsRejected() {
    TaxonomyBuilder builder = TaxonomyBuilder.empty()
        .registerFailure("Slow Answer", Severity.LOW, List.of("\\btoo slow\\b"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> builder.registerFailure("slow answer", Severity.HIGH, List.of("\\bsluggish\\b")));

    assertTrue(ex.getMessage().contains("Conflicting failures definition"), ex.getMessage());
  }

  @Test
  void conflictingPolarityIsRejected() {
    TaxonomyBuilder builder = TaxonomyBuilder.empty()
        .registerSentiment("Grumpy", Polarity.NEGATIVE, List.of("\\bmeh\\b"));

    assertThrows(IllegalArgumentException.class,
        () -> builder.registerSentiment("Grumpy", Polarity.POSITIVE, List.of("\\bbah\\b")));
  }

  @Test
  void invalidPatternNamesTableAndEntry() {
    InvalidPatternException ex = assertThrows(InvalidPatternException.class,
        () -> TaxonomyBuilder.empty().registerTopic("Broken", List.of("(unclosed")));

    assertEquals("topics", ex.table());
    assertEquals("Broken", ex.name());
    assertEquals("(unclosed", ex.pattern());
  }

  @Test
  void emptyPatternListIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TaxonomyBuilder.empty().registerTopic("Nothing", List.of()));
  }

  @Test
  void defaultsCarryEveryTable() throws IOException {
    CompiledTaxonomy taxonomy = TaxonomyBuilder.withDefaults().build();

    assertEquals(7, taxonomy.pii().size());
    assertEquals("organization", taxonomy.entities().get(0).kind().name());
    assertEquals("person_name", taxonomy.entities().get(1).kind().name());
    assertEquals(11, taxonomy.topics().size());
    assertEquals(8, taxonomy.sentiments().size());
    assertEquals("Urgent", taxonomy.sentiments().get(0).name());
    assertEquals(11, taxonomy.failures().size());
    assertEquals(Signal.values().length, taxonomy.signals().size());
  }

  @Test
  void extensionFileMergesIntoDefaults() throws Exception {
    CompiledTaxonomy taxonomy = new TaxonomyProvider().load(List.of(resource("/taxonomy/custom-taxonomy.yaml")));

    List<TopicRule> topics = taxonomy.topics();
    assertEquals(12, topics.size());
    assertEquals("BlaqVox Project", topics.get(11).name());
    TopicRule infrastructure = topics.stream()
        .filter(t -> t.name().equals("Infrastructure"))
        .findFirst()
        .orElseThrow();
    assertEquals(2, infrastructure.patterns().size());
    assertTrue(infrastructure.matches("terraform apply"));

    FailureRule drift = taxonomy.failures().get(taxonomy.failures().size() - 1);
    assertEquals("Version Drift", drift.name());
    assertEquals(Severity.MEDIUM, drift.severity());
    assertEquals("employee_id", taxonomy.pii().get(taxonomy.pii().size() - 1).kind().name());
  }

  @Test
  void invalidPatternInFileFailsLoad() throws Exception {
    Path file = resource("/taxonomy/invalid-pattern.yaml");

    assertThrows(InvalidPatternException.class, () -> new TaxonomyProvider().load(List.of(file)));
  }

  @Test
  void unsupportedVersionIsRejected() throws IOException {
    Path file = tempDir.resolve("v2.yaml");
    Files.writeString(file, "version: 2\ntopics:\n  - name: X\n    patterns: ['x']\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> TaxonomyBuilder.empty().load(file));
    assertTrue(ex.getMessage().contains("Unsupported taxonomy version 2"), ex.getMessage());
  }

  @Test
  void unknownSectionIsRejected() throws IOException {
    Path file = tempDir.resolve("unknown.yaml");
    Files.writeString(file, "version: 1\nmoods:\n  - name: X\n    patterns: ['x']\n");

    assertThrows(IllegalArgumentException.class, () -> TaxonomyBuilder.empty().load(file));
  }

  @Test
  void duplicateEntryInOneFileIsRejected() throws IOException {
    Path file = tempDir.resolve("dupe.yaml");
    Files.writeString(file, "version: 1\ntopics:\n"
        + "  - name: Cooking\n    patterns: ['pasta']\n"
        + "  - name: cooking\n    patterns: ['risotto']\n");

    assertThrows(IllegalArgumentException.class, () -> TaxonomyBuilder.empty().load(file));
  }

  @Test
  void failureWithoutSeverityIsRejected() throws IOException {
    Path file = tempDir.resolve("no-severity.yaml");
    Files.writeString(file, "version: 1\nfailures:\n  - name: Vague\n    patterns: ['vague']\n");

    assertThrows(IllegalArgumentException.class, () -> TaxonomyBuilder.empty().load(file));
  }

  @Test
  void missingFileIsAnIoError() {
    TaxonomyBuilder builder = TaxonomyBuilder.empty();

    assertThrows(IOException.class, () -> builder.load(tempDir.resolve("absent.yaml")));
    assertFalse(builder.isSealed());
  }

  private static Path resource(String name) throws URISyntaxException {
    return Path.of(Objects.requireNonNull(TaxonomyBuilderTest.class.getResource(name), name).toURI());
  }
}
