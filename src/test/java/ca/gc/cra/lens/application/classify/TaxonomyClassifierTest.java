package ca.gc.cra.lens.application.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lens.application.rules.TaxonomyBuilder;
import ca.gc.cra.lens.domain.conversation.RedactedMessage;
import ca.gc.cra.lens.domain.conversation.Role;
import ca.gc.cra.lens.domain.taxonomy.FailureMatch;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;
import ca.gc.cra.lens.domain.taxonomy.Polarity;
import ca.gc.cra.lens.domain.taxonomy.Severity;
import ca.gc.cra.lens.domain.taxonomy.Signal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class TaxonomyClassifierTest {
  private static TaxonomyClassifier classifier;

  @BeforeAll
  static void buildClassifier() throws Exception {
    classifier = new TaxonomyClassifier(TaxonomyBuilder.withDefaults().build());
  }

  @Test
  void unmatchedTextFallsBackToNeutral() {
    LabelSet labels = classifier.classifyText("Hello there");

    assertEquals("Neutral", labels.sentiment());
    assertEquals(Polarity.NEUTRAL, labels.polarity());
    assertTrue(labels.topics().isEmpty());
    assertTrue(labels.failures().isEmpty());
    assertTrue(labels.signals().isEmpty());
    assertEquals(Optional.empty(), labels.maxSeverity());
  }

  @Test
  void customSentimentIsCheckedBeforeNeutral() throws Exception {
    TaxonomyClassifier custom = new TaxonomyClassifier(TaxonomyBuilder.withDefaults()
        .registerSentiment("Relieved", Polarity.POSITIVE, List.of("\\b(relieved|phew)\\b"))
        .build());

    LabelSet relieved = custom.classifyText("okay, relieved that is done");
    LabelSet plain = custom.classifyText("okay, noted");

    assertEquals("Relieved", relieved.sentiment());
    assertEquals(Polarity.POSITIVE, relieved.polarity());
    assertEquals("Neutral", plain.sentiment());
  }

  @Test
  void firstSentimentInPriorityOrderWins() {
    LabelSet labels = classifier.classifyText("This is urgent, the docker deployment is completely broken!");

    assertEquals("Urgent", labels.sentiment());
    assertEquals(Polarity.NEUTRAL, labels.polarity());
    assertEquals(List.of("Infrastructure", "Debugging"), List.copyOf(labels.topics()));
  }

  @Test
  void failuresAreReportedInTableOrderWithSeverity() {
    LabelSet labels = classifier.classifyText("That's wrong and incomplete");

    assertEquals("Negative", labels.sentiment());
    assertEquals(Polarity.NEGATIVE, labels.polarity());
    assertEquals(List.of(
        new FailureMatch("Accuracy Error", Severity.HIGH),
        new FailureMatch("Incomplete Response", Severity.MEDIUM)), labels.failures());
    assertEquals(Optional.of(Severity.HIGH), labels.maxSeverity());
  }

  @Test
  void hallucinationComplaintCarriesAbandonment() {
    LabelSet labels = classifier.classifyText("That's not true, you made that up. I give up.");

    assertEquals(List.of(new FailureMatch("Hallucination", Severity.HIGH)), labels.failures());
    assertTrue(labels.has(Signal.ABANDONMENT));
    assertEquals("Neutral", labels.sentiment());
  }

  @Test
  void structuralSignalsAreDetected() {
    LabelSet labels = classifier.classifyText("Can you check this?\n```java\nint x;\n```");

    assertEquals(Set.of(Signal.QUESTION, Signal.CODE_BLOCK), labels.signals());
    assertEquals("Questioning", labels.sentiment());
    assertTrue(labels.topics().contains("Technical/Coding"));
  }

  @Test
  void classifyUsesRedactedText() {
    RedactedMessage message = new RedactedMessage(
        "c1", 0, Role.USER, Instant.EPOCH, "Perfect, that works now. Thanks!", 99, 6, Set.of());

    LabelSet labels = classifier.classify(message);

    assertEquals("Very Positive", labels.sentiment());
    assertEquals(Polarity.POSITIVE, labels.polarity());
    assertTrue(labels.has(Signal.CLOSING_AFFIRMATION));
  }

  @Test
  void registeredTopicIsClassified() {
    TaxonomyClassifier custom = new TaxonomyClassifier(TaxonomyBuilder.empty()
        .registerTopic("BlaqVox Project", List.of("\\bblaqvox\\b"))
        .build());

    LabelSet labels = custom.classifyText("The BlaqVox roadmap slipped");

    assertEquals(Set.of("BlaqVox Project"), labels.topics());
    assertEquals("Neutral", labels.sentiment());
  }
}
