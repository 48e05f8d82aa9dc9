package ca.gc.cra.lens.application.quality;

import ca.gc.cra.lens.domain.analysis.AnalyzedMessage;
import ca.gc.cra.lens.domain.conversation.RedactedMessage;
import ca.gc.cra.lens.domain.conversation.Role;
import ca.gc.cra.lens.domain.quality.CollaborationQuality;
import ca.gc.cra.lens.domain.quality.CompletionStatus;
import ca.gc.cra.lens.domain.quality.ConversationQuality;
import ca.gc.cra.lens.domain.quality.ResponseAssessment;
import ca.gc.cra.lens.domain.quality.ResponseEffectiveness;
import ca.gc.cra.lens.domain.taxonomy.FailureMatch;
import ca.gc.cra.lens.domain.taxonomy.LabelSet;
import ca.gc.cra.lens.domain.taxonomy.Polarity;
import ca.gc.cra.lens.domain.taxonomy.Severity;
import ca.gc.cra.lens.domain.taxonomy.Signal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Rolls one conversation's labels into flow counts, a collaboration bucket, an
 * inferred task outcome, and an effectiveness label per assistant answer.
 * <p><strong>Why:</strong> Per-message labels alone cannot say whether a conversation went well; the
 * aggregate reads alternation, timing, and tail evidence together.</p>
 * <p><strong>Role:</strong> Per-conversation join point of the analyze pipeline. Reads roles, timestamps,
 * and labels; never message text.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings.</p>
 *
 * @since 0.1.0
 */
public final class ConversationQualityAnalyzer {
  /** Sentiment label that counts as a question regardless of punctuation. */
  static final String QUESTIONING = "Questioning";

  /** Reaction signals in tie-break order. */
  private static final Map<Signal, ResponseEffectiveness> REACTIONS = new LinkedHashMap<>();

  static {
    REACTIONS.put(Signal.RESPONSE_PRAISED, ResponseEffectiveness.HIGHLY_EFFECTIVE);
    REACTIONS.put(Signal.RESPONSE_ACCEPTED, ResponseEffectiveness.EFFECTIVE);
    REACTIONS.put(Signal.RESPONSE_PARTIAL, ResponseEffectiveness.PARTIALLY_EFFECTIVE);
    REACTIONS.put(Signal.RESPONSE_REJECTED, ResponseEffectiveness.INEFFECTIVE);
  }

  private final QualitySettings settings;

  public ConversationQualityAnalyzer() {
    this(QualitySettings.defaults());
  }

  public ConversationQualityAnalyzer(QualitySettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Computes quality for one conversation.
   *
   * @param messages analyzed messages in conversation order
   * @return conversation quality; {@code MEDIUM}/{@code IN_PROGRESS} with zero counts when empty
   */
  public ConversationQuality analyze(List<AnalyzedMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    int n = messages.size();
    if (n == 0) {
      return new ConversationQuality(CollaborationQuality.MEDIUM, CompletionStatus.IN_PROGRESS,
          0.0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0.0, 0.0, List.of());
    }

    int questions = 0;
    int codeBlocks = 0;
    int failureKinds = 0;
    int negatives = 0;
    int highSeverity = 0;
    int clarifications = 0;
    int toolUses = 0;
    int users = 0;
    long userLength = 0;
    long assistantLength = 0;
    List<ResponseAssessment> responses = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      AnalyzedMessage analyzed = messages.get(i);
      RedactedMessage message = analyzed.message();
      LabelSet labels = analyzed.labels();
      if (message.role() == Role.USER) {
        users++;
        userLength += message.contentLength();
        if (labels.has(Signal.QUESTION) || QUESTIONING.equals(labels.sentiment())) {
          questions++;
        }
        if (labels.has(Signal.CLARIFICATION_REQUEST)) {
          clarifications++;
        }
      } else {
        assistantLength += message.contentLength();
        if (labels.has(Signal.CODE_BLOCK)) {
          codeBlocks++;
        }
        if (labels.has(Signal.TOOL_USE)) {
          toolUses++;
        }
        responses.add(assess(message.index(), i + 1 < n ? messages.get(i + 1) : null));
      }
      failureKinds += labels.failureCount();
      if (labels.polarity() == Polarity.NEGATIVE) {
        negatives++;
      }
      if (labels.maxSeverity().filter(s -> s == Severity.HIGH).isPresent()) {
        highSeverity++;
      }
    }

    int interruptions = 0;
    int monologues = 0;
    int quick = 0;
    int longGaps = 0;
    for (int i = 1; i < n; i++) {
      RedactedMessage previous = messages.get(i - 1).message();
      RedactedMessage current = messages.get(i).message();
      Duration delta = Duration.between(previous.timestamp(), current.timestamp());
      if (previous.role() == current.role()) {
        interruptions++;
        if (current.role() == Role.ASSISTANT) {
          monologues++;
        }
      } else if (!delta.isNegative() && delta.compareTo(settings.quickResponse()) < 0) {
        quick++;
      }
      if (delta.compareTo(settings.longGap()) > 0) {
        longGaps++;
      }
    }

    double failureDensity = (double) failureKinds / n;
    double negativeRate = (double) negatives / n;
    double highSeverityDensity = (double) highSeverity / n;
    double interruptionRate = n > 1 ? (double) interruptions / (n - 1) : 0.0;
    CollaborationQuality collaboration =
        collaboration(failureDensity, negativeRate, highSeverityDensity, interruptionRate);

    Completion completion = completion(messages);
    return new ConversationQuality(
        collaboration,
        completion.status(),
        completion.confidence(),
        completion.votes(),
        n,
        questions,
        codeBlocks,
        interruptions,
        quick,
        monologues,
        longGaps,
        clarifications,
        toolUses,
        users == 0 ? 0.0 : (double) userLength / users,
        users == n ? 0.0 : (double) assistantLength / (n - users),
        responses);
  }

  /**
   * Labels one assistant answer from the reaction signals of the message that follows it.
   *
   * @param messageIndex index of the assistant message
   * @param next following message, or {@code null} at the end of the conversation
   * @return assessment; {@link ResponseEffectiveness#UNKNOWN} unless the next message is a user reaction
   */
  static ResponseAssessment assess(int messageIndex, AnalyzedMessage next) {
    if (next == null || next.message().role() != Role.USER) {
      return ResponseAssessment.unknown(messageIndex);
    }
    ResponseEffectiveness winner = null;
    int detected = 0;
    for (Map.Entry<Signal, ResponseEffectiveness> reaction : REACTIONS.entrySet()) {
      if (next.labels().has(reaction.getKey())) {
        detected++;
        if (winner == null) {
          winner = reaction.getValue();
        }
      }
    }
    if (winner == null) {
      return ResponseAssessment.unknown(messageIndex);
    }
    return new ResponseAssessment(messageIndex, winner, 1.0 / detected);
  }

  private CollaborationQuality collaboration(
      double failureDensity, double negativeRate, double highSeverityDensity, double interruptionRate) {
    if (negativeRate > settings.confrontationalNegativeRate()
        && highSeverityDensity > settings.confrontationalHighSeverityRate()) {
      return CollaborationQuality.CONFRONTATIONAL;
    }
    double score = settings.failureWeight() * failureDensity
        + settings.negativeWeight() * negativeRate
        + settings.interruptionWeight() * interruptionRate;
    if (score <= settings.highCeiling()) {
      return CollaborationQuality.HIGH;
    }
    if (score <= settings.mediumCeiling()) {
      return CollaborationQuality.MEDIUM;
    }
    return CollaborationQuality.LOW;
  }

  private Completion completion(List<AnalyzedMessage> messages) {
    int n = messages.size();
    List<AnalyzedMessage> tail = messages.subList(Math.max(0, n - settings.tailWindow()), n);
    AnalyzedMessage last = messages.get(n - 1);

    boolean closing = false;
    boolean abandonment = false;
    boolean blocker = false;
    boolean tailFailure = false;
    boolean tailMediumFailure = false;
    for (AnalyzedMessage analyzed : tail) {
      LabelSet labels = analyzed.labels();
      closing |= labels.has(Signal.CLOSING_AFFIRMATION);
      abandonment |= labels.has(Signal.ABANDONMENT);
      blocker |= labels.has(Signal.BLOCKER);
      tailFailure |= labels.hasFailure();
      for (FailureMatch failure : labels.failures()) {
        tailMediumFailure |= failure.severity().atLeast(Severity.MEDIUM);
      }
    }
    boolean lastHigh = last.labels().maxSeverity().filter(s -> s == Severity.HIGH).isPresent();
    boolean trailingGap = n > 1 && Duration.between(
        messages.get(n - 2).message().timestamp(), last.message().timestamp())
        .compareTo(settings.abandonGap()) > 0;
    boolean unansweredUser = last.message().role() == Role.USER;

    int completed = votes(count(closing), count(!tailFailure));
    int abandoned = votes(count(abandonment) + count(lastHigh) + count(trailingGap), count(unansweredUser));
    int blocked = votes(count(blocker), count(tailMediumFailure));

    int total = completed + abandoned + blocked;
    if (total == 0) {
      return new Completion(CompletionStatus.IN_PROGRESS, 0.0, 0);
    }
    CompletionStatus status = CompletionStatus.ABANDONED;
    int winner = abandoned;
    if (blocked > winner) {
      status = CompletionStatus.BLOCKED;
      winner = blocked;
    }
    if (completed > winner) {
      status = CompletionStatus.COMPLETED;
      winner = completed;
    }
    return new Completion(status, (double) winner / (total + 1), winner);
  }

  private static int votes(int primary, int supporting) {
    return primary == 0 ? 0 : primary + supporting;
  }

  private static int count(boolean signal) {
    return signal ? 1 : 0;
  }

  private record Completion(CompletionStatus status, double confidence, int votes) {}
}
