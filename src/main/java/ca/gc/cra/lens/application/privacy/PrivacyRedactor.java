package ca.gc.cra.lens.application.privacy;

import ca.gc.cra.lens.application.assemble.InvariantViolationException;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy;
import ca.gc.cra.lens.application.rules.CompiledTaxonomy.PiiRule;
import ca.gc.cra.lens.application.rules.PatternSafety;
import ca.gc.cra.lens.application.rules.PatternSafety.Span;
import ca.gc.cra.lens.domain.conversation.Message;
import ca.gc.cra.lens.domain.conversation.RedactedMessage;
import ca.gc.cra.lens.domain.privacy.PiiKind;
import ca.gc.cra.lens.domain.privacy.PiiMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Replaces PII spans in message text with fixed placeholders or stable pseudonyms.
 * <p><strong>Why:</strong> Every later stage, and every output file, must only ever see redacted text.</p>
 * <p><strong>Role:</strong> First per-message stage of the analyze pipeline; runs on worker threads.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve overlapping candidates longest first, then earliest start, then table order.</li>
 *   <li>Repeat fixed-kind passes until nothing matches.</li>
 *   <li>Pseudonymize person and organization names through the shared {@link PseudonymTable}. Entity
 *       candidates start at every word and lose leading words that never begin a name ("Thanks", "Monday"),
 *       so "Thanks John Smith" and "John Smith said" both pseudonymize {@code John Smith}.</li>
 *   <li>Leave existing placeholders and pseudonyms untouched so redaction is idempotent.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable apart from the pseudonym table, which is concurrent.</p>
 * <p><strong>Observability:</strong> DEBUG logs carry conversation id, index, and kinds only.</p>
 *
 * @since 0.1.0
 */
public final class PrivacyRedactor {
  private static final Logger log = LoggerFactory.getLogger(PrivacyRedactor.class);

  /** Existing placeholder or pseudonym tokens; never re-matched. */
  static final Pattern PROTECTED_TOKEN = Pattern.compile("\\[[A-Z][A-Z0-9_]*_(?:REDACTED|[0-9a-f]{12})\\]");

  /** Capitalized words that open sentences or greetings but are never the first word of a name. */
  static final Set<String> NON_NAME_LEADS = Set.of(
      "hi", "hello", "hey", "dear", "thanks", "thank", "cheers", "regards", "sincerely", "congrats",
      "welcome", "also", "then", "however", "yesterday", "today", "tomorrow", "tonight", "maybe", "perhaps",
      "please", "so", "but", "and", "or", "when", "if", "while", "after", "before", "since", "because",
      "actually", "anyway", "still", "now", "later", "finally", "unfortunately", "hopefully", "ask", "tell",
      "call", "email", "meet", "contact", "ping", "the", "this", "that", "these", "those", "my", "our",
      "your", "his", "her", "their", "we", "you", "he", "she", "they", "it", "monday", "tuesday", "wednesday",
      "thursday", "friday", "saturday", "sunday", "january", "february", "march", "july", "september",
      "october", "november", "december");

  private static final Comparator<Candidate> RESOLUTION_ORDER = Comparator
      .comparingInt((Candidate c) -> c.span().length()).reversed()
      .thenComparingInt(c -> c.span().start())
      .thenComparingInt(Candidate::order);

  private final List<PiiRule> fixedRules;
  private final List<PiiRule> entityRules;
  private final PseudonymTable pseudonyms;
  private final boolean enabled;

  /**
   * Creates an enabled redactor.
   *
   * @param taxonomy compiled pattern tables
   * @param pseudonyms per-run pseudonym table
   * @param pseudonymizeOrganizations whether the {@code organization} entity kind is applied
   */
  public PrivacyRedactor(CompiledTaxonomy taxonomy, PseudonymTable pseudonyms, boolean pseudonymizeOrganizations) {
    Objects.requireNonNull(taxonomy, "taxonomy");
    this.pseudonyms = Objects.requireNonNull(pseudonyms, "pseudonyms");
    this.fixedRules = taxonomy.pii();
    this.entityRules = taxonomy.entities().stream()
        .filter(rule -> pseudonymizeOrganizations || !rule.kind().equals(PiiKind.ORGANIZATION))
        .toList();
    this.enabled = true;
  }

  private PrivacyRedactor() {
    this.fixedRules = List.of();
    this.entityRules = List.of();
    this.pseudonyms = new PseudonymTable();
    this.enabled = false;
  }

  /**
   * Returns a redactor that passes text through unchanged with no kinds.
   *
   * @return pass-through redactor
   */
  public static PrivacyRedactor disabled() {
    return new PrivacyRedactor();
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Redacts one message.
   *
   * @param message loaded message
   * @return redacted view carrying the kinds replaced
   */
  public RedactedMessage redact(Message message) {
    Objects.requireNonNull(message, "message");
    RedactionResult result = redactText(message.text());
    if (result.replacements() > 0 && log.isDebugEnabled()) {
      log.debug("Redacted {} spans in {}#{} kinds={}",
          result.replacements(), message.conversationId(), message.index(), result.kinds());
    }
    return RedactedMessage.from(message, result.text(), result.kinds());
  }

  /**
   * Redacts raw text.
   *
   * @param text raw text
   * @return redacted text and kinds
   */
  public RedactionResult redactText(String text) {
    Objects.requireNonNull(text, "text");
    if (!enabled || text.isEmpty()) {
      return RedactionResult.unchanged(text);
    }
    Set<String> kinds = new LinkedHashSet<>();
    int[] replacements = {0};

    // each pass turns at least one unprotected character into a protected token, so this terminates
    String current = text;
    int passLimit = text.length() + 1;
    for (int pass = 0; ; pass++) {
      List<PiiMatch> accepted = resolve(current, fixedRules, false, (kind, matched) -> kind.placeholder());
      if (accepted.isEmpty()) {
        break;
      }
      if (pass >= passLimit) {
        throw new InvariantViolationException("Fixed PII redaction did not converge after " + pass + " passes");
      }
      current = apply(current, accepted, kinds, replacements);
    }

    List<PiiMatch> entities = resolve(current, entityRules, true, pseudonyms::pseudonymFor);
    if (!entities.isEmpty()) {
      current = apply(current, entities, kinds, replacements);
    }
    return new RedactionResult(current, kinds, replacements[0]);
  }

  private static List<PiiMatch> resolve(
      String text, List<PiiRule> rules, boolean entities, BiFunction<PiiKind, String, String> replacement) {
    if (rules.isEmpty()) {
      return List.of();
    }
    List<Candidate> candidates = new ArrayList<>();
    for (int order = 0; order < rules.size(); order++) {
      PiiRule rule = rules.get(order);
      for (Pattern pattern : rule.patterns()) {
        if (!entities) {
          for (Span span : PatternSafety.findAll(pattern, text)) {
            candidates.add(new Candidate(rule.kind(), span, order));
          }
          continue;
        }
        for (Span span : PatternSafety.findAllOverlapping(pattern, text)) {
          Span trimmed = dropNonNameLeads(text, span);
          if (trimmed == span || PatternSafety.matchesExactly(pattern, text, trimmed)) {
            candidates.add(new Candidate(rule.kind(), trimmed, order));
          }
        }
      }
    }
    if (candidates.isEmpty()) {
      return List.of();
    }
    candidates.sort(RESOLUTION_ORDER);

    List<Span> taken = new ArrayList<>(PatternSafety.findAll(PROTECTED_TOKEN, text));
    List<PiiMatch> accepted = new ArrayList<>();
    for (Candidate candidate : candidates) {
      if (overlapsAny(candidate.span(), taken)) {
        continue;
      }
      taken.add(candidate.span());
      String matched = text.substring(candidate.span().start(), candidate.span().end());
      accepted.add(new PiiMatch(
          candidate.kind(),
          candidate.span().start(),
          candidate.span().end(),
          replacement.apply(candidate.kind(), matched)));
    }
    accepted.sort(Comparator.comparingInt(PiiMatch::start));
    return accepted;
  }

  private static String apply(String text, List<PiiMatch> matches, Set<String> kinds, int[] replacements) {
    StringBuilder out = new StringBuilder(text.length());
    int cursor = 0;
    for (PiiMatch match : matches) {
      out.append(text, cursor, match.start()).append(match.replacement());
      cursor = match.end();
      kinds.add(match.kind().name());
      replacements[0]++;
    }
    out.append(text, cursor, text.length());
    return out.toString();
  }

  /**
   * Skips leading words listed in {@link #NON_NAME_LEADS}.
   *
   * @return {@code span} itself when nothing was skipped
   */
  static Span dropNonNameLeads(String text, Span span) {
    int start = span.start();
    while (start < span.end()) {
      int wordEnd = start;
      while (wordEnd < span.end() && Character.isLetter(text.charAt(wordEnd))) {
        wordEnd++;
      }
      if (wordEnd == start || wordEnd == span.end() || !Character.isWhitespace(text.charAt(wordEnd))
          || !NON_NAME_LEADS.contains(text.substring(start, wordEnd).toLowerCase(Locale.ROOT))) {
        break;
      }
      start = wordEnd;
      while (start < span.end() && Character.isWhitespace(text.charAt(start))) {
        start++;
      }
    }
    return start == span.start() ? span : new Span(start, span.end());
  }

  private static boolean overlapsAny(Span span, List<Span> taken) {
    for (Span other : taken) {
      if (span.start() < other.end() && other.start() < span.end()) {
        return true;
      }
    }
    return false;
  }

  private record Candidate(PiiKind kind, Span span, int order) {}
}
