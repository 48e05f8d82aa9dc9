package ca.gc.cra.lens.application.rules;

import ca.gc.cra.lens.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regex evaluation that never propagates matcher failures.
 *
 * <p>A pattern that blows the stack on pathological input, or trips any other matcher error, is reported
 * once per call at WARN and treated as not matching. Only the pattern source is logged, never the text.
 *
 * @since 0.1.0
 */
public final class PatternSafety {
  private static final Logger log = LoggerFactory.getLogger(PatternSafety.class);

  private PatternSafety() {}

  /**
   * Tests whether any of the patterns finds a match in the text.
   *
   * @param patterns ordered patterns
   * @param text text to scan
   * @return {@code true} on the first pattern that matches
   */
  public static boolean anyMatch(List<Pattern> patterns, CharSequence text) {
    for (Pattern pattern : patterns) {
      if (find(pattern, text)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Tests whether the pattern finds a match in the text.
   *
   * @param pattern compiled pattern
   * @param text text to scan
   * @return {@code true} when a match exists; {@code false} when none exists or evaluation failed
   */
  public static boolean find(Pattern pattern, CharSequence text) {
    if (text == null || text.length() == 0) {
      return false;
    }
    try {
      return pattern.matcher(text).find();
    } catch (RuntimeException | StackOverflowError ex) {
      log.warn("Pattern evaluation failed for /{}/ on {}; treating as no match",
          pattern.pattern(), Logs.describeLength(text), ex);
      return false;
    }
  }

  /**
   * Returns every non-empty match of the pattern.
   *
   * @param pattern compiled pattern
   * @param text text to scan
   * @return match spans in scan order; empty when evaluation failed
   */
  public static List<Span> findAll(Pattern pattern, CharSequence text) {
    if (text == null || text.length() == 0) {
      return List.of();
    }
    try {
      List<Span> spans = new ArrayList<>();
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        if (matcher.end() > matcher.start()) {
          spans.add(new Span(matcher.start(), matcher.end()));
        }
      }
      return spans;
    } catch (RuntimeException | StackOverflowError ex) {
      log.warn("Pattern evaluation failed for /{}/ on {}; treating as no match",
          pattern.pattern(), Logs.describeLength(text), ex);
      return List.of();
    }
  }

  /**
   * Returns the first non-empty match starting at each position, so matches may overlap.
   *
   * <p>{@code "Thanks John Smith"} against a two-word name pattern yields both {@code "Thanks John"} and
   * {@code "John Smith"}; {@link #findAll} would only report the first.
   *
   * @param pattern compiled pattern
   * @param text text to scan
   * @return match spans ordered by start; empty when evaluation failed
   */
  public static List<Span> findAllOverlapping(Pattern pattern, CharSequence text) {
    if (text == null || text.length() == 0) {
      return List.of();
    }
    try {
      List<Span> spans = new ArrayList<>();
      Matcher matcher = pattern.matcher(text);
      int from = 0;
      while (from < text.length() && matcher.find(from)) {
        if (matcher.end() > matcher.start()) {
          spans.add(new Span(matcher.start(), matcher.end()));
        }
        from = matcher.start() + 1;
      }
      return spans;
    } catch (RuntimeException | StackOverflowError ex) {
      log.warn("Pattern evaluation failed for /{}/ on {}; treating as no match",
          pattern.pattern(), Logs.describeLength(text), ex);
      return List.of();
    }
  }

  /**
   * Tests whether the pattern matches exactly {@code [start, end)} of the text. Lookarounds and word
   * boundaries still see the surrounding characters.
   *
   * @param pattern compiled pattern
   * @param text full text
   * @param span region to test
   * @return {@code true} on an exact match; {@code false} otherwise or when evaluation failed
   */
  public static boolean matchesExactly(Pattern pattern, CharSequence text, Span span) {
    try {
      Matcher matcher = pattern.matcher(text);
      matcher.region(span.start(), span.end());
      matcher.useTransparentBounds(true);
      matcher.useAnchoringBounds(false);
      return matcher.matches();
    } catch (RuntimeException | StackOverflowError ex) {
      log.warn("Pattern evaluation failed for /{}/ on {}; treating as no match",
          pattern.pattern(), Logs.describeLength(text), ex);
      return false;
    }
  }

  /**
   * Half-open character span {@code [start, end)}.
   *
   * @param start inclusive start
   * @param end exclusive end
   */
  public record Span(int start, int end) {
    public int length() {
      return end - start;
    }
  }
}
