package ca.gc.cra.lens.application.rules;

/**
 * Raised when a registered pattern is not a valid regular expression.
 *
 * <p>Thrown at registration time so a bad table never reaches message processing.
 *
 * @since 0.1.0
 */
public final class InvalidPatternException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String table;
  private final String name;
  private final String pattern;

  public InvalidPatternException(String table, String name, String pattern, Throwable cause) {
    super("Invalid " + table + " pattern for '" + name + "': " + pattern + describe(cause), cause);
    this.table = table;
    this.name = name;
    this.pattern = pattern;
  }

  /** Table the pattern was registered into, e.g. {@code topics}. */
  public String table() {
    return table;
  }

  public String name() {
    return name;
  }

  public String pattern() {
    return pattern;
  }

  private static String describe(Throwable cause) {
    if (cause == null || cause.getMessage() == null) {
      return "";
    }
    return " (" + cause.getMessage().lines().findFirst().orElse("") + ")";
  }
}
