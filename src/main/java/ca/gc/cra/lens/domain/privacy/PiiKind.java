package ca.gc.cra.lens.domain.privacy;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Named category of personally identifying information.
 *
 * <p>Kinds are open-ended: the built-in constants cover the default tables and custom registrations add
 * further kinds by name. Names are normalized to lowercase snake case.
 *
 * @param name normalized kind name such as {@code email}
 * @since 0.1.0
 */
public record PiiKind(String name) {
  private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

  public static final PiiKind EMAIL = new PiiKind("email");
  public static final PiiKind PHONE = new PiiKind("phone");
  public static final PiiKind SSN = new PiiKind("ssn");
  public static final PiiKind CREDIT_CARD = new PiiKind("credit_card");
  public static final PiiKind ADDRESS = new PiiKind("address");
  public static final PiiKind IP = new PiiKind("ip");
  public static final PiiKind API_KEY = new PiiKind("api_key");
  public static final PiiKind PERSON_NAME = new PiiKind("person_name");
  public static final PiiKind ORGANIZATION = new PiiKind("organization");

  public PiiKind {
    Objects.requireNonNull(name, "name");
    name = name.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    if (!NAME_PATTERN.matcher(name).matches()) {
      throw new IllegalArgumentException("PII kind name must be alphanumeric snake case: " + name);
    }
  }

  /**
   * Parses a kind name.
   *
   * @param name raw name
   * @return normalized kind
   */
  public static PiiKind of(String name) {
    return new PiiKind(name);
  }

  /**
   * Returns the fixed replacement token for this kind, e.g. {@code [EMAIL_REDACTED]}.
   *
   * @return placeholder token
   */
  public String placeholder() {
    return "[" + tokenPrefix() + "_REDACTED]";
  }

  /**
   * Returns the uppercase token prefix used by placeholders and pseudonyms.
   *
   * @return prefix such as {@code PERSON_NAME}
   */
  public String tokenPrefix() {
    return name.toUpperCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return name;
  }
}
