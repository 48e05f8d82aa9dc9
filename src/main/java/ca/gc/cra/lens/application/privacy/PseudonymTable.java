package ca.gc.cra.lens.application.privacy;

import ca.gc.cra.lens.domain.privacy.PiiKind;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-run mapping from normalized entity text to a stable pseudonym token.
 * <p><strong>Why:</strong> The same person or organization must read as the same token everywhere in a run,
 * whichever worker sees it first, so downstream analysis can still follow who is being discussed.</p>
 * <p><strong>Role:</strong> The only shared mutable state of the analyze pipeline; created once per run and
 * handed to the {@link PrivacyRedactor}.</p>
 * <p><strong>Thread-safety:</strong> Lock-free; inserts go through {@link ConcurrentMap#computeIfAbsent}.
 * Tokens are derived from a digest, so concurrent first sightings agree on the value.</p>
 * <p><strong>Observability:</strong> Logs a WARN when two distinct entities share a token; never logs the
 * entity text.</p>
 *
 * @since 0.1.0
 */
public final class PseudonymTable {
  private static final Logger log = LoggerFactory.getLogger(PseudonymTable.class);

  /** Bytes of the SHA-256 digest kept in a token (12 hex characters). */
  static final int TOKEN_BYTES = 6;

  private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(PseudonymTable::initSha256);
  private static final HexFormat HEX = HexFormat.of();
  private static final Pattern HONORIFIC =
      Pattern.compile("^(?:(?:dr|mr|mrs|ms|prof|miss)\\.?\\s+)+", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final String salt;
  private final ConcurrentMap<String, String> tokens = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, String> owners = new ConcurrentHashMap<>();

  public PseudonymTable() {
    this("");
  }

  /**
   * Creates an empty table.
   *
   * @param salt prefix mixed into every digest; empty for unsalted tokens
   */
  public PseudonymTable(String salt) {
    this.salt = salt == null ? "" : salt;
  }

  /**
   * Returns the pseudonym for an entity, creating it on first sight.
   *
   * @param kind entity kind such as {@code person_name}
   * @param entityText matched entity text
   * @return token such as {@code [PERSON_NAME_5f2b9c01d3aa]}
   */
  public String pseudonymFor(PiiKind kind, String entityText) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(entityText, "entityText");
    String key = kind.name() + ":" + normalize(entityText);
    return tokens.computeIfAbsent(key, k -> mint(kind, k));
  }

  /** Number of distinct entities pseudonymized so far. */
  public int size() {
    return tokens.size();
  }

  /**
   * Normalizes entity text: leading honorifics removed, whitespace collapsed, lower-cased.
   *
   * @param entityText raw entity text
   * @return normalized form used as the table key
   */
  static String normalize(String entityText) {
    String collapsed = WHITESPACE.matcher(entityText.strip()).replaceAll(" ");
    String stripped = HONORIFIC.matcher(collapsed).replaceFirst("");
    if (stripped.isEmpty()) {
      stripped = collapsed;
    }
    return stripped.toLowerCase(Locale.ROOT);
  }

  private String mint(PiiKind kind, String key) {
    MessageDigest digest = SHA256.get();
    digest.reset();
    byte[] hash = digest.digest((salt + key).getBytes(StandardCharsets.UTF_8));
    String token = "[" + kind.tokenPrefix() + "_" + HEX.formatHex(hash, 0, TOKEN_BYTES) + "]";
    String previous = owners.putIfAbsent(token, key);
    if (previous != null && !previous.equals(key)) {
      log.warn("Pseudonym collision on {} for kind {}", token, kind);
    }
    return token;
  }

  private static MessageDigest initSha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
