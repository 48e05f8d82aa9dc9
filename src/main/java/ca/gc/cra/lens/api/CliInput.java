package ca.gc.cra.lens.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * CLI arguments split into bare flags ({@code --no-privacy}) and {@code key=value} pairs.
 *
 * <p>Flags are case-insensitive and stored lower-cased. {@code -h}, {@code help} and {@code -v} are folded into
 * {@code --help} and {@code --verbose}. Anything containing {@code '='} is a key/value pair, even when it starts
 * with dashes.
 */
public final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Collections.unmodifiableSet(new LinkedHashSet<>(flags));
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> pairs = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        if (arg.indexOf('=') >= 0) {
          pairs.add(arg);
        } else {
          flags.add(canonicalFlag(arg));
        }
      }
    }
    return new CliInput(pairs, flags);
  }

  private static String canonicalFlag(String arg) {
    String lower = arg.toLowerCase(Locale.ROOT);
    return switch (lower) {
      case "-h", "help" -> HELP;
      case "-v" -> VERBOSE;
      default -> lower;
    };
  }

  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains(HELP);
  }

  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  public boolean hasFlag(String flag) {
    return flag != null && !flag.isBlank() && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns flags that neither the caller nor the shared {@code --help}/{@code --verbose} pair recognise.
   *
   * @param accepted command-specific flags
   * @return unrecognised flags in argument order
   */
  public List<String> unknownFlags(Collection<String> accepted) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!flag.equals(HELP) && !flag.equals(VERBOSE) && !accepted.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }

  public Set<String> flags() {
    return flags;
  }
}
