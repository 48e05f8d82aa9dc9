package ca.gc.cra.lens.api;

/**
 * Process exit statuses for the {@code lens} commands. Scripts can tell a bad argument apart from a malformed
 * export or a disk failure by the number alone.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0, "completed"),
  /** Command-line arguments or merged settings were invalid. */
  INVALID_ARGS(2, "invalid arguments"),
  /** Reading the export or writing an output failed. */
  IO_ERROR(3, "I/O failure"),
  /** The export was malformed or a pattern failed to compile. */
  CONFIG_ERROR(4, "rejected input or patterns"),
  RUNTIME_FAILURE(5, "unexpected failure"),
  INTERRUPTED(130, "interrupted");

  private final int code;
  private final String description;

  ExitCode(int code, String description) {
    this.code = code;
    this.description = description;
  }

  /** Numeric status handed to the operating system. */
  public int code() {
    return code;
  }

  /** Short phrase for logs, e.g. {@code "exit 3 (I/O failure)"}. */
  public String description() {
    return description;
  }

  public boolean isSuccess() {
    return this == SUCCESS;
  }

  /**
   * Looks up the constant for a numeric status.
   *
   * @param code numeric status
   * @return matching constant
   * @throws IllegalArgumentException for a status LENS never returns
   */
  public static ExitCode fromCode(int code) {
    for (ExitCode exit : values()) {
      if (exit.code == code) {
        return exit;
      }
    }
    throw new IllegalArgumentException("Unknown exit code " + code);
  }

  @Override
  public String toString() {
    return "exit " + code + " (" + description + ")";
  }
}
