package ca.gc.cra.lens.api;

import ca.gc.cra.lens.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LENS command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: lens <analyze|classify> [options]";
  private static final String HELP_TEXT = """
      LENS conversation archive analyzer

      Usage:
        lens <command> [options]

      Commands:
        analyze     Redact, classify, and summarize a conversation export (analyze --help)
        classify    Show the redacted text and labels for one string (classify --help)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    if (!exit.isSuccess()) {
      log.info("lens finished with {}", exit);
    }
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the subcommand
   * @return exit code reported by the subcommand
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < tokens.length; i++) {
      if (tokens[i] != null && !tokens[i].isBlank() && !tokens[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[tokens.length - 1];
    System.arraycopy(tokens, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(tokens, commandIndex + 1, delegateArgs, commandIndex, tokens.length - commandIndex - 1);
    if (CliInput.parse(Arrays.copyOf(tokens, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    return switch (command) {
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      case "classify" -> ClassifyCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
