package ca.gc.cra.lens.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noArgumentsPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: lens"));
  }

  @Test
  void helpFlagPrintsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void dispatchesToClassify() {
    ExitCode code = Main.run(new String[] {"classify", "text=call 555-123-4567"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("[PHONE_REDACTED]"));
  }

  @Test
  void subcommandHelpIsForwarded() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"analyze", "--help"}));
    assertTrue(buffer.toString().contains("LENS analyze pipeline"));
  }
}
