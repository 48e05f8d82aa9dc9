package ca.gc.cra.lens.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Console output for usage text, dry-run plans, and the executive summary.
 *
 * <p>Writes to the stdout file descriptor so report blocks never interleave with Logback output on stderr.
 * Blocks are rendered as a heading followed by {@code " label : value"} rows with the labels padded to a
 * common width.</p>
 */
public final class CliPrinter {
  static final int LABEL_WIDTH = 18;

  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  public static void println(String message) {
    PrintWriter out = out();
    out.println(message);
    out.flush();
  }

  /**
   * Prints a heading and one aligned row per entry, in map order.
   *
   * @param heading first line; {@code null} or blank skips it
   * @param rows label to value; {@code null} values print as {@code <none>}
   */
  public static void printBlock(String heading, Map<String, ?> rows) {
    PrintWriter out = out();
    if (heading != null && !heading.isBlank()) {
      out.println(heading);
    }
    if (rows != null) {
      rows.forEach((label, value) -> out.println(row(label, value)));
    }
    out.flush();
  }

  static String row(String label, Object value) {
    StringBuilder line = new StringBuilder(LABEL_WIDTH + 16).append(' ').append(label);
    while (line.length() <= LABEL_WIDTH) {
      line.append(' ');
    }
    return line.append(": ").append(value == null ? "<none>" : value).toString();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter out() {
    PrintWriter current = override;
    return current == null ? STDOUT : current;
  }
}
