package ca.gc.cra.screenlog.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Console output for command results and usage text.
 *
 * <p>Writes to the stdout file descriptor directly so command output never interleaves with the logging
 * appender's buffer. Tests swap in their own writer.</p>
 *
 * @since 0.1.0
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  static void println(String line) {
    writer().println(line);
  }

  static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = writer();
    for (String line : lines) {
      out.println(line);
    }
  }

  /** Formats with {@link Locale#ROOT} and prints one line. */
  static void printf(String format, Object... args) {
    writer().println(String.format(Locale.ROOT, format, args));
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
