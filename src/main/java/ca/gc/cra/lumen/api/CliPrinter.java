package ca.gc.cra.lumen.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text, process listings and the interactive debugger.
 *
 * <p>Writes to the stdout file descriptor directly. Logback sends log events to stderr, so debugger
 * output and diagnostics never interleave on the same stream.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line of console output. Called from the console thread and from session listener
   * callbacks on the session driver thread.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Redirects console output for tests.
   *
   * @param writer writer that captures the output
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /**
   * Restores stdout after {@link #setWriterForTesting(PrintWriter)}.
   */
  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter active = override;
    return active != null ? active : STDOUT;
  }
}
