package ca.gc.cra.lumen.domain.breakpoint;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Wire-level description of a line breakpoint.
 * <p><strong>Why:</strong> Decouples what is sent to the debuggee from the IDE object that owns the breakpoint.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>The condition and the log message are carried independently; a debuggee treats a breakpoint with a log
 * message as a log point and never combines both for evaluation.</p>
 *
 * @param filePath source file path as known to the IDE; never blank
 * @param line 1-based line number
 * @param condition Lua boolean expression, or {@code null}
 * @param logMessage log point template, or {@code null}
 * @since 0.1.0
 */
public record BreakpointDescriptor(String filePath, int line, String condition, String logMessage) {

  public BreakpointDescriptor {
    Objects.requireNonNull(filePath, "filePath");
    if (filePath.isBlank()) {
      throw new IllegalArgumentException("filePath must not be blank");
    }
    if (line < 1) {
      throw new IllegalArgumentException("line must be 1-based (was " + line + ")");
    }
    condition = blankToNull(condition);
    logMessage = blankToNull(logMessage);
  }

  /**
   * Creates an unconditional breakpoint descriptor.
   *
   * @param filePath source file path
   * @param line 1-based line
   * @return descriptor without condition or log message
   */
  public static BreakpointDescriptor at(String filePath, int line) {
    return new BreakpointDescriptor(filePath, line, null, null);
  }

  /**
   * Indicates whether the descriptor designates a log point.
   *
   * @return {@code true} when a log message is present
   */
  public boolean isLogPoint() {
    return logMessage != null;
  }

  /**
   * Matches a reported location against this descriptor, ignoring path separators and, on request, case.
   *
   * @param file reported file
   * @param reportedLine reported 1-based line
   * @param caseSensitive whether path comparison is case-sensitive
   * @return {@code true} when the location designates this breakpoint
   */
  public boolean matches(String file, int reportedLine, boolean caseSensitive) {
    if (file == null || reportedLine != line) {
      return false;
    }
    String mine = normalize(filePath);
    String theirs = normalize(file);
    if (!caseSensitive) {
      mine = mine.toLowerCase(Locale.ROOT);
      theirs = theirs.toLowerCase(Locale.ROOT);
    }
    return mine.equals(theirs) || mine.endsWith("/" + theirs) || theirs.endsWith("/" + mine);
  }

  private static String normalize(String path) {
    String slashes = path.replace('\\', '/');
    return slashes.startsWith("./") ? slashes.substring(2) : slashes;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
