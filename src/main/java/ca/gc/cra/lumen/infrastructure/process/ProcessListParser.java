package ca.gc.cra.lumen.infrastructure.process;

import ca.gc.cra.lumen.domain.attach.ProcessInfo;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses {@code emmy_tool list_processes} output: records of four lines (pid, window title, executable path,
 * blank separator) joined with CRLF.
 *
 * @since 0.1.0
 */
public final class ProcessListParser {
  private static final Logger log = LoggerFactory.getLogger(ProcessListParser.class);
  private static final int RECORD_LINES = 4;

  private ProcessListParser() {
    // Utility
  }

  /**
   * Parses the tool output. Records with a non-numeric or non-positive pid are skipped.
   *
   * @param output decoded tool output; {@code null} yields an empty list
   * @return processes in output order
   */
  public static List<ProcessInfo> parse(String output) {
    if (output == null || output.isEmpty()) {
      return List.of();
    }
    String[] lines = output.split("\r\n", -1);
    List<ProcessInfo> result = new ArrayList<>(lines.length / RECORD_LINES + 1);
    for (int i = 0; i + 2 < lines.length; i += RECORD_LINES) {
      String pidText = lines[i].trim();
      if (pidText.isEmpty()) {
        continue;
      }
      int pid;
      try {
        pid = Integer.parseInt(pidText);
      } catch (NumberFormatException ex) {
        log.debug("Skipping process record with pid '{}'", pidText);
        continue;
      }
      if (pid <= 0) {
        continue;
      }
      result.add(ProcessInfo.fromPath(pid, lines[i + 1], lines[i + 2]));
    }
    return List.copyOf(result);
  }

  /**
   * Charset the helper tool writes: the Windows Chinese ANSI code page when the JDK has it, otherwise the
   * default charset.
   *
   * @return output charset
   */
  public static Charset toolCharset() {
    for (String name : List.of("GBK", "x-mswin-936", "windows-936")) {
      if (Charset.isSupported(name)) {
        return Charset.forName(name);
      }
    }
    return Charset.defaultCharset();
  }
}
