package ca.gc.cra.lumen.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Spawns external helper processes (injection tool, PowerShell, tasklist).
 * <p><strong>Why:</strong> Keeps the attach workflow free of {@link ProcessBuilder} plumbing and lets tests
 * script helper behaviour.</p>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent invocations.</p>
 *
 * @since 0.1.0
 */
public interface ProcessRunner {

  /**
   * Runs a command to completion, draining stdout and stderr concurrently.
   *
   * @param command executable and arguments
   * @param workingDirectory working directory, or {@code null} to inherit
   * @return exit status and captured output
   * @throws IOException when the process cannot be started
   * @throws InterruptedException when interrupted while waiting
   */
  ProcessResult run(List<String> command, Path workingDirectory) throws IOException, InterruptedException;

  /**
   * Starts a command without waiting for it (e.g. a log-capture console).
   *
   * @param command executable and arguments
   * @param workingDirectory working directory, or {@code null} to inherit
   * @throws IOException when the process cannot be started
   */
  void launch(List<String> command, Path workingDirectory) throws IOException;

  /**
   * Completed process outcome.
   *
   * @param exitCode process exit status
   * @param stdout captured standard output
   * @param stderr captured standard error
   */
  record ProcessResult(int exitCode, String stdout, String stderr) {
    public ProcessResult {
      stdout = Objects.requireNonNullElse(stdout, "");
      stderr = Objects.requireNonNullElse(stderr, "");
    }

    public boolean succeeded() {
      return exitCode == 0;
    }

    /**
     * Best diagnostic text: stderr when present, otherwise stdout.
     *
     * @return trimmed diagnostic output
     */
    public String diagnostic() {
      return stderr.isBlank() ? stdout.trim() : stderr.trim();
    }
  }
}
