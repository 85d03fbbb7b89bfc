package ca.gc.cra.lumen.api;

import ca.gc.cra.lumen.domain.session.FailureKind;

/**
 * <strong>What:</strong> Process exit codes returned by the {@code attach}, {@code panda} and
 * {@code processes} commands.
 * <p><strong>Why:</strong> Scripts wrapping the debugger can tell an attach refusal from a bad argument or a
 * broken connection.</p>
 * <p><strong>Role:</strong> Returned by every CLI entry point; {@link #forFailure(FailureKind)} maps the first
 * fatal session error onto a code.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The command finished, or the session ended normally. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A socket or helper-process I/O operation failed. */
  IO_ERROR(3),
  /** The YAML configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected failure inside the session driver. */
  RUNTIME_FAILURE(5),
  /** The attach workflow refused or failed (platform, tool, injection, connect, double attach). */
  ATTACH_REFUSED(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps the first fatal session error to an exit code. A session that was cancelled or whose debuggee
   * went away ended normally from the user's point of view.
   *
   * @param kind failure category, or {@code null} when the session ended without error
   * @return exit code for the session outcome
   */
  public static ExitCode forFailure(FailureKind kind) {
    if (kind == null) {
      return SUCCESS;
    }
    return switch (kind) {
      case CANCELLED, PEER_DISCONNECTED -> SUCCESS;
      case UNSUPPORTED_PLATFORM, TOOL_MISSING, ATTACH_FAILED, CONNECT_TIMEOUT, DOUBLE_ATTACH -> ATTACH_REFUSED;
      case CONNECT_FAILED -> IO_ERROR;
      case INTERNAL -> RUNTIME_FAILURE;
    };
  }
}
