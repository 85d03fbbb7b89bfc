package ca.gc.cra.lumen.domain.session;

import java.util.Objects;

/**
 * Output or log record forwarded from the debuggee.
 *
 * @param level severity reported by the runtime
 * @param message text
 * @since 0.1.0
 */
public record LogEvent(Level level, String message) {

  public LogEvent {
    Objects.requireNonNull(level, "level");
    message = Objects.requireNonNullElse(message, "");
  }

  /** Severity codes used by the Emmy {@code LogNotify} message (0..3). */
  public enum Level {
    DEBUG,
    INFO,
    WARNING,
    ERROR;

    /**
     * Maps a wire severity code; unknown codes map to {@link #INFO}.
     *
     * @param code wire code
     * @return level
     */
    public static Level fromCode(int code) {
      Level[] values = values();
      return code >= 0 && code < values.length ? values[code] : INFO;
    }
  }
}
