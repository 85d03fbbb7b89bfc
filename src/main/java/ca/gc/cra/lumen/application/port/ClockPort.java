package ca.gc.cra.lumen.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the attachment registry and attach workflow.
 * <ul>
 *   <li>Expose the current epoch time in milliseconds.</li>
 *   <li>Allow tests to inject deterministic clocks.</li>
 * </ul>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
