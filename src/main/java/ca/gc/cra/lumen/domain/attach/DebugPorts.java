package ca.gc.cra.lumen.domain.attach;

/**
 * Port derivation shared by the injected Emmy hook and the IDE side.
 *
 * <p>The hook listens on a port computed from its own process id, so both ends agree without any
 * out-of-band exchange. The fold keeps the result inside {@code [0x400, 0xFFFF]}: above the well-known range
 * and inside the TCP port space.</p>
 *
 * @since 0.1.0
 */
public final class DebugPorts {
  /** Lowest derivable port (1024). */
  public static final int MIN_PORT = 0x400;
  /** Highest derivable port (65535). */
  public static final int MAX_PORT = 0xFFFF;

  private DebugPorts() {}

  /**
   * Folds a process id into the debug port range.
   *
   * @param pid target process id
   * @return port in {@code [MIN_PORT, MAX_PORT]}
   */
  public static int derive(long pid) {
    long port = pid;
    while (port > MAX_PORT) {
      port -= MAX_PORT;
    }
    while (port < MIN_PORT) {
      port += MIN_PORT;
    }
    return (int) port;
  }
}
