package ca.gc.cra.lumen.domain.session;

import java.util.Locale;

/**
 * Transport/protocol combination a session is built for; selects the transporter variant at construction.
 *
 * @since 0.1.0
 */
public enum DebugProtocol {
  /** Inject into a running Windows process and connect to the pid-derived port (Emmy). */
  EMMY_ATTACH,
  /** Dial a LuaPanda debuggee listening on host:port. */
  PANDA_CLIENT,
  /** Listen for a LuaPanda debuggee and accept exactly one connection. */
  PANDA_SERVER;

  /**
   * Parses user input such as {@code client}, {@code server}, {@code attach} or the constant names.
   *
   * @param raw user supplied value
   * @return matching protocol
   * @throws IllegalArgumentException when the value is not recognised
   */
  public static DebugProtocol fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("protocol must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "ATTACH", "EMMY", "EMMY_ATTACH" -> EMMY_ATTACH;
      case "CLIENT", "TCP_CLIENT", "PANDA_CLIENT" -> PANDA_CLIENT;
      case "SERVER", "TCP_SERVER", "PANDA_SERVER" -> PANDA_SERVER;
      default -> throw new IllegalArgumentException("Unsupported protocol: " + raw);
    };
  }

  public boolean isAttach() {
    return this == EMMY_ATTACH;
  }
}
