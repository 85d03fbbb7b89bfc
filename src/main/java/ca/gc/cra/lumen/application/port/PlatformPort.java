package ca.gc.cra.lumen.application.port;

import java.util.Locale;

/**
 * Host platform facts the attach workflow depends on.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PlatformPort {

  /**
   * Indicates whether the host supports process injection via the helper tool.
   *
   * @return {@code true} on Windows
   */
  boolean supportsProcessInjection();

  /** Platform derived from the {@code os.name} system property. */
  PlatformPort SYSTEM = () -> System.getProperty("os.name", "")
      .toLowerCase(Locale.ROOT)
      .startsWith("windows");
}
