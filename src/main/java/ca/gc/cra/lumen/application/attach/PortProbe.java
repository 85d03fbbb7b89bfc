package ca.gc.cra.lumen.application.attach;

import java.util.Optional;

/**
 * Cheap connect-and-close check used only for diagnostics before the real connection.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PortProbe {

  /**
   * Probes one address.
   *
   * @param host loopback host
   * @param port port
   * @return empty when something accepted the connection, otherwise the failure text
   */
  Optional<String> probe(String host, int port);

  /** Probe that reports every port as listening. */
  PortProbe NONE = (host, port) -> Optional.empty();
}
