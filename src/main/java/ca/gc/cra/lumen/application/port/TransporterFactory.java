package ca.gc.cra.lumen.application.port;

/**
 * Creates unconnected transporters for one candidate endpoint; the attach workflow asks for a fresh one per
 * host and attempt.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransporterFactory {

  /**
   * Creates a transporter targeting {@code host:port}; the caller connects it.
   *
   * @param host candidate host
   * @param port derived debug port
   * @return new, unconnected transporter
   */
  Transporter create(String host, int port);
}
