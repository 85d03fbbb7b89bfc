package ca.gc.cra.lumen.infrastructure.transport;

import ca.gc.cra.lumen.application.attach.PortProbe;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Port probe that opens and immediately closes a plain TCP connection.
 *
 * @since 0.1.0
 */
public final class SocketPortProbe implements PortProbe {
  private final Duration timeout;

  public SocketPortProbe(Duration timeout) {
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public Optional<String> probe(String host, int port) {
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
      return Optional.empty();
    } catch (IOException ex) {
      return Optional.of(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }
}
