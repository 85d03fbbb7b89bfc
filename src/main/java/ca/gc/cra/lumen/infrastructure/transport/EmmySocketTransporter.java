package ca.gc.cra.lumen.infrastructure.transport;

import ca.gc.cra.lumen.application.callback.CallbackRegistry;
import ca.gc.cra.lumen.application.callback.CorrelationIds;
import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.infrastructure.json.JsonSupport;
import ca.gc.cra.lumen.validation.Net;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * TCP client to the Emmy debug service opened inside an attached process.
 *
 * @since 0.1.0
 */
public final class EmmySocketTransporter extends AbstractSocketTransporter {
  private final String host;
  private final int port;
  private final Duration connectTimeout;

  /**
   * Creates an unconnected transporter.
   *
   * @param host loopback host name or literal
   * @param port Emmy debug port
   * @param connectTimeout per-dial timeout
   * @param json shared JSON support
   * @param metrics metrics sink
   */
  public EmmySocketTransporter(
      String host, int port, Duration connectTimeout, JsonSupport json, MetricsPort metrics) {
    super(new EmmyWireCodec(json), new CallbackRegistry(CorrelationIds.sequential()), metrics);
    this.host = Net.requireHost("host", host);
    this.port = Net.requirePort("port", port);
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
  }

  @Override
  protected Socket openSocket() throws IOException {
    Socket socket = new Socket();
    try {
      socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
      return socket;
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
  }

  @Override
  protected String endpoint() {
    return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
  }
}
