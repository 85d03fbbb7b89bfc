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
 * LuaPanda transport where the IDE dials a debuggee that listens.
 *
 * @since 0.1.0
 */
public final class LuaPandaTcpClientTransporter extends AbstractSocketTransporter {
  private final String host;
  private final int port;
  private final Duration connectTimeout;

  public LuaPandaTcpClientTransporter(
      String host, int port, Duration connectTimeout, JsonSupport json, MetricsPort metrics) {
    super(new LuaPandaWireCodec(json), new CallbackRegistry(CorrelationIds.random()), metrics);
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
    return host + ":" + port;
  }
}
