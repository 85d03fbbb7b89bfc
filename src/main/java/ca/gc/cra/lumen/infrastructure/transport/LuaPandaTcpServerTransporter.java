package ca.gc.cra.lumen.infrastructure.transport;

import ca.gc.cra.lumen.application.callback.CallbackRegistry;
import ca.gc.cra.lumen.application.callback.CorrelationIds;
import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.TransportException;
import ca.gc.cra.lumen.infrastructure.json.JsonSupport;
import ca.gc.cra.lumen.validation.Net;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> LuaPanda transport where the IDE listens and the debuggee dials in.
 * <p><strong>Why:</strong> The usual LuaPanda setup: the game starts, {@code LuaPanda.start()} connects back to
 * the IDE port.</p>
 * <p><strong>Thread-safety:</strong> {@link #connect()} blocks in {@code accept}; {@link #close()} from another
 * thread unblocks it. Exactly one client is accepted, after which the listening socket is closed.</p>
 *
 * @since 0.1.0
 */
public final class LuaPandaTcpServerTransporter extends AbstractSocketTransporter {
  private static final Logger log = LoggerFactory.getLogger(LuaPandaTcpServerTransporter.class);

  private final String bindHost;
  private final int port;
  private final Object bindLock = new Object();
  private ServerSocket serverSocket;

  /**
   * Creates an unbound server transporter.
   *
   * @param bindHost local address to bind; {@code null} binds all interfaces
   * @param port listening port; {@code 0} picks an ephemeral port
   * @param json shared JSON support
   * @param metrics metrics sink
   */
  public LuaPandaTcpServerTransporter(String bindHost, int port, JsonSupport json, MetricsPort metrics) {
    super(new LuaPandaWireCodec(json), new CallbackRegistry(CorrelationIds.random()), metrics);
    this.bindHost = bindHost == null || bindHost.isBlank() ? null : Net.requireHost("bindHost", bindHost);
    if (port != 0) {
      Net.requirePort("port", port);
    }
    this.port = port;
  }

  /**
   * Binds the listening socket without waiting for a client. Called implicitly by {@link #connect()}.
   *
   * @return bound local port
   * @throws IOException when binding fails or the transporter is closed
   */
  public int bind() throws IOException {
    synchronized (bindLock) {
      if (isClosed()) {
        throw new TransportException("Transporter closed: " + describe());
      }
      if (serverSocket == null) {
        ServerSocket created = new ServerSocket();
        try {
          created.setReuseAddress(true);
          InetSocketAddress address = bindHost == null
              ? new InetSocketAddress(port)
              : new InetSocketAddress(bindHost, port);
          created.bind(address, 1);
        } catch (IOException ex) {
          created.close();
          throw ex;
        }
        serverSocket = created;
        log.info("Listening for LuaPanda debuggee on port {}", created.getLocalPort());
      }
      return serverSocket.getLocalPort();
    }
  }

  @Override
  protected Socket openSocket() throws IOException {
    bind();
    ServerSocket listening;
    synchronized (bindLock) {
      listening = serverSocket;
    }
    try {
      Socket client = listening.accept();
      log.info("Accepted LuaPanda debuggee from {}", client.getRemoteSocketAddress());
      return client;
    } finally {
      closeListening();
    }
  }

  @Override
  protected void closeResources() {
    closeListening();
  }

  @Override
  protected String endpoint() {
    synchronized (bindLock) {
      int local = serverSocket != null ? serverSocket.getLocalPort() : port;
      return (bindHost == null ? "*" : bindHost) + ":" + local + "?listen";
    }
  }

  private void closeListening() {
    synchronized (bindLock) {
      if (serverSocket == null || serverSocket.isClosed()) {
        return;
      }
      try {
        serverSocket.close();
      } catch (IOException ex) {
        log.debug("Error closing listening socket", ex);
      }
    }
  }
}
