package ca.gc.cra.lumen.application.port;

import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Owns one physical debugger connection and its wire codec.
 * <p><strong>Why:</strong> The debug session drives the Emmy attach socket and both LuaPanda variants through
 * the same contract; the variant is chosen once when the session is built.</p>
 * <p><strong>Thread-safety:</strong> {@link #send(WireMessage)} and {@link #request(WireMessage)} may be called
 * from any thread; listener callbacks arrive on the transporter's receive-loop thread in wire order.</p>
 * <p><strong>Lifecycle:</strong> {@code connect} at most once; {@code close} is idempotent, never throws, and
 * fails every outstanding {@link #request(WireMessage)} future.</p>
 *
 * @since 0.1.0
 */
public interface Transporter extends AutoCloseable {

  /**
   * Establishes the connection (dial or accept) and starts the receive loop.
   *
   * @throws IOException when the connection cannot be established or the transporter is closed
   */
  void connect() throws IOException;

  /**
   * Sends a message without registering a reply continuation.
   *
   * @param message message to encode and write
   * @throws IOException when the transporter is not connected or the write fails
   */
  void send(WireMessage message) throws IOException;

  /**
   * Sends a message with a freshly generated correlation id and returns the future completed by the
   * matching reply. Replies consumed this way are never forwarded to the listener.
   *
   * @param message request; any correlation id it carries is replaced
   * @return future completed with the reply, or exceptionally when the transporter closes first
   * @throws IOException when the transporter is not connected or the write fails
   */
  CompletableFuture<WireMessage> request(WireMessage message) throws IOException;

  /**
   * Installs the listener receiving uncorrelated inbound messages and the disconnect signal.
   *
   * @param listener listener; replaces any previous one
   */
  void setListener(TransportListener listener);

  /**
   * Indicates whether the connection is established and not yet closed.
   *
   * @return connection state
   */
  boolean isConnected();

  /**
   * Endpoint description for logs, e.g. {@code emmy://127.0.0.1:4465}.
   *
   * @return description
   */
  String describe();

  /**
   * Closes the connection and releases all sockets; idempotent and never throws.
   */
  @Override
  void close();
}
