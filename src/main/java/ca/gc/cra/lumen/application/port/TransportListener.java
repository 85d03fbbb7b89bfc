package ca.gc.cra.lumen.application.port;

import ca.gc.cra.lumen.domain.wire.WireMessage;

/**
 * Receives inbound traffic from a {@link Transporter}.
 *
 * <p>Callbacks run on the receive-loop thread and must not block; the debug session only enqueues.</p>
 *
 * @since 0.1.0
 */
public interface TransportListener {

  /**
   * Called for each inbound message that did not complete a pending request.
   *
   * @param message decoded message
   */
  void onMessage(WireMessage message);

  /**
   * Called once when the peer closes the stream or a read fails. Not called for a local {@code close()}.
   *
   * @param cause read failure, or {@code null} on a clean end of stream
   */
  void onDisconnect(Throwable cause);

  /** Listener that ignores everything. */
  TransportListener NONE = new TransportListener() {
    @Override
    public void onMessage(WireMessage message) {}

    @Override
    public void onDisconnect(Throwable cause) {}
  };
}
