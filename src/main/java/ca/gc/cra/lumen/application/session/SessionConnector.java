package ca.gc.cra.lumen.application.session;

import ca.gc.cra.lumen.application.attach.AttachException;
import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.application.port.Transporter;
import java.io.IOException;
import java.util.OptionalInt;
import java.util.function.BooleanSupplier;

/**
 * Produces the connected transporter for a session: either dialling/accepting directly or attaching to a
 * process first.
 *
 * <p>{@link #connect} runs on a worker thread and may block; {@link #abort()} may be called from any thread
 * to unblock it.</p>
 *
 * @since 0.1.0
 */
public interface SessionConnector {

  /**
   * Establishes the connection.
   *
   * @param listener listener installed on the transporter before it starts receiving
   * @param cancelled polled while waiting; once {@code true} the connector gives up
   * @return connected transporter
   * @throws AttachException when attaching fails for a classified reason
   * @throws IOException when the connection cannot be established
   * @throws InterruptedException when interrupted while waiting
   */
  Transporter connect(TransportListener listener, BooleanSupplier cancelled)
      throws AttachException, IOException, InterruptedException;

  /** Unblocks a pending {@link #connect}; idempotent. */
  default void abort() {}

  /** Whether this connector attaches to a running process. */
  default boolean attaches() {
    return false;
  }

  /**
   * Process id the session is bound to, for diagnostic context.
   *
   * @return pid when attaching
   */
  default OptionalInt pid() {
    return OptionalInt.empty();
  }

  /**
   * Releases the attachment after the session has closed its transporter. Runs on a worker thread.
   *
   * @throws InterruptedException when interrupted while waiting
   */
  default void detach() throws InterruptedException {}
}
