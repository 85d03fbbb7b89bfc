package ca.gc.cra.lumen.application.port;

import java.io.IOException;

/**
 * I/O failure raised by a transporter: connect refused, send on a closed connection, or the connection
 * closing while a request is outstanding.
 *
 * @since 0.1.0
 */
public final class TransportException extends IOException {
  private static final long serialVersionUID = 1L;

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
