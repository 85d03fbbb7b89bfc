package ca.gc.cra.lumen.application.session;

import ca.gc.cra.lumen.application.attach.AttachException;
import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.domain.session.FailureKind;
import java.io.IOException;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Connects a pre-built transporter, e.g. a LuaPanda client or server.
 *
 * @since 0.1.0
 */
public final class DirectConnector implements SessionConnector {
  private final Transporter transporter;

  public DirectConnector(Transporter transporter) {
    this.transporter = Objects.requireNonNull(transporter, "transporter");
  }

  @Override
  public Transporter connect(TransportListener listener, BooleanSupplier cancelled)
      throws AttachException, IOException {
    if (cancelled.getAsBoolean()) {
      throw new AttachException(FailureKind.CANCELLED, "Session stopped before connecting");
    }
    transporter.setListener(listener);
    try {
      transporter.connect();
    } catch (IOException ex) {
      transporter.close();
      if (cancelled.getAsBoolean()) {
        throw new AttachException(FailureKind.CANCELLED, "Session stopped while connecting", ex);
      }
      throw ex;
    }
    return transporter;
  }

  @Override
  public void abort() {
    // once connected the session owns shutdown so it can still send the stop message
    if (!transporter.isConnected()) {
      transporter.close();
    }
  }
}
