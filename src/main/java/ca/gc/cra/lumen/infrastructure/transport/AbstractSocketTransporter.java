package ca.gc.cra.lumen.infrastructure.transport;

import ca.gc.cra.lumen.application.callback.CallbackRegistry;
import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.TransportException;
import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import ca.gc.cra.lumen.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.lumen.logging.Logs;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shared socket plumbing for all transporters: connect-once lifecycle, receive loop,
 * reply correlation and serialized writes.
 * <p><strong>Why:</strong> The Emmy and LuaPanda variants differ only in how the socket is obtained and how
 * frames are encoded; subclasses supply {@link #openSocket()} and a {@link WireCodec}.</p>
 * <p><strong>Thread-safety:</strong> Writes are serialized on a lock; the receive loop runs on a dedicated
 * {@code lumen-rx-*} thread and is the only reader.</p>
 * <p><strong>Observability:</strong> Emits {@code transport.messages.received} and
 * {@code transport.parse.error}.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractSocketTransporter implements Transporter {
  private static final Logger log = LoggerFactory.getLogger(AbstractSocketTransporter.class);
  private static final int LOG_PREVIEW_BYTES = 512;

  private final WireCodec codec;
  private final CallbackRegistry callbacks;
  private final MetricsPort metrics;
  private final Object writeLock = new Object();
  private final AtomicBoolean connectCalled = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicBoolean disconnectReported = new AtomicBoolean();

  private volatile TransportListener listener = TransportListener.NONE;
  private volatile Socket socket;
  private volatile Writer writer;
  private volatile boolean connected;

  protected AbstractSocketTransporter(WireCodec codec, CallbackRegistry callbacks, MetricsPort metrics) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Obtains the connected socket, either by dialling or by accepting.
   *
   * @return connected socket
   * @throws IOException when the socket cannot be obtained
   */
  protected abstract Socket openSocket() throws IOException;

  /** Releases variant-specific resources such as a listening socket; called once from {@link #close()}. */
  protected void closeResources() {}

  @Override
  public final void connect() throws IOException {
    if (!connectCalled.compareAndSet(false, true)) {
      throw new TransportException("connect() already called on " + describe());
    }
    if (closed.get()) {
      throw new TransportException("Transporter closed: " + describe());
    }
    Socket opened;
    try {
      opened = openSocket();
    } catch (IOException ex) {
      if (closed.get()) {
        throw new TransportException("Transporter closed while connecting: " + describe(), ex);
      }
      throw ex;
    }
    opened.setTcpNoDelay(true);
    BufferedReader reader = new BufferedReader(
        new InputStreamReader(opened.getInputStream(), StandardCharsets.UTF_8));
    this.writer = new BufferedWriter(new OutputStreamWriter(opened.getOutputStream(), StandardCharsets.UTF_8));
    this.socket = opened;
    if (closed.get()) {
      closeQuietly(opened);
      throw new TransportException("Transporter closed while connecting: " + describe());
    }
    connected = true;
    log.info("Connected {}", describe());
    ExecutorFactories.startDaemon("lumen-rx", () -> receiveLoop(reader));
  }

  @Override
  public final void send(WireMessage message) throws IOException {
    Objects.requireNonNull(message, "message");
    String frame = codec.encode(message);
    synchronized (writeLock) {
      Writer out = writer;
      if (!connected || out == null) {
        throw new TransportException("Not connected: " + describe());
      }
      out.write(frame);
      out.flush();
    }
    if (log.isDebugEnabled()) {
      log.debug("-> {} {}", message.displayName(), Logs.oneLine(frame, LOG_PREVIEW_BYTES));
    }
  }

  @Override
  public final CompletableFuture<WireMessage> request(WireMessage message) throws IOException {
    Objects.requireNonNull(message, "message");
    CallbackRegistry.Registration registration;
    try {
      registration = callbacks.register();
    } catch (IllegalStateException ex) {
      throw new TransportException("Cannot register request on " + describe(), ex);
    }
    try {
      send(message.withCorrelationId(registration.id()));
    } catch (IOException | RuntimeException ex) {
      callbacks.cancel(registration.id(), ex);
      throw ex;
    }
    return registration.future();
  }

  @Override
  public final void setListener(TransportListener listener) {
    this.listener = listener == null ? TransportListener.NONE : listener;
  }

  @Override
  public final boolean isConnected() {
    return connected && !closed.get();
  }

  @Override
  public String describe() {
    return codec.scheme() + "://" + endpoint();
  }

  /**
   * Host and port rendered in {@link #describe()}.
   *
   * @return endpoint text
   */
  protected abstract String endpoint();

  @Override
  public final void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    connected = false;
    closeResources();
    Socket current = socket;
    if (current != null) {
      closeQuietly(current);
    }
    callbacks.failAll(new TransportException("Transporter closed: " + describe()));
    log.debug("Closed {}", describe());
  }

  /**
   * Indicates whether {@link #close()} has been called.
   *
   * @return closed flag
   */
  protected final boolean isClosed() {
    return closed.get();
  }

  protected final MetricsPort metrics() {
    return metrics;
  }

  private void receiveLoop(BufferedReader reader) {
    Throwable cause = null;
    try {
      while (!closed.get()) {
        String frame = codec.readFrame(reader);
        if (frame == null) {
          break;
        }
        dispatchFrame(frame);
      }
    } catch (IOException ex) {
      if (!closed.get()) {
        cause = ex;
      }
    }
    onStreamEnded(cause);
  }

  private void dispatchFrame(String frame) {
    WireMessage message;
    try {
      message = codec.decode(frame);
    } catch (IllegalArgumentException ex) {
      metrics.increment("transport.parse.error");
      log.warn("Dropping malformed frame from {}: {} [{}]",
          describe(), ex.getMessage(), Logs.oneLine(frame, LOG_PREVIEW_BYTES));
      return;
    }
    metrics.increment("transport.messages.received");
    if (log.isDebugEnabled()) {
      log.debug("<- {} {}", message.displayName(), Logs.oneLine(frame, LOG_PREVIEW_BYTES));
    }
    if (callbacks.complete(message)) {
      return;
    }
    try {
      listener.onMessage(message);
    } catch (RuntimeException ex) {
      log.error("Listener failed handling {} from {}", message.displayName(), describe(), ex);
    }
  }

  private void onStreamEnded(Throwable cause) {
    boolean peerInitiated = !closed.get();
    connected = false;
    if (!peerInitiated) {
      return;
    }
    if (cause == null) {
      log.info("Peer closed {}", describe());
    } else {
      log.warn("Connection lost on {}: {}", describe(), cause.getMessage());
    }
    Socket current = socket;
    if (current != null) {
      closeQuietly(current);
    }
    callbacks.failAll(new TransportException("Connection closed by peer: " + describe(), cause));
    if (disconnectReported.compareAndSet(false, true)) {
      try {
        listener.onDisconnect(cause);
      } catch (RuntimeException ex) {
        log.error("Listener failed handling disconnect of {}", describe(), ex);
      }
    }
  }

  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception ex) {
      log.debug("Error closing {}", closeable, ex);
    }
  }
}
