package ca.gc.cra.lumen.testutil;

import ca.gc.cra.lumen.application.port.TransportException;
import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory {@link Transporter} that records outbound traffic and lets tests inject inbound messages.
 *
 * <p>Requests are answered by the optional responder; unanswered ones stay pending until
 * {@link #reply(WireCommand, WireMessage)} or {@link #close()}.</p>
 */
public final class FakeTransporter implements Transporter {
  private final List<WireMessage> sent = new CopyOnWriteArrayList<>();
  private final Map<String, CompletableFuture<WireMessage>> pending = new ConcurrentHashMap<>();
  private final Map<String, WireCommand> pendingCommands = new ConcurrentHashMap<>();
  private final AtomicInteger ids = new AtomicInteger();
  private final AtomicInteger closeCount = new AtomicInteger();
  private final String name;
  private volatile TransportListener listener = TransportListener.NONE;
  private volatile Function<WireMessage, Optional<WireMessage>> responder = message -> Optional.empty();
  private volatile IOException connectFailure;
  private volatile boolean connected;
  private volatile boolean connectCalled;

  public FakeTransporter() {
    this("fake://debuggee");
  }

  public FakeTransporter(String name) {
    this.name = name;
  }

  public FakeTransporter failConnectWith(IOException failure) {
    this.connectFailure = failure;
    return this;
  }

  public FakeTransporter respondWith(Function<WireMessage, Optional<WireMessage>> responder) {
    this.responder = responder;
    return this;
  }

  @Override
  public void connect() throws IOException {
    connectCalled = true;
    if (connectFailure != null) {
      throw connectFailure;
    }
    connected = true;
  }

  @Override
  public void send(WireMessage message) throws IOException {
    if (!connected) {
      throw new TransportException("Not connected: " + name);
    }
    sent.add(message);
  }

  @Override
  public CompletableFuture<WireMessage> request(WireMessage message) throws IOException {
    String id = Integer.toString(ids.incrementAndGet());
    WireMessage correlated = message.withCorrelationId(id);
    CompletableFuture<WireMessage> future = new CompletableFuture<>();
    pending.put(id, future);
    pendingCommands.put(id, message.command());
    try {
      send(correlated);
    } catch (IOException ex) {
      pending.remove(id);
      pendingCommands.remove(id);
      throw ex;
    }
    responder.apply(correlated).ifPresent(reply -> complete(id, reply));
    return future;
  }

  @Override
  public void setListener(TransportListener listener) {
    this.listener = listener == null ? TransportListener.NONE : listener;
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public String describe() {
    return name;
  }

  @Override
  public void close() {
    closeCount.incrementAndGet();
    connected = false;
    TransportException closed = new TransportException("Transporter closed: " + name);
    pending.values().forEach(future -> future.completeExceptionally(closed));
    pending.clear();
    pendingCommands.clear();
  }

  /** Completes the oldest pending request of the given command. */
  public boolean reply(WireCommand command, WireMessage reply) {
    for (Map.Entry<String, WireCommand> entry : pendingCommands.entrySet()) {
      if (entry.getValue() == command) {
        return complete(entry.getKey(), reply);
      }
    }
    return false;
  }

  /** Simulates an inbound message from the debuggee. */
  public void deliver(WireMessage message) {
    listener.onMessage(message);
  }

  /** Simulates the debuggee dropping the connection. */
  public void dropConnection(Throwable cause) {
    connected = false;
    listener.onDisconnect(cause);
  }

  public List<WireMessage> sent() {
    return List.copyOf(sent);
  }

  public List<WireCommand> sentCommands() {
    return sent.stream().map(WireMessage::command).toList();
  }

  public long sentCount(WireCommand command) {
    return sent.stream().filter(m -> m.command() == command).count();
  }

  public int closeCount() {
    return closeCount.get();
  }

  public boolean connectCalled() {
    return connectCalled;
  }

  private boolean complete(String id, WireMessage reply) {
    pendingCommands.remove(id);
    CompletableFuture<WireMessage> future = pending.remove(id);
    return future != null && future.complete(reply.withCorrelationId(id));
  }
}
