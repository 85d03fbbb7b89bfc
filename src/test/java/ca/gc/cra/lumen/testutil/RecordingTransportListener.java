package ca.gc.cra.lumen.testutil;

import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/** Collects transport callbacks so tests can await them. */
public final class RecordingTransportListener implements TransportListener {
  private final BlockingQueue<WireMessage> messages = new LinkedBlockingQueue<>();
  private final CountDownLatch disconnected = new CountDownLatch(1);
  private final AtomicInteger disconnects = new AtomicInteger();
  private final AtomicReference<Throwable> cause = new AtomicReference<>();

  @Override
  public void onMessage(WireMessage message) {
    messages.add(message);
  }

  @Override
  public void onDisconnect(Throwable error) {
    cause.set(error);
    disconnects.incrementAndGet();
    disconnected.countDown();
  }

  public WireMessage next() throws InterruptedException {
    WireMessage message = messages.poll(5, TimeUnit.SECONDS);
    if (message == null) {
      throw new AssertionError("no message received within 5s");
    }
    return message;
  }

  public boolean hasMessages() {
    return !messages.isEmpty();
  }

  public boolean awaitDisconnect() throws InterruptedException {
    return disconnected.await(5, TimeUnit.SECONDS);
  }

  public int disconnectCount() {
    return disconnects.get();
  }

  public Throwable cause() {
    return cause.get();
  }
}
