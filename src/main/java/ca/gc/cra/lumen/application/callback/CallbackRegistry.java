package ca.gc.cra.lumen.application.callback;

import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-transporter table of pending request continuations keyed by correlation id.
 * <p><strong>Why:</strong> Replies and unsolicited notifications share one inbound stream; a reply whose id is
 * pending completes its continuation and is consumed, everything else flows on to the listener.</p>
 * <p><strong>Thread-safety:</strong> Registration happens on caller threads and dispatch on the receive loop;
 * each entry is removed exactly once, so a continuation completes at most once.</p>
 *
 * @since 0.1.0
 */
public final class CallbackRegistry {
  private static final Logger log = LoggerFactory.getLogger(CallbackRegistry.class);
  private static final int MAX_ID_ATTEMPTS = 64;

  private final ConcurrentMap<String, CompletableFuture<WireMessage>> pending = new ConcurrentHashMap<>();
  private final CorrelationIds.Generator ids;
  private volatile Throwable closedCause;

  /**
   * Creates a registry that draws ids from the supplied generator.
   *
   * @param ids id generator
   */
  public CallbackRegistry(CorrelationIds.Generator ids) {
    this.ids = Objects.requireNonNull(ids, "ids");
  }

  /** A registered continuation and the id to stamp on the outbound request. */
  public record Registration(String id, CompletableFuture<WireMessage> future) {}

  /**
   * Reserves a fresh id and returns its continuation. Ids that are still pending or equal to the sentinel are
   * skipped.
   *
   * @return registration
   * @throws IllegalStateException when the registry has been failed, or no free id could be found
   */
  public Registration register() {
    for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
      String id = ids.next();
      if (id == null || WireMessage.NO_CORRELATION.equals(id)) {
        continue;
      }
      CompletableFuture<WireMessage> future = new CompletableFuture<>();
      if (pending.putIfAbsent(id, future) != null) {
        continue;
      }
      Throwable cause = closedCause;
      if (cause != null && pending.remove(id, future)) {
        throw new IllegalStateException("Callback registry is closed", cause);
      }
      return new Registration(id, future);
    }
    throw new IllegalStateException("Unable to allocate a free correlation id");
  }

  /**
   * Completes the continuation matching the message's correlation id.
   *
   * @param message inbound message
   * @return {@code true} when a continuation consumed the message
   */
  public boolean complete(WireMessage message) {
    Objects.requireNonNull(message, "message");
    if (!message.isCorrelated()) {
      return false;
    }
    CompletableFuture<WireMessage> future = pending.remove(message.correlationId());
    if (future == null) {
      return false;
    }
    future.complete(message);
    return true;
  }

  /**
   * Drops a registration whose request was never written.
   *
   * @param id correlation id
   * @param cause failure propagated to the continuation
   */
  public void cancel(String id, Throwable cause) {
    CompletableFuture<WireMessage> future = pending.remove(id);
    if (future != null) {
      future.completeExceptionally(cause);
    }
  }

  /**
   * Fails every pending continuation and rejects future registrations.
   *
   * @param cause failure delivered to the continuations
   * @return number of continuations failed
   */
  public int failAll(Throwable cause) {
    Objects.requireNonNull(cause, "cause");
    closedCause = cause;
    int failed = 0;
    Iterator<Map.Entry<String, CompletableFuture<WireMessage>>> it = pending.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, CompletableFuture<WireMessage>> entry = it.next();
      if (pending.remove(entry.getKey(), entry.getValue())) {
        entry.getValue().completeExceptionally(cause);
        failed++;
      }
    }
    if (failed > 0) {
      log.debug("Failed {} pending callbacks: {}", failed, cause.getMessage());
    }
    return failed;
  }

  /**
   * Number of continuations awaiting a reply.
   *
   * @return pending count
   */
  public int pendingCount() {
    return pending.size();
  }

  /**
   * Indicates whether the id is awaiting a reply.
   *
   * @param id correlation id
   * @return {@code true} when pending
   */
  public boolean isPending(String id) {
    return id != null && pending.containsKey(id);
  }
}
