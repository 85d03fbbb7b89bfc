package ca.gc.cra.lumen.application.session;

import ca.gc.cra.lumen.application.port.BreakpointSource;
import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.protocol.ProtocolDialect;
import ca.gc.cra.lumen.domain.breakpoint.BreakpointDescriptor;
import ca.gc.cra.lumen.domain.breakpoint.BreakpointHandle;
import ca.gc.cra.lumen.domain.breakpoint.LineBreakpoint;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Keeps the debuggee's breakpoint set in step with the IDE's.
 * <p><strong>Why:</strong> Breakpoint objects outlive sessions; every session starts a new generation with ids
 * counted from zero so stale handles from a previous connection never resolve.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the owning session's driver thread.</p>
 * <p><strong>Observability:</strong> Emits {@code session.breakpoints.sent} per message written.</p>
 *
 * @since 0.1.0
 */
public final class BreakpointSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(BreakpointSynchronizer.class);

  /** Writes one message to the debuggee. */
  @FunctionalInterface
  public interface WireSender {
    void send(WireMessage message) throws IOException;
  }

  private final ProtocolDialect dialect;
  private final WireSender sender;
  private final BreakpointSource source;
  private final MetricsPort metrics;
  private final Map<Integer, LineBreakpoint> table = new LinkedHashMap<>();
  private int nextId;
  private long generation;

  public BreakpointSynchronizer(
      ProtocolDialect dialect, WireSender sender, BreakpointSource source, MetricsPort metrics) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.sender = Objects.requireNonNull(sender, "sender");
    this.source = Objects.requireNonNull(source, "source");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Starts a new generation and re-announces every breakpoint the source currently holds.
   *
   * @return number of breakpoints registered
   */
  public int resync() {
    table.clear();
    nextId = 0;
    generation++;
    List<LineBreakpoint> current = List.copyOf(source.breakpoints());
    current.forEach(LineBreakpoint::clearHandle);
    for (LineBreakpoint breakpoint : current) {
      register(breakpoint);
    }
    log.debug("Breakpoint resync generation {} registered {}", generation, current.size());
    return current.size();
  }

  /**
   * Assigns a handle and announces the breakpoint. Registering an already registered breakpoint returns its
   * existing handle without sending anything.
   *
   * @param breakpoint breakpoint
   * @return handle of the current generation
   */
  public BreakpointHandle register(LineBreakpoint breakpoint) {
    Objects.requireNonNull(breakpoint, "breakpoint");
    Optional<BreakpointHandle> existing = breakpoint.handle();
    if (existing.isPresent() && resolve(existing.get()).filter(bp -> bp == breakpoint).isPresent()) {
      return existing.get();
    }
    BreakpointHandle handle = new BreakpointHandle(nextId++, generation);
    breakpoint.attachHandle(handle);
    table.put(handle.id(), breakpoint);
    BreakpointDescriptor descriptor = breakpoint.toDescriptor();
    send(dialect.addBreakpoint(descriptor, sameFile(descriptor.filePath())), "add " + breakpoint);
    return handle;
  }

  /**
   * Withdraws a breakpoint. Breakpoints without a live handle are ignored.
   *
   * @param breakpoint breakpoint
   * @return {@code true} when a removal was sent
   */
  public boolean unregister(LineBreakpoint breakpoint) {
    Objects.requireNonNull(breakpoint, "breakpoint");
    Optional<BreakpointHandle> handle = breakpoint.clearHandle();
    if (handle.isEmpty() || handle.get().generation() != generation) {
      return false;
    }
    if (table.remove(handle.get().id()) == null) {
      return false;
    }
    BreakpointDescriptor descriptor = breakpoint.toDescriptor();
    send(dialect.removeBreakpoint(descriptor, sameFile(descriptor.filePath())), "remove " + breakpoint);
    return true;
  }

  /**
   * Looks up the breakpoint behind a handle; handles of earlier generations resolve to nothing.
   *
   * @param handle handle
   * @return breakpoint, if live
   */
  public Optional<LineBreakpoint> resolve(BreakpointHandle handle) {
    if (handle == null || handle.generation() != generation) {
      return Optional.empty();
    }
    return Optional.ofNullable(table.get(handle.id()));
  }

  /**
   * Finds the registered breakpoint at a reported location.
   *
   * @param file file as reported by the debuggee
   * @param line 1-based line
   * @return matching descriptor
   */
  public Optional<BreakpointDescriptor> findByLocation(String file, int line) {
    for (LineBreakpoint breakpoint : table.values()) {
      BreakpointDescriptor descriptor = breakpoint.toDescriptor();
      if (descriptor.matches(file, line, dialect.caseSensitivePaths())) {
        return Optional.of(descriptor);
      }
    }
    return Optional.empty();
  }

  public List<BreakpointDescriptor> descriptors() {
    List<BreakpointDescriptor> out = new ArrayList<>(table.size());
    table.values().forEach(bp -> out.add(bp.toDescriptor()));
    return out;
  }

  public int size() {
    return table.size();
  }

  public long generation() {
    return generation;
  }

  private List<BreakpointDescriptor> sameFile(String filePath) {
    List<BreakpointDescriptor> out = new ArrayList<>();
    for (LineBreakpoint breakpoint : table.values()) {
      if (breakpoint.filePath().equals(filePath)) {
        out.add(breakpoint.toDescriptor());
      }
    }
    return out;
  }

  private void send(WireMessage message, String what) {
    try {
      sender.send(message);
      metrics.increment("session.breakpoints.sent");
    } catch (IOException ex) {
      log.warn("Failed to send breakpoint {}: {}", what, ex.getMessage());
    }
  }
}
