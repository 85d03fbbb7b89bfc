package ca.gc.cra.lumen.application.session;

import ca.gc.cra.lumen.application.port.BreakpointSource;
import ca.gc.cra.lumen.domain.breakpoint.LineBreakpoint;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory set of user breakpoints, one per file and line.
 *
 * <p>Serves as the {@link BreakpointSource} a session re-announces after each handshake. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class BreakpointBook implements BreakpointSource {
  private final List<LineBreakpoint> entries = new CopyOnWriteArrayList<>();

  /**
   * Adds a breakpoint, replacing any existing one at the same location.
   *
   * @param breakpoint breakpoint
   * @return the replaced breakpoint, if any
   */
  public synchronized Optional<LineBreakpoint> put(LineBreakpoint breakpoint) {
    Objects.requireNonNull(breakpoint, "breakpoint");
    Optional<LineBreakpoint> previous = find(breakpoint.filePath(), breakpoint.zeroBasedLine());
    previous.ifPresent(entries::remove);
    entries.add(breakpoint);
    return previous;
  }

  /**
   * Removes the breakpoint at a location.
   *
   * @param filePath file path as entered
   * @param zeroBasedLine 0-based line
   * @return removed breakpoint
   */
  public synchronized Optional<LineBreakpoint> remove(String filePath, int zeroBasedLine) {
    Optional<LineBreakpoint> existing = find(filePath, zeroBasedLine);
    existing.ifPresent(entries::remove);
    return existing;
  }

  public Optional<LineBreakpoint> find(String filePath, int zeroBasedLine) {
    for (LineBreakpoint entry : entries) {
      if (entry.zeroBasedLine() == zeroBasedLine && entry.filePath().equals(filePath)) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  @Override
  public List<LineBreakpoint> breakpoints() {
    return List.copyOf(entries);
  }

  public int size() {
    return entries.size();
  }
}
