package ca.gc.cra.lumen.domain.breakpoint;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> IDE-side line breakpoint with a user-data slot for the handle assigned by the
 * breakpoint synchronizer.
 * <p><strong>Why:</strong> The IDE keeps breakpoint objects alive across sessions (and may persist their user
 * data across restarts), so the handle slot must be explicitly cleared on every resync.</p>
 * <p><strong>Thread-safety:</strong> Location fields are immutable; the handle slot is atomic.</p>
 * <p>Identity semantics: two breakpoint objects at the same location are distinct breakpoints.</p>
 *
 * @since 0.1.0
 */
public final class LineBreakpoint {
  private final String filePath;
  private final int zeroBasedLine;
  private final String condition;
  private final String logMessage;
  private final AtomicReference<BreakpointHandle> handle = new AtomicReference<>();

  /**
   * Creates a breakpoint as the IDE reports it.
   *
   * @param filePath source file path; never blank
   * @param zeroBasedLine IDE line index (0-based)
   * @param condition optional condition expression
   * @param logMessage optional log message
   */
  public LineBreakpoint(String filePath, int zeroBasedLine, String condition, String logMessage) {
    this.filePath = Objects.requireNonNull(filePath, "filePath");
    if (zeroBasedLine < 0) {
      throw new IllegalArgumentException("zeroBasedLine must be >= 0 (was " + zeroBasedLine + ")");
    }
    this.zeroBasedLine = zeroBasedLine;
    this.condition = condition;
    this.logMessage = logMessage;
  }

  public static LineBreakpoint at(String filePath, int zeroBasedLine) {
    return new LineBreakpoint(filePath, zeroBasedLine, null, null);
  }

  public String filePath() {
    return filePath;
  }

  public int zeroBasedLine() {
    return zeroBasedLine;
  }

  public String condition() {
    return condition;
  }

  public String logMessage() {
    return logMessage;
  }

  /**
   * Builds the wire descriptor, converting the IDE line to 1-based.
   *
   * @return descriptor for this breakpoint
   */
  public BreakpointDescriptor toDescriptor() {
    return new BreakpointDescriptor(filePath, zeroBasedLine + 1, condition, logMessage);
  }

  public Optional<BreakpointHandle> handle() {
    return Optional.ofNullable(handle.get());
  }

  public void attachHandle(BreakpointHandle value) {
    handle.set(Objects.requireNonNull(value, "value"));
  }

  /**
   * Clears the handle slot.
   *
   * @return the handle that was attached, if any
   */
  public Optional<BreakpointHandle> clearHandle() {
    return Optional.ofNullable(handle.getAndSet(null));
  }

  @Override
  public String toString() {
    return filePath + ":" + (zeroBasedLine + 1);
  }
}
