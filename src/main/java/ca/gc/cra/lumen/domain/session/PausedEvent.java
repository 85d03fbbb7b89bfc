package ca.gc.cra.lumen.domain.session;

import ca.gc.cra.lumen.domain.breakpoint.BreakpointDescriptor;
import ca.gc.cra.lumen.domain.frame.StackFrameSnapshot;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Published when a break notification moves the session to {@link SessionState#PAUSED}.
 *
 * @param frames all reported frames, innermost first
 * @param topFrame frame selected for display
 * @param hitBreakpoint registered breakpoint at the top frame location, or {@code null}
 * @param reason dialect-specific stop reason (e.g. {@code stopOnBreakpoint}), or {@code null}
 * @since 0.1.0
 */
public record PausedEvent(
    List<StackFrameSnapshot> frames,
    StackFrameSnapshot topFrame,
    BreakpointDescriptor hitBreakpoint,
    String reason) {

  public PausedEvent {
    frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
    Objects.requireNonNull(topFrame, "topFrame");
  }

  public Optional<BreakpointDescriptor> breakpoint() {
    return Optional.ofNullable(hitBreakpoint);
  }
}
