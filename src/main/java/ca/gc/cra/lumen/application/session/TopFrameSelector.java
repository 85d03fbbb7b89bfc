package ca.gc.cra.lumen.application.session;

import ca.gc.cra.lumen.application.port.SourceLocator;
import ca.gc.cra.lumen.domain.frame.StackFrameSnapshot;
import java.util.List;
import java.util.Optional;

/**
 * Picks the frame the IDE should show when the debuggee pauses.
 *
 * <p>Precedence: the first frame whose file resolves locally, then the first frame with a positive line,
 * then the first frame.</p>
 */
public final class TopFrameSelector {

  private TopFrameSelector() {
    // Utility
  }

  public static Optional<StackFrameSnapshot> select(List<StackFrameSnapshot> frames, SourceLocator locator) {
    if (frames == null || frames.isEmpty()) {
      return Optional.empty();
    }
    SourceLocator effective = locator == null ? SourceLocator.NONE : locator;
    for (StackFrameSnapshot frame : frames) {
      if (!frame.file().isEmpty() && effective.canResolve(frame.file())) {
        return Optional.of(frame);
      }
    }
    for (StackFrameSnapshot frame : frames) {
      if (frame.line() > 0) {
        return Optional.of(frame);
      }
    }
    return Optional.of(frames.get(0));
  }
}
