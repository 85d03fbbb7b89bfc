package ca.gc.cra.lumen.application.port;

import ca.gc.cra.lumen.domain.breakpoint.LineBreakpoint;
import java.util.List;

/**
 * Enumerates the breakpoints currently defined in the IDE; consulted on every (re)synchronization.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BreakpointSource {

  /**
   * Returns a snapshot of the current line breakpoints.
   *
   * @return breakpoints; never {@code null}
   */
  List<LineBreakpoint> breakpoints();

  /** Source with no breakpoints. */
  BreakpointSource EMPTY = List::of;
}
