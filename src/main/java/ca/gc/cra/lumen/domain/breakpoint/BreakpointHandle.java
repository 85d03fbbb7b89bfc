package ca.gc.cra.lumen.domain.breakpoint;

/**
 * Session-local join key between an IDE breakpoint and its wire descriptor.
 *
 * <p>{@code id} restarts at zero after every resync; {@code generation} changes with each resync so a handle
 * left over from an earlier connection never equals a fresh one.</p>
 *
 * @param id sequential id within the generation, starting at 0
 * @param generation synchronizer generation that allocated the handle
 * @since 0.1.0
 */
public record BreakpointHandle(int id, long generation) {

  public BreakpointHandle {
    if (id < 0) {
      throw new IllegalArgumentException("id must be >= 0 (was " + id + ")");
    }
  }
}
