package ca.gc.cra.lumen.application.port;

/**
 * Decides whether a file name reported by the debuggee maps to a source the IDE can open; drives top-frame
 * selection on break.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SourceLocator {

  /**
   * Indicates whether the reported file resolves to a known source.
   *
   * @param reportedFile file name or chunk name from a stack frame
   * @return {@code true} when the IDE can show the file
   */
  boolean canResolve(String reportedFile);

  /** Locator that resolves nothing; top-frame selection then falls back to line numbers. */
  SourceLocator NONE = file -> false;
}
