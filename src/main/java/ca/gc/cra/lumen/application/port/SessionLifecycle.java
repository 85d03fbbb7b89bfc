package ca.gc.cra.lumen.application.port;

import ca.gc.cra.lumen.domain.session.SessionState;

/**
 * Read-only view of a session used by collaborators that react to its lifecycle, such as the attachment
 * registry.
 *
 * @since 0.1.0
 */
public interface SessionLifecycle {

  String id();

  SessionState state();

  /**
   * Registers a listener. A listener added after termination receives {@code onTerminated} immediately.
   *
   * @param listener listener to add
   */
  void addListener(SessionListener listener);
}
