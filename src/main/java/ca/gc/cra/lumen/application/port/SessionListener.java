package ca.gc.cra.lumen.application.port;

import ca.gc.cra.lumen.domain.session.LogEvent;
import ca.gc.cra.lumen.domain.session.PausedEvent;
import ca.gc.cra.lumen.domain.session.SessionError;
import ca.gc.cra.lumen.domain.session.SessionState;

/**
 * Observer of debug session events. All methods default to no-ops.
 *
 * <p>Callbacks run on the session driver thread. IDE integrations marshal onto their own UI thread; the
 * engine never does.</p>
 *
 * @since 0.1.0
 */
public interface SessionListener {

  default void onStateChanged(SessionState previous, SessionState current) {}

  default void onPaused(PausedEvent event) {}

  default void onResumed() {}

  default void onLog(LogEvent event) {}

  /** Called at most once, before the session enters {@link SessionState#STOPPING}. */
  default void onError(SessionError error) {}

  /** Called exactly once when the session reaches {@link SessionState#TERMINATED}. */
  default void onTerminated() {}
}
