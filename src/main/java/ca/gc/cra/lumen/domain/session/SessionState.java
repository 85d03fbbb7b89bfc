package ca.gc.cra.lumen.domain.session;

/**
 * Lifecycle of a debug session.
 *
 * <pre>
 * CREATED -&gt; INITIALIZING -&gt; CONNECTING -&gt; (ATTACHING) -&gt; HANDSHAKING -&gt; READY &lt;-&gt; RUNNING &lt;-&gt; PAUSED
 *                                                                       \-------------------------&gt; STOPPING -&gt; TERMINATED
 * </pre>
 *
 * <p>{@link #ATTACHING} only occurs for the process-attach protocol. Any non-terminal state may move to
 * {@link #STOPPING}.</p>
 *
 * @since 0.1.0
 */
public enum SessionState {
  CREATED,
  INITIALIZING,
  CONNECTING,
  ATTACHING,
  HANDSHAKING,
  READY,
  RUNNING,
  PAUSED,
  STOPPING,
  TERMINATED;

  /**
   * Whether run-control commands may be issued.
   *
   * @return {@code true} for READY, RUNNING and PAUSED
   */
  public boolean isInteractive() {
    return this == READY || this == RUNNING || this == PAUSED;
  }

  /**
   * Whether the session is on its way out or gone.
   *
   * @return {@code true} for STOPPING and TERMINATED
   */
  public boolean isStoppingOrTerminated() {
    return this == STOPPING || this == TERMINATED;
  }
}
