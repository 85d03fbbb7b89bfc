package ca.gc.cra.lumen.domain.session;

/**
 * Fatal failure categories that end a debug session.
 *
 * <p>Parse errors on an inbound record are not listed: they are recovered inside the transporter.</p>
 *
 * @since 0.1.0
 */
public enum FailureKind {
  /** Process attach requested on a platform without injection support. */
  UNSUPPORTED_PLATFORM,
  /** Helper executable or injection library missing; not retryable. */
  TOOL_MISSING,
  /** Helper exited with a non-zero status; carries its stderr. */
  ATTACH_FAILED,
  /** Bounded connect retries exhausted. */
  CONNECT_TIMEOUT,
  /** The pid already has an attached session; nothing was spawned. */
  DOUBLE_ATTACH,
  /** The session was stopped while the attach workflow was still running. */
  CANCELLED,
  /** A direct transporter connect (client dial or server accept) failed. */
  CONNECT_FAILED,
  /** The peer closed the stream or the connection broke. */
  PEER_DISCONNECTED,
  /** Any other unexpected failure in the session driver. */
  INTERNAL
}
