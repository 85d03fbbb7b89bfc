package ca.gc.cra.lumen.application.attach;

import ca.gc.cra.lumen.domain.session.FailureKind;
import java.util.Objects;

/**
 * Signals that attaching to a process, or connecting a session, failed for a classified reason.
 *
 * @since 0.1.0
 */
public final class AttachException extends Exception {
  private static final long serialVersionUID = 1L;

  private final FailureKind kind;

  public AttachException(FailureKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public AttachException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Failure category reported to session listeners.
   *
   * @return kind
   */
  public FailureKind kind() {
    return kind;
  }
}
