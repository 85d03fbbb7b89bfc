package ca.gc.cra.lumen.domain.attach;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Registry entry for a process that has (or is acquiring) an attached debug session.
 * <p><strong>Why:</strong> Lets a second attach request for the same pid be refused with who holds it and
 * since when.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the registry replaces records instead of mutating them.</p>
 *
 * @param pid target process id
 * @param processName display name of the target process
 * @param sessionId id of the owning debug session
 * @param attachTimestamp when the pid was claimed, updated when the attach completes
 * @param status whether the attach is still in progress or completed
 * @since 0.1.0
 */
public record AttachmentRecord(
    int pid,
    String processName,
    String sessionId,
    Instant attachTimestamp,
    Status status) {

  public AttachmentRecord {
    if (pid <= 0) {
      throw new IllegalArgumentException("pid must be positive (was " + pid + ")");
    }
    processName = Objects.requireNonNullElse(processName, "");
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(attachTimestamp, "attachTimestamp");
    Objects.requireNonNull(status, "status");
  }

  /**
   * Returns a copy marked as attached at {@code when}.
   *
   * @param when completion time
   * @return attached record
   */
  public AttachmentRecord attachedAt(Instant when) {
    return new AttachmentRecord(pid, processName, sessionId, when, Status.ATTACHED);
  }

  /** Attach progress. */
  public enum Status {
    /** Pid reserved; the attach workflow is still running. */
    ATTACHING,
    /** Transporter connected. */
    ATTACHED
  }
}
