package ca.gc.cra.lumen.application.attach;

import ca.gc.cra.lumen.domain.attach.WinArch;
import java.util.List;
import java.util.Objects;

/**
 * One attach attempt.
 *
 * @param pid target process id
 * @param processName display name recorded in the attachment registry
 * @param requestedArch architecture chosen by the user; the detected one wins when they differ
 * @param captureLog ask the hook to capture the target's log and launch a log receiver
 * @param probePort run the diagnostic port probe before connecting
 * @param hosts loopback addresses tried in order on every connect round
 * @since 0.1.0
 */
public record AttachRequest(
    int pid,
    String processName,
    WinArch requestedArch,
    boolean captureLog,
    boolean probePort,
    List<String> hosts) {

  /** Loopback candidates: IPv4, IPv6, then the host name. */
  public static final List<String> LOOPBACK_HOSTS = List.of("127.0.0.1", "::1", "localhost");

  public AttachRequest {
    if (pid <= 0) {
      throw new IllegalArgumentException("pid must be positive (was " + pid + ")");
    }
    processName = Objects.requireNonNullElse(processName, "");
    requestedArch = Objects.requireNonNullElse(requestedArch, WinArch.X64);
    hosts = hosts == null || hosts.isEmpty() ? LOOPBACK_HOSTS : List.copyOf(hosts);
  }
}
