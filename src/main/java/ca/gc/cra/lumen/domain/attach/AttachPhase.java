package ca.gc.cra.lumen.domain.attach;

/**
 * Phases of one process attach attempt.
 *
 * @since 0.1.0
 */
public enum AttachPhase {
  IDLE,
  VALIDATING,
  INVOKING,
  WAITING_FOR_SERVICE,
  PROBING_PORT,
  CONNECTING,
  CONNECTED,
  FAILED;

  public boolean isTerminal() {
    return this == CONNECTED || this == FAILED;
  }
}
