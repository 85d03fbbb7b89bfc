package ca.gc.cra.lumen.domain.wire;

/**
 * <strong>What:</strong> Protocol-neutral command vocabulary exchanged between the debug session and a debuggee.
 * <p><strong>Why:</strong> Lets the session state machine speak one language while each wire codec maps the
 * constants onto its own dialect (Emmy {@code MessageCMD} ordinals, LuaPanda {@code cmd} strings).</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum WireCommand {
  /** Session bootstrap sent by the IDE; carries helper script text or paths and session metadata. */
  INIT,
  /** Signals that the IDE finished its handshake and the debuggee may run. */
  READY,
  /** Inbound: the debuggee stopped and reports its stack. */
  BREAK_NOTIFY,
  /** Adds or replaces breakpoints on the debuggee. */
  ADD_BREAKPOINT,
  /** Removes breakpoints on the debuggee. */
  REMOVE_BREAKPOINT,
  /** Run-control: resume execution. */
  CONTINUE,
  /** Run-control: step over. */
  STEP_OVER,
  /** Run-control: step into. */
  STEP_IN,
  /** Run-control: step out. */
  STEP_OUT,
  /** Run-control: pause as soon as possible. */
  BREAK,
  /** Run-control: stop debugging; inbound it means the debuggee ended the session. */
  STOP,
  /** Expression evaluation request. */
  EVAL,
  /** Expression evaluation reply. */
  EVAL_RESULT,
  /** Lazy child-variable fetch; request and reply share the command. */
  VARIABLES,
  /** Log or console output from the debuggee. */
  LOG,
  /** Inbound: the injected runtime reports it is attached. */
  ATTACHED,
  /** A dialect command with no neutral mapping; the raw name is kept on the message. */
  UNKNOWN;

  /**
   * Indicates whether the command moves the debuggee between running and paused.
   *
   * @return {@code true} for continue, step and break commands
   */
  public boolean isRunControl() {
    return switch (this) {
      case CONTINUE, STEP_OVER, STEP_IN, STEP_OUT, BREAK -> true;
      default -> false;
    };
  }
}
