package ca.gc.cra.lumen.application.protocol;

import ca.gc.cra.lumen.domain.breakpoint.BreakpointDescriptor;
import ca.gc.cra.lumen.domain.frame.EvalResult;
import ca.gc.cra.lumen.domain.frame.StackFrameSnapshot;
import ca.gc.cra.lumen.domain.frame.Variable;
import ca.gc.cra.lumen.domain.session.LogEvent;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Builds outbound payloads and interprets inbound payloads for one debugger dialect.
 * <p><strong>Why:</strong> The session state machine is shared by Emmy and LuaPanda; everything that depends
 * on payload shape lives behind this seam.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and safe to share.</p>
 *
 * @since 0.1.0
 */
public interface ProtocolDialect {

  /** How the session completes the handshake after connecting. */
  enum HandshakeMode {
    /** Send init, resync breakpoints, send ready without waiting for replies. */
    SYNCHRONOUS,
    /** Send init as a request; resync and become ready once the reply arrives. */
    AWAIT_INIT_ACK
  }

  /**
   * How the session tells the debuggee to stop.
   *
   * @param message stop message
   * @param awaitReply whether to wait for the debuggee's confirmation
   * @param timeout maximum wait when {@code awaitReply} is set
   */
  record StopPlan(WireMessage message, boolean awaitReply, Duration timeout) {
    public StopPlan {
      Objects.requireNonNull(message, "message");
      timeout = Objects.requireNonNullElse(timeout, Duration.ZERO);
    }
  }

  String name();

  HandshakeMode handshakeMode();

  WireMessage initMessage();

  Optional<WireMessage> readyMessage();

  /**
   * Summarizes the debuggee's reply to the init request for logging.
   *
   * @param reply init reply
   * @return one-line summary
   */
  String describeInitReply(WireMessage reply);

  /**
   * Message announcing a new breakpoint.
   *
   * @param added new breakpoint
   * @param sameFile every registered breakpoint in the same file, including {@code added}
   * @return message to send
   */
  WireMessage addBreakpoint(BreakpointDescriptor added, List<BreakpointDescriptor> sameFile);

  /**
   * Message withdrawing a breakpoint.
   *
   * @param removed withdrawn breakpoint
   * @param remaining breakpoints still registered in the same file
   * @return message to send
   */
  WireMessage removeBreakpoint(BreakpointDescriptor removed, List<BreakpointDescriptor> remaining);

  /**
   * Message for a run-control command ({@link WireCommand#isRunControl()}).
   *
   * @param command run-control command
   * @return message to send
   */
  WireMessage runControl(WireCommand command);

  StopPlan stopPlan();

  WireMessage evalRequest(String expression, StackFrameSnapshot frame);

  EvalResult parseEvalResult(WireMessage reply);

  /**
   * Request for the locals of a frame, when the break notification does not carry them.
   *
   * @param frame frame to inspect
   * @return request, or empty when {@link StackFrameSnapshot#locals()} is already complete
   */
  Optional<WireMessage> localsRequest(StackFrameSnapshot frame);

  WireMessage childrenRequest(Variable variable, StackFrameSnapshot frame);

  List<Variable> parseChildren(WireMessage reply);

  List<StackFrameSnapshot> parseFrames(WireMessage notification);

  String stopReason(WireMessage notification);

  LogEvent parseLog(WireMessage message);

  /**
   * Whether file paths reported by the debuggee compare case-sensitively.
   *
   * @return path case sensitivity
   */
  boolean caseSensitivePaths();
}
