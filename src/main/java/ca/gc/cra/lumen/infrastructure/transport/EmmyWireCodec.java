package ca.gc.cra.lumen.infrastructure.transport;

import ca.gc.cra.lumen.domain.wire.Payloads;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import ca.gc.cra.lumen.infrastructure.json.JsonSupport;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emmy debugger framing: the numeric command id on one line followed by the JSON body on the next.
 *
 * <p>Run-control commands share {@code ActionReq} and are told apart by the {@code action} field; replies
 * are matched by the integer {@code seq} field of the body.</p>
 *
 * @since 0.1.0
 */
public final class EmmyWireCodec implements WireCodec {

  /** Emmy message ids; the ordinal is the wire value. */
  enum MessageCmd {
    Unknown,
    InitReq,
    InitRsp,
    ReadyReq,
    ReadyRsp,
    AddBreakPointReq,
    AddBreakPointRsp,
    RemoveBreakPointReq,
    RemoveBreakPointRsp,
    ActionReq,
    ActionRsp,
    EvalReq,
    EvalRsp,
    BreakNotify,
    AttachedNotify,
    StartHookReq,
    StartHookRsp,
    LogNotify;

    static MessageCmd fromId(int id) {
      MessageCmd[] values = values();
      return id >= 0 && id < values.length ? values[id] : Unknown;
    }

    static MessageCmd fromName(String name) {
      for (MessageCmd cmd : values()) {
        if (cmd.name().equalsIgnoreCase(name)) {
          return cmd;
        }
      }
      throw new IllegalArgumentException("Unknown Emmy command: " + name);
    }
  }

  /** Emmy {@code DebugAction} values; the ordinal is the wire value. */
  enum DebugAction {
    Break,
    Continue,
    StepOver,
    StepIn,
    StepOut,
    Stop
  }

  static final String SEQ = "seq";
  static final String ACTION = "action";

  private final JsonSupport json;

  public EmmyWireCodec(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public String readFrame(BufferedReader reader) throws IOException {
    String header;
    do {
      header = reader.readLine();
      if (header == null) {
        return null;
      }
      header = header.trim();
    } while (header.isEmpty());
    if (!isCommandId(header)) {
      // returned alone so decode rejects it and the next line is read as a header
      return header;
    }
    String body = reader.readLine();
    if (body == null) {
      return null;
    }
    return header + "\n" + body;
  }

  private static boolean isCommandId(String header) {
    if (header.length() > 9) {
      return false;
    }
    for (int i = 0; i < header.length(); i++) {
      if (!Character.isDigit(header.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public WireMessage decode(String frame) {
    Objects.requireNonNull(frame, "frame");
    int split = frame.indexOf('\n');
    String header = split < 0 ? frame : frame.substring(0, split);
    String body = split < 0 ? "" : frame.substring(split + 1);
    int id;
    try {
      id = Integer.parseInt(header.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Emmy command id is not numeric: " + header, ex);
    }
    MessageCmd cmd = MessageCmd.fromId(id);
    Map<String, Object> payload = body.isBlank() ? new LinkedHashMap<>() : json.parseObject(body);
    String correlationId = payload.containsKey(SEQ)
        ? Long.toString(Payloads.longValue(payload, SEQ, 0L))
        : WireMessage.NO_CORRELATION;
    return new WireMessage(toNeutral(cmd, payload), payload, correlationId, cmd.name());
  }

  @Override
  public String encode(WireMessage message) {
    Objects.requireNonNull(message, "message");
    Map<String, Object> body = new LinkedHashMap<>(message.payload());
    MessageCmd cmd = toWire(message, body);
    if (message.isCorrelated()) {
      body.put(SEQ, parseSeq(message.correlationId()));
    }
    return cmd.ordinal() + "\n" + json.write(body) + "\n";
  }

  @Override
  public String scheme() {
    return "emmy";
  }

  private static long parseSeq(String correlationId) {
    try {
      return Long.parseLong(correlationId);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Emmy correlation ids must be numeric: " + correlationId, ex);
    }
  }

  private static MessageCmd toWire(WireMessage message, Map<String, Object> body) {
    return switch (message.command()) {
      case INIT -> MessageCmd.InitReq;
      case READY -> MessageCmd.ReadyReq;
      case ADD_BREAKPOINT -> MessageCmd.AddBreakPointReq;
      case REMOVE_BREAKPOINT -> MessageCmd.RemoveBreakPointReq;
      case BREAK -> action(body, DebugAction.Break);
      case CONTINUE -> action(body, DebugAction.Continue);
      case STEP_OVER -> action(body, DebugAction.StepOver);
      case STEP_IN -> action(body, DebugAction.StepIn);
      case STEP_OUT -> action(body, DebugAction.StepOut);
      case STOP -> action(body, DebugAction.Stop);
      case EVAL, VARIABLES -> MessageCmd.EvalReq;
      case UNKNOWN -> {
        if (message.rawCommand() == null) {
          throw new IllegalArgumentException("UNKNOWN messages need a raw Emmy command name");
        }
        yield MessageCmd.fromName(message.rawCommand());
      }
      default -> throw new IllegalArgumentException(
          "Emmy has no outbound form of " + message.command());
    };
  }

  private static MessageCmd action(Map<String, Object> body, DebugAction action) {
    body.put(ACTION, action.ordinal());
    return MessageCmd.ActionReq;
  }

  private static WireCommand toNeutral(MessageCmd cmd, Map<String, Object> payload) {
    return switch (cmd) {
      case InitReq, InitRsp -> WireCommand.INIT;
      case ReadyReq, ReadyRsp -> WireCommand.READY;
      case AddBreakPointReq, AddBreakPointRsp -> WireCommand.ADD_BREAKPOINT;
      case RemoveBreakPointReq, RemoveBreakPointRsp -> WireCommand.REMOVE_BREAKPOINT;
      case ActionReq -> actionCommand(Payloads.integer(payload, ACTION, -1));
      case EvalReq -> WireCommand.EVAL;
      case EvalRsp -> WireCommand.EVAL_RESULT;
      case BreakNotify -> WireCommand.BREAK_NOTIFY;
      case AttachedNotify -> WireCommand.ATTACHED;
      case LogNotify -> WireCommand.LOG;
      default -> WireCommand.UNKNOWN;
    };
  }

  private static WireCommand actionCommand(int action) {
    DebugAction[] actions = DebugAction.values();
    if (action < 0 || action >= actions.length) {
      return WireCommand.UNKNOWN;
    }
    return switch (actions[action]) {
      case Break -> WireCommand.BREAK;
      case Continue -> WireCommand.CONTINUE;
      case StepOver -> WireCommand.STEP_OVER;
      case StepIn -> WireCommand.STEP_IN;
      case StepOut -> WireCommand.STEP_OUT;
      case Stop -> WireCommand.STOP;
    };
  }
}
