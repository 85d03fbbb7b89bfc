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
 * LuaPanda framing: one JSON record {@code {"cmd","info","callbackId"}} terminated by {@code |*|} and a
 * newline.
 *
 * <p>The neutral payload holds the record's {@code info} under {@code "info"} and, for break notifications,
 * the top-level {@code stack} under {@code "stack"}.</p>
 *
 * @since 0.1.0
 */
public final class LuaPandaWireCodec implements WireCodec {
  /** Record terminator. */
  public static final String DELIMITER = "|*|";
  static final String INFO = "info";
  static final String STACK = "stack";

  private final JsonSupport json;

  public LuaPandaWireCodec(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public String readFrame(BufferedReader reader) throws IOException {
    String line;
    do {
      line = reader.readLine();
      if (line == null) {
        return null;
      }
      line = line.strip();
    } while (line.isEmpty());
    // one line is one record; a line without the terminator is still handed to decode on its own
    if (line.endsWith(DELIMITER)) {
      return line.substring(0, line.length() - DELIMITER.length());
    }
    return line;
  }

  @Override
  public WireMessage decode(String frame) {
    Objects.requireNonNull(frame, "frame");
    Map<String, Object> record = json.parseObject(frame);
    String cmd = Payloads.string(record, "cmd");
    if (cmd == null || cmd.isBlank()) {
      throw new IllegalArgumentException("LuaPanda record has no cmd");
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(INFO, record.get(INFO));
    if (record.containsKey(STACK)) {
      payload.put(STACK, record.get(STACK));
    }
    String callbackId = Payloads.string(record, "callbackId", WireMessage.NO_CORRELATION);
    return new WireMessage(toNeutral(cmd), payload, callbackId, cmd);
  }

  @Override
  public String encode(WireMessage message) {
    Objects.requireNonNull(message, "message");
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("cmd", wireName(message));
    Object info = message.payload().get(INFO);
    record.put(INFO, info == null ? Map.of() : info);
    record.put("callbackId", message.correlationId());
    return json.write(record) + DELIMITER + "\n";
  }

  @Override
  public String scheme() {
    return "luapanda";
  }

  private static String wireName(WireMessage message) {
    if (message.rawCommand() != null && !message.rawCommand().isBlank()) {
      return message.rawCommand();
    }
    return switch (message.command()) {
      case INIT -> "initSuccess";
      case ADD_BREAKPOINT, REMOVE_BREAKPOINT -> "setBreakPoint";
      case CONTINUE -> "continue";
      case STEP_OVER -> "stopOnStep";
      case STEP_IN -> "stopOnStepIn";
      case STEP_OUT -> "stopOnStepOut";
      case BREAK -> "stopOnBreakpoint";
      case STOP -> "stopRun";
      case EVAL -> "eval";
      case VARIABLES -> "getVariable";
      case LOG -> "output";
      default -> throw new IllegalArgumentException(
          "LuaPanda has no outbound form of " + message.command());
    };
  }

  static WireCommand toNeutral(String cmd) {
    return switch (cmd) {
      case "initSuccess" -> WireCommand.INIT;
      case "setBreakPoint" -> WireCommand.ADD_BREAKPOINT;
      case "stopOnBreakpoint", "stopOnEntry", "stopOnStep", "stopOnStepIn", "stopOnStepOut",
          "stopOnCodeBreakpoint" -> WireCommand.BREAK_NOTIFY;
      case "continue" -> WireCommand.CONTINUE;
      case "stopRun" -> WireCommand.STOP;
      case "output", "log" -> WireCommand.LOG;
      case "eval" -> WireCommand.EVAL_RESULT;
      case "getVariable", "getWatchedVariable" -> WireCommand.VARIABLES;
      default -> WireCommand.UNKNOWN;
    };
  }
}
