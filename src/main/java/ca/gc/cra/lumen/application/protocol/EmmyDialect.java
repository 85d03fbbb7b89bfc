package ca.gc.cra.lumen.application.protocol;

import ca.gc.cra.lumen.domain.breakpoint.BreakpointDescriptor;
import ca.gc.cra.lumen.domain.frame.EvalResult;
import ca.gc.cra.lumen.domain.frame.StackFrameSnapshot;
import ca.gc.cra.lumen.domain.frame.Variable;
import ca.gc.cra.lumen.domain.session.LogEvent;
import ca.gc.cra.lumen.domain.wire.Payloads;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Payload shapes of the Emmy debugger protocol.
 * <p><strong>Why:</strong> Emmy break notifications carry full stacks with locals and upvalues inline;
 * expandable values are fetched by evaluating the variable name against its {@code cacheId}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class EmmyDialect implements ProtocolDialect {
  /** Script extensions announced to the debuggee by default. */
  public static final List<String> DEFAULT_EXTENSIONS = List.of(".lua", ".lua.txt", ".lua.bytes");

  private static final int LUA_TABLE = 5;
  private static final int LUA_USERDATA = 7;
  private static final int CHILD_DEPTH = 2;

  private final Map<String, Object> initPayload;

  private EmmyDialect(Map<String, Object> initPayload) {
    this.initPayload = Map.copyOf(initPayload);
  }

  /**
   * Dialect whose init request ships the helper script source inline.
   *
   * @param helperCode assembled helper script
   * @param extensions script extensions
   * @return dialect
   */
  public static EmmyDialect inlineHelper(String helperCode, List<String> extensions) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("emmyHelper", Objects.requireNonNull(helperCode, "helperCode"));
    payload.put("ext", extensions == null ? DEFAULT_EXTENSIONS : List.copyOf(extensions));
    return new EmmyDialect(payload);
  }

  /**
   * Dialect whose init request points the hook at helper scripts on disk.
   *
   * @param helperDir directory holding {@code emmyHelper.lua}
   * @param customHelperDir optional directory searched first; {@code null} for none
   * @param extensionScript type-registry script name, e.g. {@code emmyHelper_ue}
   * @param extensions script extensions
   * @return dialect
   */
  public static EmmyDialect helperPaths(
      String helperDir, String customHelperDir, String extensionScript, List<String> extensions) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("emmyHelperPath", Objects.requireNonNull(helperDir, "helperDir"));
    payload.put("customHelperPath", Objects.requireNonNullElse(customHelperDir, ""));
    payload.put("emmyHelperName", "emmyHelper");
    payload.put("emmyHelperExtName", Objects.requireNonNullElse(extensionScript, "emmyHelper_ue"));
    payload.put("ext", extensions == null ? DEFAULT_EXTENSIONS : List.copyOf(extensions));
    return new EmmyDialect(payload);
  }

  @Override
  public String name() {
    return "emmy";
  }

  @Override
  public HandshakeMode handshakeMode() {
    return HandshakeMode.SYNCHRONOUS;
  }

  @Override
  public WireMessage initMessage() {
    return WireMessage.of(WireCommand.INIT, initPayload);
  }

  @Override
  public Optional<WireMessage> readyMessage() {
    return Optional.of(WireMessage.of(WireCommand.READY));
  }

  @Override
  public String describeInitReply(WireMessage reply) {
    return "emmy init " + reply.payload();
  }

  @Override
  public WireMessage addBreakpoint(BreakpointDescriptor added, List<BreakpointDescriptor> sameFile) {
    Map<String, Object> bp = new LinkedHashMap<>();
    bp.put("file", added.filePath());
    bp.put("line", added.line());
    if (added.condition() != null) {
      bp.put("condition", added.condition());
    }
    if (added.logMessage() != null) {
      bp.put("logMessage", added.logMessage());
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("breakPoints", List.of(bp));
    payload.put("clear", false);
    return WireMessage.of(WireCommand.ADD_BREAKPOINT, payload);
  }

  @Override
  public WireMessage removeBreakpoint(BreakpointDescriptor removed, List<BreakpointDescriptor> remaining) {
    Map<String, Object> bp = new LinkedHashMap<>();
    bp.put("file", removed.filePath());
    bp.put("line", removed.line());
    return WireMessage.of(WireCommand.REMOVE_BREAKPOINT, Map.of("breakPoints", List.of(bp)));
  }

  @Override
  public WireMessage runControl(WireCommand command) {
    if (!command.isRunControl()) {
      throw new IllegalArgumentException("Not a run-control command: " + command);
    }
    return WireMessage.of(command);
  }

  @Override
  public StopPlan stopPlan() {
    return new StopPlan(WireMessage.of(WireCommand.STOP), false, Duration.ZERO);
  }

  @Override
  public WireMessage evalRequest(String expression, StackFrameSnapshot frame) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("expr", expression);
    payload.put("stackLevel", frame.index());
    payload.put("depth", 1);
    payload.put("cacheId", 0);
    return WireMessage.of(WireCommand.EVAL, payload);
  }

  @Override
  public EvalResult parseEvalResult(WireMessage reply) {
    Map<String, Object> payload = reply.payload();
    if (!Payloads.bool(payload, "success", false)) {
      return EvalResult.failed(Payloads.string(payload, "error", "evaluation failed"));
    }
    return EvalResult.ok(parseVariable(Payloads.map(payload, "value")));
  }

  @Override
  public Optional<WireMessage> localsRequest(StackFrameSnapshot frame) {
    return Optional.empty();
  }

  @Override
  public WireMessage childrenRequest(Variable variable, StackFrameSnapshot frame) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("expr", variable.name());
    payload.put("stackLevel", frame.index());
    payload.put("depth", CHILD_DEPTH);
    payload.put("cacheId", cacheId(variable.childRef()));
    return WireMessage.of(WireCommand.VARIABLES, payload);
  }

  @Override
  public List<Variable> parseChildren(WireMessage reply) {
    if (!Payloads.bool(reply.payload(), "success", false)) {
      return List.of();
    }
    return parseVariable(Payloads.map(reply.payload(), "value")).children();
  }

  @Override
  public List<StackFrameSnapshot> parseFrames(WireMessage notification) {
    List<StackFrameSnapshot> frames = new ArrayList<>();
    List<Object> stacks = Payloads.list(notification.payload(), "stacks");
    for (int i = 0; i < stacks.size(); i++) {
      Map<String, Object> stack = Payloads.asMap(stacks.get(i));
      frames.add(new StackFrameSnapshot(
          Payloads.string(stack, "file", ""),
          Payloads.integer(stack, "line", 0),
          Payloads.string(stack, "functionName", ""),
          Payloads.integer(stack, "level", i),
          parseVariables(Payloads.list(stack, "localVariables")),
          parseVariables(Payloads.list(stack, "upvalueVariables"))));
    }
    return frames;
  }

  @Override
  public String stopReason(WireMessage notification) {
    return "break";
  }

  @Override
  public LogEvent parseLog(WireMessage message) {
    Map<String, Object> payload = message.payload();
    return new LogEvent(
        LogEvent.Level.fromCode(Payloads.integer(payload, "type", 1)),
        Payloads.string(payload, "message", ""));
  }

  @Override
  public boolean caseSensitivePaths() {
    return false;
  }

  static List<Variable> parseVariables(List<Object> raw) {
    List<Variable> variables = new ArrayList<>(raw.size());
    for (Object item : raw) {
      variables.add(parseVariable(Payloads.asMap(item)));
    }
    return variables;
  }

  static Variable parseVariable(Map<String, Object> node) {
    int valueType = Payloads.integer(node, "valueType", 0);
    long cacheId = Payloads.longValue(node, "cacheId", 0L);
    String childRef = (valueType == LUA_TABLE || valueType == LUA_USERDATA) && cacheId != 0
        ? Long.toString(cacheId)
        : null;
    return new Variable(
        Payloads.string(node, "name", ""),
        Payloads.string(node, "value", "nil"),
        Payloads.string(node, "valueTypeName", ""),
        childRef,
        parseVariables(Payloads.list(node, "children")));
  }

  private static long cacheId(String childRef) {
    if (childRef == null) {
      return 0L;
    }
    try {
      return Long.parseLong(childRef);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Emmy child references are numeric cache ids: " + childRef, ex);
    }
  }
}
