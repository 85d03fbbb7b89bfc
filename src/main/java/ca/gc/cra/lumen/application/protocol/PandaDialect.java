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
 * <strong>What:</strong> Payload shapes of the LuaPanda protocol.
 * <p><strong>Why:</strong> LuaPanda replaces a file's breakpoints wholesale with {@code setBreakPoint}, fetches
 * locals lazily with {@code getVariable}, and confirms {@code stopRun}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class PandaDialect implements ProtocolDialect {
  private static final String INFO = "info";
  private static final String STACK = "stack";
  private static final int LINE_BREAKPOINT_TYPE = 2;

  /**
   * Values announced in the {@code initSuccess} request.
   *
   * @param stopOnEntry pause on the first executed line
   * @param useCHook ask the debuggee to use the native hook library
   * @param logLevel debuggee log verbosity, {@code 0} (all) to {@code 2} (errors)
   * @param cwd working directory the debuggee resolves relative paths against
   * @param tempFilePath directory for debuggee temporary files
   * @param osType host operating system name
   * @param stopConfirmTimeout maximum wait for the {@code stopRun} confirmation
   * @param luaFileExtension script extension without the dot
   * @param pathCaseSensitivity compare breakpoint paths case-sensitively
   * @param autoPathMode let the debuggee resolve chunk names to full paths
   * @param distinguishSameNameFile keep same-named files in different directories apart
   * @param truncatedOPath path prefix the debuggee strips from chunk names
   * @param developmentMode enable the debuggee's development diagnostics
   */
  public record Options(
      boolean stopOnEntry,
      boolean useCHook,
      int logLevel,
      String cwd,
      String tempFilePath,
      String osType,
      Duration stopConfirmTimeout,
      String luaFileExtension,
      boolean pathCaseSensitivity,
      boolean autoPathMode,
      boolean distinguishSameNameFile,
      String truncatedOPath,
      boolean developmentMode) {
    public Options {
      if (logLevel < 0 || logLevel > 2) {
        throw new IllegalArgumentException("logLevel must be between 0 and 2 (was " + logLevel + ")");
      }
      cwd = Objects.requireNonNullElse(cwd, "");
      tempFilePath = Objects.requireNonNullElse(tempFilePath, cwd);
      osType = Objects.requireNonNullElse(osType, "");
      stopConfirmTimeout = Objects.requireNonNullElse(stopConfirmTimeout, Duration.ofSeconds(3));
      luaFileExtension = luaFileExtension == null || luaFileExtension.isBlank()
          ? "lua" : luaFileExtension.trim().replaceFirst("^\\.", "");
      truncatedOPath = Objects.requireNonNullElse(truncatedOPath, "");
    }

    /**
     * Options with the debuggee's usual defaults: no stop on entry, C hook on, log level 1, case-sensitive
     * paths.
     *
     * @param cwd working directory
     * @param osType host operating system name
     * @return options
     */
    public static Options defaults(String cwd, String osType) {
      return new Options(false, true, 1, cwd, cwd, osType, Duration.ofSeconds(3),
          "lua", true, false, false, "", false);
    }
  }

  private final Options options;

  public PandaDialect(Options options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  @Override
  public String name() {
    return "luapanda";
  }

  @Override
  public HandshakeMode handshakeMode() {
    return HandshakeMode.AWAIT_INIT_ACK;
  }

  @Override
  public WireMessage initMessage() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("stopOnEntry", Boolean.toString(options.stopOnEntry()));
    info.put("useCHook", Boolean.toString(options.useCHook()));
    info.put("logLevel", Integer.toString(options.logLevel()));
    info.put("luaFileExtension", options.luaFileExtension());
    info.put("cwd", options.cwd());
    info.put("isNeedB64EncodeStr", "false");
    info.put("TempFilePath", options.tempFilePath());
    info.put("pathCaseSensitivity", Boolean.toString(options.pathCaseSensitivity()));
    info.put("osType", options.osType());
    info.put("clibPath", "");
    info.put("adapterVersion", "1.0.0");
    info.put("autoPathMode", Boolean.toString(options.autoPathMode()));
    info.put("distinguishSameNameFile", Boolean.toString(options.distinguishSameNameFile()));
    info.put("truncatedOPath", options.truncatedOPath());
    info.put("developmentMode", Boolean.toString(options.developmentMode()));
    return info(WireCommand.INIT, info);
  }

  @Override
  public Optional<WireMessage> readyMessage() {
    return Optional.empty();
  }

  @Override
  public String describeInitReply(WireMessage reply) {
    Map<String, Object> info = Payloads.map(reply.payload(), INFO);
    return "UseHookLib=" + Payloads.string(info, "UseHookLib", "0")
        + ", UseLoadstring=" + Payloads.string(info, "UseLoadstring", "0")
        + ", isNeedB64EncodeStr=" + Payloads.string(info, "isNeedB64EncodeStr", "false");
  }

  @Override
  public WireMessage addBreakpoint(BreakpointDescriptor added, List<BreakpointDescriptor> sameFile) {
    return setBreakpoints(WireCommand.ADD_BREAKPOINT, added.filePath(), sameFile);
  }

  @Override
  public WireMessage removeBreakpoint(BreakpointDescriptor removed, List<BreakpointDescriptor> remaining) {
    return setBreakpoints(WireCommand.REMOVE_BREAKPOINT, removed.filePath(), remaining);
  }

  @Override
  public WireMessage runControl(WireCommand command) {
    if (!command.isRunControl()) {
      throw new IllegalArgumentException("Not a run-control command: " + command);
    }
    return info(command, Map.of());
  }

  @Override
  public StopPlan stopPlan() {
    return new StopPlan(info(WireCommand.STOP, Map.of()), true, options.stopConfirmTimeout());
  }

  @Override
  public WireMessage evalRequest(String expression, StackFrameSnapshot frame) {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("expr", expression);
    info.put("frameIndex", frame.index());
    return info(WireCommand.EVAL, info);
  }

  @Override
  public EvalResult parseEvalResult(WireMessage reply) {
    Map<String, Object> info = Payloads.map(reply.payload(), INFO);
    Map<String, Object> result = Payloads.map(info, "result");
    if (!Payloads.bool(info, "success", false) || result.isEmpty()) {
      return EvalResult.failed(Payloads.string(info, "error", "evaluation failed"));
    }
    return EvalResult.ok(parseVariable(result));
  }

  @Override
  public Optional<WireMessage> localsRequest(StackFrameSnapshot frame) {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("frameIndex", frame.index());
    info.put("varType", "local");
    return Optional.of(info(WireCommand.VARIABLES, info));
  }

  @Override
  public WireMessage childrenRequest(Variable variable, StackFrameSnapshot frame) {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("frameIndex", frame.index());
    info.put("variablesReference", referenceOf(variable.childRef()));
    return info(WireCommand.VARIABLES, info);
  }

  @Override
  public List<Variable> parseChildren(WireMessage reply) {
    Map<String, Object> info = Payloads.map(reply.payload(), INFO);
    return parseVariables(Payloads.list(info, "variables"));
  }

  @Override
  public List<StackFrameSnapshot> parseFrames(WireMessage notification) {
    Map<String, Object> payload = notification.payload();
    List<Object> stacks = payload.get(STACK) != null
        ? Payloads.list(payload, STACK)
        : Payloads.list(payload, INFO);
    List<StackFrameSnapshot> frames = new ArrayList<>(stacks.size());
    for (int i = 0; i < stacks.size(); i++) {
      Map<String, Object> stack = Payloads.asMap(stacks.get(i));
      if (stack.isEmpty()) {
        continue;
      }
      String function = Payloads.string(stack, "functionName");
      frames.add(new StackFrameSnapshot(
          Payloads.string(stack, "file", ""),
          Payloads.integer(stack, "line", 0),
          function != null ? function : Payloads.string(stack, "name", ""),
          i,
          parseVariables(Payloads.list(stack, "locals")),
          parseVariables(Payloads.list(stack, "upvalues"))));
    }
    return frames;
  }

  @Override
  public String stopReason(WireMessage notification) {
    return Objects.requireNonNullElse(notification.rawCommand(), "stopOnBreakpoint");
  }

  @Override
  public LogEvent parseLog(WireMessage message) {
    Map<String, Object> info = Payloads.map(message.payload(), INFO);
    String content = Payloads.string(info, "content");
    if (content == null) {
      content = Payloads.string(info, "logInfo", "");
    }
    return new LogEvent(LogEvent.Level.INFO, content);
  }

  @Override
  public boolean caseSensitivePaths() {
    return options.pathCaseSensitivity();
  }

  static List<Variable> parseVariables(List<Object> raw) {
    List<Variable> variables = new ArrayList<>(raw.size());
    for (Object item : raw) {
      Map<String, Object> node = Payloads.asMap(item);
      if (!node.isEmpty()) {
        variables.add(parseVariable(node));
      }
    }
    return variables;
  }

  static Variable parseVariable(Map<String, Object> node) {
    return new Variable(
        Payloads.string(node, "name", ""),
        Payloads.string(node, "value", "nil"),
        Payloads.string(node, "type", ""),
        Payloads.string(node, "variablesReference"),
        parseVariables(Payloads.list(node, "children")));
  }

  private static WireMessage setBreakpoints(
      WireCommand command, String path, List<BreakpointDescriptor> breakpoints) {
    List<Map<String, Object>> bks = new ArrayList<>(breakpoints.size());
    for (BreakpointDescriptor descriptor : breakpoints) {
      Map<String, Object> bk = new LinkedHashMap<>();
      bk.put("verified", true);
      bk.put("type", LINE_BREAKPOINT_TYPE);
      bk.put("line", descriptor.line());
      if (descriptor.condition() != null) {
        bk.put("condition", descriptor.condition());
      }
      if (descriptor.logMessage() != null) {
        bk.put("logMessage", descriptor.logMessage());
      }
      bks.add(bk);
    }
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("path", path);
    info.put("bks", bks);
    return info(command, info);
  }

  private static long referenceOf(String childRef) {
    if (childRef == null) {
      return 0L;
    }
    try {
      return Long.parseLong(childRef);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("LuaPanda variable references are numeric: " + childRef, ex);
    }
  }

  private static WireMessage info(WireCommand command, Map<String, Object> info) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(INFO, info);
    return WireMessage.of(command, payload);
  }
}
