package ca.gc.cra.lumen.application.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.domain.breakpoint.BreakpointDescriptor;
import ca.gc.cra.lumen.domain.frame.EvalResult;
import ca.gc.cra.lumen.domain.frame.StackFrameSnapshot;
import ca.gc.cra.lumen.domain.frame.Variable;
import ca.gc.cra.lumen.domain.session.LogEvent;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EmmyDialectTest {

  private final EmmyDialect dialect = EmmyDialect.inlineHelper("-- helper", null);

  @Test
  void inlineInitCarriesHelperAndExtensions() {
    WireMessage init = dialect.initMessage();

    assertEquals(WireCommand.INIT, init.command());
    assertEquals("-- helper", init.payload().get("emmyHelper"));
    assertEquals(EmmyDialect.DEFAULT_EXTENSIONS, init.payload().get("ext"));
    assertEquals(ProtocolDialect.HandshakeMode.SYNCHRONOUS, dialect.handshakeMode());
    assertTrue(dialect.readyMessage().isPresent());
  }

  @Test
  void pathInitNamesHelperDirectories() {
    Map<String, Object> payload = EmmyDialect
        .helperPaths("/tools/emmy", null, null, List.of(".lua"))
        .initMessage().payload();

    assertEquals("/tools/emmy", payload.get("emmyHelperPath"));
    assertEquals("", payload.get("customHelperPath"));
    assertEquals("emmyHelper", payload.get("emmyHelperName"));
    assertEquals("emmyHelper_ue", payload.get("emmyHelperExtName"));
    assertEquals(List.of(".lua"), payload.get("ext"));
  }

  @Test
  void addBreakpointSendsSingleEntryWithoutClearing() {
    BreakpointDescriptor bp = new BreakpointDescriptor("main.lua", 12, "x == 1", null);

    WireMessage message = dialect.addBreakpoint(bp, List.of(bp));

    assertEquals(Boolean.FALSE, message.payload().get("clear"));
    List<?> entries = (List<?>) message.payload().get("breakPoints");
    assertEquals(Map.of("file", "main.lua", "line", 12, "condition", "x == 1"), entries.get(0));
  }

  @Test
  void stopIsFireAndForget() {
    ProtocolDialect.StopPlan plan = dialect.stopPlan();

    assertEquals(WireCommand.STOP, plan.message().command());
    assertFalse(plan.awaitReply());
  }

  @Test
  void runControlRejectsNonRunCommands() {
    assertEquals(WireCommand.STEP_IN, dialect.runControl(WireCommand.STEP_IN).command());
    assertThrows(IllegalArgumentException.class, () -> dialect.runControl(WireCommand.EVAL));
  }

  @Test
  void parsesFramesWithVariables() {
    Map<String, Object> local = Map.of("name", "t", "value", "table: 0x1", "valueType", 5,
        "valueTypeName", "table", "cacheId", 42);
    Map<String, Object> stack = Map.of("file", "main.lua", "line", 7, "functionName", "update",
        "level", 0, "localVariables", List.of(local));
    WireMessage notify = WireMessage.of(WireCommand.BREAK_NOTIFY, Map.of("stacks", List.of(stack)));

    List<StackFrameSnapshot> frames = dialect.parseFrames(notify);

    assertEquals(1, frames.size());
    StackFrameSnapshot frame = frames.get(0);
    assertEquals("update main.lua:7", frame.label());
    Variable t = frame.locals().get(0);
    assertEquals("42", t.childRef());
    assertTrue(t.expandable());
  }

  @Test
  void evalFailureCarriesError() {
    EvalResult failed = dialect.parseEvalResult(
        WireMessage.of(WireCommand.EVAL_RESULT, Map.of("success", false, "error", "nil value")));
    EvalResult ok = dialect.parseEvalResult(WireMessage.of(WireCommand.EVAL_RESULT,
        Map.of("success", true, "value", Map.of("name", "hp", "value", "10", "valueType", 3))));

    assertEquals("nil value", failed.error());
    assertEquals("10", ok.value().value());
    assertNull(ok.value().childRef());
  }

  @Test
  void childRequestUsesCacheId() {
    StackFrameSnapshot frame = new StackFrameSnapshot("a.lua", 1, "f", 2, null, null);
    Variable table = new Variable("t", "table", "table", "42", null);

    WireMessage request = dialect.childrenRequest(table, frame);

    assertEquals(WireCommand.VARIABLES, request.command());
    assertEquals(42L, request.payload().get("cacheId"));
    assertEquals(2, request.payload().get("stackLevel"));
    assertTrue(dialect.localsRequest(frame).isEmpty());
  }

  @Test
  void logUsesTypeAsLevel() {
    LogEvent event = dialect.parseLog(WireMessage.of(WireCommand.LOG, Map.of("type", 3, "message", "boom")));

    assertEquals(LogEvent.Level.ERROR, event.level());
    assertEquals("boom", event.message());
  }
}
