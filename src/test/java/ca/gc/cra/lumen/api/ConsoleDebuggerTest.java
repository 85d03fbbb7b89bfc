package ca.gc.cra.lumen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.SourceLocator;
import ca.gc.cra.lumen.application.protocol.EmmyDialect;
import ca.gc.cra.lumen.application.session.BreakpointBook;
import ca.gc.cra.lumen.application.session.DebugSession;
import ca.gc.cra.lumen.application.session.DirectConnector;
import ca.gc.cra.lumen.domain.breakpoint.LineBreakpoint;
import ca.gc.cra.lumen.domain.frame.Variable;
import ca.gc.cra.lumen.domain.session.SessionState;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import ca.gc.cra.lumen.testutil.Await;
import ca.gc.cra.lumen.testutil.FakeTransporter;
import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConsoleDebuggerTest {

  private final ExecutorService workers = Executors.newCachedThreadPool();
  private final BreakpointBook book = new BreakpointBook();
  private final FakeTransporter transporter = new FakeTransporter();
  private final StringWriter buffer = new StringWriter();
  private DebugSession session;
  private ConsoleDebugger console;

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    session = new DebugSession("c1", EmmyDialect.inlineHelper("-- helper", null),
        new DirectConnector(transporter), book, SourceLocator.NONE, workers, MetricsPort.NO_OP);
    console = new ConsoleDebugger(session, book);
    session.addListener(console);
    session.start();
    Await.until(() -> session.state() == SessionState.READY, "ready");
  }

  @AfterEach
  void tearDown() {
    session.stop();
    workers.shutdownNow();
    CliPrinter.clearTestWriter();
  }

  @Test
  void breakpointCommandsUseOneBasedLines() throws Exception {
    assertTrue(console.execute("b main.lua:5 hp < 10"));
    Await.until(() -> transporter.sentCount(WireCommand.ADD_BREAKPOINT) == 1, "add");

    LineBreakpoint stored = book.find("main.lua", 4).orElseThrow();
    assertEquals("hp < 10", stored.condition());

    assertTrue(console.execute("d main.lua:5"));
    Await.until(() -> transporter.sentCount(WireCommand.REMOVE_BREAKPOINT) == 1, "remove");
    assertEquals(0, book.size());
  }

  @Test
  void invalidLocationsPrintUsage() throws Exception {
    console.execute("b main.lua");
    console.execute("d nowhere.lua:3");

    assertTrue(buffer.toString().contains("usage: b FILE:LINE [condition]"));
    assertTrue(buffer.toString().contains("no breakpoint at nowhere.lua:3"));
  }

  @Test
  void steppingCommandsReachDebuggee() throws Exception {
    transporter.deliver(WireMessage.of(WireCommand.BREAK_NOTIFY, Map.of("stacks", List.of(
        Map.of("file", "main.lua", "line", 3, "functionName", "update", "level", 0)))));
    Await.until(() -> session.state() == SessionState.PAUSED, "paused");

    console.execute("bt");
    assertTrue(buffer.toString().contains("=> #0"));

    console.execute("n");
    Await.until(() -> transporter.sentCount(WireCommand.STEP_OVER) == 1, "step");
  }

  @Test
  void commandsOutsidePauseReportNotPaused() throws Exception {
    console.execute("l");
    console.execute("e x");

    assertTrue(buffer.toString().contains("not paused"));
  }

  @Test
  void quitEndsLoopAndStopsSession() throws Exception {
    console.run(new BufferedReader(new StringReader("zz\nq\nc\n")));

    assertTrue(buffer.toString().contains("unknown command 'zz'"));
    assertTrue(session.awaitTermination(Duration.ofSeconds(5)));
    assertEquals(0, transporter.sentCount(WireCommand.CONTINUE));
  }

  @Test
  void locationParsingKeepsDriveLetters() {
    assertEquals(Optional.of(new ConsoleDebugger.Location("C:\\game\\main.lua", 12)),
        ConsoleDebugger.Location.parse("C:\\game\\main.lua:12"));
    assertTrue(ConsoleDebugger.Location.parse("main.lua:0").isEmpty());
    assertTrue(ConsoleDebugger.Location.parse("main.lua:").isEmpty());
    assertTrue(ConsoleDebugger.Location.parse(":4").isEmpty());
    assertFalse(ConsoleDebugger.Location.parse("main.lua:x").isPresent());
  }

  @Test
  void describeShowsTypeAndExpansion() {
    assertEquals("hp = 100 (number)", ConsoleDebugger.describe(Variable.leaf("hp", "100", "number")));
    assertEquals("t = table (table) {...}",
        ConsoleDebugger.describe(new Variable("t", "table", "table", "42", List.of())));
  }
}
