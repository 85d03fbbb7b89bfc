package ca.gc.cra.lumen.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.application.protocol.PandaDialect;
import ca.gc.cra.lumen.domain.breakpoint.BreakpointHandle;
import ca.gc.cra.lumen.domain.breakpoint.LineBreakpoint;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import ca.gc.cra.lumen.testutil.RecordingMetrics;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BreakpointSynchronizerTest {

  private final List<WireMessage> sent = new ArrayList<>();
  private final BreakpointBook book = new BreakpointBook();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private BreakpointSynchronizer synchronizer;

  @BeforeEach
  void setUp() {
    PandaDialect dialect = new PandaDialect(PandaDialect.Options.defaults("/work", "Linux"));
    synchronizer = new BreakpointSynchronizer(dialect, sent::add, book, metrics);
  }

  @Test
  void resyncAssignsIdsFromZeroInSourceOrder() {
    LineBreakpoint a = LineBreakpoint.at("main.lua", 2);
    LineBreakpoint b = LineBreakpoint.at("util.lua", 5);
    book.put(a);
    book.put(b);

    assertEquals(2, synchronizer.resync());

    assertEquals(0, a.handle().orElseThrow().id());
    assertEquals(1, b.handle().orElseThrow().id());
    assertEquals(2, sent.size());
    assertEquals(2, metrics.count("session.breakpoints.sent"));
  }

  @Test
  void resyncStartsOverAndInvalidatesOldHandles() {
    LineBreakpoint a = LineBreakpoint.at("main.lua", 2);
    book.put(a);
    synchronizer.resync();
    BreakpointHandle first = a.handle().orElseThrow();

    synchronizer.resync();

    BreakpointHandle second = a.handle().orElseThrow();
    assertEquals(0, second.id());
    assertTrue(second.generation() > first.generation());
    assertTrue(synchronizer.resolve(first).isEmpty());
    assertSame(a, synchronizer.resolve(second).orElseThrow());
  }

  @Test
  void registeringTwiceIsIdempotent() {
    LineBreakpoint a = LineBreakpoint.at("main.lua", 2);
    synchronizer.resync();

    BreakpointHandle handle = synchronizer.register(a);

    assertEquals(handle, synchronizer.register(a));
    assertEquals(1, sent.size());
  }

  @Test
  void unregisterSendsRemainingBreakpointsOfFile() {
    LineBreakpoint a = LineBreakpoint.at("main.lua", 2);
    LineBreakpoint b = LineBreakpoint.at("main.lua", 8);
    book.put(a);
    book.put(b);
    synchronizer.resync();
    sent.clear();

    assertTrue(synchronizer.unregister(a));

    WireMessage remove = sent.get(0);
    assertEquals(WireCommand.REMOVE_BREAKPOINT, remove.command());
    List<?> bks = (List<?>) ((Map<?, ?>) remove.payload().get("info")).get("bks");
    assertEquals(1, bks.size());
    assertEquals(9, ((Map<?, ?>) bks.get(0)).get("line"));
    assertTrue(a.handle().isEmpty());
    assertEquals(1, synchronizer.size());
  }

  @Test
  void unregisterWithStaleHandleIsIgnored() {
    LineBreakpoint a = LineBreakpoint.at("main.lua", 2);
    book.put(a);
    synchronizer.resync();
    BreakpointHandle stale = a.handle().orElseThrow();
    synchronizer.resync();
    sent.clear();
    a.attachHandle(stale);

    assertFalse(synchronizer.unregister(a));
    assertTrue(sent.isEmpty());
  }

  @Test
  void findByLocationMatchesOneBasedLine() {
    book.put(LineBreakpoint.at("scripts/main.lua", 2));
    synchronizer.resync();

    assertTrue(synchronizer.findByLocation("main.lua", 3).isPresent());
    assertTrue(synchronizer.findByLocation("main.lua", 2).isEmpty());
  }

  @Test
  void sendFailureKeepsLocalState() {
    BreakpointSynchronizer failing = new BreakpointSynchronizer(
        new PandaDialect(PandaDialect.Options.defaults("/work", "Linux")),
        message -> {
          throw new IOException("socket closed");
        },
        book, metrics);
    book.put(LineBreakpoint.at("main.lua", 1));

    assertEquals(1, failing.resync());
    assertEquals(1, failing.size());
    assertEquals(0, metrics.count("session.breakpoints.sent"));
  }
}
