package ca.gc.cra.lumen.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.domain.breakpoint.LineBreakpoint;
import org.junit.jupiter.api.Test;

class BreakpointBookTest {

  @Test
  void putReplacesSameLocation() {
    BreakpointBook book = new BreakpointBook();
    LineBreakpoint first = LineBreakpoint.at("main.lua", 4);
    LineBreakpoint second = new LineBreakpoint("main.lua", 4, "x > 1", null);

    assertTrue(book.put(first).isEmpty());
    assertSame(first, book.put(second).orElseThrow());
    assertEquals(1, book.size());
    assertSame(second, book.find("main.lua", 4).orElseThrow());
  }

  @Test
  void removeReturnsEntry() {
    BreakpointBook book = new BreakpointBook();
    LineBreakpoint bp = LineBreakpoint.at("main.lua", 4);
    book.put(bp);

    assertSame(bp, book.remove("main.lua", 4).orElseThrow());
    assertTrue(book.remove("main.lua", 4).isEmpty());
  }

  @Test
  void breakpointsIsSnapshot() {
    BreakpointBook book = new BreakpointBook();
    book.put(LineBreakpoint.at("a.lua", 0));

    assertThrows(UnsupportedOperationException.class, () -> book.breakpoints().add(LineBreakpoint.at("b.lua", 0)));
  }
}
