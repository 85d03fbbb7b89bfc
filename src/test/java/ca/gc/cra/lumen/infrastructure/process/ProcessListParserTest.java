package ca.gc.cra.lumen.infrastructure.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.domain.attach.ProcessInfo;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProcessListParserTest {

  @Test
  void parsesFourLineRecords() {
    String output = "1234\r\nMy Game\r\nC:\\Games\\game.exe\r\n\r\n"
        + "88\r\n\r\nC:\\Windows\\explorer.exe\r\n\r\n";

    List<ProcessInfo> processes = ProcessListParser.parse(output);

    assertEquals(2, processes.size());
    assertEquals(new ProcessInfo(1234, "game.exe", "My Game", "C:\\Games\\game.exe"), processes.get(0));
    assertEquals("explorer.exe", processes.get(1).displayName());
  }

  @Test
  void skipsInvalidPidsAndTrailingFragments() {
    String output = "abc\r\nx\r\nC:\\x.exe\r\n\r\n"
        + "0\r\n\r\nC:\\idle.exe\r\n\r\n"
        + "77\r\n\r\nC:\\ok.exe\r\n\r\n"
        + "99\r\npartial";

    List<ProcessInfo> processes = ProcessListParser.parse(output);

    assertEquals(List.of(77), processes.stream().map(ProcessInfo::pid).toList());
  }

  @Test
  void emptyOutputYieldsEmptyList() {
    assertTrue(ProcessListParser.parse(null).isEmpty());
    assertTrue(ProcessListParser.parse("").isEmpty());
  }

  @Test
  void toolCharsetIsAvailable() {
    assertNotNull(ProcessListParser.toolCharset());
  }
}
