package ca.gc.cra.lumen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.lumen.domain.attach.ProcessInfo;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProcessesCliTest {

  private final List<ProcessInfo> processes = List.of(
      ProcessInfo.fromPath(100, "Main Window", "C:\\Games\\Game.exe"),
      ProcessInfo.fromPath(200, "", "C:\\Windows\\notepad.exe"),
      ProcessInfo.fromPath(300, "", "/usr/bin/lua5.1"));

  @Test
  void blankFilterKeepsEverything() {
    assertEquals(processes, ProcessesCli.filter(processes, " "));
    assertEquals(processes, ProcessesCli.filter(processes, null));
  }

  @Test
  void filterMatchesNameTitleOrExactPid() {
    assertEquals(List.of(100), pids(ProcessesCli.filter(processes, "main window")));
    assertEquals(List.of(100), pids(ProcessesCli.filter(processes, "GAME")));
    assertEquals(List.of(200), pids(ProcessesCli.filter(processes, "200")));
    assertEquals(List.of(), pids(ProcessesCli.filter(processes, "20")));
  }

  private static List<Integer> pids(List<ProcessInfo> list) {
    return list.stream().map(ProcessInfo::pid).toList();
  }
}
