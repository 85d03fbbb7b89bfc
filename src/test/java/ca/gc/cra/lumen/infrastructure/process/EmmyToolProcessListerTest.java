package ca.gc.cra.lumen.infrastructure.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.application.attach.HelperToolLayout;
import ca.gc.cra.lumen.application.port.ProcessRunner.ProcessResult;
import ca.gc.cra.lumen.domain.attach.ProcessInfo;
import ca.gc.cra.lumen.testutil.FakeProcessRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmmyToolProcessListerTest {
  @TempDir Path root;

  @Test
  void runsListProcessesWithAvailableTool() throws Exception {
    Path x86 = Files.createDirectories(root.resolve("x86"));
    Files.writeString(x86.resolve(HelperToolLayout.TOOL_NAME), "tool");
    FakeProcessRunner runner = new FakeProcessRunner(command ->
        new ProcessResult(0, "42\r\nTitle\r\nC:\\a.exe\r\n\r\n", ""));

    List<ProcessInfo> processes = new EmmyToolProcessLister(new HelperToolLayout(root), runner).listProcesses();

    assertEquals(List.of("list_processes"), runner.verbs());
    assertEquals(42, processes.get(0).pid());
  }

  @Test
  void missingToolIsIoError() {
    IOException ex = assertThrows(IOException.class, () -> new EmmyToolProcessLister(
        new HelperToolLayout(root), FakeProcessRunner.succeeding()).listProcesses());

    assertTrue(ex.getMessage().contains(HelperToolLayout.TOOL_NAME));
  }
}
