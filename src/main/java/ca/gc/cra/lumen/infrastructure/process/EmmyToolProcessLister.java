package ca.gc.cra.lumen.infrastructure.process;

import ca.gc.cra.lumen.application.attach.HelperToolLayout;
import ca.gc.cra.lumen.application.port.ProcessLister;
import ca.gc.cra.lumen.application.port.ProcessRunner;
import ca.gc.cra.lumen.application.port.ProcessRunner.ProcessResult;
import ca.gc.cra.lumen.domain.attach.ProcessInfo;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Lists running processes through {@code emmy_tool list_processes}.
 *
 * @since 0.1.0
 */
public final class EmmyToolProcessLister implements ProcessLister {
  private final HelperToolLayout layout;
  private final ProcessRunner runner;

  /**
   * @param layout helper tool layout; any architecture's tool is acceptable
   * @param runner runner decoding with {@link ProcessListParser#toolCharset()}
   */
  public EmmyToolProcessLister(HelperToolLayout layout, ProcessRunner runner) {
    this.layout = Objects.requireNonNull(layout, "layout");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public List<ProcessInfo> listProcesses() throws IOException, InterruptedException {
    Path tool = layout.anyTool()
        .orElseThrow(() -> new IOException(HelperToolLayout.TOOL_NAME + " not found under " + layout.root()));
    ProcessResult result = runner.run(List.of(tool.toString(), "list_processes"), tool.getParent());
    if (!result.succeeded()) {
      throw new IOException("list_processes failed (exit code " + result.exitCode() + "): " + result.diagnostic());
    }
    return ProcessListParser.parse(result.stdout());
  }
}
