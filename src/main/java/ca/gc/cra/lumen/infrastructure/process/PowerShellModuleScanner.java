package ca.gc.cra.lumen.infrastructure.process;

import ca.gc.cra.lumen.application.port.ModuleScanner;
import ca.gc.cra.lumen.application.port.ProcessRunner;
import ca.gc.cra.lumen.application.port.ProcessRunner.ProcessResult;
import ca.gc.cra.lumen.domain.attach.ModuleScan;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the modules loaded by a process with PowerShell, falling back to {@code tasklist /m}.
 *
 * <p>Used only for diagnostics after attach; results never affect the session.</p>
 *
 * @since 0.1.0
 */
public final class PowerShellModuleScanner implements ModuleScanner {
  private static final Logger log = LoggerFactory.getLogger(PowerShellModuleScanner.class);

  private final ProcessRunner runner;

  public PowerShellModuleScanner(ProcessRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public ModuleScan scan(int pid) throws IOException, InterruptedException {
    ProcessResult ps = runner.run(List.of(
        "powershell", "-NoProfile", "-NonInteractive", "-Command",
        "(Get-Process -Id " + pid + ").Modules | ForEach-Object { $_.ModuleName }"), null);
    if (ps.succeeded() && !ps.stdout().isBlank()) {
      return ModuleScan.classify(parseModuleLines(ps.stdout()), "powershell");
    }
    log.debug("PowerShell module listing failed for pid {}: {}", pid, ps.diagnostic());
    ProcessResult tasklist = runner.run(
        List.of("tasklist", "/m", "/fi", "PID eq " + pid, "/fo", "csv", "/nh"), null);
    if (!tasklist.succeeded()) {
      throw new IOException("Module listing failed for pid " + pid + ": " + tasklist.diagnostic());
    }
    return ModuleScan.classify(parseTasklistCsv(tasklist.stdout()), "tasklist");
  }

  static List<String> parseModuleLines(String output) {
    Set<String> modules = new LinkedHashSet<>();
    for (String line : output.split("\\R")) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        modules.add(trimmed);
      }
    }
    return new ArrayList<>(modules);
  }

  /**
   * Parses {@code "image","pid","mod1,mod2,..."} rows.
   *
   * @param output CSV output
   * @return module names
   */
  static List<String> parseTasklistCsv(String output) {
    Set<String> modules = new LinkedHashSet<>();
    for (String line : output.split("\\R")) {
      String[] columns = line.split("\",\"");
      if (columns.length < 3) {
        continue;
      }
      String last = columns[columns.length - 1].replace("\"", "");
      for (String module : last.split(",")) {
        String name = module.trim();
        if (!name.isEmpty() && !name.toUpperCase(Locale.ROOT).equals("N/A")) {
          modules.add(name);
        }
      }
    }
    return new ArrayList<>(modules);
  }
}
