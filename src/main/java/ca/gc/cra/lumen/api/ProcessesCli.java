package ca.gc.cra.lumen.api;

import ca.gc.cra.lumen.application.port.ProcessLister;
import ca.gc.cra.lumen.config.AttachConfig;
import ca.gc.cra.lumen.config.CompositionRoot;
import ca.gc.cra.lumen.domain.attach.ProcessInfo;
import ca.gc.cra.lumen.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists attachable processes through the helper tool.
 *
 * @since 0.1.0
 */
public final class ProcessesCli {
  private static final Logger log = LoggerFactory.getLogger(ProcessesCli.class);
  private static final String SUMMARY_USAGE = "usage: processes [filter=TEXT] [toolRoot=PATH] [config=PATH]";

  private ProcessesCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    Map<String, String> effective;
    Path toolRoot;
    try {
      effective = ConfigCliUtils.effectiveConfig("processes", CliArgsParser.toMap(input.keyValueArgs()));
      toolRoot = Path.of(effective.getOrDefault("toolRoot", AttachConfig.DEFAULT_TOOL_ROOT)).toAbsolutePath();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid processes arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(effective)) {
      ProcessLister lister = root.processLister(toolRoot);
      List<ProcessInfo> processes = filter(lister.listProcesses(), effective.get("filter"));
      for (ProcessInfo process : processes) {
        CliPrinter.println(String.format(Locale.ROOT, "%8d  %s", process.pid(), process.displayName()));
      }
      log.debug("Listed {} processes", processes.size());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Process listing failed: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    }
  }

  static List<ProcessInfo> filter(List<ProcessInfo> processes, String filter) {
    if (filter == null || filter.isBlank()) {
      return processes;
    }
    String needle = filter.trim().toLowerCase(Locale.ROOT);
    return processes.stream()
        .filter(p -> p.displayName().toLowerCase(Locale.ROOT).contains(needle)
            || Integer.toString(p.pid()).equals(needle))
        .toList();
  }
}
