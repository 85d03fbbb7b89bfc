package ca.gc.cra.lumen.api;

import ca.gc.cra.lumen.application.attach.AttachException;
import ca.gc.cra.lumen.application.session.DebugSession;
import ca.gc.cra.lumen.config.AttachConfig;
import ca.gc.cra.lumen.config.CompositionRoot;
import ca.gc.cra.lumen.config.EmmyHelperConfig;
import ca.gc.cra.lumen.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches to a running process through the Emmy helper tool and opens an interactive console.
 *
 * @since 0.1.0
 */
public final class AttachCli {
  private static final Logger log = LoggerFactory.getLogger(AttachCli.class);
  private static final String SUMMARY_USAGE =
      "usage: attach pid=N [arch=x86|x64] [toolRoot=PATH] [captureLog=true] [maxConnectAttempts=N] "
          + "[retryDelayMs=N] [settleDelayMs=N] [config=PATH] [--no-console]";
  private static final String HELP_TEXT = """
      LUMEN attach

      Usage:
        attach pid=N [options]

      Options:
        pid=N                   Target process id (required)
        processName=NAME        Name recorded for the attachment
        arch=x86|x64            Requested architecture (default x64; the detected one wins)
        toolRoot=PATH           Directory holding x86/ and x64/ helper tools (default debugger/emmy/windows)
        captureLog=true         Capture the target's log output
        probePort=true          Probe the debug port before connecting
        settleDelayMs=N         Wait after injection (default 100)
        maxConnectAttempts=N    Connect rounds (default 15)
        retryDelayMs=N          Wait between rounds (default 2000)
        connectTimeoutMs=N      Per-dial timeout (default 1000)
        helper.mode=inline|paths  Send the helper script text or its directory (default inline)
        helper.customRegistry=PATH  Type registry replacing the bundled one
        sourceRoots=DIR[,DIR]   Local source roots used to pick the top frame
        metricsExporter=otlp|none   Metrics export (default none)
        config=PATH             YAML file with common/attach sections
        --no-console            Wait for the target to disconnect instead of reading commands
        --verbose               Enable DEBUG logging
        --help                  Show this message
      """;

  private AttachCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Executes the attach command.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for attach CLI");
    }

    Map<String, String> effective;
    AttachConfig attach;
    EmmyHelperConfig helper;
    try {
      effective = ConfigCliUtils.effectiveConfig("attach", CliArgsParser.toMap(input.keyValueArgs()));
      TelemetryConfigurator.configureMetrics(effective);
      attach = AttachConfig.fromMap(effective);
      helper = EmmyHelperConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid attach arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(effective)) {
      DebugSession session = root.sessionFactory(helper.extensions()).attach(
          root.emmyDialect(attach, helper), root.attachWorkflow(attach), root.registry(), attach.toRequest());
      log.info("Attaching to pid {} with tools under {}", attach.pid(), attach.toolRoot());
      return SessionRunner.run(session, root.breakpoints(), !input.hasFlag("--no-console"));
    } catch (AttachException ex) {
      log.error("Attach refused ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.ATTACH_REFUSED;
    } catch (IOException ex) {
      log.error("Console I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Attach interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in attach", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
