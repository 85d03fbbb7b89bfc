package ca.gc.cra.lumen.api;

import ca.gc.cra.lumen.application.session.DebugSession;
import ca.gc.cra.lumen.config.CompositionRoot;
import ca.gc.cra.lumen.config.PandaConfig;
import ca.gc.cra.lumen.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debugs a LuaPanda debuggee over TCP, either dialling it or waiting for it to connect.
 *
 * @since 0.1.0
 */
public final class PandaCli {
  private static final Logger log = LoggerFactory.getLogger(PandaCli.class);
  private static final String SUMMARY_USAGE =
      "usage: panda [transport=client|server] [host=H] [port=P] [stopOnEntry=true] [config=PATH] [--no-console]";
  private static final String HELP_TEXT = """
      LUMEN LuaPanda session

      Usage:
        panda [options]

      Options:
        transport=client|server  server listens for the debuggee (default); client dials it
        host=H                   Bind or target host (default localhost)
        port=P                   Port (default 8818; 0 picks a free port in server mode)
        stopOnEntry=true         Pause on the first executed line
        useCHook=true|false      Ask the debuggee to use its C hook (default true)
        logLevel=0|1|2           Debuggee log level (default 1)
        cwd=PATH                 Working directory announced to the debuggee
        stopConfirmTimeoutMs=N   Wait for stopRun confirmation (default 3000)
        sourceRoots=DIR[,DIR]    Local source roots used to pick the top frame
        config=PATH              YAML file with common/panda sections
        --no-console             Wait for the debuggee to disconnect instead of reading commands
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private PandaCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for panda CLI");
    }

    Map<String, String> effective;
    PandaConfig panda;
    try {
      effective = ConfigCliUtils.effectiveConfig("panda", CliArgsParser.toMap(input.keyValueArgs()));
      TelemetryConfigurator.configureMetrics(effective);
      panda = PandaConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid panda arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(effective)) {
      DebugSession session = root.sessionFactory(List.of("." + panda.luaFileExtension()))
          .direct(root.pandaDialect(panda), root.pandaTransporter(panda));
      log.info("LuaPanda {} on {}:{}", panda.transport(), panda.host(), panda.port());
      return SessionRunner.run(session, root.breakpoints(), !input.hasFlag("--no-console"));
    } catch (IOException ex) {
      log.error("Console I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Panda session interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in panda session", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
