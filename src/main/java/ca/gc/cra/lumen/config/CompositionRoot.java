package ca.gc.cra.lumen.config;

import ca.gc.cra.lumen.application.attach.HelperToolLayout;
import ca.gc.cra.lumen.application.attach.PortProbe;
import ca.gc.cra.lumen.application.attach.ProcessAttachWorkflow;
import ca.gc.cra.lumen.application.attach.ProcessAttachmentRegistry;
import ca.gc.cra.lumen.application.port.ClockPort;
import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.PlatformPort;
import ca.gc.cra.lumen.application.port.ProcessLister;
import ca.gc.cra.lumen.application.port.ProcessRunner;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.application.protocol.EmmyDialect;
import ca.gc.cra.lumen.application.protocol.HelperScriptAssembler;
import ca.gc.cra.lumen.application.protocol.PandaDialect;
import ca.gc.cra.lumen.application.session.BreakpointBook;
import ca.gc.cra.lumen.application.session.DebugSessionFactory;
import ca.gc.cra.lumen.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.lumen.infrastructure.json.JsonSupport;
import ca.gc.cra.lumen.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.lumen.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.lumen.infrastructure.process.EmmyToolProcessLister;
import ca.gc.cra.lumen.infrastructure.process.PowerShellModuleScanner;
import ca.gc.cra.lumen.infrastructure.process.ProcessListParser;
import ca.gc.cra.lumen.infrastructure.process.SystemProcessRunner;
import ca.gc.cra.lumen.infrastructure.script.ClasspathScriptProvider;
import ca.gc.cra.lumen.infrastructure.script.FileScriptProvider;
import ca.gc.cra.lumen.infrastructure.source.FileSystemSourceLocator;
import ca.gc.cra.lumen.infrastructure.transport.EmmyTransporterFactory;
import ca.gc.cra.lumen.infrastructure.transport.LuaPandaTcpClientTransporter;
import ca.gc.cra.lumen.infrastructure.transport.LuaPandaTcpServerTransporter;
import ca.gc.cra.lumen.infrastructure.transport.SocketPortProbe;
import ca.gc.cra.lumen.validation.Numbers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires LUMEN use cases to concrete adapters from an effective configuration map.
 * <p><strong>Why:</strong> One place translates configuration into transporters, dialects, the attach
 * workflow and the shared worker pool.</p>
 * <p><strong>Thread-safety:</strong> Build and use from the CLI thread; the objects it hands out are
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final Map<String, String> config;
  private final OpenTelemetryMetricsAdapter metrics;
  private final PlatformPort platform;
  private final ClockPort clock;
  private final JsonSupport json = new JsonSupport();
  private final ExecutorService workers;
  private final BreakpointBook breakpoints = new BreakpointBook();
  private final ProcessAttachmentRegistry registry;

  /**
   * Creates a root using the JVM's platform, clock and telemetry settings.
   *
   * @param config effective configuration (defaults, YAML and CLI merged)
   */
  public CompositionRoot(Map<String, String> config) {
    this(config, OpenTelemetryMetricsAdapter.create(TelemetrySettings.fromEnvironment(
        config.getOrDefault("metricsExporter", "none"))), PlatformPort.SYSTEM, ClockPort.SYSTEM);
  }

  CompositionRoot(
      Map<String, String> config, OpenTelemetryMetricsAdapter metrics, PlatformPort platform, ClockPort clock) {
    this.config = Map.copyOf(Objects.requireNonNull(config, "config"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.platform = Objects.requireNonNull(platform, "platform");
    this.clock = Objects.requireNonNull(clock, "clock");
    int workerCount = (int) Numbers.parseInRange("workers", config.get("workers"), 4, 1, 64);
    this.workers = ExecutorFactories.newWorkerPool(workerCount, "lumen-worker", ExecutorFactories.LOGGING_HANDLER);
    this.registry = new ProcessAttachmentRegistry(clock);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public BreakpointBook breakpoints() {
    return breakpoints;
  }

  public ProcessAttachmentRegistry registry() {
    return registry;
  }

  /**
   * Session factory whose source locator searches {@code sourceRoots} with the given extensions.
   *
   * @param extensions script extensions
   * @return factory
   */
  public DebugSessionFactory sessionFactory(List<String> extensions) {
    FileSystemSourceLocator locator = new FileSystemSourceLocator(sourceRoots(), extensions);
    return new DebugSessionFactory(workers, breakpoints, locator, metrics);
  }

  /**
   * Attach workflow for the helper tool under {@code attach.toolRoot()}.
   *
   * @param attach attach settings
   * @return workflow
   */
  public ProcessAttachWorkflow attachWorkflow(AttachConfig attach) {
    ProcessRunner runner = new SystemProcessRunner();
    PortProbe probe = new SocketPortProbe(attach.connectTimeout());
    return new ProcessAttachWorkflow(
        platform,
        new HelperToolLayout(attach.toolRoot()),
        runner,
        new EmmyTransporterFactory(attach.connectTimeout(), json, metrics),
        probe,
        new PowerShellModuleScanner(runner),
        workers,
        attach.toTiming(),
        metrics,
        clock);
  }

  /**
   * Emmy dialect for attach mode. Inline mode assembles the helper from bundled resources; when that fails
   * the dialect falls back to announcing helper directories.
   *
   * @param attach attach settings
   * @param helper helper delivery settings
   * @return dialect
   */
  public EmmyDialect emmyDialect(AttachConfig attach, EmmyHelperConfig helper) {
    if (helper.mode() == EmmyHelperConfig.Mode.INLINE) {
      HelperScriptAssembler assembler = new HelperScriptAssembler(
          new ClasspathScriptProvider(), new FileScriptProvider(Path.of("").toAbsolutePath()));
      Optional<String> script = assembler.assemble(helper.customRegistry());
      if (script.isPresent()) {
        return EmmyDialect.inlineHelper(script.get(), helper.extensions());
      }
      log.warn("Falling back to helper paths under {}", attach.toolRoot());
    }
    Path helperDir = Objects.requireNonNullElse(attach.toolRoot().getParent(), attach.toolRoot());
    String customDir = null;
    if (helper.customRegistry() != null) {
      Path parent = Path.of(helper.customRegistry()).toAbsolutePath().getParent();
      customDir = parent == null ? null : parent.toString();
    }
    return EmmyDialect.helperPaths(helperDir.toString(), customDir, "emmyHelper_ue", helper.extensions());
  }

  public PandaDialect pandaDialect(PandaConfig panda) {
    return new PandaDialect(panda.toOptions(System.getProperty("os.name", "")));
  }

  /**
   * Unconnected LuaPanda transporter for the configured role.
   *
   * @param panda panda settings
   * @return client or server transporter
   */
  public Transporter pandaTransporter(PandaConfig panda) {
    if (panda.transport() == PandaConfig.Transport.CLIENT) {
      return new LuaPandaTcpClientTransporter(panda.host(), panda.port(), panda.connectTimeout(), json, metrics);
    }
    return new LuaPandaTcpServerTransporter(panda.host(), panda.port(), json, metrics);
  }

  /**
   * Process lister backed by the helper tool.
   *
   * @param toolRoot helper tool root
   * @return lister
   */
  public ProcessLister processLister(Path toolRoot) {
    return new EmmyToolProcessLister(
        new HelperToolLayout(toolRoot), new SystemProcessRunner(ProcessListParser.toolCharset()));
  }

  List<Path> sourceRoots() {
    List<Path> roots = new ArrayList<>();
    for (String part : config.getOrDefault("sourceRoots", ".").split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        roots.add(Path.of(trimmed).toAbsolutePath().normalize());
      }
    }
    return roots;
  }

  /** Shuts down the worker pool, clears the registry and flushes metrics. */
  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(Duration.ofSeconds(2).toMillis(), TimeUnit.MILLISECONDS)) {
        log.debug("Worker pool still busy at shutdown; interrupting");
        workers.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
    registry.close();
    metrics.flush();
    metrics.close();
  }
}
