package ca.gc.cra.lumen.application.attach;

import ca.gc.cra.lumen.application.port.ClockPort;
import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.ModuleScanner;
import ca.gc.cra.lumen.application.port.PlatformPort;
import ca.gc.cra.lumen.application.port.ProcessRunner;
import ca.gc.cra.lumen.application.port.ProcessRunner.ProcessResult;
import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.application.port.TransporterFactory;
import ca.gc.cra.lumen.domain.attach.AttachPhase;
import ca.gc.cra.lumen.domain.attach.DebugPorts;
import ca.gc.cra.lumen.domain.attach.ModuleScan;
import ca.gc.cra.lumen.domain.attach.WinArch;
import ca.gc.cra.lumen.domain.session.FailureKind;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Injects the Emmy hook into a running process and connects to the debug service it
 * opens.
 * <p><strong>Why:</strong> The hook offers no readiness signal, so the workflow waits a settle delay and then
 * retries the connection in bounded rounds across every loopback address.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each {@link #attach} runs on the calling worker
 * thread and may block for the full retry window unless cancelled.</p>
 * <p><strong>Observability:</strong> Emits {@code attach.connect.attempts} per round and
 * {@code attach.latencyMillis} on success.</p>
 *
 * @since 0.1.0
 */
public final class ProcessAttachWorkflow {
  private static final Logger log = LoggerFactory.getLogger(ProcessAttachWorkflow.class);

  private final PlatformPort platform;
  private final HelperToolLayout layout;
  private final ProcessRunner runner;
  private final TransporterFactory transporters;
  private final PortProbe probe;
  private final ModuleScanner moduleScanner;
  private final Executor background;
  private final AttachTiming timing;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public ProcessAttachWorkflow(
      PlatformPort platform,
      HelperToolLayout layout,
      ProcessRunner runner,
      TransporterFactory transporters,
      PortProbe probe,
      ModuleScanner moduleScanner,
      Executor background,
      AttachTiming timing,
      MetricsPort metrics,
      ClockPort clock) {
    this.platform = Objects.requireNonNull(platform, "platform");
    this.layout = Objects.requireNonNull(layout, "layout");
    this.runner = Objects.requireNonNull(runner, "runner");
    this.transporters = Objects.requireNonNull(transporters, "transporters");
    this.probe = Objects.requireNonNullElse(probe, PortProbe.NONE);
    this.moduleScanner = moduleScanner;
    this.background = Objects.requireNonNull(background, "background");
    this.timing = Objects.requireNonNull(timing, "timing");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  public AttachTiming timing() {
    return timing;
  }

  /**
   * Runs the workflow without phase reporting.
   *
   * @see #attach(AttachRequest, TransportListener, BooleanSupplier, Consumer)
   */
  public Transporter attach(AttachRequest request, TransportListener listener, BooleanSupplier cancelled)
      throws AttachException, InterruptedException {
    return attach(request, listener, cancelled, phase -> { });
  }

  /**
   * Validates, injects, waits and connects.
   *
   * @param request attach parameters
   * @param listener installed on the transporter before it starts receiving
   * @param cancelled polled between steps and in every wait slice
   * @param phases receives each phase as it is entered
   * @return connected transporter
   * @throws AttachException classified failure, including {@link FailureKind#CANCELLED}
   * @throws InterruptedException when the worker is interrupted
   */
  public Transporter attach(
      AttachRequest request,
      TransportListener listener,
      BooleanSupplier cancelled,
      Consumer<AttachPhase> phases) throws AttachException, InterruptedException {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(cancelled, "cancelled");
    Consumer<AttachPhase> phaseSink = Objects.requireNonNullElse(phases, phase -> { });
    long startedAt = clock.nowMillis();
    try {
      phaseSink.accept(AttachPhase.VALIDATING);
      validate();
      checkCancelled(cancelled);

      phaseSink.accept(AttachPhase.INVOKING);
      WinArch arch = chooseArch(request);
      layout.requireArch(arch);
      inject(request, arch);
      checkCancelled(cancelled);

      phaseSink.accept(AttachPhase.WAITING_FOR_SERVICE);
      sleepSliced(timing.settleDelay(), cancelled);

      int port = DebugPorts.derive(request.pid());
      if (request.probePort()) {
        phaseSink.accept(AttachPhase.PROBING_PORT);
        probePort(request.hosts(), port);
      }

      phaseSink.accept(AttachPhase.CONNECTING);
      Transporter transporter = connect(request.hosts(), port, listener, cancelled);
      metrics.observe("attach.latencyMillis", clock.nowMillis() - startedAt);
      phaseSink.accept(AttachPhase.CONNECTED);
      log.info("Attached to pid {} ({}) on port {}", request.pid(), arch.directoryName(), port);
      scanModulesAsync(request.pid());
      return transporter;
    } catch (AttachException | InterruptedException | RuntimeException ex) {
      phaseSink.accept(AttachPhase.FAILED);
      throw ex;
    }
  }

  /**
   * Releases the attachment after the session closed its connection. The injected hook notices the closed
   * socket; this only waits out the grace period.
   *
   * @param pid attached process
   * @throws InterruptedException when interrupted while waiting
   */
  public void detach(int pid) throws InterruptedException {
    Thread.sleep(timing.detachGrace().toMillis());
    log.info("Detached from pid {}; the hook library may stay loaded in the target", pid);
  }

  private void validate() throws AttachException {
    if (!platform.supportsProcessInjection()) {
      throw new AttachException(FailureKind.UNSUPPORTED_PLATFORM,
          "Process attach is only supported on Windows");
    }
    layout.validate();
  }

  private WinArch chooseArch(AttachRequest request) throws InterruptedException {
    WinArch detected = detectArch(request.pid());
    if (detected != request.requestedArch()) {
      log.info("Process {} is {} but {} was requested; using the detected architecture",
          request.pid(), detected.directoryName(), request.requestedArch().directoryName());
    }
    return detected;
  }

  private WinArch detectArch(int pid) throws InterruptedException {
    Optional<Path> tool = layout.anyTool();
    if (tool.isEmpty()) {
      return WinArch.X86;
    }
    try {
      ProcessResult result = runner.run(
          List.of(tool.get().toString(), "arch_pid", Integer.toString(pid)), tool.get().getParent());
      return result.succeeded() ? WinArch.X64 : WinArch.X86;
    } catch (IOException ex) {
      log.debug("Architecture query failed for pid {}; assuming x86: {}", pid, ex.getMessage());
      return WinArch.X86;
    }
  }

  private void inject(AttachRequest request, WinArch arch) throws AttachException, InterruptedException {
    Path toolDir = layout.toolDirectory(arch);
    List<String> command = new ArrayList<>(List.of(
        layout.tool(arch).toString(),
        "attach",
        "-p",
        Integer.toString(request.pid()),
        "-dir",
        "\"" + toolDir + "\"",
        "-dll",
        HelperToolLayout.HOOK_NAME));
    if (request.captureLog()) {
      command.add("-capture-log");
    }
    log.debug("Running {} in {}", String.join(" ", command), toolDir);
    ProcessResult result;
    try {
      result = runner.run(command, toolDir);
    } catch (IOException ex) {
      throw new AttachException(FailureKind.ATTACH_FAILED,
          "Failed to launch " + HelperToolLayout.TOOL_NAME + ": " + ex.getMessage(), ex);
    }
    if (!result.stdout().isBlank()) {
      log.debug("attach output: {}", result.stdout().trim());
    }
    if (!result.succeeded()) {
      throw new AttachException(FailureKind.ATTACH_FAILED,
          "Attach failed (exit code " + result.exitCode() + "): " + result.stderr().trim());
    }
    log.info("Injected {} into pid {}", HelperToolLayout.HOOK_NAME, request.pid());
    if (request.captureLog()) {
      launchLogReceiver(request.pid(), arch);
    }
  }

  private void launchLogReceiver(int pid, WinArch arch) {
    try {
      runner.launch(
          List.of(layout.tool(arch).toString(), "receive_log", "-p", Integer.toString(pid)),
          layout.toolDirectory(arch));
      log.info("Started log capture for pid {}", pid);
    } catch (IOException ex) {
      log.warn("Log capture unavailable for pid {}: {}", pid, ex.getMessage());
    }
  }

  private void probePort(List<String> hosts, int port) {
    for (String host : hosts) {
      Optional<String> failure = probe.probe(host, port);
      if (failure.isEmpty()) {
        log.debug("Port probe {}:{} accepted", host, port);
        return;
      }
      log.debug("Port probe {}:{} failed: {}", host, port, failure.get());
    }
  }

  private Transporter connect(
      List<String> hosts, int port, TransportListener listener, BooleanSupplier cancelled)
      throws AttachException, InterruptedException {
    int maxAttempts = timing.maxConnectAttempts();
    List<String> lastErrors = List.of();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      checkCancelled(cancelled);
      metrics.increment("attach.connect.attempts");
      List<String> errors = new ArrayList<>(hosts.size());
      for (String host : hosts) {
        checkCancelled(cancelled);
        Transporter transporter = transporters.create(host, port);
        if (listener != null) {
          transporter.setListener(listener);
        }
        try {
          transporter.connect();
        } catch (IOException ex) {
          transporter.close();
          errors.add(host + ": " + describe(ex));
          continue;
        }
        if (cancelled.getAsBoolean()) {
          transporter.close();
          throw new AttachException(FailureKind.CANCELLED, "Attach cancelled after connecting");
        }
        log.info("Connected to {}:{} on attempt {}/{}", host, port, attempt, maxAttempts);
        return transporter;
      }
      lastErrors = errors;
      log.debug("Connect attempt {}/{} to port {} failed: {}", attempt, maxAttempts, port, errors);
      if (attempt < maxAttempts) {
        sleepSliced(timing.retryDelay(), cancelled);
      }
    }
    throw new AttachException(FailureKind.CONNECT_TIMEOUT, timeoutMessage(port, maxAttempts, lastErrors));
  }

  static String timeoutMessage(int port, int attempts, List<String> lastErrors) {
    return "Could not connect to the debug service on port " + port + " after " + attempts + " attempts."
        + " Last errors: " + (lastErrors.isEmpty() ? "none recorded" : String.join("; ", lastErrors)) + "."
        + " Likely causes: the target has not loaded a Lua runtime;"
        + " the hook injection was blocked by antivirus or missing privileges;"
        + " another process holds port " + port + ";"
        + " a firewall blocks loopback connections.";
  }

  private void scanModulesAsync(int pid) {
    if (moduleScanner == null) {
      return;
    }
    try {
      background.execute(() -> reportModules(pid));
    } catch (RejectedExecutionException ex) {
      log.debug("Module scan skipped for pid {}: worker pool unavailable", pid);
    }
  }

  private void reportModules(int pid) {
    try {
      ModuleScan scan = moduleScanner.scan(pid);
      if (scan.hasLuaRuntime()) {
        log.info("Lua runtime modules in pid {}: {} (via {})", pid, scan.luaModules(), scan.source());
      } else {
        log.warn("No Lua runtime module among {} modules of pid {} (via {}); breakpoints may never hit",
            scan.modules().size(), pid, scan.source());
      }
    } catch (IOException | RuntimeException ex) {
      log.debug("Module scan failed for pid {}: {}", pid, ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Module scan interrupted for pid {}", pid);
    }
  }

  private void sleepSliced(Duration total, BooleanSupplier cancelled)
      throws AttachException, InterruptedException {
    long remaining = total.toMillis();
    long slice = timing.retrySlice().toMillis();
    while (remaining > 0) {
      checkCancelled(cancelled);
      long step = Math.min(slice, remaining);
      Thread.sleep(step);
      remaining -= step;
    }
    checkCancelled(cancelled);
  }

  private static void checkCancelled(BooleanSupplier cancelled) throws AttachException {
    if (cancelled.getAsBoolean()) {
      throw new AttachException(FailureKind.CANCELLED, "Attach cancelled");
    }
  }

  private static String describe(IOException ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
