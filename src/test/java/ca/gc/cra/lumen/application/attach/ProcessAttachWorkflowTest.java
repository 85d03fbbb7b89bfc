package ca.gc.cra.lumen.application.attach;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.application.port.ClockPort;
import ca.gc.cra.lumen.application.port.ModuleScanner;
import ca.gc.cra.lumen.application.port.PlatformPort;
import ca.gc.cra.lumen.application.port.ProcessRunner.ProcessResult;
import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.application.port.TransporterFactory;
import ca.gc.cra.lumen.domain.attach.AttachPhase;
import ca.gc.cra.lumen.domain.attach.DebugPorts;
import ca.gc.cra.lumen.domain.attach.ModuleScan;
import ca.gc.cra.lumen.domain.attach.WinArch;
import ca.gc.cra.lumen.domain.session.FailureKind;
import ca.gc.cra.lumen.testutil.FakeProcessRunner;
import ca.gc.cra.lumen.testutil.FakeTransporter;
import ca.gc.cra.lumen.testutil.RecordingMetrics;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessAttachWorkflowTest {

  private static final int PID = 4242;
  private static final AttachTiming FAST =
      new AttachTiming(Duration.ZERO, 15, Duration.ZERO, Duration.ofMillis(1), Duration.ZERO);

  @TempDir Path toolRoot;

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final List<String> connectTargets = new CopyOnWriteArrayList<>();

  @Test
  void attachInjectsHookAndConnectsToDerivedPort() throws Exception {
    installTools(WinArch.X64);
    FakeProcessRunner runner = FakeProcessRunner.succeeding();
    FakeTransporter connected = new FakeTransporter();
    List<AttachPhase> phases = new ArrayList<>();

    Transporter transporter = workflow(() -> true, runner, (host, port) -> {
      connectTargets.add(host + ":" + port);
      return connected;
    }).attach(request(false), TransportListener.NONE, () -> false, phases::add);

    assertSame(connected, transporter);
    assertEquals(List.of("arch_pid", "attach"), runner.verbs());
    List<String> attach = runner.runs().get(1);
    assertEquals(List.of("-p", Integer.toString(PID), "-dir"), attach.subList(2, 5));
    assertEquals("\"" + toolRoot.toAbsolutePath().normalize().resolve("x64") + "\"", attach.get(5));
    assertEquals(List.of("-dll", "emmy_hook.dll"), attach.subList(6, 8));
    assertEquals(List.of("127.0.0.1:" + DebugPorts.derive(PID)), connectTargets);
    assertEquals(List.of(AttachPhase.VALIDATING, AttachPhase.INVOKING, AttachPhase.WAITING_FOR_SERVICE,
        AttachPhase.CONNECTING, AttachPhase.CONNECTED), phases);
    assertEquals(1, metrics.observed("attach.latencyMillis").size());
  }

  @Test
  void detectedArchitectureWinsOverRequested() throws Exception {
    installTools(WinArch.X86);
    installTools(WinArch.X64);
    FakeProcessRunner runner = new FakeProcessRunner(command -> command.get(1).equals("arch_pid")
        ? new ProcessResult(1, "", "")
        : new ProcessResult(0, "", ""));

    workflow(() -> true, runner, (host, port) -> new FakeTransporter())
        .attach(request(false), TransportListener.NONE, () -> false);

    assertEquals(toolRoot.toAbsolutePath().normalize().resolve("x86").resolve(HelperToolLayout.TOOL_NAME).toString(),
        runner.runs().get(1).get(0));
  }

  @Test
  void unsupportedPlatformFailsBeforeRunningTools() {
    FakeProcessRunner runner = FakeProcessRunner.succeeding();

    AttachException ex = assertThrows(AttachException.class, () -> workflow(() -> false, runner,
        (host, port) -> new FakeTransporter()).attach(request(false), TransportListener.NONE, () -> false));

    assertEquals(FailureKind.UNSUPPORTED_PLATFORM, ex.kind());
    assertTrue(runner.runs().isEmpty());
  }

  @Test
  void missingToolIsReported() {
    AttachException ex = assertThrows(AttachException.class, () -> workflow(() -> true,
        FakeProcessRunner.succeeding(), (host, port) -> new FakeTransporter())
        .attach(request(false), TransportListener.NONE, () -> false));

    assertEquals(FailureKind.TOOL_MISSING, ex.kind());
    assertTrue(ex.getMessage().contains("emmy_tool.exe"));
  }

  @Test
  void failedInjectionCarriesExitCodeAndStderr() throws Exception {
    installTools(WinArch.X64);
    FakeProcessRunner runner = new FakeProcessRunner(command -> command.get(1).equals("attach")
        ? new ProcessResult(5, "", "OpenProcess failed: access denied\n")
        : new ProcessResult(0, "", ""));
    List<AttachPhase> phases = new ArrayList<>();

    AttachException ex = assertThrows(AttachException.class, () -> workflow(() -> true, runner,
        (host, port) -> new FakeTransporter()).attach(request(false), TransportListener.NONE, () -> false,
        phases::add));

    assertEquals(FailureKind.ATTACH_FAILED, ex.kind());
    assertEquals("Attach failed (exit code 5): OpenProcess failed: access denied", ex.getMessage());
    assertEquals(AttachPhase.FAILED, phases.get(phases.size() - 1));
  }

  @Test
  void toolLaunchFailureIsAttachFailure() throws Exception {
    installTools(WinArch.X64);
    FakeProcessRunner runner = new FakeProcessRunner(command -> command.get(1).equals("attach")
        ? null
        : new ProcessResult(0, "", ""));

    AttachException ex = assertThrows(AttachException.class, () -> workflow(() -> true, runner,
        (host, port) -> new FakeTransporter()).attach(request(false), TransportListener.NONE, () -> false));

    assertEquals(FailureKind.ATTACH_FAILED, ex.kind());
    assertTrue(ex.getCause() instanceof IOException);
  }

  @Test
  void connectGivesUpAfterConfiguredAttempts() throws Exception {
    installTools(WinArch.X64);
    AtomicInteger created = new AtomicInteger();
    TransporterFactory refusing = (host, port) -> {
      created.incrementAndGet();
      return new FakeTransporter(host).failConnectWith(new ConnectException("Connection refused"));
    };

    AttachException ex = assertThrows(AttachException.class, () -> workflow(() -> true,
        FakeProcessRunner.succeeding(), refusing).attach(request(false), TransportListener.NONE, () -> false));

    assertEquals(FailureKind.CONNECT_TIMEOUT, ex.kind());
    assertTrue(ex.getMessage().contains("after 15 attempts"));
    assertTrue(ex.getMessage().contains("127.0.0.1: Connection refused"));
    assertTrue(ex.getMessage().contains("port " + DebugPorts.derive(PID)));
    assertEquals(15 * 3, created.get());
    assertEquals(15, metrics.count("attach.connect.attempts"));
  }

  @Test
  void laterHostIsTriedWhenFirstRefuses() throws Exception {
    installTools(WinArch.X64);
    FakeTransporter ipv6 = new FakeTransporter("::1");
    TransporterFactory factory = (host, port) -> {
      connectTargets.add(host);
      return host.equals("127.0.0.1")
          ? new FakeTransporter(host).failConnectWith(new ConnectException("Connection refused"))
          : ipv6;
    };

    Transporter transporter = workflow(() -> true, FakeProcessRunner.succeeding(), factory)
        .attach(request(false), TransportListener.NONE, () -> false);

    assertSame(ipv6, transporter);
    assertEquals(List.of("127.0.0.1", "::1"), connectTargets);
  }

  @Test
  void cancellationAfterInjectionStopsBeforeConnecting() throws Exception {
    installTools(WinArch.X64);
    AtomicBoolean cancelled = new AtomicBoolean();
    FakeProcessRunner runner = new FakeProcessRunner(command -> {
      if (command.get(1).equals("attach")) {
        cancelled.set(true);
      }
      return new ProcessResult(0, "", "");
    });
    AtomicInteger created = new AtomicInteger();

    AttachException ex = assertThrows(AttachException.class, () -> workflow(() -> true, runner,
        (host, port) -> {
          created.incrementAndGet();
          return new FakeTransporter();
        }).attach(request(false), TransportListener.NONE, cancelled::get));

    assertEquals(FailureKind.CANCELLED, ex.kind());
    assertEquals(0, created.get());
  }

  @Test
  void captureLogStartsReceiverAndProbeRuns() throws Exception {
    installTools(WinArch.X64);
    FakeProcessRunner runner = FakeProcessRunner.succeeding();
    List<String> probed = new ArrayList<>();
    List<Integer> scanned = new ArrayList<>();
    ModuleScanner scanner = pid -> {
      scanned.add(pid);
      return ModuleScan.classify(List.of("lua51.dll"), "test");
    };
    ProcessAttachWorkflow workflow = new ProcessAttachWorkflow(() -> true, new HelperToolLayout(toolRoot),
        runner, (host, port) -> new FakeTransporter(), (host, port) -> {
          probed.add(host + ":" + port);
          return Optional.empty();
        }, scanner, Runnable::run, FAST, metrics, ClockPort.SYSTEM);
    AttachRequest request = new AttachRequest(PID, "game.exe", WinArch.X64, true, true, List.of("127.0.0.1"));

    workflow.attach(request, TransportListener.NONE, () -> false);

    assertTrue(runner.runs().get(1).contains("-capture-log"));
    assertEquals(List.of("receive_log", "-p", Integer.toString(PID)), runner.launches().get(0).subList(1, 4));
    assertEquals(List.of("127.0.0.1:" + DebugPorts.derive(PID)), probed);
    assertEquals(List.of(PID), scanned);
  }

  @Test
  void timeoutMessageListsLikelyCauses() {
    String message = ProcessAttachWorkflow.timeoutMessage(1324, 15, List.of());

    assertTrue(message.contains("none recorded"));
    assertTrue(message.contains("antivirus"));
  }

  private ProcessAttachWorkflow workflow(
      PlatformPort platform, FakeProcessRunner runner, TransporterFactory factory) {
    return new ProcessAttachWorkflow(platform, new HelperToolLayout(toolRoot), runner, factory,
        PortProbe.NONE, null, Runnable::run, FAST, metrics, ClockPort.SYSTEM);
  }

  private static AttachRequest request(boolean captureLog) {
    return new AttachRequest(PID, "game.exe", WinArch.X64, captureLog, false, null);
  }

  private void installTools(WinArch arch) throws IOException {
    Path dir = Files.createDirectories(toolRoot.resolve(arch.directoryName()));
    Files.writeString(dir.resolve(HelperToolLayout.TOOL_NAME), "tool");
    Files.writeString(dir.resolve(HelperToolLayout.HOOK_NAME), "hook");
  }
}
