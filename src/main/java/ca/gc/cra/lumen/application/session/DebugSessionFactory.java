package ca.gc.cra.lumen.application.session;

import ca.gc.cra.lumen.application.attach.AttachConnector;
import ca.gc.cra.lumen.application.attach.AttachException;
import ca.gc.cra.lumen.application.attach.AttachRequest;
import ca.gc.cra.lumen.application.attach.ProcessAttachWorkflow;
import ca.gc.cra.lumen.application.attach.ProcessAttachmentRegistry;
import ca.gc.cra.lumen.application.port.BreakpointSource;
import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.SourceLocator;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.application.protocol.ProtocolDialect;
import ca.gc.cra.lumen.domain.attach.AttachmentRecord;
import ca.gc.cra.lumen.domain.session.FailureKind;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds unstarted {@link DebugSession}s wired to a connector.
 *
 * @since 0.1.0
 */
public final class DebugSessionFactory {
  private final Executor workers;
  private final BreakpointSource breakpointSource;
  private final SourceLocator sourceLocator;
  private final MetricsPort metrics;
  private final AtomicInteger sequence = new AtomicInteger();

  public DebugSessionFactory(
      Executor workers, BreakpointSource breakpointSource, SourceLocator sourceLocator, MetricsPort metrics) {
    this.workers = Objects.requireNonNull(workers, "workers");
    this.breakpointSource = Objects.requireNonNullElse(breakpointSource, BreakpointSource.EMPTY);
    this.sourceLocator = Objects.requireNonNullElse(sourceLocator, SourceLocator.NONE);
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Session over a transporter that dials or accepts directly.
   *
   * @param dialect debuggee dialect
   * @param transporter unconnected transporter
   * @return unstarted session
   */
  public DebugSession direct(ProtocolDialect dialect, Transporter transporter) {
    return new DebugSession(nextId(), dialect, new DirectConnector(transporter),
        breakpointSource, sourceLocator, workers, metrics);
  }

  /**
   * Session that attaches to a running process. The pid is reserved before anything is spawned.
   *
   * <p>The reservation is released only when the session terminates, so the caller owns the returned
   * session and must {@link DebugSession#close() close} it, started or not.</p>
   *
   * @param dialect Emmy dialect
   * @param workflow attach workflow
   * @param registry process-wide attachment registry
   * @param request attach parameters
   * @return unstarted session owning the reservation
   * @throws AttachException {@link FailureKind#DOUBLE_ATTACH} when another session holds the pid
   */
  public DebugSession attach(
      ProtocolDialect dialect,
      ProcessAttachWorkflow workflow,
      ProcessAttachmentRegistry registry,
      AttachRequest request) throws AttachException {
    String id = nextId();
    DebugSession session = new DebugSession(id, dialect,
        new AttachConnector(workflow, request, registry, id),
        breakpointSource, sourceLocator, workers, metrics);
    Optional<AttachmentRecord> existing = registry.attemptAttach(request.pid(), request.processName(), session);
    if (existing.isPresent()) {
      AttachmentRecord record = existing.get();
      throw new AttachException(FailureKind.DOUBLE_ATTACH,
          "Process " + record.pid() + " (" + record.processName() + ") is already attached since "
              + record.attachTimestamp() + " by session " + record.sessionId());
    }
    return session;
  }

  private String nextId() {
    return "s" + sequence.incrementAndGet();
  }
}
