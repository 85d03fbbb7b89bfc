package ca.gc.cra.lumen.application.attach;

import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.application.session.SessionConnector;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.BooleanSupplier;

/**
 * Session connector that attaches to a process through {@link ProcessAttachWorkflow}.
 *
 * @since 0.1.0
 */
public final class AttachConnector implements SessionConnector {
  private final ProcessAttachWorkflow workflow;
  private final AttachRequest request;
  private final ProcessAttachmentRegistry registry;
  private final String sessionId;

  public AttachConnector(
      ProcessAttachWorkflow workflow, AttachRequest request, ProcessAttachmentRegistry registry,
      String sessionId) {
    this.workflow = Objects.requireNonNull(workflow, "workflow");
    this.request = Objects.requireNonNull(request, "request");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
  }

  @Override
  public Transporter connect(TransportListener listener, BooleanSupplier cancelled)
      throws AttachException, InterruptedException {
    Transporter transporter = workflow.attach(request, listener, cancelled);
    registry.markAttached(request.pid(), sessionId);
    return transporter;
  }

  @Override
  public boolean attaches() {
    return true;
  }

  @Override
  public OptionalInt pid() {
    return OptionalInt.of(request.pid());
  }

  @Override
  public void detach() throws InterruptedException {
    workflow.detach(request.pid());
  }
}
