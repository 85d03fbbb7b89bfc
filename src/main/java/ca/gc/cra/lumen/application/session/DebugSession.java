package ca.gc.cra.lumen.application.session;

import ca.gc.cra.lumen.application.attach.AttachException;
import ca.gc.cra.lumen.application.port.BreakpointSource;
import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.SessionLifecycle;
import ca.gc.cra.lumen.application.port.SessionListener;
import ca.gc.cra.lumen.application.port.SourceLocator;
import ca.gc.cra.lumen.application.port.TransportListener;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.application.protocol.ExpressionNormalizer;
import ca.gc.cra.lumen.application.protocol.ProtocolDialect;
import ca.gc.cra.lumen.domain.breakpoint.BreakpointDescriptor;
import ca.gc.cra.lumen.domain.breakpoint.LineBreakpoint;
import ca.gc.cra.lumen.domain.frame.EvalResult;
import ca.gc.cra.lumen.domain.frame.StackFrameSnapshot;
import ca.gc.cra.lumen.domain.frame.Variable;
import ca.gc.cra.lumen.domain.session.FailureKind;
import ca.gc.cra.lumen.domain.session.PausedEvent;
import ca.gc.cra.lumen.domain.session.SessionError;
import ca.gc.cra.lumen.domain.session.SessionState;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import ca.gc.cra.lumen.infrastructure.exec.ExecutorFactories;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives one debugging session from connect through handshake, run control and
 * inspection to a single, idempotent stop.
 * <p><strong>Why:</strong> Receive loops, attach workers and IDE calls all feed one serial driver, so state
 * transitions never race and stop runs exactly once regardless of who triggers it.</p>
 * <p><strong>Thread-safety:</strong> Public methods may be called from any thread. Mutations run on the
 * session's {@code lumen-session-*} driver; blocking connects and detach cleanup run on the shared worker
 * pool. Listener callbacks arrive on the driver thread.</p>
 * <p><strong>Observability:</strong> Driver tasks carry MDC keys {@code session} and, when attaching,
 * {@code pid}.</p>
 *
 * @since 0.1.0
 */
public final class DebugSession implements SessionLifecycle, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DebugSession.class);
  private static final Map<SessionState, Set<SessionState>> TRANSITIONS = transitions();

  private final String id;
  private final ProtocolDialect dialect;
  private final SessionConnector connector;
  private final BreakpointSource breakpointSource;
  private final SourceLocator sourceLocator;
  private final Executor workers;
  private final MetricsPort metrics;
  private final ExecutorService driver;
  private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
  private final Object lifecycleLock = new Object();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopping = new AtomicBoolean();
  private final AtomicBoolean errorReported = new AtomicBoolean();
  private final CountDownLatch terminatedLatch = new CountDownLatch(1);

  private volatile SessionState state = SessionState.CREATED;
  private volatile Transporter transporter;
  private volatile PausedEvent lastPause;
  private boolean terminated;

  // driver-thread confined
  private BreakpointSynchronizer synchronizer;
  private LineBreakpoint runToTarget;
  private final List<WireMessage> earlyInbound = new ArrayList<>();

  /**
   * Creates a session; nothing happens until {@link #start()}.
   *
   * @param id session id used in logs and the attachment registry
   * @param dialect payload dialect of the debuggee
   * @param connector produces the connected transporter
   * @param breakpointSource IDE breakpoints re-announced on every handshake
   * @param sourceLocator decides which reported files resolve locally
   * @param workers pool for blocking connects and detach cleanup
   * @param metrics metrics sink
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Worker pool and breakpoint source are shared collaborators owned by the composition root.")
  public DebugSession(
      String id,
      ProtocolDialect dialect,
      SessionConnector connector,
      BreakpointSource breakpointSource,
      SourceLocator sourceLocator,
      Executor workers,
      MetricsPort metrics) {
    this.id = Objects.requireNonNull(id, "id");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.breakpointSource = Objects.requireNonNullElse(breakpointSource, BreakpointSource.EMPTY);
    this.sourceLocator = Objects.requireNonNullElse(sourceLocator, SourceLocator.NONE);
    this.workers = Objects.requireNonNull(workers, "workers");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.driver = ExecutorFactories.newSerialExecutor("lumen-session-" + id, ExecutorFactories.LOGGING_HANDLER);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public SessionState state() {
    return state;
  }

  @Override
  public void addListener(SessionListener listener) {
    Objects.requireNonNull(listener, "listener");
    boolean alreadyTerminated;
    synchronized (lifecycleLock) {
      alreadyTerminated = terminated;
      if (!alreadyTerminated) {
        listeners.add(listener);
      }
    }
    if (alreadyTerminated) {
      safely(listener, SessionListener::onTerminated);
    }
  }

  public void removeListener(SessionListener listener) {
    listeners.remove(listener);
  }

  /**
   * Starts connecting in the background.
   *
   * @throws IllegalStateException when already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Session " + id + " already started");
    }
    post(() -> transition(SessionState.INITIALIZING));
    try {
      workers.execute(this::connectPhase);
    } catch (RejectedExecutionException ex) {
      post(() -> fail(FailureKind.INTERNAL, "Worker pool rejected session start", ex));
    }
  }

  /** Resumes execution. */
  public void resume() {
    post(() -> runControl(WireCommand.CONTINUE));
  }

  public void stepOver() {
    post(() -> runControl(WireCommand.STEP_OVER));
  }

  public void stepInto() {
    post(() -> runControl(WireCommand.STEP_IN));
  }

  public void stepOut() {
    post(() -> runControl(WireCommand.STEP_OUT));
  }

  /** Asks the debuggee to pause at the next executed line. */
  public void pause() {
    post(() -> runControl(WireCommand.BREAK));
  }

  /**
   * Runs until the given location using a temporary breakpoint that is withdrawn at the next pause.
   *
   * @param filePath file path as the debuggee knows it
   * @param zeroBasedLine 0-based line
   */
  public void runToPosition(String filePath, int zeroBasedLine) {
    LineBreakpoint target = LineBreakpoint.at(filePath, zeroBasedLine);
    post(() -> {
      if (!state.isInteractive() || synchronizer == null) {
        log.warn("Ignoring run-to-position in state {}", state);
        return;
      }
      if (runToTarget != null) {
        synchronizer.unregister(runToTarget);
      }
      runToTarget = target;
      synchronizer.register(target);
      if (state == SessionState.PAUSED) {
        runControl(WireCommand.CONTINUE);
      }
    });
  }

  /**
   * Announces a breakpoint added in the IDE. Before the handshake the next resync picks it up from the
   * breakpoint source instead.
   *
   * @param breakpoint breakpoint
   */
  public void addBreakpoint(LineBreakpoint breakpoint) {
    Objects.requireNonNull(breakpoint, "breakpoint");
    post(() -> {
      if (synchronizer != null && state.isInteractive()) {
        synchronizer.register(breakpoint);
      }
    });
  }

  public void removeBreakpoint(LineBreakpoint breakpoint) {
    Objects.requireNonNull(breakpoint, "breakpoint");
    post(() -> {
      if (synchronizer != null && state.isInteractive()) {
        synchronizer.unregister(breakpoint);
      }
    });
  }

  /**
   * Evaluates an expression in the context of a frame.
   *
   * @param expression expression; method references are normalized
   * @param frame frame to evaluate in
   * @return future that always completes normally; failures are carried by the result
   */
  public CompletableFuture<EvalResult> evaluate(String expression, StackFrameSnapshot frame) {
    Objects.requireNonNull(frame, "frame");
    WireMessage request = dialect.evalRequest(ExpressionNormalizer.normalize(expression), frame);
    return request(request)
        .thenApply(dialect::parseEvalResult)
        .exceptionally(ex -> EvalResult.failed(rootMessage(ex)));
  }

  /**
   * Loads the locals of a frame, fetching them when the break notification did not carry them.
   *
   * @param frame frame
   * @return locals
   */
  public CompletableFuture<List<Variable>> fetchLocals(StackFrameSnapshot frame) {
    Objects.requireNonNull(frame, "frame");
    Optional<WireMessage> request = dialect.localsRequest(frame);
    if (request.isEmpty()) {
      return CompletableFuture.completedFuture(frame.locals());
    }
    return request(request.get()).thenApply(dialect::parseChildren);
  }

  /**
   * Loads the children of an expandable value.
   *
   * @param variable parent value
   * @param frame frame the value belongs to
   * @return children; inline children are returned without a round trip
   */
  public CompletableFuture<List<Variable>> fetchChildren(Variable variable, StackFrameSnapshot frame) {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(frame, "frame");
    if (variable.childRef() == null) {
      return CompletableFuture.completedFuture(variable.children());
    }
    return request(dialect.childrenRequest(variable, frame)).thenApply(dialect::parseChildren);
  }

  /**
   * Latest pause, cleared on resume.
   *
   * @return pause details
   */
  public Optional<PausedEvent> lastPause() {
    return Optional.ofNullable(lastPause);
  }

  /**
   * Stops the session. Safe to call any number of times from any thread; only the first call has effect.
   */
  public void stop() {
    if (!stopping.compareAndSet(false, true)) {
      return;
    }
    log.info("Stopping session {}", id);
    connector.abort();
    if (!post(this::doStop)) {
      log.warn("Session {} driver unavailable during stop", id);
    }
  }

  public boolean isStopping() {
    return stopping.get();
  }

  /**
   * Waits until the session has terminated.
   *
   * @param timeout maximum wait
   * @return {@code true} when terminated
   * @throws InterruptedException when interrupted
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminatedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public void close() {
    stop();
  }

  private void connectPhase() {
    withContext(() -> {
      post(() -> transition(SessionState.CONNECTING));
      if (connector.attaches()) {
        post(() -> transition(SessionState.ATTACHING));
      }
      try {
        Transporter connected = connector.connect(new InboundListener(), stopping::get);
        if (!post(() -> onConnected(connected))) {
          connected.close();
        }
      } catch (AttachException ex) {
        post(() -> fail(ex.kind(), ex.getMessage(), ex));
      } catch (IOException ex) {
        post(() -> fail(FailureKind.CONNECT_FAILED, "Connection failed: " + ex.getMessage(), ex));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        post(() -> fail(FailureKind.CANCELLED, "Interrupted while connecting", ex));
      } catch (RuntimeException ex) {
        post(() -> fail(FailureKind.INTERNAL, "Unexpected connect failure: " + ex.getMessage(), ex));
      }
    });
  }

  private void onConnected(Transporter connected) {
    if (stopping.get()) {
      connected.close();
      return;
    }
    transporter = connected;
    log.info("Session {} connected via {}", id, connected.describe());
    if (!transition(SessionState.HANDSHAKING)) {
      return;
    }
    synchronizer = new BreakpointSynchronizer(dialect, connected::send, breakpointSource, metrics);
    try {
      if (dialect.handshakeMode() == ProtocolDialect.HandshakeMode.SYNCHRONOUS) {
        connected.send(dialect.initMessage());
        completeHandshake();
      } else {
        connected.request(dialect.initMessage())
            .whenComplete((reply, error) -> post(() -> onInitReply(reply, error)));
      }
    } catch (IOException ex) {
      fail(FailureKind.CONNECT_FAILED, "Handshake failed: " + ex.getMessage(), ex);
    }
  }

  private void onInitReply(WireMessage reply, Throwable error) {
    if (stopping.get()) {
      return;
    }
    if (error != null) {
      fail(FailureKind.CONNECT_FAILED, "Handshake failed: " + rootMessage(error), error);
      return;
    }
    log.info("Debuggee initialized: {}", dialect.describeInitReply(reply));
    try {
      completeHandshake();
    } catch (IOException ex) {
      fail(FailureKind.CONNECT_FAILED, "Handshake failed: " + ex.getMessage(), ex);
    }
  }

  private void completeHandshake() throws IOException {
    int registered = synchronizer.resync();
    Optional<WireMessage> ready = dialect.readyMessage();
    if (ready.isPresent()) {
      transporter.send(ready.get());
    }
    if (!transition(SessionState.READY)) {
      return;
    }
    log.info("Session {} ready ({} breakpoints)", id, registered);
    List<WireMessage> buffered = new ArrayList<>(earlyInbound);
    earlyInbound.clear();
    buffered.forEach(this::handleInbound);
  }

  private void onInbound(WireMessage message) {
    if (state.isStoppingOrTerminated()) {
      log.debug("Ignoring {} while {}", message.displayName(), state);
      return;
    }
    if (!state.isInteractive()) {
      earlyInbound.add(message);
      return;
    }
    handleInbound(message);
  }

  private void handleInbound(WireMessage message) {
    switch (message.command()) {
      case BREAK_NOTIFY -> onBreak(message);
      case LOG -> notifyListeners(l -> l.onLog(dialect.parseLog(message)));
      case STOP -> {
        log.info("Debuggee requested stop");
        stop();
      }
      case ATTACHED -> log.info("Debug hook attached: {}", message.payload());
      default -> log.debug("Unhandled {}", message.displayName());
    }
  }

  private void onBreak(WireMessage message) {
    List<StackFrameSnapshot> frames = dialect.parseFrames(message);
    if (frames.isEmpty()) {
      log.warn("Break notification without stack frames");
      return;
    }
    if (runToTarget != null) {
      synchronizer.unregister(runToTarget);
      runToTarget = null;
    }
    StackFrameSnapshot top = TopFrameSelector.select(frames, sourceLocator).orElse(frames.get(0));
    BreakpointDescriptor hit = synchronizer.findByLocation(top.file(), top.line()).orElse(null);
    PausedEvent event = new PausedEvent(frames, top, hit, dialect.stopReason(message));
    if (!transition(SessionState.PAUSED)) {
      return;
    }
    lastPause = event;
    log.info("Paused at {} ({} frames)", top.label(), frames.size());
    notifyListeners(l -> l.onPaused(event));
  }

  private void runControl(WireCommand command) {
    SessionState current = state;
    Transporter connected = transporter;
    if (!current.isInteractive() || connected == null) {
      log.warn("Ignoring {} in state {}", command, current);
      return;
    }
    try {
      connected.send(dialect.runControl(command));
    } catch (IOException ex) {
      log.warn("Failed to send {}: {}", command, ex.getMessage());
      return;
    }
    if (command == WireCommand.BREAK || current == SessionState.RUNNING) {
      return;
    }
    if (transition(SessionState.RUNNING) && current == SessionState.PAUSED) {
      lastPause = null;
      notifyListeners(SessionListener::onResumed);
    }
  }

  private void onPeerDisconnected(Throwable cause) {
    if (stopping.get()) {
      return;
    }
    if (cause != null) {
      reportError(new SessionError(FailureKind.PEER_DISCONNECTED,
          "Connection to debuggee lost: " + cause.getMessage(), cause));
    } else {
      log.info("Debuggee closed the connection");
    }
    stop();
  }

  private void fail(FailureKind kind, String message, Throwable cause) {
    if (stopping.get()) {
      log.debug("Ignoring {} after stop was requested: {}", kind, message);
      return;
    }
    log.error("Session {} failed ({}): {}", id, kind, message);
    reportError(new SessionError(kind, message, cause));
    stop();
  }

  private void reportError(SessionError error) {
    if (errorReported.compareAndSet(false, true)) {
      notifyListeners(l -> l.onError(error));
    }
  }

  private void doStop() {
    transition(SessionState.STOPPING);
    Transporter connected = transporter;
    if (connected != null && connected.isConnected()) {
      sendStop(connected);
    }
    if (connected != null) {
      connected.close();
    }
    if (connector.attaches()) {
      try {
        workers.execute(() -> withContext(this::detach));
      } catch (RejectedExecutionException ex) {
        log.warn("Detach skipped; worker pool unavailable");
      }
    }
    transition(SessionState.TERMINATED);
    synchronized (lifecycleLock) {
      terminated = true;
    }
    notifyListeners(SessionListener::onTerminated);
    listeners.clear();
    terminatedLatch.countDown();
    log.info("Session {} terminated", id);
    driver.shutdown();
  }

  private void sendStop(Transporter connected) {
    ProtocolDialect.StopPlan plan = dialect.stopPlan();
    try {
      if (!plan.awaitReply()) {
        connected.send(plan.message());
        return;
      }
      connected.request(plan.message()).get(plan.timeout().toMillis(), TimeUnit.MILLISECONDS);
      log.info("Debuggee confirmed stop");
    } catch (TimeoutException ex) {
      log.info("No stop confirmation within {} ms; closing", plan.timeout().toMillis());
    } catch (ExecutionException ex) {
      log.debug("Stop confirmation failed: {}", rootMessage(ex));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Interrupted while awaiting stop confirmation");
    } catch (IOException ex) {
      log.debug("Stop message not delivered: {}", ex.getMessage());
    }
  }

  private void detach() {
    try {
      connector.detach();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Detach interrupted");
    } catch (RuntimeException ex) {
      log.warn("Detach failed: {}", ex.getMessage(), ex);
    }
  }

  private CompletableFuture<WireMessage> request(WireMessage message) {
    Transporter connected = transporter;
    if (connected == null || !state.isInteractive()) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Session " + id + " is not connected (state " + state + ")"));
    }
    try {
      return connected.request(message);
    } catch (IOException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }

  private boolean transition(SessionState next) {
    SessionState previous = state;
    if (previous == next) {
      return true;
    }
    if (!TRANSITIONS.get(previous).contains(next)) {
      log.warn("Illegal session transition {} -> {}", previous, next);
      return false;
    }
    state = next;
    log.debug("Session {} {} -> {}", id, previous, next);
    notifyListeners(l -> l.onStateChanged(previous, next));
    return true;
  }

  private void notifyListeners(Consumer<SessionListener> event) {
    for (SessionListener listener : listeners) {
      safely(listener, event);
    }
  }

  private void safely(SessionListener listener, Consumer<SessionListener> event) {
    try {
      event.accept(listener);
    } catch (RuntimeException ex) {
      log.warn("Session listener {} failed", listener, ex);
    }
  }

  private boolean post(Runnable task) {
    try {
      driver.execute(() -> withContext(task));
      return true;
    } catch (RejectedExecutionException ex) {
      log.debug("Session {} driver already shut down; dropping task", id);
      return false;
    }
  }

  private void withContext(Runnable task) {
    MDC.put("session", id);
    OptionalInt pid = connector.pid();
    if (pid.isPresent()) {
      MDC.put("pid", Integer.toString(pid.getAsInt()));
    }
    try {
      task.run();
    } finally {
      MDC.remove("session");
      MDC.remove("pid");
    }
  }

  private static String rootMessage(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
  }

  private static Map<SessionState, Set<SessionState>> transitions() {
    Map<SessionState, Set<SessionState>> map = new EnumMap<>(SessionState.class);
    map.put(SessionState.CREATED, EnumSet.of(SessionState.INITIALIZING, SessionState.STOPPING));
    map.put(SessionState.INITIALIZING, EnumSet.of(SessionState.CONNECTING, SessionState.STOPPING));
    map.put(SessionState.CONNECTING,
        EnumSet.of(SessionState.ATTACHING, SessionState.HANDSHAKING, SessionState.STOPPING));
    map.put(SessionState.ATTACHING, EnumSet.of(SessionState.HANDSHAKING, SessionState.STOPPING));
    map.put(SessionState.HANDSHAKING, EnumSet.of(SessionState.READY, SessionState.STOPPING));
    map.put(SessionState.READY,
        EnumSet.of(SessionState.RUNNING, SessionState.PAUSED, SessionState.STOPPING));
    map.put(SessionState.RUNNING, EnumSet.of(SessionState.PAUSED, SessionState.STOPPING));
    map.put(SessionState.PAUSED, EnumSet.of(SessionState.RUNNING, SessionState.STOPPING));
    map.put(SessionState.STOPPING, EnumSet.of(SessionState.TERMINATED));
    map.put(SessionState.TERMINATED, EnumSet.noneOf(SessionState.class));
    return map;
  }

  private final class InboundListener implements TransportListener {
    @Override
    public void onMessage(WireMessage message) {
      post(() -> onInbound(message));
    }

    @Override
    public void onDisconnect(Throwable cause) {
      post(() -> onPeerDisconnected(cause));
    }
  }
}
