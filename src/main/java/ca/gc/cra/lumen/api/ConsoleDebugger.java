package ca.gc.cra.lumen.api;

import ca.gc.cra.lumen.application.port.SessionListener;
import ca.gc.cra.lumen.application.session.BreakpointBook;
import ca.gc.cra.lumen.application.session.DebugSession;
import ca.gc.cra.lumen.domain.breakpoint.LineBreakpoint;
import ca.gc.cra.lumen.domain.frame.EvalResult;
import ca.gc.cra.lumen.domain.frame.StackFrameSnapshot;
import ca.gc.cra.lumen.domain.frame.Variable;
import ca.gc.cra.lumen.domain.session.LogEvent;
import ca.gc.cra.lumen.domain.session.PausedEvent;
import ca.gc.cra.lumen.domain.session.SessionError;
import ca.gc.cra.lumen.domain.session.SessionState;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented console that drives a {@link DebugSession} and prints its events.
 *
 * <p>Commands: {@code c} continue, {@code n} step over, {@code s} step into, {@code o} step out,
 * {@code p} pause, {@code b FILE:LINE [cond]}, {@code d FILE:LINE}, {@code run FILE:LINE},
 * {@code e EXPR}, {@code l} locals, {@code bt} backtrace, {@code q} quit. Lines are 1-based.</p>
 *
 * @since 0.1.0
 */
final class ConsoleDebugger implements SessionListener {
  private static final Logger log = LoggerFactory.getLogger(ConsoleDebugger.class);
  private static final long REPLY_TIMEOUT_SECONDS = 10;
  static final String HELP = "commands: c n s o p | b FILE:LINE [cond] | d FILE:LINE | run FILE:LINE"
      + " | e EXPR | l | bt | q";

  private final DebugSession session;
  private final BreakpointBook breakpoints;

  ConsoleDebugger(DebugSession session, BreakpointBook breakpoints) {
    this.session = Objects.requireNonNull(session, "session");
    this.breakpoints = Objects.requireNonNull(breakpoints, "breakpoints");
  }

  /**
   * Reads commands until {@code q}, end of input or session termination, then stops the session.
   *
   * @param in command source
   * @throws IOException when reading fails
   * @throws InterruptedException when interrupted while waiting for a reply
   */
  void run(BufferedReader in) throws IOException, InterruptedException {
    CliPrinter.println(HELP);
    try {
      String line;
      while (session.state() != SessionState.TERMINATED && (line = in.readLine()) != null) {
        if (!execute(line.trim())) {
          break;
        }
      }
    } finally {
      session.stop();
    }
  }

  /**
   * Executes one command line.
   *
   * @param line trimmed command
   * @return {@code false} when the console should exit
   * @throws InterruptedException when interrupted while waiting for a reply
   */
  boolean execute(String line) throws InterruptedException {
    if (line.isEmpty()) {
      return true;
    }
    int space = line.indexOf(' ');
    String verb = space < 0 ? line : line.substring(0, space);
    String rest = space < 0 ? "" : line.substring(space + 1).trim();
    switch (verb) {
      case "c" -> session.resume();
      case "n" -> session.stepOver();
      case "s" -> session.stepInto();
      case "o" -> session.stepOut();
      case "p" -> session.pause();
      case "b" -> addBreakpoint(rest);
      case "d" -> removeBreakpoint(rest);
      case "run" -> runTo(rest);
      case "e" -> evaluate(rest);
      case "l" -> printLocals();
      case "bt" -> printBacktrace();
      case "q" -> {
        return false;
      }
      default -> CliPrinter.println("unknown command '" + verb + "'; " + HELP);
    }
    return true;
  }

  private void addBreakpoint(String args) {
    String location = args;
    String condition = null;
    int space = args.indexOf(' ');
    if (space > 0) {
      location = args.substring(0, space);
      condition = args.substring(space + 1).trim();
    }
    Optional<Location> parsed = Location.parse(location);
    if (parsed.isEmpty()) {
      CliPrinter.println("usage: b FILE:LINE [condition]");
      return;
    }
    LineBreakpoint breakpoint = new LineBreakpoint(
        parsed.get().file(), parsed.get().line() - 1, condition == null || condition.isEmpty() ? null : condition, null);
    breakpoints.put(breakpoint).ifPresent(session::removeBreakpoint);
    session.addBreakpoint(breakpoint);
    CliPrinter.println("breakpoint " + breakpoint);
  }

  private void removeBreakpoint(String args) {
    Optional<Location> parsed = Location.parse(args);
    if (parsed.isEmpty()) {
      CliPrinter.println("usage: d FILE:LINE");
      return;
    }
    Optional<LineBreakpoint> removed = breakpoints.remove(parsed.get().file(), parsed.get().line() - 1);
    if (removed.isEmpty()) {
      CliPrinter.println("no breakpoint at " + args);
      return;
    }
    session.removeBreakpoint(removed.get());
    CliPrinter.println("removed " + removed.get());
  }

  private void runTo(String args) {
    Optional<Location> parsed = Location.parse(args);
    if (parsed.isEmpty()) {
      CliPrinter.println("usage: run FILE:LINE");
      return;
    }
    session.runToPosition(parsed.get().file(), parsed.get().line() - 1);
  }

  private void evaluate(String expression) throws InterruptedException {
    Optional<StackFrameSnapshot> frame = currentFrame();
    if (frame.isEmpty() || expression.isEmpty()) {
      return;
    }
    EvalResult result = await(session.evaluate(expression, frame.get()));
    if (result == null) {
      return;
    }
    CliPrinter.println(result.success() ? describe(result.value()) : "error: " + result.error());
  }

  private void printLocals() throws InterruptedException {
    Optional<StackFrameSnapshot> frame = currentFrame();
    if (frame.isEmpty()) {
      return;
    }
    List<Variable> locals = await(session.fetchLocals(frame.get()));
    if (locals != null) {
      locals.forEach(variable -> CliPrinter.println("  " + describe(variable)));
    }
  }

  private void printBacktrace() {
    Optional<PausedEvent> pause = session.lastPause();
    if (pause.isEmpty()) {
      CliPrinter.println("not paused");
      return;
    }
    for (StackFrameSnapshot frame : pause.get().frames()) {
      String marker = frame.equals(pause.get().topFrame()) ? "=> " : "   ";
      CliPrinter.println(marker + "#" + frame.index() + " " + frame.label());
    }
  }

  private Optional<StackFrameSnapshot> currentFrame() {
    Optional<StackFrameSnapshot> frame = session.lastPause().map(PausedEvent::topFrame);
    if (frame.isEmpty()) {
      CliPrinter.println("not paused");
    }
    return frame;
  }

  private <T> T await(CompletableFuture<T> future) throws InterruptedException {
    try {
      return future.get(REPLY_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (ExecutionException ex) {
      CliPrinter.println("error: " + ex.getCause().getMessage());
    } catch (TimeoutException ex) {
      future.cancel(false);
      CliPrinter.println("error: no reply within " + REPLY_TIMEOUT_SECONDS + "s");
    }
    return null;
  }

  static String describe(Variable variable) {
    String type = variable.typeName().isEmpty() ? "" : " (" + variable.typeName() + ")";
    String name = variable.name().isEmpty() ? "" : variable.name() + " = ";
    return name + variable.value() + type + (variable.expandable() ? " {...}" : "");
  }

  @Override
  public void onStateChanged(SessionState previous, SessionState current) {
    log.debug("Session {} {} -> {}", session.id(), previous, current);
    if (current == SessionState.READY) {
      CliPrinter.println("connected (" + breakpoints.size() + " breakpoints)");
    }
  }

  @Override
  public void onPaused(PausedEvent event) {
    String where = event.breakpoint().map(bp -> "breakpoint " + bp.filePath() + ":" + bp.line())
        .orElse(Objects.requireNonNullElse(event.reason(), "pause"));
    CliPrinter.println("paused (" + where + ") at " + event.topFrame().label());
  }

  @Override
  public void onResumed() {
    CliPrinter.println("running");
  }

  @Override
  public void onLog(LogEvent event) {
    CliPrinter.println("[" + event.level() + "] " + event.message());
  }

  @Override
  public void onError(SessionError error) {
    CliPrinter.println("error (" + error.kind() + "): " + error.message());
  }

  @Override
  public void onTerminated() {
    CliPrinter.println("session terminated; press Enter to exit");
  }

  /** Parsed {@code FILE:LINE}; the last colon splits so drive letters survive. */
  record Location(String file, int line) {
    static Optional<Location> parse(String text) {
      if (text == null) {
        return Optional.empty();
      }
      String trimmed = text.trim();
      int colon = trimmed.lastIndexOf(':');
      if (colon <= 0 || colon == trimmed.length() - 1) {
        return Optional.empty();
      }
      try {
        int line = Integer.parseInt(trimmed.substring(colon + 1));
        return line < 1 ? Optional.empty() : Optional.of(new Location(trimmed.substring(0, colon), line));
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }
  }
}
