package ca.gc.cra.lumen.api;

import ca.gc.cra.lumen.application.port.SessionListener;
import ca.gc.cra.lumen.application.session.BreakpointBook;
import ca.gc.cra.lumen.application.session.DebugSession;
import ca.gc.cra.lumen.domain.session.SessionError;
import ca.gc.cra.lumen.domain.session.SessionState;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts a session, runs the console (or waits) and maps the outcome to an {@link ExitCode}.
 */
final class SessionRunner {
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(10);

  private SessionRunner() {}

  static ExitCode run(DebugSession session, BreakpointBook breakpoints, boolean console)
      throws IOException, InterruptedException {
    AtomicReference<SessionError> firstError = new AtomicReference<>();
    session.addListener(new SessionListener() {
      @Override
      public void onError(SessionError error) {
        firstError.compareAndSet(null, error);
      }
    });
    ConsoleDebugger debugger = new ConsoleDebugger(session, breakpoints);
    session.addListener(debugger);
    try {
      session.start();
      if (console) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        debugger.run(in);
      } else {
        Runtime.getRuntime().addShutdownHook(new Thread(session::stop, "lumen-shutdown"));
        while (!session.awaitTermination(Duration.ofSeconds(1))) {
          // wait for the debuggee to disconnect
        }
      }
    } finally {
      // releases an attach reservation even when the console fails
      if (session.state() != SessionState.TERMINATED) {
        session.stop();
      }
    }
    session.awaitTermination(SHUTDOWN_WAIT);
    return exitCodeFor(firstError.get());
  }

  static ExitCode exitCodeFor(SessionError error) {
    return ExitCode.forFailure(error == null ? null : error.kind());
  }
}
