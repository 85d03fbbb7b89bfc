package ca.gc.cra.lumen.testutil;

import ca.gc.cra.lumen.application.port.ProcessRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** {@link ProcessRunner} whose results come from a function of the command line. */
public final class FakeProcessRunner implements ProcessRunner {
  private final List<List<String>> runs = new CopyOnWriteArrayList<>();
  private final List<List<String>> launches = new CopyOnWriteArrayList<>();
  private final Function<List<String>, ProcessResult> results;

  public FakeProcessRunner(Function<List<String>, ProcessResult> results) {
    this.results = results;
  }

  /** Every command succeeds with empty output. */
  public static FakeProcessRunner succeeding() {
    return new FakeProcessRunner(command -> new ProcessResult(0, "", ""));
  }

  @Override
  public ProcessResult run(List<String> command, Path workingDirectory) throws IOException {
    runs.add(List.copyOf(command));
    ProcessResult result = results.apply(command);
    if (result == null) {
      throw new IOException("cannot run " + command.get(0));
    }
    return result;
  }

  @Override
  public void launch(List<String> command, Path workingDirectory) {
    launches.add(List.copyOf(command));
  }

  public List<List<String>> runs() {
    return List.copyOf(runs);
  }

  public List<List<String>> launches() {
    return List.copyOf(launches);
  }

  /** Returns the verb (second element) of each run command. */
  public List<String> verbs() {
    return runs.stream().map(c -> c.size() > 1 ? c.get(1) : "").toList();
  }
}
