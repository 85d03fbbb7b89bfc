package ca.gc.cra.lumen.infrastructure.process;

import ca.gc.cra.lumen.application.port.ProcessRunner;
import ca.gc.cra.lumen.infrastructure.exec.ExecutorFactories;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProcessRunner} backed by {@link ProcessBuilder}.
 * <p><strong>Why:</strong> The helper tool writes to both streams; each is drained on its own
 * {@code lumen-proc-*} thread so neither pipe can fill and block the child.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the charset; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class SystemProcessRunner implements ProcessRunner {
  private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);
  private static final long STDOUT_JOIN_MILLIS = 3_000L;
  private static final long STDERR_JOIN_MILLIS = 2_000L;

  private final Charset charset;

  /** Runner decoding output with the platform's native encoding. */
  public SystemProcessRunner() {
    this(nativeCharset());
  }

  /**
   * Runner decoding output with the supplied charset.
   *
   * @param charset output charset
   */
  public SystemProcessRunner(Charset charset) {
    this.charset = Objects.requireNonNull(charset, "charset");
  }

  @Override
  public ProcessResult run(List<String> command, Path workingDirectory) throws IOException, InterruptedException {
    Process process = builder(command, workingDirectory).start();
    process.getOutputStream().close();
    StreamCollector stdout = StreamCollector.start(process.getInputStream());
    StreamCollector stderr = StreamCollector.start(process.getErrorStream());
    int exitCode = process.waitFor();
    String out = stdout.await(STDOUT_JOIN_MILLIS, charset);
    String err = stderr.await(STDERR_JOIN_MILLIS, charset);
    log.debug("{} exited with {}", command.get(0), exitCode);
    return new ProcessResult(exitCode, out, err);
  }

  @Override
  public void launch(List<String> command, Path workingDirectory) throws IOException {
    Process process = builder(command, workingDirectory)
        .redirectOutput(ProcessBuilder.Redirect.INHERIT)
        .redirectError(ProcessBuilder.Redirect.INHERIT)
        .start();
    log.debug("Launched {} as pid {}", command.get(0), process.pid());
  }

  public Charset charset() {
    return charset;
  }

  private static ProcessBuilder builder(List<String> command, Path workingDirectory) {
    Objects.requireNonNull(command, "command");
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDirectory != null) {
      builder.directory(workingDirectory.toFile());
    }
    return builder;
  }

  /**
   * Native encoding of the host; on Chinese Windows this is GBK, which the helper tool writes.
   *
   * @return native charset, or the default charset when the property is unknown
   */
  static Charset nativeCharset() {
    String name = System.getProperty("native.encoding");
    if (name != null && Charset.isSupported(name)) {
      return Charset.forName(name);
    }
    return Charset.defaultCharset();
  }

  private static final class StreamCollector {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final AtomicReference<IOException> failure = new AtomicReference<>();
    private Thread thread;

    static StreamCollector start(InputStream in) {
      StreamCollector collector = new StreamCollector();
      collector.thread = ExecutorFactories.startDaemon("lumen-proc", () -> collector.drain(in));
      return collector;
    }

    private void drain(InputStream in) {
      try (InputStream stream = in) {
        byte[] chunk = new byte[4096];
        int read;
        while ((read = stream.read(chunk)) != -1) {
          synchronized (buffer) {
            buffer.write(chunk, 0, read);
          }
        }
      } catch (IOException ex) {
        failure.set(ex);
      }
    }

    String await(long millis, Charset charset) throws IOException, InterruptedException {
      thread.join(millis);
      if (thread.isAlive()) {
        log.debug("Output reader {} still running after {} ms; using partial output", thread.getName(), millis);
      }
      IOException ex = failure.get();
      if (ex != null) {
        throw new IOException("Failed reading process output", ex);
      }
      synchronized (buffer) {
        return buffer.toString(charset);
      }
    }
  }
}
