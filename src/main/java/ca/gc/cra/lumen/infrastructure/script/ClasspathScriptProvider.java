package ca.gc.cra.lumen.infrastructure.script;

import ca.gc.cra.lumen.application.port.ScriptProvider;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads helper scripts bundled in the jar.
 *
 * @since 0.1.0
 */
public final class ClasspathScriptProvider implements ScriptProvider {
  private final ClassLoader loader;

  public ClasspathScriptProvider() {
    this(ClasspathScriptProvider.class.getClassLoader());
  }

  public ClasspathScriptProvider(ClassLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  @Override
  public Optional<String> load(String logicalPath) {
    Objects.requireNonNull(logicalPath, "logicalPath");
    String resource = logicalPath.startsWith("/") ? logicalPath.substring(1) : logicalPath;
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        return Optional.empty();
      }
      return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read bundled script " + resource, ex);
    }
  }
}
