package ca.gc.cra.lumen.infrastructure.script;

import ca.gc.cra.lumen.application.port.ScriptProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads user-supplied scripts from the file system, resolving relative paths against a base directory.
 *
 * @since 0.1.0
 */
public final class FileScriptProvider implements ScriptProvider {
  private static final Logger log = LoggerFactory.getLogger(FileScriptProvider.class);

  private final Path baseDirectory;

  public FileScriptProvider(Path baseDirectory) {
    this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory");
  }

  @Override
  public Optional<String> load(String logicalPath) {
    if (logicalPath == null || logicalPath.isBlank()) {
      return Optional.empty();
    }
    Path path = baseDirectory.resolve(logicalPath.trim()).normalize();
    if (!Files.isRegularFile(path)) {
      log.warn("Script {} not found", path);
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException ex) {
      log.warn("Failed to read script {}: {}", path, ex.getMessage());
      return Optional.empty();
    }
  }
}
