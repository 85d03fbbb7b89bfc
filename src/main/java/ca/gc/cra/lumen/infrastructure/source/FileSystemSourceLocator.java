package ca.gc.cra.lumen.infrastructure.source;

import ca.gc.cra.lumen.application.port.SourceLocator;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Resolves debuggee-reported chunk names against workspace roots, trying each configured extension when the
 * name has none of them.
 *
 * @since 0.1.0
 */
public final class FileSystemSourceLocator implements SourceLocator {
  private final List<Path> roots;
  private final List<String> extensions;

  /**
   * @param roots workspace roots, searched in order
   * @param extensions file extensions such as {@code .lua}
   */
  public FileSystemSourceLocator(List<Path> roots, List<String> extensions) {
    this.roots = List.copyOf(Objects.requireNonNull(roots, "roots"));
    this.extensions = List.copyOf(Objects.requireNonNull(extensions, "extensions"));
  }

  @Override
  public boolean canResolve(String reportedFile) {
    if (reportedFile == null || reportedFile.isBlank()) {
      return false;
    }
    String name = strip(reportedFile.trim());
    try {
      Path direct = Path.of(name);
      if (direct.isAbsolute()) {
        return exists(direct);
      }
      for (Path root : roots) {
        if (exists(root.resolve(name))) {
          return true;
        }
      }
    } catch (InvalidPathException ex) {
      return false;
    }
    return false;
  }

  private boolean exists(Path candidate) {
    if (Files.isRegularFile(candidate)) {
      return true;
    }
    String fileName = candidate.getFileName() == null ? "" : candidate.getFileName().toString();
    for (String extension : extensions) {
      if (!fileName.endsWith(extension) && Files.isRegularFile(candidate.resolveSibling(fileName + extension))) {
        return true;
      }
    }
    return false;
  }

  private static String strip(String reported) {
    return reported.startsWith("@") ? reported.substring(1) : reported;
  }
}
