package ca.gc.cra.lumen.domain.attach;

import java.util.Objects;

/**
 * Process reported by the helper tool's {@code list_processes} command.
 *
 * @param pid process id
 * @param name executable file name derived from {@code path}
 * @param title main window title, possibly empty
 * @param path full executable path, possibly empty
 * @since 0.1.0
 */
public record ProcessInfo(int pid, String name, String title, String path) {

  public ProcessInfo {
    if (pid <= 0) {
      throw new IllegalArgumentException("pid must be positive (was " + pid + ")");
    }
    name = Objects.requireNonNullElse(name, "");
    title = Objects.requireNonNullElse(title, "");
    path = Objects.requireNonNullElse(path, "");
  }

  /**
   * Builds a record deriving the name from the last path segment.
   *
   * @param pid process id
   * @param title window title
   * @param path executable path
   * @return process info
   */
  public static ProcessInfo fromPath(int pid, String title, String path) {
    String safePath = Objects.requireNonNullElse(path, "").trim();
    int slash = Math.max(safePath.lastIndexOf('\\'), safePath.lastIndexOf('/'));
    String name = slash >= 0 ? safePath.substring(slash + 1) : safePath;
    return new ProcessInfo(pid, name, title == null ? "" : title.trim(), safePath);
  }

  public String displayName() {
    return title.isBlank() ? name : name + " - " + title;
  }
}
