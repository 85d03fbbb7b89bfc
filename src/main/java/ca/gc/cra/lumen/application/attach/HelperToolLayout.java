package ca.gc.cra.lumen.application.attach;

import ca.gc.cra.lumen.domain.attach.WinArch;
import ca.gc.cra.lumen.domain.session.FailureKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates {@code emmy_tool.exe} and {@code emmy_hook.dll} under {@code <root>/x86} and {@code <root>/x64}.
 *
 * @since 0.1.0
 */
public final class HelperToolLayout {
  public static final String TOOL_NAME = "emmy_tool.exe";
  public static final String HOOK_NAME = "emmy_hook.dll";

  private final Path root;

  public HelperToolLayout(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  public Path toolDirectory(WinArch arch) {
    return root.resolve(arch.directoryName());
  }

  public Path tool(WinArch arch) {
    return toolDirectory(arch).resolve(TOOL_NAME);
  }

  public Path hook(WinArch arch) {
    return toolDirectory(arch).resolve(HOOK_NAME);
  }

  /**
   * Confirms at least one architecture ships the tool and at least one ships the hook.
   *
   * @throws AttachException {@link FailureKind#TOOL_MISSING} otherwise
   */
  public void validate() throws AttachException {
    if (!Files.isRegularFile(tool(WinArch.X86)) && !Files.isRegularFile(tool(WinArch.X64))) {
      throw new AttachException(FailureKind.TOOL_MISSING,
          TOOL_NAME + " not found under " + root + " (expected x86/ or x64/)");
    }
    if (!Files.isRegularFile(hook(WinArch.X86)) && !Files.isRegularFile(hook(WinArch.X64))) {
      throw new AttachException(FailureKind.TOOL_MISSING,
          HOOK_NAME + " not found under " + root + " (expected x86/ or x64/)");
    }
  }

  /**
   * Confirms both files exist for one architecture.
   *
   * @param arch architecture
   * @throws AttachException {@link FailureKind#TOOL_MISSING} when either is absent
   */
  public void requireArch(WinArch arch) throws AttachException {
    if (!Files.isRegularFile(tool(arch))) {
      throw new AttachException(FailureKind.TOOL_MISSING,
          "No " + arch.directoryName() + " debugger tool at " + tool(arch));
    }
    if (!Files.isRegularFile(hook(arch))) {
      throw new AttachException(FailureKind.TOOL_MISSING,
          "No " + arch.directoryName() + " debugger hook at " + hook(arch));
    }
  }

  /**
   * Any available tool, preferring 64-bit; used for architecture queries and process listing.
   *
   * @return tool path
   */
  public Optional<Path> anyTool() {
    if (Files.isRegularFile(tool(WinArch.X64))) {
      return Optional.of(tool(WinArch.X64));
    }
    if (Files.isRegularFile(tool(WinArch.X86))) {
      return Optional.of(tool(WinArch.X86));
    }
    return Optional.empty();
  }
}
