package ca.gc.cra.lumen.domain.attach;

import java.util.Locale;

/**
 * Target process architecture; names the helper tool sub-directory.
 *
 * @since 0.1.0
 */
public enum WinArch {
  X86("x86"),
  X64("x64");

  private final String directoryName;

  WinArch(String directoryName) {
    this.directoryName = directoryName;
  }

  public String directoryName() {
    return directoryName;
  }

  public static WinArch fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("arch must not be blank");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "x86", "win32", "32" -> X86;
      case "x64", "amd64", "64" -> X64;
      default -> throw new IllegalArgumentException("arch must be x86 or x64 (was " + raw + ")");
    };
  }
}
