package ca.gc.cra.lumen.config;

import ca.gc.cra.lumen.application.attach.AttachRequest;
import ca.gc.cra.lumen.application.attach.AttachTiming;
import ca.gc.cra.lumen.domain.attach.WinArch;
import ca.gc.cra.lumen.validation.Numbers;
import ca.gc.cra.lumen.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for the {@code attach} command: target process, helper tool location and
 * connect timing.
 * <p><strong>Why:</strong> Keeps the attach workflow free of string parsing; every value is validated once
 * here.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param pid target process id
 * @param processName display name recorded in the attachment registry
 * @param arch requested architecture; the detected one wins
 * @param toolRoot directory holding {@code x86/} and {@code x64/} tool folders
 * @param captureLog pass {@code -capture-log} and start the log receiver
 * @param settleDelay wait after injection before the first connect
 * @param probePort probe the debug port before connecting
 * @param maxConnectAttempts connect rounds before giving up
 * @param retryDelay wait between rounds
 * @param retrySlice cancellation polling granularity while waiting
 * @param connectTimeout per-dial socket timeout
 * @param detachGrace wait after closing before reporting the detach
 * @since 0.1.0
 */
public record AttachConfig(
    int pid,
    String processName,
    WinArch arch,
    Path toolRoot,
    boolean captureLog,
    Duration settleDelay,
    boolean probePort,
    int maxConnectAttempts,
    Duration retryDelay,
    Duration retrySlice,
    Duration connectTimeout,
    Duration detachGrace) {

  /** Default helper tool root, relative to the working directory. */
  public static final String DEFAULT_TOOL_ROOT = "debugger/emmy/windows";

  public AttachConfig {
    Numbers.requireRange("pid", pid, 1, Integer.MAX_VALUE);
    processName = Objects.requireNonNullElse(processName, "");
    arch = Objects.requireNonNullElse(arch, WinArch.X64);
    Objects.requireNonNull(toolRoot, "toolRoot");
    Objects.requireNonNull(settleDelay, "settleDelay");
    Objects.requireNonNull(retryDelay, "retryDelay");
    Objects.requireNonNull(retrySlice, "retrySlice");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(detachGrace, "detachGrace");
    Numbers.requireRange("maxConnectAttempts", maxConnectAttempts, 1, 1_000);
  }

  /**
   * Builds the configuration from a merged flat map.
   *
   * @param map effective configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or malformed
   */
  public static AttachConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    int pid = (int) Numbers.parseInRange("pid", Strings.requireNonBlank("pid", map.getOrDefault("pid", "")),
        0, 1, Integer.MAX_VALUE);
    String archText = Strings.optional("arch", map.get("arch"));
    return new AttachConfig(
        pid,
        Strings.optional("processName", map.get("processName")),
        archText == null ? WinArch.X64 : WinArch.fromString(archText),
        toolRoot(map.get("toolRoot")),
        Strings.parseFlag("captureLog", map.get("captureLog"), false),
        millis(map, "settleDelayMs", 100, 0, 60_000),
        Strings.parseFlag("probePort", map.get("probePort"), false),
        (int) Numbers.parseInRange("maxConnectAttempts", map.get("maxConnectAttempts"), 15, 1, 1_000),
        millis(map, "retryDelayMs", 2_000, 0, 60_000),
        millis(map, "retrySliceMs", 100, 1, 10_000),
        millis(map, "connectTimeoutMs", 1_000, 1, 60_000),
        millis(map, "detachGraceMs", 300, 0, 60_000));
  }

  public AttachRequest toRequest() {
    return new AttachRequest(pid, processName, arch, captureLog, probePort, AttachRequest.LOOPBACK_HOSTS);
  }

  public AttachTiming toTiming() {
    return new AttachTiming(settleDelay, maxConnectAttempts, retryDelay, retrySlice, detachGrace);
  }

  static Path toolRoot(String raw) {
    String value = Strings.optional("toolRoot", raw);
    try {
      return Path.of(value == null ? DEFAULT_TOOL_ROOT : value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("toolRoot is not a valid path: " + raw, ex);
    }
  }

  static Duration millis(Map<String, String> map, String key, long defaultValue, long min, long max) {
    return Duration.ofMillis(Numbers.parseInRange(key, map.get(key), defaultValue, min, max));
  }
}
