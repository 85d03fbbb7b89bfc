package ca.gc.cra.lumen.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each LUMEN CLI command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForCommand {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForCommand() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command CLI command (attach, panda, processes)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "attach" -> buildAttachDefaults();
      case "panda" -> buildPandaDefaults();
      case "processes" -> buildProcessesDefaults();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    map.put("sourceRoots", ".");
    map.put("workers", "4");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAttachDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("arch", "x64");
    map.put("toolRoot", AttachConfig.DEFAULT_TOOL_ROOT);
    map.put("captureLog", "false");
    map.put("probePort", "false");
    map.put("settleDelayMs", "100");
    map.put("maxConnectAttempts", "15");
    map.put("retryDelayMs", "2000");
    map.put("retrySliceMs", "100");
    map.put("connectTimeoutMs", "1000");
    map.put("detachGraceMs", "300");
    map.put("helper.mode", "inline");
    map.put("helper.customRegistry", "");
    map.put("helper.extensions", String.join(",", EmmyHelperConfig.DEFAULT_EXTENSIONS));
    return map;
  }

  private static Map<String, String> buildPandaDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("transport", "server");
    map.put("host", PandaConfig.DEFAULT_HOST);
    map.put("port", Integer.toString(PandaConfig.DEFAULT_PORT));
    map.put("connectTimeoutMs", "3000");
    map.put("stopOnEntry", "false");
    map.put("useCHook", "true");
    map.put("logLevel", "1");
    map.put("luaFileExtension", "lua");
    map.put("cwd", "");
    map.put("tempFilePath", "");
    map.put("pathCaseSensitivity", "true");
    map.put("autoPathMode", "false");
    map.put("distinguishSameNameFile", "false");
    map.put("truncatedOPath", "");
    map.put("developmentMode", "false");
    map.put("stopConfirmTimeoutMs", "3000");
    return map;
  }

  private static Map<String, String> buildProcessesDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("toolRoot", AttachConfig.DEFAULT_TOOL_ROOT);
    map.put("filter", "");
    return map;
  }
}
