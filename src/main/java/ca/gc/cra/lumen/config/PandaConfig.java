package ca.gc.cra.lumen.config;

import ca.gc.cra.lumen.application.protocol.PandaDialect;
import ca.gc.cra.lumen.validation.Net;
import ca.gc.cra.lumen.validation.Numbers;
import ca.gc.cra.lumen.validation.Strings;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for the {@code panda} command: socket role, endpoint and the values
 * announced to the debuggee during the {@code initSuccess} handshake.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @since 0.1.0
 */
public record PandaConfig(
    Transport transport,
    String host,
    int port,
    Duration connectTimeout,
    boolean stopOnEntry,
    boolean useCHook,
    int logLevel,
    String luaFileExtension,
    String cwd,
    String tempFilePath,
    boolean pathCaseSensitivity,
    boolean autoPathMode,
    boolean distinguishSameNameFile,
    String truncatedOPath,
    boolean developmentMode,
    Duration stopConfirmTimeout) {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 8818;

  /** Which side opens the connection. */
  public enum Transport {
    /** LUMEN dials a debuggee that listens. */
    CLIENT,
    /** LUMEN listens and the debuggee dials in. */
    SERVER;

    public static Transport fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        return SERVER;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "client", "tcp-client" -> CLIENT;
        case "server", "tcp-server" -> SERVER;
        default -> throw new IllegalArgumentException("transport must be client or server (was " + raw + ")");
      };
    }
  }

  public PandaConfig {
    transport = Objects.requireNonNullElse(transport, Transport.SERVER);
    host = Net.requireHost("host", host == null || host.isBlank() ? DEFAULT_HOST : host);
    Numbers.requireRange("port", port, transport == Transport.SERVER ? 0 : 1, 65_535);
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Numbers.requireRange("logLevel", logLevel, 0, 2);
    luaFileExtension = luaFileExtension == null || luaFileExtension.isBlank() ? "lua" : luaFileExtension.trim();
    cwd = Objects.requireNonNullElse(cwd, "");
    tempFilePath = tempFilePath == null || tempFilePath.isBlank() ? cwd : tempFilePath;
    truncatedOPath = Objects.requireNonNullElse(truncatedOPath, "");
    Objects.requireNonNull(stopConfirmTimeout, "stopConfirmTimeout");
  }

  /**
   * Builds the configuration from a merged flat map.
   *
   * @param map effective configuration
   * @return validated configuration
   */
  public static PandaConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    Transport transport = Transport.fromString(map.get("transport"));
    String cwd = Strings.optional("cwd", map.get("cwd"));
    return new PandaConfig(
        transport,
        Strings.optional("host", map.get("host")),
        (int) Numbers.parseInRange("port", map.get("port"), DEFAULT_PORT, 0, 65_535),
        AttachConfig.millis(map, "connectTimeoutMs", 3_000, 1, 60_000),
        Strings.parseFlag("stopOnEntry", map.get("stopOnEntry"), false),
        Strings.parseFlag("useCHook", map.get("useCHook"), true),
        (int) Numbers.parseInRange("logLevel", map.get("logLevel"), 1, 0, 2),
        Strings.optional("luaFileExtension", map.get("luaFileExtension")),
        cwd == null ? System.getProperty("user.dir", "") : cwd,
        Strings.optional("tempFilePath", map.get("tempFilePath")),
        Strings.parseFlag("pathCaseSensitivity", map.get("pathCaseSensitivity"), true),
        Strings.parseFlag("autoPathMode", map.get("autoPathMode"), false),
        Strings.parseFlag("distinguishSameNameFile", map.get("distinguishSameNameFile"), false),
        Strings.optional("truncatedOPath", map.get("truncatedOPath")),
        Strings.parseFlag("developmentMode", map.get("developmentMode"), false),
        AttachConfig.millis(map, "stopConfirmTimeoutMs", 3_000, 0, 60_000));
  }

  /**
   * Handshake options for the LuaPanda dialect.
   *
   * @param osType host operating system name
   * @return dialect options
   */
  public PandaDialect.Options toOptions(String osType) {
    return new PandaDialect.Options(stopOnEntry, useCHook, logLevel, cwd, tempFilePath, osType,
        stopConfirmTimeout, luaFileExtension, pathCaseSensitivity, autoPathMode, distinguishSameNameFile,
        truncatedOPath, developmentMode);
  }
}
