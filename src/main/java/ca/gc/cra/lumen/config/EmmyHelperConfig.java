package ca.gc.cra.lumen.config;

import ca.gc.cra.lumen.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * How the Emmy helper script reaches the debuggee.
 *
 * @param mode {@code INLINE} sends the assembled script text, {@code PATHS} sends directories
 * @param customRegistry optional type-registry script replacing the bundled one
 * @param extensions script extensions announced to the hook
 * @since 0.1.0
 */
public record EmmyHelperConfig(Mode mode, String customRegistry, List<String> extensions) {
  public static final List<String> DEFAULT_EXTENSIONS = List.of(".lua", ".lua.txt", ".lua.bytes");

  /** Helper delivery mode. */
  public enum Mode {
    INLINE,
    PATHS
  }

  public EmmyHelperConfig {
    mode = Objects.requireNonNullElse(mode, Mode.INLINE);
    extensions = extensions == null || extensions.isEmpty() ? DEFAULT_EXTENSIONS : List.copyOf(extensions);
  }

  /**
   * Reads {@code helper.mode}, {@code helper.customRegistry} and {@code helper.extensions}.
   *
   * @param map effective configuration
   * @return helper settings
   */
  public static EmmyHelperConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    String modeText = Strings.optional("helper.mode", map.get("helper.mode"));
    Mode mode = modeText == null ? Mode.INLINE : switch (modeText.toLowerCase(Locale.ROOT)) {
      case "inline" -> Mode.INLINE;
      case "paths" -> Mode.PATHS;
      default -> throw new IllegalArgumentException("helper.mode must be inline or paths (was " + modeText + ")");
    };
    return new EmmyHelperConfig(
        mode,
        Strings.optional("helper.customRegistry", map.get("helper.customRegistry")),
        splitExtensions(map.get("helper.extensions")));
  }

  static List<String> splitExtensions(String raw) {
    List<String> result = new ArrayList<>();
    if (raw == null) {
      return result;
    }
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        result.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
      }
    }
    return result;
  }
}
