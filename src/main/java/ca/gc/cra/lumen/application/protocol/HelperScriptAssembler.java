package ca.gc.cra.lumen.application.protocol;

import ca.gc.cra.lumen.application.port.ScriptProvider;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Emmy helper script shipped with the init request.
 *
 * <p>The main helper carries a placeholder line that is replaced by the type-registry script: a custom one
 * when configured and readable, otherwise the bundled Unreal registry.</p>
 *
 * @since 0.1.0
 */
public final class HelperScriptAssembler {
  private static final Logger log = LoggerFactory.getLogger(HelperScriptAssembler.class);

  /** Line in the main helper replaced by the type registry. */
  public static final String PLACEHOLDER = "-- [EMMY_HELPER_INIT_CONTENT]";
  /** Logical path of the main helper script. */
  public static final String MAIN_SCRIPT = "debugger/emmy/emmyHelper.lua";
  /** Logical path of the bundled type registry. */
  public static final String DEFAULT_REGISTRY = "debugger/emmy/emmyHelper_ue.lua";

  private final ScriptProvider bundled;
  private final ScriptProvider custom;

  /**
   * @param bundled loads scripts shipped with LUMEN
   * @param custom loads a user-supplied registry by path
   */
  public HelperScriptAssembler(ScriptProvider bundled, ScriptProvider custom) {
    this.bundled = Objects.requireNonNull(bundled, "bundled");
    this.custom = Objects.requireNonNull(custom, "custom");
  }

  /**
   * Assembles the helper.
   *
   * @param customRegistryPath optional user registry; blank or {@code null} selects the bundled one
   * @return assembled script, or empty when the main helper is unavailable
   */
  public Optional<String> assemble(String customRegistryPath) {
    Optional<String> main = bundled.load(MAIN_SCRIPT);
    if (main.isEmpty()) {
      log.warn("Emmy helper script {} not found; init will carry no helper", MAIN_SCRIPT);
      return Optional.empty();
    }
    String registry;
    if (customRegistryPath != null && !customRegistryPath.isBlank()) {
      registry = custom.load(customRegistryPath)
          .map(text -> "-- ========== Custom Type Registry: " + fileName(customRegistryPath)
              + " ==========\n" + text)
          .orElse(null);
      if (registry == null) {
        log.warn("Custom type registry {} is not readable; no registry loaded", customRegistryPath);
      }
    } else {
      registry = bundled.load(DEFAULT_REGISTRY)
          .map(text -> "-- ========== Default Type Registry: emmyHelper_ue.lua ==========\n" + text)
          .orElse(null);
    }
    return Optional.of(main.get().replace(PLACEHOLDER,
        registry != null ? registry : "-- No type registry script loaded"));
  }

  private static String fileName(String path) {
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return slash >= 0 ? path.substring(slash + 1) : path;
  }
}
