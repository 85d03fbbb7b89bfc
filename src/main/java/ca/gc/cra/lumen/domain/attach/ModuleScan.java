package ca.gc.cra.lumen.domain.attach;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Loaded-module report for a target process, used only for diagnostics.
 *
 * @param modules module file names as reported
 * @param luaModules subset classified as Lua runtimes
 * @param source which probe produced the list ({@code powershell}, {@code tasklist})
 * @since 0.1.0
 */
public record ModuleScan(List<String> modules, List<String> luaModules, String source) {

  private static final List<String> LUA_MARKERS = List.of("lua", "luajit", "lua5", "luadll");

  public ModuleScan {
    modules = List.copyOf(Objects.requireNonNull(modules, "modules"));
    luaModules = List.copyOf(Objects.requireNonNull(luaModules, "luaModules"));
    source = Objects.requireNonNullElse(source, "");
  }

  /**
   * Builds a scan from raw module names, classifying Lua runtimes.
   *
   * @param modules module names
   * @param source probe name
   * @return classified scan
   */
  public static ModuleScan classify(List<String> modules, String source) {
    List<String> lua = modules.stream().filter(ModuleScan::isLuaModule).toList();
    return new ModuleScan(modules, lua, source);
  }

  public static boolean isLuaModule(String moduleName) {
    if (moduleName == null) {
      return false;
    }
    String lower = moduleName.toLowerCase(Locale.ROOT);
    return LUA_MARKERS.stream().anyMatch(lower::contains);
  }

  public boolean hasLuaRuntime() {
    return !luaModules.isEmpty();
  }
}
