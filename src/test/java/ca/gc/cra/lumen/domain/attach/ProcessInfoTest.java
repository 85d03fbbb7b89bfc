package ca.gc.cra.lumen.domain.attach;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProcessInfoTest {

  @Test
  void fromPathExtractsExecutableName() {
    ProcessInfo info = ProcessInfo.fromPath(42, " Game Window ", "C:\\Games\\bin\\game.exe");
    assertEquals("game.exe", info.name());
    assertEquals("game.exe - Game Window", info.displayName());
  }

  @Test
  void displayNameOmitsBlankTitle() {
    assertEquals("tool", ProcessInfo.fromPath(7, null, "/usr/bin/tool").displayName());
  }

  @Test
  void rejectsNonPositivePid() {
    assertThrows(IllegalArgumentException.class, () -> new ProcessInfo(0, "x", "", ""));
  }

  @Test
  void moduleScanDetectsLuaRuntimes() {
    ModuleScan scan = ModuleScan.classify(List.of("kernel32.dll", "lua51.dll", "LuaJIT.dll"), "tasklist");
    assertTrue(scan.hasLuaRuntime());
    assertEquals(List.of("lua51.dll", "LuaJIT.dll"), scan.luaModules());
    assertFalse(ModuleScan.classify(List.of("user32.dll"), "tasklist").hasLuaRuntime());
  }

  @Test
  void winArchParsesAliases() {
    assertEquals(WinArch.X86, WinArch.fromString("win32"));
    assertEquals(WinArch.X64, WinArch.fromString(" AMD64 "));
    assertThrows(IllegalArgumentException.class, () -> WinArch.fromString("arm64"));
  }
}
