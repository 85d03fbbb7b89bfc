package ca.gc.cra.lumen.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemSourceLocatorTest {
  @TempDir Path workspace;

  private FileSystemSourceLocator locator;

  @BeforeEach
  void setUp() throws Exception {
    Files.createDirectories(workspace.resolve("scripts/game"));
    Files.writeString(workspace.resolve("scripts/game/player.lua"), "return {}");
    Files.writeString(workspace.resolve("scripts/config.lua.txt"), "return {}");
    locator = new FileSystemSourceLocator(
        List.of(workspace.resolve("missing"), workspace.resolve("scripts")), List.of(".lua", ".lua.txt"));
  }

  @Test
  void resolvesRelativeChunkNames() {
    assertTrue(locator.canResolve("game/player.lua"));
    assertTrue(locator.canResolve("@game/player.lua"));
    assertTrue(locator.canResolve("game/player"));
    assertTrue(locator.canResolve("config"));
  }

  @Test
  void resolvesAbsolutePaths() {
    assertTrue(locator.canResolve(workspace.resolve("scripts/game/player.lua").toString()));
    assertFalse(locator.canResolve(workspace.resolve("scripts/other.lua").toAbsolutePath().toString()));
  }

  @Test
  void unknownOrBlankNamesFail() {
    assertFalse(locator.canResolve("=[C]"));
    assertFalse(locator.canResolve(" "));
    assertFalse(locator.canResolve(null));
  }
}
