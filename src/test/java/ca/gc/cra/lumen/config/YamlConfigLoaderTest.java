package ca.gc.cra.lumen.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndCommandSections() throws IOException {
    Path yaml = tempDir.resolve("lumen.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          verbose: true
        attach:
          pid: 4242
          maxConnectAttempts: 5
          verbose: false
        panda:
          port: 9000
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "attach");

    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("4242", map.get("pid"));
    assertEquals("5", map.get("maxConnectAttempts"));
    assertEquals("false", map.get("verbose"));
    assertFalse(map.containsKey("port"));
  }

  @Test
  void nestedMapsAndListsFlatten() {
    Map<String, String> map = YamlConfigLoader.parse(new StringReader("""
        Attach:
          helper:
            mode: paths
            extensions: [lua, lua.txt]
          customRegistry:
        """), "ATTACH");

    assertEquals("paths", map.get("helper.mode"));
    assertEquals("lua,lua.txt", map.get("helper.extensions"));
    assertEquals("", map.get("customRegistry"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "panda").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() {
    assertTrue(YamlConfigLoader.parse(new StringReader(""), "panda").isEmpty());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - panda:
            port: 8818
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "panda"));
  }

  @Test
  void nestedListsAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("""
            panda:
              sourceRoots:
                - [a, b]
            """), "panda"));

    assertTrue(ex.getMessage().contains("sourceRoots"));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("panda: [unclosed"), "panda"));
  }
}
