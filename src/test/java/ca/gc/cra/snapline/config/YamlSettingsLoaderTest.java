package ca.gc.cra.snapline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlSettingsLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadReadsTopLevelKeys() throws IOException {
    Path yaml = tempDir.resolve("snapline.yaml");
    Files.writeString(yaml, """
        update: always
        verbose: true
        """);

    Map<String, String> map = YamlSettingsLoader.load(yaml).orElseThrow();

    assertEquals("always", map.get("update"));
    assertEquals("true", map.get("verbose"));
  }

  @Test
  void loadDropsSnaplineSectionPrefix() throws IOException {
    Path yaml = tempDir.resolve("snapline.yaml");
    Files.writeString(yaml, """
        snapline:
          update: on
          workspace: /tmp/ws
        """);

    Map<String, String> map = YamlSettingsLoader.load(yaml).orElseThrow();

    // bare "on" is a YAML 1.1 boolean
    assertEquals("true", map.get("update"));
    assertEquals("/tmp/ws", map.get("workspace"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlSettingsLoader.load(tempDir.resolve("missing.yaml")).isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - update: on
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlSettingsLoader.load(yaml));
  }

  @Test
  void locatePrefersExplicitProperty() {
    assertEquals(Path.of("/etc/snap.yaml"),
        YamlSettingsLoader.locate(Map.of("snapline.config", "/etc/snap.yaml"), tempDir));
    assertEquals(tempDir.resolve("snapline.yaml"), YamlSettingsLoader.locate(Map.of(), tempDir));
  }
}
