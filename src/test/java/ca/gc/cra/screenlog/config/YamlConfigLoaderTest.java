package ca.gc.cra.screenlog.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommon() throws Exception {
    Path file = tempDir.resolve("screenlog.yaml");
    Files.writeString(file, """
        common:
          dataDir: /var/screenlog
          fps: 1
        record:
          fps: 2
          retention:
            retentionDays: 7
            enabled: false
        cleanup:
          fps: 9
        """);

    Map<String, String> record = YamlConfigLoader.load(file, "record").orElseThrow();
    assertEquals("/var/screenlog", record.get("dataDir"));
    assertEquals("2", record.get("fps"));
    assertEquals("7", record.get("retention.retentionDays"));
    assertEquals("false", record.get("retention.enabled"));

    Map<String, String> chunks = YamlConfigLoader.load(file, "chunks").orElseThrow();
    assertEquals("1", chunks.get("fps"));
    assertFalse(chunks.containsKey("retention.retentionDays"));
  }

  @Test
  void scalarListsBecomeCommaSeparated() throws Exception {
    Path file = tempDir.resolve("list.yaml");
    Files.writeString(file, """
        memory:
          tags: [a, b, c]
          empty:
        """);

    Map<String, String> map = YamlConfigLoader.load(file, "MEMORY").orElseThrow();
    assertEquals("a,b,c", map.get("tags"));
    assertEquals("", map.get("empty"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "record"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");
    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(file, "cleanup"));
  }

  @Test
  void unknownSectionsAreIgnored() throws Exception {
    Path file = Files.writeString(tempDir.resolve("extra.yaml"), """
        legacy:
          fps: 30
        chunks:
          limit: 5
        """);
    assertEquals(Map.of("limit", "5"), YamlConfigLoader.load(file, "chunks").orElseThrow());
  }

  @Test
  void rejectsUnknownModeAndMalformedDocuments() throws Exception {
    Path file = Files.writeString(tempDir.resolve("bad.yaml"), "record: [unclosed");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "record"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "replay"));

    Path scalarRoot = Files.writeString(tempDir.resolve("scalar.yaml"), "just text");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalarRoot, "record"));

    Path nestedList = Files.writeString(tempDir.resolve("nested.yaml"), """
        record:
          matrix: [[1, 2], [3]]
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "record"));
  }
}
