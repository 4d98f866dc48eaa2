package ca.gc.cra.trail.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "record").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = write("");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(file, "record"));
  }

  @Test
  void commonAndCommandSectionsAreFlattened() throws Exception {
    Path file = write("""
        common:
          storeDir: /var/trail/logs
          region: ap-northeast-1
        Upload-All:
          sink: kafka
          region: eu-west-1
          kafka:
            bootstrap: broker:9092
        record:
          language: en
        """);

    Map<String, String> values = YamlConfigLoader.load(file, "upload-all").orElseThrow();

    assertEquals("/var/trail/logs", values.get("storeDir"));
    assertEquals("eu-west-1", values.get("region"));
    assertEquals("kafka", values.get("sink"));
    assertEquals("broker:9092", values.get("kafka.bootstrap"));
    assertFalse(values.containsKey("language"));
  }

  @Test
  void nullValuesBecomeBlankAndScalarsAreStringified() throws Exception {
    Path file = write("""
        send:
          region:
          maxAttempts: 5
          dryRun: true
        """);

    Map<String, String> values = YamlConfigLoader.load(file, "send").orElseThrow();

    assertEquals("", values.get("region"));
    assertEquals("5", values.get("maxAttempts"));
    assertEquals("true", values.get("dryRun"));
  }

  @Test
  void listsAreRejected() throws Exception {
    Path file = write("""
        exec:
          command:
            - claude
            - --print
        """);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "exec"));
    assertTrue(ex.getMessage().contains("command"));
  }

  @Test
  void nonMappingSectionIsRejected() throws Exception {
    Path file = write("record: just-a-string\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "record"));
  }

  @Test
  void malformedYamlIsRejected() throws Exception {
    Path file = write("record: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "record"));
  }

  private Path write(String content) throws Exception {
    Path file = tempDir.resolve("trail.yaml");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
