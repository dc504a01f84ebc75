package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void profileSectionOverridesCommonAndNestedKeysAreFlattened() throws IOException {
    Path yaml = tempDir.resolve("scribe.yaml");
    Files.writeString(yaml, """
        common:
          minimumLevel: information
          destinations:
            app:
              kind: plain
              path: /var/log/app.log
        production:
          minimumLevel: warning
          destinations:
            app:
              writeMode: buffered
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "Production").orElseThrow();

    assertEquals("warning", map.get("minimumLevel"));
    assertEquals("plain", map.get("destinations.app.kind"));
    assertEquals("/var/log/app.log", map.get("destinations.app.path"));
    assertEquals("buffered", map.get("destinations.app.writeMode"));
  }

  @Test
  void missingFileReturnsEmpty() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "dev").isPresent());
  }

  @Test
  void nonMappingRootIsRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        - common:
            mode: sync
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "dev"));
  }

  @Test
  void sequencesAreRejected() throws IOException {
    Path yaml = tempDir.resolve("seq.yaml");
    Files.writeString(yaml, """
        common:
          destinations:
            - console
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "dev"));
  }
}
