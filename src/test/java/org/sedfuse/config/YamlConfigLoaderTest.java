package org.sedfuse.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @Test
  void flattensCommonAndModeSections(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("sedfuse.yaml");
    Files.writeString(file, """
        common:
          metricsExporter: none
          fields: [lat, lon, name, z]
          field:
            z:
              pattern: "[0-9.]+"
        fuse:
          snapshots: /data/snapshots
          toleranceArcsec: 5
          metricsExporter: otlp
        template:
          template: "{name}"
        """, StandardCharsets.UTF_8);

    Map<String, String> fuse = YamlConfigLoader.load(file, "fuse").orElseThrow();

    assertEquals("otlp", fuse.get("metricsExporter"));
    assertEquals("lat,lon,name,z", fuse.get("fields"));
    assertEquals("[0-9.]+", fuse.get("field.z.pattern"));
    assertEquals("/data/snapshots", fuse.get("snapshots"));
    assertEquals("5", fuse.get("toleranceArcsec"));
    assertFalse(fuse.containsKey("template"));

    Map<String, String> template = YamlConfigLoader.load(file, "template").orElseThrow();
    assertEquals("{name}", template.get("template"));
    assertEquals("none", template.get("metricsExporter"));
  }

  @Test
  void missingFileYieldsEmpty(@TempDir Path dir) throws IOException {
    assertEquals(Optional.empty(), YamlConfigLoader.load(dir.resolve("absent.yaml"), "fuse"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("empty.yaml");
    Files.writeString(file, "", StandardCharsets.UTF_8);
    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(file, "fuse"));
  }

  @Test
  void rejectsMalformedShapes(@TempDir Path dir) throws IOException {
    Path scalarRoot = dir.resolve("scalar.yaml");
    Files.writeString(scalarRoot, "just text", StandardCharsets.UTF_8);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalarRoot, "fuse"));

    Path commaList = dir.resolve("comma.yaml");
    Files.writeString(commaList, "fuse:\n  reddeningColumns: [\"a,b\"]\n", StandardCharsets.UTF_8);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(commaList, "fuse"));

    Path broken = dir.resolve("broken.yaml");
    Files.writeString(broken, "fuse: [unclosed\n", StandardCharsets.UTF_8);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "fuse"));
  }
}
