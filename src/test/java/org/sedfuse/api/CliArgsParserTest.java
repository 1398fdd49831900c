package org.sedfuse.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"in=sources.txt", " field.z.pattern=[0-9.]+ ", "template={name} {z:%.3f}"});
    assertEquals(List.of("in", "field.z.pattern", "template"), List.copyOf(map.keySet()));
    assertEquals("[0-9.]+", map.get("field.z.pattern"));
    assertEquals("{name} {z:%.3f}", map.get("template"));
  }

  @Test
  void splitsOnFirstEquals() {
    assertEquals("env=prod", CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=prod"})
        .get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in=a\u0007b"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in=a", "in=b"}));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }
}
