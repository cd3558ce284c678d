package ca.gc.cra.docrelay.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"topic=runs", " key = run-1 ", ""});
    assertEquals("runs", map.get("topic"));
    assertEquals("run-1", map.get("key"));
    assertEquals(2, map.size());
  }

  @Test
  void valuesMayContainEqualsSigns() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=a=b,c=d"});
    assertEquals("a=b,c=d", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"topic="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=runs"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"to pic=runs"}));
  }

  @Test
  void requireAndOptionalConsumeKeys() {
    Map<String, String> map = new HashMap<>(Map.of("topic", "runs"));

    assertEquals("latest", CliArgsParser.optional(map, "offsetReset", "latest"));
    assertEquals("runs", CliArgsParser.require(map, "topic"));
    assertTrue(map.isEmpty());
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> CliArgsParser.require(map, "topic"));
    assertEquals("topic is required", thrown.getMessage());
  }
}
