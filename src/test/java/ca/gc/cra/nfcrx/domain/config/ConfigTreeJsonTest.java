package ca.gc.cra.nfcrx.domain.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConfigTreeJsonTest {

  @Test
  void writesCompactJsonInInsertionOrder() {
    ConfigTree tree = ConfigTree.builder()
        .put("debugEnabled", false)
        .put("sampleRate", 10_000_000)
        .build()
        .withPath("nfca.enabled", true);

    assertEquals("{\"debugEnabled\":false,\"sampleRate\":10000000,\"nfca\":{\"enabled\":true}}",
        ConfigTreeJson.write(tree));
  }

  @Test
  void parseDropsNullMembers() {
    ConfigTree tree = ConfigTreeJson.parse("{\"status\":\"idle\",\"name\":null,\"gain\":1.5}");

    assertEquals("idle", tree.string("status").orElseThrow());
    assertFalse(tree.containsKey("name"));
    assertEquals(1.5, tree.scalar("gain").orElseThrow());
  }

  @Test
  void blankInputIsEmptyTree() {
    assertTrue(ConfigTreeJson.parse("  ").isEmpty());
  }

  @Test
  void arraysAndNonObjectRootsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigTreeJson.parse("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> ConfigTreeJson.parse("{\"a\":[1]}"));
    assertThrows(IllegalArgumentException.class, () -> ConfigTreeJson.parse("{\"a\":"));
  }
}
