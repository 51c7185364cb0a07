package ca.gc.cra.nfcrx.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("unknown option: -x", Logs.truncate("unknown option: -x", 64));
  }

  @Test
  void longValuesAreCutWithLengthMetadata() {
    String truncated = Logs.truncate("x".repeat(100), 10);

    assertTrue(truncated.startsWith("xxxxxxxxxx... (truncated, 10 of 100)"));
  }

  @Test
  void nullAndInvalidBudgetAreHandled() {
    assertEquals("<null>", Logs.bounded(null, 10));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}
