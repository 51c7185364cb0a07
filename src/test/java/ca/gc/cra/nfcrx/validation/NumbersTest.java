package ca.gc.cra.nfcrx.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("executor.maxSize", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("executor.maxSize", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("executor.maxSize", 65, 1, 64));
  }

  @Test
  void parseInRangeTrimsAndRejectsNonIntegers() {
    assertEquals(5, Numbers.parseInRange("-t", " 5 ", 0, 100));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("-t", "5s", 0, 100));
    assertEquals("-t must be an integer (was '5s')", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("-t", "", 0, 100));
  }
}
