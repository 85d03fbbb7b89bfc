package ca.gc.cra.lumen.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("workers", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsOutOfBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65, 1, 64));
  }

  @Test
  void parseInRangeFallsBackToDefaultWhenBlank() {
    assertEquals(15, Numbers.parseInRange("attempts", "  ", 15, 1, 100));
    assertEquals(15, Numbers.parseInRange("attempts", null, 15, 1, 100));
  }

  @Test
  void parseInRangeRejectsNonNumeric() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("attempts", "many", 15, 1, 100));
    assertTrue(ex.getMessage().contains("attempts must be numeric"));
  }
}
