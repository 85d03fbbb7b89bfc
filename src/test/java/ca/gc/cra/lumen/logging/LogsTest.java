package ca.gc.cra.lumen.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("{\"cmd\":\"initSuccess\"}", Logs.truncate("{\"cmd\":\"initSuccess\"}", 64));
    assertEquals("<null>", Logs.truncate(null, 4));
  }

  @Test
  void longValuesCarryLengthMetadata() {
    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void truncationNeverSplitsCodepoints() {
    String truncated = Logs.truncate("é".repeat(4), 3);

    assertTrue(truncated.startsWith("é..."));
  }

  @Test
  void oneLineEscapesNewlines() {
    assertEquals("11\\n{}\\n", Logs.oneLine("11\n{}\n", 100));
  }

  @Test
  void nonPositiveLimitRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}
