package org.sedfuse.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("Total flux", Logs.truncate("Total flux", 32));
  }

  @Test
  void longValuesAreTruncatedWithLength() {
    assertEquals("H-alp... (truncated, 5 of 12)", Logs.truncate("H-alpha line", 5));
  }

  @Test
  void nullAndNonPositiveLimits() {
    assertEquals("<null>", Logs.truncate(null, 5));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
