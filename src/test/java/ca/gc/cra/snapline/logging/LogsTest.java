package ca.gc.cra.snapline.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("abc", Logs.truncate("abc", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void longValuesAreTruncatedWithLength() {
    assertEquals("abc... (truncated, 3 of 6 bytes)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncationNeverSplitsCodePoints() {
    String truncated = Logs.truncate("éé", 3);

    assertTrue(truncated.startsWith("é..."));
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void verboseLoggingRaisesLibraryLevel() {
    Logger logger = (Logger) LoggerFactory.getLogger(LoggingConfigurator.LIBRARY_LOGGER);
    Level original = logger.getLevel();
    try {
      assertTrue(LoggingConfigurator.enableVerboseLogging());
      assertEquals(Level.DEBUG, logger.getLevel());
    } finally {
      logger.setLevel(original);
    }
  }
}
