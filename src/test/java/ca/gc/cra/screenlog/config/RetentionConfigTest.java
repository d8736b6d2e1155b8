package ca.gc.cra.screenlog.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class RetentionConfigTest {
  @Test
  void defaultsKeepThreeDaysInTenGigabytesHourly() {
    RetentionConfig defaults = RetentionConfig.defaults();
    assertTrue(defaults.enabled());
    assertEquals(3, defaults.retentionDays());
    assertEquals(10, defaults.maxStorageGB());
    assertEquals(1, defaults.cleanupIntervalHours());
    assertEquals(10L * 1024 * 1024 * 1024, defaults.maxStorageBytes());
  }

  @Test
  void acceptsInclusiveBounds() {
    assertDoesNotThrow(() -> new RetentionConfig(true, 1, 1, 1));
    assertDoesNotThrow(() -> new RetentionConfig(true, 365, 1000, 24));
  }

  @Test
  void rejectsOutOfRangeValuesInsteadOfClamping() {
    assertThrows(IllegalArgumentException.class, () -> new RetentionConfig(true, 0, 10, 1));
    assertThrows(IllegalArgumentException.class, () -> new RetentionConfig(true, 366, 10, 1));
    assertThrows(IllegalArgumentException.class, () -> new RetentionConfig(true, 3, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> new RetentionConfig(true, 3, 1001, 1));
    assertThrows(IllegalArgumentException.class, () -> new RetentionConfig(true, 3, 10, 0));
    assertThrows(IllegalArgumentException.class, () -> RetentionConfig.validate(3, 10, 25));
  }

  @Test
  void messageListsEveryViolation() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new RetentionConfig(false, 400, 2000, 30));
    assertTrue(ex.getMessage().contains("retentionDays must be between 1 and 365 (was 400)"), ex.getMessage());
    assertTrue(ex.getMessage().contains("maxStorageGB must be between 1 and 1000 (was 2000)"), ex.getMessage());
    assertTrue(ex.getMessage().contains("cleanupIntervalHours must be between 1 and 24 (was 30)"), ex.getMessage());
  }

  @Test
  void fromMapOverlaysKeysOnDefaults() {
    RetentionConfig stored = new RetentionConfig(true, 7, 20, 2);
    RetentionConfig merged = RetentionConfig.fromMap(
        Map.of("retention.retentionDays", "14", "retention.enabled", "FALSE", "unrelated", "x"), stored);

    assertEquals(new RetentionConfig(false, 14, 20, 2), merged);
    assertSame(stored, RetentionConfig.fromMap(Map.of(), stored));
    assertEquals(RetentionConfig.defaults(), RetentionConfig.fromMap(null));
  }

  @Test
  void fromMapRejectsMalformedValues() {
    assertThrows(IllegalArgumentException.class,
        () -> RetentionConfig.fromMap(Map.of("retention.enabled", "yes")));
    assertThrows(IllegalArgumentException.class,
        () -> RetentionConfig.fromMap(Map.of("retention.maxStorageGB", "ten")));
    assertThrows(IllegalArgumentException.class,
        () -> RetentionConfig.fromMap(Map.of("retention.cleanupIntervalHours", "48")));
  }
}
