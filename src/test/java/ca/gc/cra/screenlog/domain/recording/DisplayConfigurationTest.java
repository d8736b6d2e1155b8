package ca.gc.cra.screenlog.domain.recording;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class DisplayConfigurationTest {
  private static final DisplayInfo MAIN = new DisplayInfo(1, 2560, 1440, true);
  private static final DisplayInfo SIDE = new DisplayInfo(2, 1920, 1080, false);

  @Test
  void identicalLayoutDoesNotRequireRestart() {
    DisplayConfiguration current = new DisplayConfiguration(List.of(MAIN, SIDE));
    DisplayConfiguration reordered = new DisplayConfiguration(List.of(SIDE, MAIN));
    assertFalse(current.requiresRestart(reordered));
  }

  @Test
  void countPrimaryOrResolutionChangesRequireRestart() {
    DisplayConfiguration current = new DisplayConfiguration(List.of(MAIN, SIDE));
    assertTrue(current.requiresRestart(new DisplayConfiguration(List.of(MAIN))));
    assertTrue(current.requiresRestart(new DisplayConfiguration(List.of(
        new DisplayInfo(1, 2560, 1440, false), new DisplayInfo(2, 1920, 1080, true)))));
    assertTrue(current.requiresRestart(new DisplayConfiguration(List.of(
        MAIN, new DisplayInfo(2, 1280, 720, false)))));
  }

  @Test
  void primaryFallsBackToFirstDisplay() {
    DisplayConfiguration noPrimary = new DisplayConfiguration(List.of(SIDE));
    assertEquals(2, noPrimary.primaryDisplayId());
    assertEquals(-1, new DisplayConfiguration(null).primaryDisplayId());
    assertNull(new DisplayConfiguration(List.of()).primaryDisplay());
  }
}
