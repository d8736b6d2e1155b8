package ca.gc.cra.screenlog.infrastructure.capture;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.screenlog.application.port.CaptureSource;
import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.recording.DisplayConfiguration;
import ca.gc.cra.screenlog.domain.recording.DisplayInfo;
import ca.gc.cra.screenlog.domain.recording.SystemEvent;
import ca.gc.cra.screenlog.testing.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SyntheticCaptureSourceTest {
  private final MutableClock clock = new MutableClock(5_000L);

  @Test
  void framesAreDownsampledAndStamped() {
    SyntheticCaptureSource source = new SyntheticCaptureSource(1920, 1080, clock, 7L);
    source.open(source.currentDisplays());

    CapturedFrame frame = source.nextFrame(Duration.ofSeconds(1)).orElseThrow();

    assertEquals(120, frame.width());
    assertEquals(67, frame.height());
    assertEquals(120 * 67, frame.sizeBytes());
    assertEquals(1, frame.displayId());
    assertEquals(5_000L, frame.capturedAtMillis());
  }

  @Test
  void consecutiveFramesDifferOnlyInOneBlock() {
    SyntheticCaptureSource source = new SyntheticCaptureSource(1920, 1080, clock, 11L);
    source.open(source.currentDisplays());

    byte[] first = source.nextFrame(Duration.ZERO).orElseThrow().pixels();
    byte[] second = source.nextFrame(Duration.ZERO).orElseThrow().pixels();

    assertFalse(Arrays.equals(first, second));
    int changed = 0;
    for (int i = 0; i < first.length; i++) {
      if (first[i] != second[i]) {
        changed++;
      }
    }
    assertTrue(changed <= 64, "changed=" + changed);
  }

  @Test
  void closedStreamRefusesFrames() {
    SyntheticCaptureSource source = new SyntheticCaptureSource(640, 480, clock, 1L);
    assertThrows(IllegalStateException.class, () -> source.nextFrame(Duration.ZERO));

    source.open(source.currentDisplays());
    source.close();

    assertThrows(IllegalStateException.class, () -> source.nextFrame(Duration.ZERO));
  }

  @Test
  void revokingPermissionBlocksOpenAndNotifiesListener() {
    SyntheticCaptureSource source = new SyntheticCaptureSource(640, 480, clock, 1L);
    List<SystemEvent> events = new ArrayList<>();
    source.setListener(listener(events, new ArrayList<>()));

    source.raise(SystemEvent.PERMISSION_REVOKED);

    assertFalse(source.hasPermission());
    assertEquals(List.of(SystemEvent.PERMISSION_REVOKED), events);
    assertThrows(IllegalStateException.class, () -> source.open(source.currentDisplays()));
  }

  @Test
  void displayChangesAreReportedAndApplied() {
    SyntheticCaptureSource source = new SyntheticCaptureSource(640, 480, clock, 1L);
    List<DisplayConfiguration> changes = new ArrayList<>();
    source.setListener(listener(new ArrayList<>(), changes));
    DisplayConfiguration dual = new DisplayConfiguration(List.of(
        new DisplayInfo(1, 640, 480, false), new DisplayInfo(2, 2560, 1440, true)));

    source.changeDisplays(dual);
    source.open(source.currentDisplays());

    assertEquals(List.of(dual), changes);
    CapturedFrame frame = source.nextFrame(Duration.ZERO).orElseThrow();
    assertEquals(2, frame.displayId());
    assertEquals(160, frame.width());
  }

  private static CaptureSource.Listener listener(List<SystemEvent> events, List<DisplayConfiguration> changes) {
    return new CaptureSource.Listener() {
      @Override
      public void onDisplaysChanged(DisplayConfiguration configuration) {
        changes.add(configuration);
      }

      @Override
      public void onSystemEvent(SystemEvent event) {
        events.add(event);
      }
    };
  }
}
