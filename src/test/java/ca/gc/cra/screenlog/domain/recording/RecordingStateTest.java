package ca.gc.cra.screenlog.domain.recording;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.screenlog.domain.recording.RecordingState.Phase;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RecordingStateTest {
  @Test
  void activeStatesAreStartingRecordingAndFinishing() {
    assertTrue(RecordingState.starting().isActive());
    assertTrue(RecordingState.recording(2).isActive());
    assertTrue(RecordingState.finishing().isActive());
    assertFalse(RecordingState.idle().isActive());
    assertFalse(RecordingState.paused().isActive());
    assertFalse(RecordingState.stopping().isActive());
    assertFalse(RecordingState.error(ErrorCode.PERMISSION_DENIED).isActive());
  }

  @Test
  void errorCodeOnlyAccompaniesErrorPhase() {
    assertThrows(IllegalArgumentException.class,
        () -> new RecordingState(Phase.ERROR, 0, Optional.empty()));
    assertThrows(IllegalArgumentException.class,
        () -> new RecordingState(Phase.IDLE, 0, Optional.of(ErrorCode.STORAGE_SPACE_LOW)));
    assertThrows(IllegalArgumentException.class, () -> RecordingState.recording(-1));
  }

  @Test
  void rendersCompactLabels() {
    assertEquals("recording(3)", RecordingState.recording(3).toString());
    assertEquals("error(storage_space_low)", RecordingState.error(ErrorCode.STORAGE_SPACE_LOW).toString());
    assertEquals("paused", RecordingState.paused().toString());
  }

  @Test
  void recordingStatesCompareByDisplayCount() {
    assertEquals(RecordingState.recording(1), RecordingState.recording(1));
    assertNotEquals(RecordingState.recording(1), RecordingState.recording(2));
  }
}
