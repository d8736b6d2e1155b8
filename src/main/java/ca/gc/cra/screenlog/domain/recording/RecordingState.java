package ca.gc.cra.screenlog.domain.recording;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> State of the recording state machine.
 * <p><strong>Role:</strong> Published on the recorder status channel on every transition.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param phase state kind
 * @param displayCount displays being recorded; meaningful only while {@link Phase#RECORDING}
 * @param errorCode failure code; present only while {@link Phase#ERROR}
 * @since 0.1.0
 */
public record RecordingState(Phase phase, int displayCount, Optional<ErrorCode> errorCode) {

  /** State kinds. */
  public enum Phase {
    IDLE,
    STARTING,
    RECORDING,
    PAUSED,
    FINISHING,
    STOPPING,
    ERROR
  }

  private static final RecordingState IDLE = new RecordingState(Phase.IDLE, 0, Optional.empty());
  private static final RecordingState STARTING = new RecordingState(Phase.STARTING, 0, Optional.empty());
  private static final RecordingState PAUSED = new RecordingState(Phase.PAUSED, 0, Optional.empty());
  private static final RecordingState FINISHING = new RecordingState(Phase.FINISHING, 0, Optional.empty());
  private static final RecordingState STOPPING = new RecordingState(Phase.STOPPING, 0, Optional.empty());

  public RecordingState {
    Objects.requireNonNull(phase, "phase");
    errorCode = Objects.requireNonNullElse(errorCode, Optional.empty());
    if (phase == Phase.ERROR && errorCode.isEmpty()) {
      throw new IllegalArgumentException("error state requires an error code");
    }
    if (phase != Phase.ERROR && errorCode.isPresent()) {
      throw new IllegalArgumentException("only the error state carries an error code");
    }
    if (displayCount < 0) {
      throw new IllegalArgumentException("displayCount must be non-negative");
    }
  }

  public static RecordingState idle() {
    return IDLE;
  }

  public static RecordingState starting() {
    return STARTING;
  }

  public static RecordingState recording(int displayCount) {
    return new RecordingState(Phase.RECORDING, displayCount, Optional.empty());
  }

  public static RecordingState paused() {
    return PAUSED;
  }

  public static RecordingState finishing() {
    return FINISHING;
  }

  public static RecordingState stopping() {
    return STOPPING;
  }

  public static RecordingState error(ErrorCode code) {
    return new RecordingState(Phase.ERROR, 0, Optional.of(Objects.requireNonNull(code, "code")));
  }

  /**
   * Indicates whether capture resources are held in this state.
   *
   * @return {@code true} for starting, recording and finishing
   */
  public boolean isActive() {
    return phase == Phase.STARTING || phase == Phase.RECORDING || phase == Phase.FINISHING;
  }

  public boolean is(Phase candidate) {
    return phase == candidate;
  }

  @Override
  public String toString() {
    return switch (phase) {
      case RECORDING -> "recording(" + displayCount + ")";
      case ERROR -> "error(" + errorCode.map(ErrorCode::code).orElse("?") + ")";
      default -> phase.name().toLowerCase(Locale.ROOT);
    };
  }
}
