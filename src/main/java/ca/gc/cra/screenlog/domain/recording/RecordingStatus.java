package ca.gc.cra.screenlog.domain.recording;

import java.util.Objects;
import java.util.Optional;

/**
 * Event published on the recorder status channel: every state change and every error.
 *
 * @param timestampMillis event time in epoch milliseconds
 * @param state recorder state after the event
 * @param error error that caused the event, if any
 * @since 0.1.0
 */
public record RecordingStatus(long timestampMillis, RecordingState state, Optional<RecordingError> error) {
  public RecordingStatus {
    Objects.requireNonNull(state, "state");
    error = Objects.requireNonNullElse(error, Optional.empty());
  }

  public static RecordingStatus stateChanged(long timestampMillis, RecordingState state) {
    return new RecordingStatus(timestampMillis, state, Optional.empty());
  }

  public static RecordingStatus failure(long timestampMillis, RecordingState state, RecordingError error) {
    return new RecordingStatus(timestampMillis, state, Optional.of(Objects.requireNonNull(error, "error")));
  }

  public boolean isError() {
    return error.isPresent();
  }
}
