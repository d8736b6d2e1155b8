package ca.gc.cra.screenlog.domain.recording;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> User-visible recorder failure with recovery guidance.
 * <p><strong>Role:</strong> Published on the recorder status channel and carried by the error state.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param code failure classification
 * @param message human readable description
 * @param recoveryActions at least one recovery option
 * @param timestampMillis failure time in epoch milliseconds
 * @since 0.1.0
 */
public record RecordingError(
    ErrorCode code, String message, List<RecoveryAction> recoveryActions, long timestampMillis) {

  public RecordingError {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(message, "message");
    recoveryActions = recoveryActions == null ? List.of() : List.copyOf(recoveryActions);
    if (recoveryActions.isEmpty()) {
      throw new IllegalArgumentException("recording errors must offer at least one recovery action");
    }
  }

  public boolean retryable() {
    return code.retryable();
  }

  public static RecordingError permissionDenied(long nowMillis) {
    return new RecordingError(
        ErrorCode.PERMISSION_DENIED,
        "Screen recording permission is required to capture your screen.",
        List.of(RecoveryAction.primary("Open System Preferences"), RecoveryAction.secondary("Learn More")),
        nowMillis);
  }

  public static RecordingError displayConfigurationChanged(long nowMillis) {
    return new RecordingError(
        ErrorCode.DISPLAY_CONFIGURATION_CHANGED,
        "Display configuration changed. Recording will restart automatically.",
        List.of(RecoveryAction.primary("Retry Now"), RecoveryAction.secondary("Dismiss")),
        nowMillis);
  }

  /**
   * Creates a low disk space error.
   *
   * @param availableBytes bytes still free on the recordings volume
   * @param nowMillis failure time
   * @return error instance
   */
  public static RecordingError storageSpaceLow(long availableBytes, long nowMillis) {
    long availableMb = availableBytes / (1024 * 1024);
    return new RecordingError(
        ErrorCode.STORAGE_SPACE_LOW,
        "Low disk space (" + availableMb + " MB available). Recording may stop soon.",
        List.of(RecoveryAction.primary("Free Up Space"), RecoveryAction.secondary("Continue Anyway")),
        nowMillis);
  }

  public static RecordingError compressionFailed(String reason, long nowMillis) {
    return new RecordingError(
        ErrorCode.COMPRESSION_FAILED,
        "Video compression failed: " + reason,
        List.of(RecoveryAction.primary("Retry"), RecoveryAction.secondary("Use Lower Quality")),
        nowMillis);
  }

  public static RecordingError frameCaptureTimeout(long nowMillis) {
    return new RecordingError(
        ErrorCode.FRAME_CAPTURE_TIMEOUT,
        "Failed to capture frames within expected time. System may be under heavy load.",
        List.of(RecoveryAction.primary("Retry"), RecoveryAction.secondary("Stop Recording")),
        nowMillis);
  }

  public static RecordingError databaseWriteFailed(String reason, long nowMillis) {
    return new RecordingError(
        ErrorCode.DATABASE_WRITE_FAILED,
        "Failed to save recording metadata: " + reason,
        List.of(RecoveryAction.primary("Retry"), RecoveryAction.secondary("Continue Without Metadata")),
        nowMillis);
  }
}
