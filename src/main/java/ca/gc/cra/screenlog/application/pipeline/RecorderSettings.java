package ca.gc.cra.screenlog.application.pipeline;

import ca.gc.cra.screenlog.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Timing and resource limits for {@link RecordingCoordinator}.
 *
 * @param framesPerSecond capture rate (1-30)
 * @param chunkDuration length of each chunk before rotation
 * @param frameTimeout maximum wait for a single frame
 * @param minimumFreeBytes free disk required to start
 * @param displayDebounce quiet period that collapses bursts of display changes
 * @param wakeResumeDelay delay before resuming after the system wakes
 * @param unlockResumeDelay delay before resuming after the screen unlocks
 * @param retry budget for reopening the capture stream
 * @since 0.1.0
 */
public record RecorderSettings(
    int framesPerSecond,
    Duration chunkDuration,
    Duration frameTimeout,
    long minimumFreeBytes,
    Duration displayDebounce,
    Duration wakeResumeDelay,
    Duration unlockResumeDelay,
    RetryPolicy retry) {

  public static final long DEFAULT_MINIMUM_FREE_BYTES = 100L * 1024 * 1024;

  public RecorderSettings {
    Numbers.requireRange("framesPerSecond", framesPerSecond, 1, 30);
    requirePositive("chunkDuration", chunkDuration);
    requirePositive("frameTimeout", frameTimeout);
    Objects.requireNonNull(displayDebounce, "displayDebounce");
    Objects.requireNonNull(wakeResumeDelay, "wakeResumeDelay");
    Objects.requireNonNull(unlockResumeDelay, "unlockResumeDelay");
    Objects.requireNonNull(retry, "retry");
    if (minimumFreeBytes < 0) {
      throw new IllegalArgumentException("minimumFreeBytes must not be negative");
    }
  }

  /** 1 fps, 15 minute chunks, 100 MB free disk, 0.5 s display debounce, 5 s wake and 0.5 s unlock delays. */
  public static RecorderSettings defaults() {
    return new RecorderSettings(
        1,
        Duration.ofMinutes(15),
        Duration.ofSeconds(1),
        DEFAULT_MINIMUM_FREE_BYTES,
        Duration.ofMillis(500),
        Duration.ofSeconds(5),
        Duration.ofMillis(500),
        RetryPolicy.defaults());
  }

  public Duration framePeriod() {
    return Duration.ofMillis(Math.max(1L, 1_000L / framesPerSecond));
  }

  public RecorderSettings withFramesPerSecond(int fps) {
    return new RecorderSettings(fps, chunkDuration, frameTimeout, minimumFreeBytes, displayDebounce,
        wakeResumeDelay, unlockResumeDelay, retry);
  }

  public RecorderSettings withChunkDuration(Duration duration) {
    return new RecorderSettings(framesPerSecond, duration, frameTimeout, minimumFreeBytes, displayDebounce,
        wakeResumeDelay, unlockResumeDelay, retry);
  }

  public RecorderSettings withRetry(RetryPolicy policy) {
    return new RecorderSettings(framesPerSecond, chunkDuration, frameTimeout, minimumFreeBytes, displayDebounce,
        wakeResumeDelay, unlockResumeDelay, policy);
  }

  public RecorderSettings withDisplayDebounce(Duration debounce) {
    return new RecorderSettings(framesPerSecond, chunkDuration, frameTimeout, minimumFreeBytes, debounce,
        wakeResumeDelay, unlockResumeDelay, retry);
  }

  public RecorderSettings withResumeDelays(Duration wake, Duration unlock) {
    return new RecorderSettings(framesPerSecond, chunkDuration, frameTimeout, minimumFreeBytes, displayDebounce,
        wake, unlock, retry);
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
