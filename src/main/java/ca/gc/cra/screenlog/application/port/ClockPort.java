package ca.gc.cra.screenlog.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the recorder, monitor and store.
 * <p><strong>Why:</strong> Alert debouncing, leak windows, chunk boundaries and retention cutoffs all depend on
 * time; tests inject a controllable clock instead of sleeping.</p>
 * <p><strong>Role:</strong> Application port consumed by components.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads happen on the recorder, monitor
 * and store writer threads.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.screenlog.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z, subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns the current epoch time in whole seconds.
   *
   * @return seconds since 1970-01-01T00:00:00Z
   */
  default long nowEpochSeconds() {
    return nowMillis() / 1_000L;
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
