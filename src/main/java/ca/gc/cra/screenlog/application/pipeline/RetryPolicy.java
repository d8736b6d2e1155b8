package ca.gc.cra.screenlog.application.pipeline;

import ca.gc.cra.screenlog.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry budget with linear back-off: the wait after the n-th failed attempt is {@code n × step}.
 *
 * @param maxAttempts total attempts including the first
 * @param step back-off increment
 * @since 0.1.0
 */
public record RetryPolicy(int maxAttempts, Duration step) {

  public RetryPolicy {
    Numbers.requireRange("maxAttempts", maxAttempts, 1, 100);
    Objects.requireNonNull(step, "step");
    if (step.isNegative()) {
      throw new IllegalArgumentException("step must not be negative");
    }
  }

  /** Four attempts, one second apart per failure. */
  public static RetryPolicy defaults() {
    return new RetryPolicy(4, Duration.ofSeconds(1));
  }

  /**
   * @param failedAttempts attempts that have failed so far
   * @return {@code true} while another attempt fits in the budget
   */
  public boolean canRetry(int failedAttempts) {
    return failedAttempts < maxAttempts;
  }

  public Duration delayAfter(int failedAttempts) {
    return step.multipliedBy(Math.max(1, failedAttempts));
  }
}
