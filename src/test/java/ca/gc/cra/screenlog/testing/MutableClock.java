package ca.gc.cra.screenlog.testing;

import ca.gc.cra.screenlog.application.port.ClockPort;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock. */
public final class MutableClock implements ClockPort {
  private final AtomicLong nowMillis;

  public MutableClock(long startMillis) {
    this.nowMillis = new AtomicLong(startMillis);
  }

  public static MutableClock atEpochSeconds(long seconds) {
    return new MutableClock(seconds * 1_000L);
  }

  @Override
  public long nowMillis() {
    return nowMillis.get();
  }

  public void advance(Duration duration) {
    nowMillis.addAndGet(duration.toMillis());
  }

  public void set(long millis) {
    nowMillis.set(millis);
  }
}
