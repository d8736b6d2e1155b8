package ca.gc.cra.screenlog.infrastructure.time;

import ca.gc.cra.screenlog.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()} that never moves backwards.
 *
 * <p>Alert debouncing and chunk rotation compare successive readings; a wall-clock step backwards (NTP
 * correction, manual change) would otherwise reopen debounce windows or produce chunks ending before they
 * start. Readings hold at the last observed value until the wall clock catches up.</p>
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private static final Logger log = LoggerFactory.getLogger(SystemClockAdapter.class);

  private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

  @Override
  public long nowMillis() {
    long wall = System.currentTimeMillis();
    long previous = last.getAndAccumulate(wall, Math::max);
    if (wall < previous) {
      log.debug("Wall clock moved back {} ms; holding at last reading", previous - wall);
      return previous;
    }
    return wall;
  }
}
