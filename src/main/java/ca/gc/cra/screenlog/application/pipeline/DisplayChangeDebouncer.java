package ca.gc.cra.screenlog.application.pipeline;

import ca.gc.cra.screenlog.domain.recording.DisplayConfiguration;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses a burst of display-configuration changes into one delivery of the latest configuration once the
 * quiet period has elapsed without further changes.
 */
final class DisplayChangeDebouncer {
  private static final Logger log = LoggerFactory.getLogger(DisplayChangeDebouncer.class);

  private final ScheduledExecutorService scheduler;
  private final long quietMillis;
  private final Consumer<DisplayConfiguration> action;
  private final ReentrantLock lock = new ReentrantLock();

  private DisplayConfiguration latest;
  private ScheduledFuture<?> pending;
  private int collapsed;

  DisplayChangeDebouncer(
      ScheduledExecutorService scheduler, Duration quietPeriod, Consumer<DisplayConfiguration> action) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.quietMillis = Objects.requireNonNull(quietPeriod, "quietPeriod").toMillis();
    this.action = Objects.requireNonNull(action, "action");
  }

  void submit(DisplayConfiguration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    lock.lock();
    try {
      latest = configuration;
      if (pending != null && pending.cancel(false)) {
        collapsed++;
      }
      pending = scheduler.schedule(this::fire, quietMillis, TimeUnit.MILLISECONDS);
    } finally {
      lock.unlock();
    }
  }

  void cancel() {
    lock.lock();
    try {
      if (pending != null) {
        pending.cancel(false);
      }
      pending = null;
      latest = null;
      collapsed = 0;
    } finally {
      lock.unlock();
    }
  }

  private void fire() {
    DisplayConfiguration configuration;
    int merged;
    lock.lock();
    try {
      configuration = latest;
      merged = collapsed;
      latest = null;
      pending = null;
      collapsed = 0;
    } finally {
      lock.unlock();
    }
    if (configuration == null) {
      return;
    }
    log.debug("Display configuration settled after {} superseded change(s)", merged);
    action.accept(configuration);
  }
}
