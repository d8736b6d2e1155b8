package ca.gc.cra.screenlog.infrastructure.metrics;

import ca.gc.cra.screenlog.application.port.MetricsPort;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that discards observations, logging each key once at debug level so disabled metrics stay
 * discoverable.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  private static final Logger log = LoggerFactory.getLogger(NoOpMetricsAdapter.class);

  private final Set<String> seen = ConcurrentHashMap.newKeySet();

  @Override
  public void increment(String key) {
    note(key);
  }

  @Override
  public void observe(String key, long value) {
    note(key);
  }

  private void note(String key) {
    if (log.isDebugEnabled() && key != null && seen.add(key)) {
      log.debug("Metric {} discarded (metrics disabled)", key);
    }
  }
}
