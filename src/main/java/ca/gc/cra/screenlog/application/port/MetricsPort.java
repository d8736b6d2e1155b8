package ca.gc.cra.screenlog.application.port;

/**
 * <strong>What:</strong> Port abstracting SCREENLOG metrics emission.
 * <p><strong>Why:</strong> Lets the pool, monitor, store and recorder record counters and latencies without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like evictions, alerts or failed chunks.</li>
 *   <li>Record numeric observations for latency, byte counts or multipliers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from capture, monitor and
 * store threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code db.write.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code buffer.evicted}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
