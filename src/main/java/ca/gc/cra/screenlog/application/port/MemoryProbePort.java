package ca.gc.cra.screenlog.application.port;

/**
 * <strong>What:</strong> Port reading process memory counters for the memory monitor.
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> Each call should complete well within the monitor's 10 ms sampling budget.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.screenlog.infrastructure.memory.JvmMemoryProbe
 */
public interface MemoryProbePort {

  /**
   * Immutable reading of the process memory counters.
   *
   * @param usedMemoryMb memory in use, in MiB
   * @param availableMemoryMb memory still available, in MiB
   * @param activeThreadCount live threads
   */
  record Reading(double usedMemoryMb, double availableMemoryMb, int activeThreadCount) {}

  /**
   * Reads the current counters.
   *
   * @return current reading
   */
  Reading read();
}
