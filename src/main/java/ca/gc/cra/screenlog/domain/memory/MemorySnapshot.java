package ca.gc.cra.screenlog.domain.memory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Point-in-time memory reading produced by each monitor tick.
 * <p><strong>Role:</strong> Domain value consumed by threshold checks, leak detection and alert observers.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param timestampMillis sampling time in epoch milliseconds
 * @param usedMemoryMb memory in use, in MiB
 * @param availableMemoryMb memory still available, in MiB
 * @param bufferCount live frame handles in the buffer pool
 * @param activeThreadCount live JVM threads
 * @param persistenceConnectionCount open store connections when known
 * @since 0.1.0
 */
public record MemorySnapshot(
    long timestampMillis,
    double usedMemoryMb,
    double availableMemoryMb,
    int bufferCount,
    int activeThreadCount,
    OptionalInt persistenceConnectionCount) {

  /**
   * Validates memory figures and normalizes the optional connection count.
   */
  public MemorySnapshot {
    if (usedMemoryMb < 0 || availableMemoryMb < 0) {
      throw new IllegalArgumentException("memory figures must be non-negative");
    }
    persistenceConnectionCount = Objects.requireNonNullElse(persistenceConnectionCount, OptionalInt.empty());
  }

  /**
   * Returns used plus available memory.
   *
   * @return total memory in MiB
   */
  public double totalMemoryMb() {
    return usedMemoryMb + availableMemoryMb;
  }

  /**
   * Returns used memory as a percentage of the total.
   *
   * @return usage in percent; {@code 0} when the total is zero
   */
  public double memoryUsagePercent() {
    double total = totalMemoryMb();
    if (total <= 0) {
      return 0.0;
    }
    return usedMemoryMb / total * 100.0;
  }

  public MemoryPressure memoryPressure() {
    return MemoryPressure.fromUsagePercent(memoryUsagePercent());
  }
}
