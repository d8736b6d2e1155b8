package ca.gc.cra.screenlog.infrastructure.memory;

import ca.gc.cra.screenlog.application.port.MemoryProbePort;
import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;

/**
 * Reads heap usage and live thread count from the running JVM.
 *
 * <p>Used memory is committed heap minus free heap. Available memory is the heap ceiling ({@code -Xmx}) minus used,
 * so the usage percentage tracks distance to an {@link OutOfMemoryError}.</p>
 *
 * @since 0.1.0
 */
public final class JvmMemoryProbe implements MemoryProbePort {
  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private final Runtime runtime;
  private final ThreadMXBean threads;

  public JvmMemoryProbe() {
    this.runtime = Runtime.getRuntime();
    this.threads = ManagementFactory.getThreadMXBean();
  }

  @Override
  public Reading read() {
    long total = runtime.totalMemory();
    long free = runtime.freeMemory();
    long max = runtime.maxMemory() == Long.MAX_VALUE ? total : runtime.maxMemory();
    long used = Math.max(0L, total - free);
    long available = Math.max(0L, max - used);
    return new Reading(used / BYTES_PER_MB, available / BYTES_PER_MB, threads.getThreadCount());
  }
}
