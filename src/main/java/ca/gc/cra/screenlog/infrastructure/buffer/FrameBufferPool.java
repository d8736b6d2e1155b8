package ca.gc.cra.screenlog.infrastructure.buffer;

import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.application.port.FramePoolPort;
import ca.gc.cra.screenlog.application.port.MetricsPort;
import ca.gc.cra.screenlog.domain.capture.BufferPoolDiagnostics;
import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.capture.FrameHandle;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded pool of captured frames with strict FIFO eviction.
 * <p><strong>Why:</strong> Caps frame memory during multi-hour recording; a full pool evicts its oldest frame
 * instead of growing.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link FramePoolPort}.</p>
 * <p><strong>Thread-safety:</strong> All mutation passes through one {@link ReentrantLock}; each handle has exactly
 * one release path so a frame is never released twice. {@link #count()} reads a volatile snapshot published under
 * that lock and never acquires it, so monitors cannot stall the capture path.</p>
 * <p><strong>Performance:</strong> O(1) add, release and eviction via an insertion-ordered map.</p>
 * <p><strong>Observability:</strong> Emits {@code buffer.add.latencyNanos}, {@code buffer.evicted} and
 * {@code buffer.released}.</p>
 *
 * @since 0.1.0
 */
public final class FrameBufferPool implements FramePoolPort {
  private static final Logger log = LoggerFactory.getLogger(FrameBufferPool.class);

  /** Default maximum number of live handles. */
  public static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final LinkedHashMap<Long, FrameHandle> live;
  private final ReentrantLock lock = new ReentrantLock();

  private long nextId = 1L;
  private long totalAllocated;
  private long totalEvicted;
  private long totalReleased;
  private long liveBytes;
  private volatile int liveCount;

  /**
   * Creates a pool with the default capacity.
   *
   * @param clock time source for acquisition timestamps
   * @param metrics metrics sink
   */
  public FrameBufferPool(ClockPort clock, MetricsPort metrics) {
    this(DEFAULT_CAPACITY, clock, metrics);
  }

  /**
   * Creates a pool with a custom capacity.
   *
   * @param capacity maximum live handles; must be positive
   * @param clock time source for acquisition timestamps
   * @param metrics metrics sink
   */
  public FrameBufferPool(int capacity, ClockPort clock, MetricsPort metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.live = new LinkedHashMap<>(capacity * 2);
  }

  @Override
  public long add(CapturedFrame frame) {
    Objects.requireNonNull(frame, "frame");
    long started = System.nanoTime();
    long evictedId = -1L;
    long id;
    lock.lock();
    try {
      if (live.size() >= capacity) {
        evictedId = evictOldestLocked();
      }
      id = nextId++;
      FrameHandle handle = new FrameHandle(id, frame, clock.nowMillis());
      live.put(id, handle);
      liveBytes += handle.sizeBytes();
      totalAllocated++;
      liveCount = live.size();
    } finally {
      lock.unlock();
    }
    metrics.observe("buffer.add.latencyNanos", System.nanoTime() - started);
    if (evictedId >= 0) {
      metrics.increment("buffer.evicted");
      log.trace("Evicted frame handle {} to admit {}", evictedId, id);
    }
    return id;
  }

  @Override
  public void release(long handleId) {
    boolean released;
    lock.lock();
    try {
      FrameHandle handle = live.remove(handleId);
      released = handle != null && releaseLocked(handle);
      liveCount = live.size();
    } finally {
      lock.unlock();
    }
    if (released) {
      metrics.increment("buffer.released");
    }
  }

  @Override
  public Optional<CapturedFrame> take(long handleId) {
    CapturedFrame frame;
    lock.lock();
    try {
      FrameHandle handle = live.remove(handleId);
      if (handle == null) {
        return Optional.empty();
      }
      liveCount = live.size();
      liveBytes -= handle.sizeBytes();
      totalReleased++;
      frame = handle.transfer();
    } finally {
      lock.unlock();
    }
    metrics.increment("buffer.released");
    return Optional.ofNullable(frame);
  }

  @Override
  public int releaseAll() {
    int released = 0;
    lock.lock();
    try {
      Iterator<FrameHandle> it = live.values().iterator();
      while (it.hasNext()) {
        FrameHandle handle = it.next();
        it.remove();
        if (releaseLocked(handle)) {
          released++;
        }
      }
      liveCount = 0;
    } finally {
      lock.unlock();
    }
    if (released > 0) {
      log.debug("Released {} frame handles", released);
    }
    return released;
  }

  @Override
  public int count() {
    return liveCount;
  }

  @Override
  public BufferPoolDiagnostics diagnostics() {
    long now = clock.nowMillis();
    lock.lock();
    try {
      long oldestAge = 0L;
      if (!live.isEmpty()) {
        FrameHandle oldest = live.values().iterator().next();
        oldestAge = Math.max(0L, now - oldest.acquiredAtMillis());
      }
      return new BufferPoolDiagnostics(
          live.size(), capacity, totalAllocated, totalEvicted, totalReleased, liveBytes, oldestAge);
    } finally {
      lock.unlock();
    }
  }

  public int capacity() {
    return capacity;
  }

  private long evictOldestLocked() {
    Iterator<Map.Entry<Long, FrameHandle>> it = live.entrySet().iterator();
    Map.Entry<Long, FrameHandle> eldest = it.next();
    it.remove();
    FrameHandle handle = eldest.getValue();
    if (handle.release()) {
      liveBytes -= handle.sizeBytes();
    }
    totalEvicted++;
    return eldest.getKey();
  }

  private boolean releaseLocked(FrameHandle handle) {
    if (!handle.release()) {
      return false;
    }
    liveBytes -= handle.sizeBytes();
    totalReleased++;
    return true;
  }
}
