package ca.gc.cra.screenlog.application.monitor;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.application.port.EventChannel;
import ca.gc.cra.screenlog.application.port.MemoryProbePort;
import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.memory.AlertSeverity;
import ca.gc.cra.screenlog.domain.memory.MemoryAlert;
import ca.gc.cra.screenlog.domain.memory.MemoryPressure;
import ca.gc.cra.screenlog.domain.memory.MemorySnapshot;
import ca.gc.cra.screenlog.infrastructure.buffer.FrameBufferPool;
import ca.gc.cra.screenlog.testing.InMemoryChunkStore;
import ca.gc.cra.screenlog.testing.MutableClock;
import ca.gc.cra.screenlog.testing.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemoryMonitorTest {
  private MutableClock clock;
  private RecordingMetricsPort metrics;
  private FakeProbe probe;
  private FrameBufferPool pool;
  private MemoryMonitor monitor;
  private EventChannel.Subscription<MemoryAlert> alerts;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(1_000_000L);
    metrics = new RecordingMetricsPort();
    probe = new FakeProbe();
    pool = new FrameBufferPool(10, clock, metrics);
    monitor = new MemoryMonitor(probe, pool, new InMemoryChunkStore(), clock, metrics, MonitorSettings.defaults());
    alerts = monitor.alerts().subscribe(32);
  }

  @AfterEach
  void tearDown() {
    monitor.close();
  }

  @Test
  void snapshotCombinesProbePoolAndStore() {
    probe.set(600, 400, 17);
    pool.add(new CapturedFrame(new byte[4], 2, 2, 1, 0L));

    MemorySnapshot snapshot = monitor.sampleNow();

    assertEquals(60.0, snapshot.memoryUsagePercent(), 1e-9);
    assertEquals(MemoryPressure.NORMAL, snapshot.memoryPressure());
    assertEquals(1, snapshot.bufferCount());
    assertEquals(17, snapshot.activeThreadCount());
    assertEquals(1, snapshot.persistenceConnectionCount().getAsInt());
    assertEquals(clock.nowMillis(), snapshot.timestampMillis());
    assertTrue(alerts.drain().isEmpty());
    assertTrue(metrics.hasObservation("memory.sample.latencyNanos"));
  }

  @Test
  void warningAlertIsDebouncedForSixtySeconds() {
    probe.set(750, 250, 1);

    monitor.sampleNow();
    clock.advance(Duration.ofSeconds(30));
    monitor.sampleNow();
    clock.advance(Duration.ofSeconds(31));
    monitor.sampleNow();

    List<MemoryAlert> raised = alerts.drain();
    assertEquals(2, raised.size());
    assertTrue(raised.stream().allMatch(alert -> alert.severity() == AlertSeverity.WARNING));
    assertEquals("High memory usage: 75% (750MB / 1000MB)", raised.get(0).message());
    assertFalse(raised.get(0).isLeakAlert());
    assertEquals(2, metrics.count("memory.alert.warning"));
  }

  @Test
  void criticalAndWarningAreDebouncedIndependently() {
    probe.set(750, 250, 1);
    monitor.sampleNow();
    probe.set(950, 50, 1);
    clock.advance(Duration.ofSeconds(10));
    monitor.sampleNow();
    clock.advance(Duration.ofSeconds(10));
    monitor.sampleNow();

    List<MemoryAlert> raised = alerts.drain();
    assertEquals(2, raised.size());
    assertEquals(AlertSeverity.WARNING, raised.get(0).severity());
    assertEquals(AlertSeverity.CRITICAL, raised.get(1).severity());
    assertTrue(raised.get(1).message().startsWith("Critical memory usage: 95%"), raised.get(1).message());
  }

  @Test
  void steadyGrowthRaisesLeakAlert() {
    monitor.close();
    monitor = new MemoryMonitor(probe, pool, new InMemoryChunkStore(), clock, metrics,
        MonitorSettings.defaults().withMinimumLeakSamples(6));
    alerts = monitor.alerts().subscribe(32);

    for (double used : new double[] {500, 520, 540, 555, 570, 585}) {
      probe.set(used, 8_000, 1);
      monitor.sampleNow();
      clock.advance(Duration.ofSeconds(10));
    }

    List<MemoryAlert> raised = alerts.drain();
    assertEquals(1, raised.size());
    MemoryAlert leak = raised.get(0);
    assertTrue(leak.isLeakAlert());
    assertEquals(AlertSeverity.CRITICAL, leak.severity());
    assertEquals(17.0, leak.growthRatePercent().getAsDouble(), 1e-9);
    assertEquals(Duration.ofMinutes(5), leak.detectionWindow().orElseThrow());
    assertEquals("Memory leak detected: 17.0% growth over 5 minutes", leak.message());
    assertEquals(1, metrics.count("memory.alert.leak"));
  }

  @Test
  void transientSpikeDoesNotRaiseLeakAlert() {
    monitor.close();
    monitor = new MemoryMonitor(probe, pool, new InMemoryChunkStore(), clock, metrics,
        MonitorSettings.defaults().withMinimumLeakSamples(6));
    alerts = monitor.alerts().subscribe(32);

    for (double used : new double[] {500, 600, 620, 550, 510, 505}) {
      probe.set(used, 8_000, 1);
      monitor.sampleNow();
      clock.advance(Duration.ofSeconds(10));
    }

    assertTrue(alerts.drain().isEmpty());
  }

  @Test
  void historyIsBoundedAndTrendFiltersByAge() {
    probe.set(100, 900, 1);
    for (int i = 0; i < 400; i++) {
      monitor.sampleNow();
      clock.advance(Duration.ofSeconds(10));
    }

    assertEquals(360, monitor.historySize());
    assertEquals(6, monitor.trend(1).size());
    assertEquals(360, monitor.trend(24 * 60).size());
    assertThrows(IllegalArgumentException.class, () -> monitor.trend(-1));
  }

  @Test
  void currentSnapshotDoesNotTouchHistory() {
    probe.set(100, 900, 1);
    monitor.currentSnapshot();
    assertEquals(0, monitor.historySize());
  }

  @Test
  void forceCleanupReleasesPooledFrames() {
    for (int i = 0; i < 4; i++) {
      pool.add(new CapturedFrame(new byte[8], 2, 4, 1, 0L));
    }

    assertEquals(4, monitor.forceCleanup());
    assertEquals(0, pool.count());
  }

  @Test
  void periodicSamplingStartsAndStops() throws Exception {
    probe.set(100, 900, 1);
    assertThrows(IllegalArgumentException.class, () -> monitor.startMonitoring(0));

    monitor.startMonitoring(1);
    monitor.startMonitoring(1);
    assertTrue(monitor.isMonitoring());

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (monitor.historySize() == 0 && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertTrue(monitor.historySize() >= 1);

    monitor.stopMonitoring();
    assertFalse(monitor.isMonitoring());
    monitor.stopMonitoring();
  }

  @Test
  void samplingDoesNotWaitForPoolWriters() throws Exception {
    CountDownLatch insideAdd = new CountDownLatch(1);
    CountDownLatch finishAdd = new CountDownLatch(1);
    AtomicBoolean stall = new AtomicBoolean();
    ClockPort stallingClock = () -> {
      if (stall.get()) {
        insideAdd.countDown();
        try {
          finishAdd.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }
      return 1_000L;
    };
    FrameBufferPool busyPool = new FrameBufferPool(10, stallingClock, metrics);
    busyPool.add(new CapturedFrame(new byte[4], 2, 2, 1, 0L));
    MemoryMonitor sampler = new MemoryMonitor(
        probe, busyPool, new InMemoryChunkStore(), clock, metrics, MonitorSettings.defaults());
    ExecutorService writer = Executors.newSingleThreadExecutor();
    try {
      stall.set(true);
      Future<Long> pendingAdd = writer.submit(() -> busyPool.add(new CapturedFrame(new byte[4], 2, 2, 1, 1L)));
      assertTrue(insideAdd.await(5, TimeUnit.SECONDS));

      MemorySnapshot snapshot = assertTimeoutPreemptively(Duration.ofSeconds(2), sampler::sampleNow);
      assertEquals(1, snapshot.bufferCount());

      finishAdd.countDown();
      pendingAdd.get(5, TimeUnit.SECONDS);
      assertEquals(2, sampler.sampleNow().bufferCount());
    } finally {
      finishAdd.countDown();
      writer.shutdownNow();
      sampler.close();
    }
  }

  private static final class FakeProbe implements MemoryProbePort {
    private volatile Reading reading = new Reading(0, 1, 1);

    void set(double usedMb, double availableMb, int threads) {
      reading = new Reading(usedMb, availableMb, threads);
    }

    @Override
    public Reading read() {
      return reading;
    }
  }
}
