package ca.gc.cra.screenlog.application.retention;

import ca.gc.cra.screenlog.application.port.MetricsPort;
import ca.gc.cra.screenlog.config.RetentionConfig;
import ca.gc.cra.screenlog.domain.chunk.CleanupStats;
import ca.gc.cra.screenlog.domain.chunk.StorageUsage;
import ca.gc.cra.screenlog.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.screenlog.infrastructure.persistence.PersistenceCoordinator;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Applies the retention policy on a schedule and reports quota usage.
 * <p><strong>Why:</strong> Continuous recording fills the disk; old chunks must go even when nobody asks.</p>
 * <p><strong>Role:</strong> Application service over {@link PersistenceCoordinator}; the policy is persisted under
 * {@link #POLICY_KEY}.</p>
 * <p><strong>Thread-safety:</strong> Policy and schedule are guarded by one lock. Cleanup runs on the
 * {@code screenlog-retention} thread or on the caller's thread for {@link #performCleanup()}.</p>
 * <p><strong>Observability:</strong> Emits {@code retention.cleanup.runs}, {@code retention.cleanup.failed} and
 * {@code retention.bytesFreed}.</p>
 *
 * @since 0.1.0
 */
public final class RetentionService implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RetentionService.class);
  private static final String THREAD_NAME = "screenlog-retention";

  /** Settings key holding the JSON policy. */
  public static final String POLICY_KEY = "retention.policy";
  /** Share of the quota above which {@link #isApproachingQuota()} reports true. */
  public static final double QUOTA_WARNING_FRACTION = 0.9;

  private final PersistenceCoordinator store;
  private final Path recordingsRoot;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();

  private RetentionConfig policy;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> task;
  private int scheduledIntervalHours;

  public RetentionService(PersistenceCoordinator store, Path recordingsRoot, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.recordingsRoot = Objects.requireNonNull(recordingsRoot, "recordingsRoot");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.policy = store.loadSetting(POLICY_KEY, RetentionConfig.class, RetentionConfig.defaults());
  }

  /**
   * Starts periodic cleanup every {@code cleanupIntervalHours}. The first pass runs after one interval.
   * A no-op when already started or when the policy is disabled.
   */
  public void start() {
    lock.lock();
    try {
      if (scheduler != null) {
        return;
      }
      scheduler = ExecutorFactories.newScheduler(THREAD_NAME, true);
      reschedule();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs one cleanup pass now.
   *
   * @return cleanup outcome, or empty when the policy is disabled or the pass failed
   */
  public Optional<CleanupStats> performCleanup() {
    RetentionConfig current = policy();
    if (!current.enabled()) {
      log.debug("Retention disabled; skipping cleanup");
      return Optional.empty();
    }
    try {
      CleanupStats stats = store.cleanupOldChunks(current.retentionDays());
      metrics.increment("retention.cleanup.runs");
      metrics.observe("retention.bytesFreed", stats.bytesFreed());
      if (stats.chunksFound() > 0) {
        log.info("Retention cleanup freed {} MB across {} chunk(s)",
            String.format(Locale.ROOT, "%.1f", stats.megabytesFreed()), stats.recordsDeleted());
      }
      if (isApproachingQuota()) {
        log.warn("Storage usage at {}% of the {} GB quota",
            String.format(Locale.ROOT, "%.1f", storageUsagePercentage()), current.maxStorageGB());
      }
      return Optional.of(stats);
    } catch (RuntimeException ex) {
      metrics.increment("retention.cleanup.failed");
      log.error("Retention cleanup failed", ex);
      return Optional.empty();
    }
  }

  /**
   * Validates, persists and applies a new policy; the schedule is rebuilt when the interval or the enabled flag
   * changed.
   *
   * @param next new policy
   */
  public void updatePolicy(RetentionConfig next) {
    Objects.requireNonNull(next, "next");
    RetentionConfig.validate(next.retentionDays(), next.maxStorageGB(), next.cleanupIntervalHours());
    store.saveSetting(POLICY_KEY, next);
    lock.lock();
    try {
      RetentionConfig previous = policy;
      policy = next;
      if (scheduler != null
          && (previous.enabled() != next.enabled()
              || previous.cleanupIntervalHours() != next.cleanupIntervalHours())) {
        reschedule();
      }
    } finally {
      lock.unlock();
    }
    log.info("Retention policy updated: {}", next);
  }

  public RetentionConfig policy() {
    lock.lock();
    try {
      return policy;
    } finally {
      lock.unlock();
    }
  }

  public StorageUsage storageUsage() {
    return store.storageUsage(recordingsRoot);
  }

  /** Usage as a percentage of {@code maxStorageGB}; may exceed 100. */
  public double storageUsagePercentage() {
    return storageUsage().fractionOf(policy().maxStorageBytes()) * 100.0;
  }

  public boolean isApproachingQuota() {
    return storageUsage().fractionOf(policy().maxStorageBytes()) > QUOTA_WARNING_FRACTION;
  }

  /** Hours between scheduled passes, or 0 when nothing is scheduled. */
  public int scheduledIntervalHours() {
    lock.lock();
    try {
      return task == null ? 0 : scheduledIntervalHours;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    ScheduledExecutorService executor;
    lock.lock();
    try {
      if (task != null) {
        task.cancel(false);
        task = null;
      }
      executor = scheduler;
      scheduler = null;
    } finally {
      lock.unlock();
    }
    ExecutorFactories.shutdownGracefully(executor, 5_000L);
  }

  private void reschedule() {
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (!policy.enabled()) {
      log.info("Retention disabled; no cleanup scheduled");
      return;
    }
    scheduledIntervalHours = policy.cleanupIntervalHours();
    task = scheduler.scheduleAtFixedRate(
        this::tick, scheduledIntervalHours, scheduledIntervalHours, TimeUnit.HOURS);
    log.info("Retention cleanup scheduled every {} hour(s), keeping {} day(s)",
        scheduledIntervalHours, policy.retentionDays());
  }

  private void tick() {
    MDC.put("pipeline", "retention");
    try {
      performCleanup();
    } finally {
      MDC.remove("pipeline");
    }
  }
}
