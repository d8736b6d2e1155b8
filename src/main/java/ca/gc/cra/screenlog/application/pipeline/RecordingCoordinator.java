package ca.gc.cra.screenlog.application.pipeline;

import ca.gc.cra.screenlog.application.compression.AdaptiveCompressionController;
import ca.gc.cra.screenlog.application.port.CaptureSource;
import ca.gc.cra.screenlog.application.port.ChunkStorePort;
import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.application.port.DiskSpacePort;
import ca.gc.cra.screenlog.application.port.EncoderPort;
import ca.gc.cra.screenlog.application.port.EventChannel;
import ca.gc.cra.screenlog.application.port.FramePoolPort;
import ca.gc.cra.screenlog.application.port.MetricsPort;
import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.compression.CompletedChunk;
import ca.gc.cra.screenlog.domain.compression.CompressionSettings;
import ca.gc.cra.screenlog.domain.compression.Resolution;
import ca.gc.cra.screenlog.domain.recording.DisplayConfiguration;
import ca.gc.cra.screenlog.domain.recording.DisplayInfo;
import ca.gc.cra.screenlog.domain.recording.ErrorCode;
import ca.gc.cra.screenlog.domain.recording.RecordingError;
import ca.gc.cra.screenlog.domain.recording.RecordingState;
import ca.gc.cra.screenlog.domain.recording.RecordingState.Phase;
import ca.gc.cra.screenlog.domain.recording.RecordingStatus;
import ca.gc.cra.screenlog.domain.recording.SystemEvent;
import ca.gc.cra.screenlog.infrastructure.events.BroadcastChannel;
import ca.gc.cra.screenlog.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Recording state machine tying capture, encoding, chunk rotation and persistence together.
 * <p><strong>Why:</strong> Display reconfiguration, sleep, lock screens and permission changes all interrupt capture;
 * one serialized owner keeps the lifecycle consistent and recovers from transient faults within a bounded budget.</p>
 * <p><strong>Role:</strong> Application service; the composition root wires its ports.</p>
 * <p><strong>Thread-safety:</strong> Every state mutation runs on the single {@code screenlog-recorder} thread.
 * Public methods enqueue work there and return {@link CompletableFuture}s. {@link #currentState()} reads a volatile
 * snapshot.</p>
 * <p><strong>Observability:</strong> Publishes every state change and error on {@link #status()}; emits
 * {@code recorder.frames}, {@code recorder.frame.timeout}, {@code recorder.chunks.completed},
 * {@code recorder.chunks.failed}, {@code recorder.restarts} and {@code recorder.errors}.</p>
 *
 * @since 0.1.0
 */
public final class RecordingCoordinator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RecordingCoordinator.class);
  private static final String THREAD_NAME = "screenlog-recorder";

  /** Settings key holding whether recording was active at last start/stop. */
  public static final String WAS_ACTIVE_KEY = "recording.wasActive";

  private final CaptureSource source;
  private final EncoderPort encoder;
  private final FramePoolPort pool;
  private final ChunkStorePort store;
  private final DiskSpacePort disk;
  private final AdaptiveCompressionController compression;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final RecorderSettings settings;

  private final ScheduledExecutorService executor;
  private final BroadcastChannel<RecordingStatus> status = new BroadcastChannel<>("recording-status");
  private final DisplayChangeDebouncer displayDebouncer;

  private volatile RecordingState state = RecordingState.idle();

  // Confined to the recorder thread.
  private long epoch;
  private int failedAttempts;
  private boolean streamOpen;
  private DisplayConfiguration activeDisplays = new DisplayConfiguration(null);
  private EncoderPort.Session session;
  private long chunkStartSeconds;
  private ScheduledFuture<?> frameTask;
  private ScheduledFuture<?> rotationTask;
  private ScheduledFuture<?> retryTask;
  private ScheduledFuture<?> resumeTask;

  public RecordingCoordinator(
      CaptureSource source,
      EncoderPort encoder,
      FramePoolPort pool,
      ChunkStorePort store,
      DiskSpacePort disk,
      AdaptiveCompressionController compression,
      ClockPort clock,
      MetricsPort metrics,
      RecorderSettings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.encoder = Objects.requireNonNull(encoder, "encoder");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.store = Objects.requireNonNull(store, "store");
    this.disk = Objects.requireNonNull(disk, "disk");
    this.compression = Objects.requireNonNull(compression, "compression");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.executor = ExecutorFactories.newScheduler(THREAD_NAME, true);
    this.displayDebouncer = new DisplayChangeDebouncer(
        executor, settings.displayDebounce(), config -> guarded("display change", () -> applyDisplayChange(config)));
    source.setListener(new CaptureSource.Listener() {
      @Override
      public void onDisplaysChanged(DisplayConfiguration configuration) {
        displayChanged(configuration);
      }

      @Override
      public void onSystemEvent(SystemEvent event) {
        handleSystemEvent(event);
      }
    });
  }

  /**
   * Starts recording from {@code IDLE} or {@code ERROR}. Permission and free disk space are checked before the
   * capture stream is opened; the returned state is {@code RECORDING}, {@code STARTING} while retrying, or
   * {@code ERROR}.
   */
  public CompletableFuture<RecordingState> start() {
    return submit("start", () -> {
      if (!state.is(Phase.IDLE) && !state.is(Phase.ERROR)) {
        log.debug("Start ignored in state {}", state);
        return state;
      }
      saveWasActive(true);
      beginStarting();
      return state;
    });
  }

  /**
   * Stops recording from any state, finalizing the in-flight chunk and releasing pooled frames. Idempotent.
   */
  public CompletableFuture<RecordingState> stop() {
    return halt(true);
  }

  private CompletableFuture<RecordingState> halt(boolean clearResumeFlag) {
    return submit("stop", () -> {
      if (state.is(Phase.IDLE)) {
        return state;
      }
      cancelActivity();
      displayDebouncer.cancel();
      transition(RecordingState.stopping());
      finishChunk();
      closeStream();
      int released = pool.releaseAll();
      if (released > 0) {
        log.debug("Released {} pooled frame(s) on stop", released);
      }
      if (clearResumeFlag) {
        saveWasActive(false);
      }
      transition(RecordingState.idle());
      return state;
    });
  }

  /**
   * Reacts to power, lock and permission events.
   */
  public CompletableFuture<RecordingState> handleSystemEvent(SystemEvent event) {
    Objects.requireNonNull(event, "event");
    return submit("system event " + event, () -> {
      log.info("System event {} in state {}", event, state);
      switch (event) {
        case SLEEP:
        case SCREEN_LOCKED:
          pause();
          break;
        case WAKE:
          scheduleResume(settings.wakeResumeDelay());
          break;
        case SCREEN_UNLOCKED:
          scheduleResume(settings.unlockResumeDelay());
          break;
        case PERMISSION_REVOKED:
          if (!state.is(Phase.IDLE)) {
            fail(RecordingError.permissionDenied(clock.nowMillis()));
          }
          break;
        case STREAM_INTERRUPTED:
          if (state.is(Phase.RECORDING)) {
            restartCapture(ErrorCode.FRAME_CAPTURE_TIMEOUT, "stream interrupted");
          }
          break;
        default:
          log.warn("Unhandled system event {}", event);
      }
      return state;
    });
  }

  /**
   * Feeds a display-configuration change through the debouncer; bursts collapse into one restart.
   */
  public void displayChanged(DisplayConfiguration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    try {
      displayDebouncer.submit(configuration);
    } catch (RejectedExecutionException ex) {
      log.debug("Display change ignored; recorder closed");
    }
  }

  /** Stream of state changes and errors. */
  public EventChannel<RecordingStatus> status() {
    return status;
  }

  public RecordingState currentState() {
    return state;
  }

  /**
   * Stops recording and shuts the recorder thread down. Unlike {@link #stop()} the persisted
   * {@value #WAS_ACTIVE_KEY} flag is left as is, so a process exit while recording resumes on the next start.
   */
  @Override
  public void close() {
    try {
      halt(false).get(10, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException | TimeoutException ex) {
      log.warn("Recorder did not stop cleanly", ex);
    } catch (RuntimeException ex) {
      log.debug("Recorder already closed", ex);
    }
    ExecutorFactories.shutdownGracefully(executor, 5_000L);
  }

  private void beginStarting() {
    cancelActivity();
    transition(RecordingState.starting());
    if (!source.hasPermission()) {
      fail(RecordingError.permissionDenied(clock.nowMillis()));
      return;
    }
    try {
      long available = disk.availableBytes();
      if (available < settings.minimumFreeBytes()) {
        fail(RecordingError.storageSpaceLow(available, clock.nowMillis()));
        return;
      }
    } catch (IOException ex) {
      log.warn("Unable to determine free disk space; continuing", ex);
    }
    failedAttempts = 0;
    attemptOpen(epoch, ErrorCode.FRAME_CAPTURE_TIMEOUT);
  }

  private void attemptOpen(long token, ErrorCode exhaustedCode) {
    if (token != epoch || !state.is(Phase.STARTING)) {
      return;
    }
    if (!source.hasPermission()) {
      fail(RecordingError.permissionDenied(clock.nowMillis()));
      return;
    }
    CapturedFrame first;
    try {
      DisplayConfiguration displays = source.currentDisplays();
      source.open(displays);
      streamOpen = true;
      first = source.nextFrame(settings.frameTimeout())
          .orElseThrow(() -> new TimeoutException(
              "no frame within " + settings.frameTimeout().toMillis() + " ms"));
      adoptDisplays(displays);
    } catch (Exception ex) {
      closeStream();
      failedAttempts++;
      if (!settings.retry().canRetry(failedAttempts)) {
        log.error("Capture could not be opened after {} attempt(s)", failedAttempts, ex);
        fail(errorFor(exhaustedCode, ex));
        return;
      }
      Duration delay = settings.retry().delayAfter(failedAttempts);
      log.warn("Capture attempt {}/{} failed ({}); retrying in {} ms",
          failedAttempts, settings.retry().maxAttempts(), ex.toString(), delay.toMillis());
      retryTask = schedule(delay, () -> attemptOpen(token, exhaustedCode));
      return;
    }
    failedAttempts = 0;
    // An unavailable encoder is fatal; reopening capture cannot fix it.
    try {
      beginChunk();
    } catch (Exception ex) {
      log.error("Encoder unavailable; recording cannot start", ex);
      fail(RecordingError.compressionFailed(describe(ex), clock.nowMillis()));
      return;
    }
    acceptFrame(first);
    transition(RecordingState.recording(activeDisplays.displayCount()));
    long period = settings.framePeriod().toMillis();
    frameTask = executor.scheduleWithFixedDelay(
        () -> guarded("frame", () -> captureTick(token)), period, period, TimeUnit.MILLISECONDS);
    long chunkMillis = settings.chunkDuration().toMillis();
    rotationTask = executor.scheduleAtFixedRate(
        () -> guarded("rotation", () -> rotate(token)), chunkMillis, chunkMillis, TimeUnit.MILLISECONDS);
  }

  private void captureTick(long token) {
    if (token != epoch || !state.is(Phase.RECORDING)) {
      return;
    }
    Optional<CapturedFrame> frame;
    try {
      frame = source.nextFrame(settings.frameTimeout());
    } catch (Exception ex) {
      log.warn("Frame capture failed", ex);
      restartCapture(ErrorCode.FRAME_CAPTURE_TIMEOUT, ex.toString());
      return;
    }
    if (frame.isEmpty()) {
      metrics.increment("recorder.frame.timeout");
      restartCapture(ErrorCode.FRAME_CAPTURE_TIMEOUT, "frame timeout");
      return;
    }
    acceptFrame(frame.get());
  }

  private void acceptFrame(CapturedFrame frame) {
    long handle = pool.add(frame);
    Optional<CapturedFrame> owned = pool.take(handle);
    if (owned.isEmpty()) {
      log.debug("Frame {} evicted before encoding", handle);
      return;
    }
    if (session == null) {
      return;
    }
    try {
      session.append(owned.get());
      metrics.increment("recorder.frames");
    } catch (Exception ex) {
      log.warn("Encoder rejected frame; starting a new chunk", ex);
      abortChunk();
      emitError(RecordingError.compressionFailed(describe(ex), clock.nowMillis()));
      try {
        beginChunk();
      } catch (Exception restartFailure) {
        fail(RecordingError.compressionFailed(describe(restartFailure), clock.nowMillis()));
      }
    }
  }

  private void rotate(long token) {
    if (token != epoch || !state.is(Phase.RECORDING)) {
      return;
    }
    int displays = state.displayCount();
    transition(RecordingState.finishing());
    finishChunk();
    try {
      beginChunk();
    } catch (Exception ex) {
      fail(RecordingError.compressionFailed(describe(ex), clock.nowMillis()));
      return;
    }
    transition(RecordingState.recording(displays));
  }

  private void pause() {
    if (!state.isActive()) {
      log.debug("Pause ignored in state {}", state);
      return;
    }
    cancelActivity();
    finishChunk();
    closeStream();
    transition(RecordingState.paused());
  }

  private void scheduleResume(Duration delay) {
    if (!state.is(Phase.PAUSED)) {
      return;
    }
    if (resumeTask != null) {
      resumeTask.cancel(false);
    }
    long token = epoch;
    resumeTask = schedule(delay, () -> {
      if (token == epoch && state.is(Phase.PAUSED)) {
        log.info("Resuming capture");
        beginStarting();
      }
    });
  }

  private void applyDisplayChange(DisplayConfiguration next) {
    if (!state.is(Phase.RECORDING)) {
      log.debug("Display change noted in state {}", state);
      return;
    }
    if (!activeDisplays.requiresRestart(next)) {
      log.debug("Display change does not affect capture");
      return;
    }
    log.info("Display configuration changed ({} -> {} display(s)); restarting capture",
        activeDisplays.displayCount(), next.displayCount());
    restartCapture(ErrorCode.DISPLAY_CONFIGURATION_CHANGED, "display configuration changed");
  }

  private void restartCapture(ErrorCode exhaustedCode, String reason) {
    metrics.increment("recorder.restarts");
    log.info("Restarting capture: {}", reason);
    cancelActivity();
    finishChunk();
    closeStream();
    transition(RecordingState.starting());
    failedAttempts = 0;
    attemptOpen(epoch, exhaustedCode);
  }

  private void fail(RecordingError error) {
    cancelActivity();
    finishChunk();
    closeStream();
    metrics.increment("recorder.errors");
    RecordingState next = RecordingState.error(error.code());
    state = next;
    log.error("Recording error {}: {}", error.code().code(), error.message());
    status.publish(RecordingStatus.failure(clock.nowMillis(), next, error));
  }

  private void beginChunk() throws Exception {
    chunkStartSeconds = clock.nowEpochSeconds();
    session = encoder.begin(compression.currentSettings(), chunkStartSeconds);
  }

  private void abortChunk() {
    if (session != null) {
      session.abort();
      session = null;
    }
  }

  private void finishChunk() {
    EncoderPort.Session current = session;
    if (current == null) {
      return;
    }
    session = null;
    if (current.frameCount() == 0) {
      current.abort();
      return;
    }
    long start = chunkStartSeconds;
    long end = Math.max(start, clock.nowEpochSeconds());
    CompletedChunk chunk;
    try {
      chunk = current.finish(end);
    } catch (Exception ex) {
      current.abort();
      log.warn("Encoder failed to finalize chunk starting at {}", start, ex);
      metrics.increment("recorder.chunks.failed");
      emitError(RecordingError.compressionFailed(describe(ex), clock.nowMillis()));
      recordFailedChunk(encoder.chunkFile(start, end), start, end);
      return;
    }
    try {
      long id = store.registerChunk(chunk.file(), chunk.startEpochSeconds(), chunk.endEpochSeconds());
      store.markCompleted(id);
      metrics.increment("recorder.chunks.completed");
    } catch (RuntimeException ex) {
      log.error("Unable to record chunk {}", chunk.file(), ex);
      emitError(RecordingError.databaseWriteFailed(describe(ex), clock.nowMillis()));
    }
    compression.analyzeAndAdjust(chunk).ifPresent(next ->
        log.info("Next chunk uses bitrate {} bps", next.effectiveBitrate()));
  }

  private void recordFailedChunk(Path file, long start, long end) {
    try {
      long id = store.registerChunk(file, start, end);
      store.markFailed(id);
    } catch (RuntimeException ex) {
      log.error("Unable to record failed chunk {}", file, ex);
      emitError(RecordingError.databaseWriteFailed(describe(ex), clock.nowMillis()));
    }
  }

  private void adoptDisplays(DisplayConfiguration displays) {
    activeDisplays = displays;
    DisplayInfo primary = displays.primaryDisplay();
    if (primary == null) {
      return;
    }
    CompressionSettings current = compression.currentSettings();
    Resolution resolution = new Resolution(primary.width(), primary.height());
    if (!current.resolution().equals(resolution)) {
      compression.rebase(current.withResolution(resolution));
    }
  }

  private void closeStream() {
    if (streamOpen) {
      streamOpen = false;
      source.close();
    }
  }

  private void cancelActivity() {
    epoch++;
    frameTask = cancel(frameTask);
    rotationTask = cancel(rotationTask);
    retryTask = cancel(retryTask);
    resumeTask = cancel(resumeTask);
  }

  private static ScheduledFuture<?> cancel(ScheduledFuture<?> task) {
    if (task != null) {
      task.cancel(false);
    }
    return null;
  }

  private void saveWasActive(boolean active) {
    try {
      store.saveSetting(WAS_ACTIVE_KEY, active);
    } catch (RuntimeException ex) {
      log.warn("Unable to persist recording flag", ex);
      emitError(RecordingError.databaseWriteFailed(describe(ex), clock.nowMillis()));
    }
  }

  private void transition(RecordingState next) {
    RecordingState previous = state;
    state = next;
    if (!previous.equals(next)) {
      log.info("Recording state {} -> {}", previous, next);
    }
    status.publish(RecordingStatus.stateChanged(clock.nowMillis(), next));
  }

  private void emitError(RecordingError error) {
    metrics.increment("recorder.errors");
    status.publish(RecordingStatus.failure(clock.nowMillis(), state, error));
  }

  private RecordingError errorFor(ErrorCode code, Exception cause) {
    long now = clock.nowMillis();
    switch (code) {
      case DISPLAY_CONFIGURATION_CHANGED:
        return RecordingError.displayConfigurationChanged(now);
      case COMPRESSION_FAILED:
        return RecordingError.compressionFailed(describe(cause), now);
      case PERMISSION_DENIED:
        return RecordingError.permissionDenied(now);
      default:
        return RecordingError.frameCaptureTimeout(now);
    }
  }

  private ScheduledFuture<?> schedule(Duration delay, Runnable work) {
    return executor.schedule(() -> guarded("scheduled", work), delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void guarded(String action, Runnable work) {
    MDC.put("pipeline", "recorder");
    try {
      work.run();
    } catch (RuntimeException ex) {
      log.error("Recorder {} task failed", action, ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private <T> CompletableFuture<T> submit(String action, Callable<T> work) {
    CompletableFuture<T> future = new CompletableFuture<>();
    try {
      executor.execute(() -> {
        MDC.put("pipeline", "recorder");
        try {
          future.complete(work.call());
        } catch (Exception ex) {
          log.error("Recorder {} failed", action, ex);
          future.completeExceptionally(ex);
        } finally {
          MDC.remove("pipeline");
        }
      });
    } catch (RejectedExecutionException ex) {
      future.completeExceptionally(new IllegalStateException("recorder is closed", ex));
    }
    return future;
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
