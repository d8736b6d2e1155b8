package ca.gc.cra.screenlog.application.pipeline;

import ca.gc.cra.screenlog.application.port.CaptureSource;
import ca.gc.cra.screenlog.application.port.EncoderPort;
import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.chunk.ChunkFileName;
import ca.gc.cra.screenlog.domain.compression.CompletedChunk;
import ca.gc.cra.screenlog.domain.compression.CompressionSettings;
import ca.gc.cra.screenlog.domain.recording.DisplayConfiguration;
import ca.gc.cra.screenlog.domain.recording.DisplayInfo;
import ca.gc.cra.screenlog.domain.recording.SystemEvent;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

final class RecorderFixtures {
  static final DisplayConfiguration SINGLE =
      new DisplayConfiguration(List.of(new DisplayInfo(1, 1920, 1080, true)));
  static final DisplayConfiguration DUAL = new DisplayConfiguration(List.of(
      new DisplayInfo(1, 1920, 1080, true), new DisplayInfo(2, 1280, 1024, false)));

  private RecorderFixtures() {}

  /** Recorder settings scaled down so state changes happen within milliseconds. */
  static RecorderSettings fastSettings() {
    return new RecorderSettings(
        30,
        Duration.ofHours(1),
        Duration.ofMillis(50),
        100L * 1024 * 1024,
        Duration.ofMillis(100),
        Duration.ofMillis(20),
        Duration.ofMillis(20),
        new RetryPolicy(3, Duration.ofMillis(10)));
  }

  static boolean await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) {
        return true;
      }
      Thread.sleep(5);
    }
    return condition.getAsBoolean();
  }

  /** Capture source whose permission, display layout and frame supply are driven by the test. */
  static final class FakeCaptureSource implements CaptureSource {
    final AtomicInteger opens = new AtomicInteger();
    final AtomicInteger closes = new AtomicInteger();
    final AtomicInteger failOpens = new AtomicInteger();
    volatile boolean permission = true;
    volatile boolean stalled;
    volatile DisplayConfiguration displays = SINGLE;
    private volatile Listener listener;
    private volatile boolean open;

    @Override
    public boolean hasPermission() {
      return permission;
    }

    @Override
    public DisplayConfiguration currentDisplays() {
      return displays;
    }

    @Override
    public void open(DisplayConfiguration configuration) throws IOException {
      opens.incrementAndGet();
      if (failOpens.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
        throw new IOException("capture stream unavailable");
      }
      open = true;
    }

    @Override
    public Optional<CapturedFrame> nextFrame(Duration timeout) {
      if (!open) {
        throw new IllegalStateException("stream closed");
      }
      if (stalled) {
        return Optional.empty();
      }
      return Optional.of(new CapturedFrame(new byte[16], 4, 4, 1, System.currentTimeMillis()));
    }

    @Override
    public void setListener(Listener listener) {
      this.listener = listener;
    }

    @Override
    public void close() {
      open = false;
      closes.incrementAndGet();
    }

    void changeDisplays(DisplayConfiguration next) {
      displays = next;
      listener.onDisplaysChanged(next);
    }

    void raise(SystemEvent event) {
      listener.onSystemEvent(event);
    }
  }

  /** Encoder that writes nothing and reports each frame as one kilobyte. */
  static final class FakeEncoder implements EncoderPort {
    final Path directory;
    final List<CompletedChunk> finished = new CopyOnWriteArrayList<>();
    final AtomicInteger begun = new AtomicInteger();
    final AtomicInteger aborted = new AtomicInteger();
    final AtomicInteger frames = new AtomicInteger();
    volatile boolean failFinish;
    volatile boolean failAppend;
    volatile boolean failBegin;

    FakeEncoder(Path directory) {
      this.directory = directory;
    }

    @Override
    public Session begin(CompressionSettings settings, long startEpochSeconds) {
      begun.incrementAndGet();
      if (failBegin) {
        throw new IllegalStateException("encoder unavailable");
      }
      return new Session() {
        private int count;

        @Override
        public void append(CapturedFrame frame) throws IOException {
          if (failAppend) {
            throw new IOException("encoder rejected frame");
          }
          count++;
          frames.incrementAndGet();
        }

        @Override
        public CompletedChunk finish(long endEpochSeconds) throws IOException {
          if (failFinish) {
            throw new IOException("muxer failed");
          }
          CompletedChunk chunk = new CompletedChunk(
              chunkFile(startEpochSeconds, endEpochSeconds), count * 1_024L, startEpochSeconds,
              endEpochSeconds, count, settings);
          finished.add(chunk);
          return chunk;
        }

        @Override
        public void abort() {
          aborted.incrementAndGet();
        }

        @Override
        public int frameCount() {
          return count;
        }
      };
    }

    @Override
    public Path chunkFile(long startEpochSeconds, long endEpochSeconds) {
      return new ChunkFileName(startEpochSeconds, endEpochSeconds, "sfr").resolveIn(directory);
    }
  }
}
