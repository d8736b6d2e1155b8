package ca.gc.cra.screenlog.infrastructure.capture;

import ca.gc.cra.screenlog.application.port.CaptureSource;
import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.recording.DisplayConfiguration;
import ca.gc.cra.screenlog.domain.recording.DisplayInfo;
import ca.gc.cra.screenlog.domain.recording.SystemEvent;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SplittableRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CaptureSource} that fabricates downsampled frames of a mostly static desktop.
 * <p><strong>Why:</strong> Drives the recorder from the CLI and from tests on machines without screen-capture
 * access.</p>
 * <p><strong>Role:</strong> Infrastructure adapter on the capture side.</p>
 * <p><strong>Behavior:</strong> Each frame keeps the previous content and repaints one small block, so consecutive
 * frames compress well. Display changes and system events are injected through {@link #changeDisplays} and
 * {@link #raise}.</p>
 * <p><strong>Thread-safety:</strong> Frame generation is confined to the recorder thread; the injection methods may be
 * called from any thread.</p>
 *
 * @since 0.1.0
 */
public final class SyntheticCaptureSource implements CaptureSource {
  private static final Logger log = LoggerFactory.getLogger(SyntheticCaptureSource.class);
  private static final int DOWNSAMPLE = 16;
  private static final int BLOCK = 64;

  private final ClockPort clock;
  private final SplittableRandom random;

  private volatile DisplayConfiguration displays;
  private volatile boolean permission = true;
  private volatile Listener listener;
  private volatile boolean open;
  private byte[] canvas = new byte[0];
  private DisplayInfo target;
  private int frameWidth;
  private int frameHeight;
  private long generated;

  /**
   * Creates a source reporting a single primary display of the given size.
   */
  public SyntheticCaptureSource(int width, int height, ClockPort clock, long seed) {
    this(new DisplayConfiguration(List.of(new DisplayInfo(1, width, height, true))), clock, seed);
  }

  public SyntheticCaptureSource(DisplayConfiguration displays, ClockPort clock, long seed) {
    this.displays = Objects.requireNonNull(displays, "displays");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = new SplittableRandom(seed);
  }

  @Override
  public boolean hasPermission() {
    return permission;
  }

  @Override
  public DisplayConfiguration currentDisplays() {
    return displays;
  }

  @Override
  public void open(DisplayConfiguration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    if (!permission) {
      throw new IllegalStateException("screen capture permission not granted");
    }
    DisplayInfo primary = configuration.primaryDisplay();
    if (primary == null) {
      throw new IllegalArgumentException("no display to capture");
    }
    this.target = primary;
    this.frameWidth = Math.max(1, primary.width() / DOWNSAMPLE);
    this.frameHeight = Math.max(1, primary.height() / DOWNSAMPLE);
    this.canvas = new byte[frameWidth * frameHeight];
    random.nextBytes(canvas);
    this.open = true;
    log.info("Synthetic capture opened on display {} ({}x{}, {}x{} samples)",
        primary.id(), primary.width(), primary.height(), frameWidth, frameHeight);
  }

  @Override
  public Optional<CapturedFrame> nextFrame(Duration timeout) {
    if (!open) {
      throw new IllegalStateException("capture stream not open");
    }
    int start = canvas.length <= BLOCK ? 0 : random.nextInt(canvas.length - BLOCK);
    int end = Math.min(canvas.length, start + BLOCK);
    for (int i = start; i < end; i++) {
      canvas[i] = (byte) random.nextInt(256);
    }
    generated++;
    return Optional.of(new CapturedFrame(
        canvas, frameWidth, frameHeight, target.id(), clock.nowMillis()));
  }

  @Override
  public void setListener(Listener listener) {
    this.listener = listener;
  }

  /**
   * Replaces the reported display layout and notifies the listener.
   */
  public void changeDisplays(DisplayConfiguration next) {
    this.displays = Objects.requireNonNull(next, "next");
    Listener current = listener;
    if (current != null) {
      current.onDisplaysChanged(next);
    }
  }

  /**
   * Delivers a system event to the listener. {@link SystemEvent#PERMISSION_REVOKED} also withdraws permission.
   */
  public void raise(SystemEvent event) {
    Objects.requireNonNull(event, "event");
    if (event == SystemEvent.PERMISSION_REVOKED) {
      permission = false;
    }
    Listener current = listener;
    if (current != null) {
      current.onSystemEvent(event);
    }
  }

  public void setPermission(boolean granted) {
    this.permission = granted;
  }

  @Override
  public void close() {
    if (open) {
      open = false;
      log.info("Synthetic capture closed after {} frames", generated);
    }
  }
}
