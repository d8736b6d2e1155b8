package ca.gc.cra.screenlog.application.port;

import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.recording.DisplayConfiguration;
import ca.gc.cra.screenlog.domain.recording.SystemEvent;
import java.time.Duration;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that supplies screen frames and environment notifications to the recorder.
 * <p><strong>Why:</strong> Keeps the recording state machine agnostic of the platform capture API.</p>
 * <p><strong>Role:</strong> Application port implemented by platform adapters and by
 * {@code SyntheticCaptureSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report capture permission and the attached displays.</li>
 *   <li>Open and close the frame stream for a display configuration.</li>
 *   <li>Deliver frames with bounded blocking.</li>
 *   <li>Push display changes and system events to the registered listener.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #open}, {@link #nextFrame} and {@link #close} are called from the
 * recorder thread only; listener callbacks may arrive on any thread.</p>
 * <p><strong>Observability:</strong> Implementations may emit {@code capture.*} metrics.</p>
 *
 * @since 0.1.0
 */
public interface CaptureSource extends AutoCloseable {

  /**
   * Receives notifications raised by the capture platform.
   */
  interface Listener {
    /**
     * Called when displays were attached, detached or reconfigured.
     *
     * @param configuration newly observed configuration
     */
    void onDisplaysChanged(DisplayConfiguration configuration);

    /**
     * Called for sleep, wake, lock, unlock, permission and stream notifications.
     *
     * @param event observed event
     */
    void onSystemEvent(SystemEvent event);
  }

  /**
   * Reports whether screen capture is currently permitted.
   *
   * @return {@code true} when the process may capture the screen
   */
  boolean hasPermission();

  /**
   * Returns the currently attached displays.
   *
   * @return display snapshot; empty when none are attached
   */
  DisplayConfiguration currentDisplays();

  /**
   * Opens the frame stream for the given configuration.
   *
   * @param configuration displays to capture
   * @throws Exception if the stream cannot be opened
   */
  void open(DisplayConfiguration configuration) throws Exception;

  /**
   * Waits for the next frame.
   *
   * @param timeout maximum wait
   * @return next frame, or empty on timeout
   * @throws Exception if the stream failed
   */
  Optional<CapturedFrame> nextFrame(Duration timeout) throws Exception;

  /**
   * Registers the listener for platform notifications, replacing any previous one.
   *
   * @param listener listener; {@code null} clears the registration
   */
  void setListener(Listener listener);

  /**
   * Closes the frame stream. Safe to call when not open.
   */
  @Override
  void close();
}
