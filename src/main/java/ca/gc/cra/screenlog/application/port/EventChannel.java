package ca.gc.cra.screenlog.application.port;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Typed broadcast channel between a producer (recorder, monitor) and any number of
 * observers.
 * <p><strong>Why:</strong> Observers subscribe and unsubscribe independently of the producer's lifetime, and a slow
 * observer can never block the producer.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code BroadcastChannel}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent publish and subscribe.</p>
 *
 * @param <T> event type
 * @since 0.1.0
 */
public interface EventChannel<T> {

  /**
   * Delivers an event to every current subscriber. Never blocks.
   *
   * @param event event to publish
   */
  void publish(T event);

  /**
   * Opens a queue-backed subscription. When the queue is full the oldest event is dropped.
   *
   * @param capacity maximum buffered events
   * @return open subscription
   */
  Subscription<T> subscribe(int capacity);

  /**
   * Registers a callback invoked on the publishing thread. Exceptions thrown by the callback are logged and
   * swallowed by the channel.
   *
   * @param handler callback
   * @return registration; closing it removes the callback
   */
  Registration onEvent(Consumer<? super T> handler);

  /**
   * Handle to a callback registration.
   */
  interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  /**
   * Queue-backed subscription.
   *
   * @param <T> event type
   */
  interface Subscription<T> extends Registration {
    /**
     * Waits for the next event.
     *
     * @param timeout maximum wait
     * @return next event, or empty on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> poll(Duration timeout) throws InterruptedException;

    /**
     * Removes and returns all buffered events.
     *
     * @return buffered events, oldest first
     */
    List<T> drain();

    /**
     * Returns how many events were dropped because the queue was full.
     *
     * @return dropped count
     */
    long dropped();
  }
}
