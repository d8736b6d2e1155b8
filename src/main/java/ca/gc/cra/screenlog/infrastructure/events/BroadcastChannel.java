package ca.gc.cra.screenlog.infrastructure.events;

import ca.gc.cra.screenlog.application.port.EventChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link EventChannel} fanning each event out to callbacks and bounded subscriber queues.
 *
 * <p>Publishing never blocks: a full subscriber queue drops its oldest event and counts the drop. Callbacks run on
 * the publishing thread; their exceptions are logged.</p>
 *
 * @param <T> event type
 * @since 0.1.0
 */
public final class BroadcastChannel<T> implements EventChannel<T> {
  private static final Logger log = LoggerFactory.getLogger(BroadcastChannel.class);

  private final String name;
  private final CopyOnWriteArrayList<QueueSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final CopyOnWriteArrayList<Consumer<? super T>> handlers = new CopyOnWriteArrayList<>();

  /**
   * Creates a channel.
   *
   * @param name label used in log messages
   */
  public BroadcastChannel(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  @Override
  public void publish(T event) {
    Objects.requireNonNull(event, "event");
    for (QueueSubscription subscription : subscriptions) {
      subscription.offer(event);
    }
    for (Consumer<? super T> handler : handlers) {
      try {
        handler.accept(event);
      } catch (RuntimeException ex) {
        log.warn("{} handler failed for event {}", name, event, ex);
      }
    }
  }

  @Override
  public Subscription<T> subscribe(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    QueueSubscription subscription = new QueueSubscription(capacity);
    subscriptions.add(subscription);
    return subscription;
  }

  @Override
  public Registration onEvent(Consumer<? super T> handler) {
    Objects.requireNonNull(handler, "handler");
    handlers.add(handler);
    return () -> handlers.remove(handler);
  }

  /**
   * Returns the number of open subscriptions and callbacks.
   *
   * @return subscriber count
   */
  public int subscriberCount() {
    return subscriptions.size() + handlers.size();
  }

  private final class QueueSubscription implements Subscription<T> {
    private final ArrayBlockingQueue<T> queue;
    private final AtomicLong dropped = new AtomicLong();

    private QueueSubscription(int capacity) {
      this.queue = new ArrayBlockingQueue<>(capacity);
    }

    private void offer(T event) {
      while (!queue.offer(event)) {
        if (queue.poll() != null) {
          long total = dropped.incrementAndGet();
          if (total == 1 || total % 100 == 0) {
            log.warn("{} subscriber queue full; dropped {} events so far", name, total);
          }
        }
      }
    }

    @Override
    public Optional<T> poll(Duration timeout) throws InterruptedException {
      return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    @Override
    public List<T> drain() {
      List<T> events = new ArrayList<>(queue.size());
      queue.drainTo(events);
      return events;
    }

    @Override
    public long dropped() {
      return dropped.get();
    }

    @Override
    public void close() {
      subscriptions.remove(this);
      queue.clear();
    }
  }
}
