package ca.gc.cra.screenlog.infrastructure.events;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.screenlog.application.port.EventChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BroadcastChannelTest {
  @Test
  void everySubscriberReceivesEveryEvent() throws Exception {
    BroadcastChannel<String> channel = new BroadcastChannel<>("test");
    EventChannel.Subscription<String> first = channel.subscribe(8);
    EventChannel.Subscription<String> second = channel.subscribe(8);

    channel.publish("a");
    channel.publish("b");

    assertEquals(List.of("a", "b"), first.drain());
    assertEquals("a", second.poll(Duration.ofMillis(10)).orElseThrow());
    assertEquals("b", second.poll(Duration.ofMillis(10)).orElseThrow());
    assertTrue(second.poll(Duration.ofMillis(1)).isEmpty());
  }

  @Test
  void fullQueueDropsOldestEvent() {
    BroadcastChannel<Integer> channel = new BroadcastChannel<>("test");
    EventChannel.Subscription<Integer> subscription = channel.subscribe(2);

    channel.publish(1);
    channel.publish(2);
    channel.publish(3);

    assertEquals(List.of(2, 3), subscription.drain());
    assertEquals(1L, subscription.dropped());
  }

  @Test
  void closedRegistrationsStopReceiving() {
    BroadcastChannel<String> channel = new BroadcastChannel<>("test");
    List<String> seen = new ArrayList<>();
    EventChannel.Registration registration = channel.onEvent(seen::add);
    EventChannel.Subscription<String> subscription = channel.subscribe(4);
    assertEquals(2, channel.subscriberCount());

    channel.publish("before");
    registration.close();
    subscription.close();
    channel.publish("after");

    assertEquals(List.of("before"), seen);
    assertEquals(0, channel.subscriberCount());
  }

  @Test
  void failingHandlerDoesNotBlockOthers() {
    BroadcastChannel<String> channel = new BroadcastChannel<>("test");
    List<String> seen = new ArrayList<>();
    channel.onEvent(event -> {
      throw new IllegalStateException("boom");
    });
    channel.onEvent(seen::add);

    channel.publish("event");

    assertEquals(List.of("event"), seen);
  }
}
