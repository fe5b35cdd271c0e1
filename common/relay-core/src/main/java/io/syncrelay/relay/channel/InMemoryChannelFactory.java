package io.syncrelay.relay.channel;

import io.syncrelay.relay.support.RelayClock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link InMemoryLeasedChannel} per queue identifier, so every component of a JVM
 * opening the same queue shares its messages.
 */
public final class InMemoryChannelFactory implements LeasedChannelFactory {

  private final RelayClock clock;
  private final Map<String, InMemoryLeasedChannel> channels = new ConcurrentHashMap<>();

  public InMemoryChannelFactory() {
    this(RelayClock.system());
  }

  public InMemoryChannelFactory(RelayClock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public InMemoryLeasedChannel open(String queue) {
    Objects.requireNonNull(queue, "queue");
    return channels.computeIfAbsent(queue.trim(), key -> new InMemoryLeasedChannel(QueueNames.of(key), clock));
  }
}
