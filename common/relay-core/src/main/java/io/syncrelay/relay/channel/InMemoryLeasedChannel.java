package io.syncrelay.relay.channel;

import io.syncrelay.relay.envelope.DeliveryMetadata;
import io.syncrelay.relay.support.RelayClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link LeasedChannel} kept in process memory.
 * <p>
 * Reproduces the lease semantics of a hosted queue: delivery delays, a visibility deadline per
 * leased message, a fresh receipt handle on every delivery (stale handles are rejected), receive
 * counters and sent/first-receive timestamps. Delivery order is not guaranteed; a released message
 * goes behind every other held message. Used by the tests and by the single-JVM
 * {@code in-memory} channel type.
 */
public final class InMemoryLeasedChannel implements LeasedChannel {

  private final String name;
  private final RelayClock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final List<Entry> entries = new ArrayList<>();
  private final AtomicLong sequence = new AtomicLong();

  public InMemoryLeasedChannel(String name) {
    this(name, RelayClock.system());
  }

  public InMemoryLeasedChannel(String name, RelayClock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String publish(String body, Duration delay) {
    Objects.requireNonNull(body, "body");
    long delayNanos = delay == null || delay.isNegative() ? 0L : delay.toNanos();
    String messageId = name + "-" + sequence.incrementAndGet();
    lock.lock();
    try {
      entries.add(new Entry(messageId, body, clock.unixMillis(), clock.monotonicNanos() + delayNanos));
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    return messageId;
  }

  @Override
  public List<LeasedMessage> receive(int maxMessages, Duration wait, Duration visibility) {
    if (maxMessages < 1) {
      throw new IllegalArgumentException("maxMessages must be >= 1");
    }
    long waitNanos = wait == null || wait.isNegative() ? 0L : wait.toNanos();
    long visibilityNanos = visibility == null || visibility.isNegative() ? 0L : visibility.toNanos();
    long waitUntil = clock.monotonicNanos() + waitNanos;
    try {
      lock.lockInterruptibly();
      while (true) {
        long now = clock.monotonicNanos();
        List<LeasedMessage> leased = leaseVisible(maxMessages, visibilityNanos, now);
        if (!leased.isEmpty()) {
          return leased;
        }
        long remaining = waitUntil - now;
        if (remaining <= 0L) {
          return List.of();
        }
        changed.awaitNanos(Math.min(remaining, nanosUntilNextVisible(now)));
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ChannelException("receive from " + name + " interrupted", ex);
    } finally {
      if (lock.isHeldByCurrentThread()) {
        lock.unlock();
      }
    }
  }

  @Override
  public void delete(LeasedMessage message) {
    Objects.requireNonNull(message, "message");
    lock.lock();
    try {
      Iterator<Entry> iterator = entries.iterator();
      while (iterator.hasNext()) {
        Entry entry = iterator.next();
        if (entry.holds(message)) {
          iterator.remove();
          return;
        }
      }
      throw new ChannelException("receipt handle for " + message.messageId() + " is no longer valid on " + name);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void release(LeasedMessage message) {
    Objects.requireNonNull(message, "message");
    lock.lock();
    try {
      Iterator<Entry> iterator = entries.iterator();
      while (iterator.hasNext()) {
        Entry entry = iterator.next();
        if (entry.holds(message)) {
          // re-queue at the tail so other visible messages are read first
          iterator.remove();
          entry.visibleAtNanos = clock.monotonicNanos();
          entry.receiptHandle = null;
          entries.add(entry);
          changed.signalAll();
          return;
        }
      }
      throw new ChannelException("receipt handle for " + message.messageId() + " is no longer valid on " + name);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Total number of messages held, visible or leased.
   */
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Number of messages a reader could receive right now.
   */
  public int visibleCount() {
    lock.lock();
    try {
      long now = clock.monotonicNanos();
      return (int) entries.stream().filter(entry -> entry.visibleAtNanos <= now).count();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Bodies of all held messages in publish order.
   */
  public List<String> bodies() {
    lock.lock();
    try {
      return entries.stream().map(entry -> entry.body).toList();
    } finally {
      lock.unlock();
    }
  }

  private List<LeasedMessage> leaseVisible(int maxMessages, long visibilityNanos, long now) {
    List<LeasedMessage> leased = new ArrayList<>();
    for (Entry entry : entries) {
      if (leased.size() >= maxMessages) {
        break;
      }
      if (entry.visibleAtNanos > now) {
        continue;
      }
      entry.receiveCount++;
      if (entry.firstReceiveMs == 0L) {
        entry.firstReceiveMs = clock.unixMillis();
      }
      entry.receiptHandle = UUID.randomUUID().toString();
      entry.visibleAtNanos = now + visibilityNanos;
      leased.add(new LeasedMessage(
          entry.messageId,
          entry.receiptHandle,
          entry.body,
          new DeliveryMetadata(entry.sentMs, entry.firstReceiveMs, entry.receiveCount)));
    }
    return leased;
  }

  private long nanosUntilNextVisible(long now) {
    long next = Long.MAX_VALUE;
    for (Entry entry : entries) {
      next = Math.min(next, entry.visibleAtNanos - now);
    }
    return next == Long.MAX_VALUE ? TimeUnit.SECONDS.toNanos(1) : Math.max(next, 1L);
  }

  private static final class Entry {

    private final String messageId;
    private final String body;
    private final long sentMs;
    private long firstReceiveMs;
    private long receiveCount;
    private long visibleAtNanos;
    private String receiptHandle;

    private Entry(String messageId, String body, long sentMs, long visibleAtNanos) {
      this.messageId = messageId;
      this.body = body;
      this.sentMs = sentMs;
      this.visibleAtNanos = visibleAtNanos;
    }

    private boolean holds(LeasedMessage message) {
      return messageId.equals(message.messageId()) && message.receiptHandle().equals(receiptHandle);
    }
  }
}
