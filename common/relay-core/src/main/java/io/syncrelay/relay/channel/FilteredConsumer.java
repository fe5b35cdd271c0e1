package io.syncrelay.relay.channel;

import io.syncrelay.relay.support.RelayClock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filtered consume-or-release over a shared {@link LeasedChannel}.
 * <p>
 * Every step reads at most one message and settles its lease before returning:
 * <ul>
 *   <li>the message decodes and satisfies the matcher: it is deleted and returned;</li>
 *   <li>the message decodes but belongs to somebody else: its lease is released so the rightful
 *       reader sees it without waiting for the lease to expire;</li>
 *   <li>the message does not decode: it is deleted so it is never redelivered.</li>
 * </ul>
 * Failures of the delete/release calls are logged and left to the channel's lease expiry.
 *
 * @param <T> decoded message type
 */
public final class FilteredConsumer<T> {

  private static final Logger log = LoggerFactory.getLogger(FilteredConsumer.class);

  private final LeasedChannel channel;
  private final Function<String, T> decoder;
  private final RelayClock clock;

  /**
   * @param channel channel shared with other readers
   * @param decoder decodes a message body, throwing {@link IllegalArgumentException} for malformed input
   * @param clock   time source for the receive instant
   */
  public FilteredConsumer(LeasedChannel channel, Function<String, T> decoder, RelayClock clock) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Reads one message and settles it.
   *
   * @param wait       long-wait for the read
   * @param visibility lease taken on the message while it is inspected
   * @param matcher    decides whether a decoded message belongs to the caller
   * @throws ChannelException when the read itself fails
   */
  public Step<T> pollOnce(Duration wait, Duration visibility, Predicate<? super T> matcher) {
    Objects.requireNonNull(matcher, "matcher");
    List<LeasedMessage> messages = channel.receive(1, wait, visibility);
    long polledUnixNano = clock.unixNanos();
    if (messages.isEmpty()) {
      return new Step<>(PollOutcome.EMPTY, null, null, polledUnixNano);
    }
    LeasedMessage message = messages.get(0);
    T decoded;
    try {
      decoded = decoder.apply(message.body());
    } catch (IllegalArgumentException ex) {
      log.warn("Deleting malformed message {} from {}: {}", message.messageId(), channel.name(), ex.getMessage());
      settle(message, true);
      return new Step<>(PollOutcome.DISCARDED, null, message, polledUnixNano);
    }
    if (matcher.test(decoded)) {
      settle(message, true);
      return new Step<>(PollOutcome.MATCHED, decoded, message, polledUnixNano);
    }
    if (log.isDebugEnabled()) {
      log.debug("Releasing message {} on {} for another waiter", message.messageId(), channel.name());
    }
    settle(message, false);
    return new Step<>(PollOutcome.RELEASED, decoded, message, polledUnixNano);
  }

  private void settle(LeasedMessage message, boolean consume) {
    try {
      if (consume) {
        channel.delete(message);
      } else {
        channel.release(message);
      }
    } catch (RuntimeException ex) {
      log.warn("Failed to {} message {} on {}; leaving it to lease expiry",
          consume ? "delete" : "release", message.messageId(), channel.name(), ex);
    }
  }

  /**
   * Result of one {@link #pollOnce} step.
   *
   * @param outcome        what happened to the message read, if any
   * @param value          decoded message for {@link PollOutcome#MATCHED} and {@link PollOutcome#RELEASED}
   * @param message        raw delivery, {@code null} for {@link PollOutcome#EMPTY}
   * @param polledUnixNano wall-clock instant the read returned
   */
  public record Step<T>(PollOutcome outcome, T value, LeasedMessage message, long polledUnixNano) {

    public Step {
      Objects.requireNonNull(outcome, "outcome");
    }
  }
}
