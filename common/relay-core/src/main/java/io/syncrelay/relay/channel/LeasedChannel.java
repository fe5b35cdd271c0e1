package io.syncrelay.relay.channel;

import java.time.Duration;
import java.util.List;

/**
 * Unordered, at-least-once, multi-consumer queue with a visibility lease.
 * <p>
 * Once a message is returned by {@link #receive} it stays hidden from other readers until the
 * lease expires, it is {@linkplain #delete deleted}, or its lease is {@linkplain #release released}.
 * Implementations must be safe for concurrent use and must abort a blocking {@link #receive} when
 * the calling thread is interrupted.
 */
public interface LeasedChannel {

  Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(900);

  /**
   * Human readable queue name used for logging and response provenance.
   */
  String name();

  /**
   * Publishes an opaque text payload.
   *
   * @param body  message body
   * @param delay delivery delay, {@link Duration#ZERO} for none; callers clamp it to {@link #maxDelay()}
   * @return the channel assigned message id
   * @throws ChannelException when the publish call fails
   */
  String publish(String body, Duration delay);

  /**
   * Publishes with an upper bound on how long the publish call itself may take. Implementations
   * whose client supports per-call timeouts should override this; the default ignores the bound.
   */
  default String publish(String body, Duration delay, Duration timeout) {
    return publish(body, delay);
  }

  /**
   * Reads up to {@code maxMessages} messages, waiting at most {@code wait} for the first one.
   *
   * @param maxMessages batch size, at least one
   * @param wait        server-side long wait; {@link Duration#ZERO} returns immediately
   * @param visibility  lease granted on every returned message
   * @return the leased messages, empty when none arrived before {@code wait} elapsed
   * @throws ChannelException when the read fails or the thread is interrupted
   */
  List<LeasedMessage> receive(int maxMessages, Duration wait, Duration visibility);

  /**
   * Consumes the message so it is never redelivered.
   *
   * @throws ChannelException when the delete call fails
   */
  void delete(LeasedMessage message);

  /**
   * Ends the lease early so the message becomes visible to other readers immediately.
   *
   * @throws ChannelException when the release call fails
   */
  void release(LeasedMessage message);

  /**
   * Largest publish delay the channel supports.
   */
  default Duration maxDelay() {
    return DEFAULT_MAX_DELAY;
  }
}
