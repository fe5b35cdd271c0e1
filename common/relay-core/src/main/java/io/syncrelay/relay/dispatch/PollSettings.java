package io.syncrelay.relay.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of the response poll loop.
 *
 * @param receiveWait     long-wait of each read, capped by the time left before the deadline
 * @param visibility      lease taken on each message while it is inspected
 * @param mismatchBackoff pause after releasing a message that belongs to another waiter
 * @param emptyBackoff    minimum spacing between reads when the channel returns empty immediately
 */
public record PollSettings(Duration receiveWait,
                           Duration visibility,
                           Duration mismatchBackoff,
                           Duration emptyBackoff) {

  public static final Duration DEFAULT_RECEIVE_WAIT = Duration.ofSeconds(20);
  public static final Duration DEFAULT_VISIBILITY = Duration.ofSeconds(10);
  public static final Duration DEFAULT_MISMATCH_BACKOFF = Duration.ofMillis(20);
  public static final Duration DEFAULT_EMPTY_BACKOFF = Duration.ofMillis(20);

  public PollSettings {
    receiveWait = nonNegative(receiveWait, "receiveWait");
    visibility = nonNegative(visibility, "visibility");
    mismatchBackoff = nonNegative(mismatchBackoff, "mismatchBackoff");
    emptyBackoff = nonNegative(emptyBackoff, "emptyBackoff");
  }

  public static PollSettings defaults() {
    return new PollSettings(DEFAULT_RECEIVE_WAIT, DEFAULT_VISIBILITY, DEFAULT_MISMATCH_BACKOFF, DEFAULT_EMPTY_BACKOFF);
  }

  private static Duration nonNegative(Duration value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isNegative()) {
      throw new IllegalArgumentException(field + " must be >= 0");
    }
    return value;
  }
}
