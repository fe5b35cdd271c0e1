package io.syncrelay.relay.dispatch;

import io.syncrelay.relay.support.RelayClock;
import java.time.Duration;
import java.util.Objects;

/**
 * Point on the monotonic clock after which a dispatch gives up.
 */
public final class Deadline {

  private final RelayClock clock;
  private final long expiresAtNanos;

  private Deadline(RelayClock clock, long expiresAtNanos) {
    this.clock = clock;
    this.expiresAtNanos = expiresAtNanos;
  }

  public static Deadline after(Duration budget, RelayClock clock) {
    Objects.requireNonNull(budget, "budget");
    Objects.requireNonNull(clock, "clock");
    return new Deadline(clock, clock.monotonicNanos() + Math.max(0L, budget.toNanos()));
  }

  public boolean isExpired() {
    return clock.monotonicNanos() - expiresAtNanos >= 0L;
  }

  /**
   * Time left before expiry, never negative.
   */
  public Duration remaining() {
    long left = expiresAtNanos - clock.monotonicNanos();
    return left <= 0L ? Duration.ZERO : Duration.ofNanos(left);
  }

  /**
   * Returns {@code candidate} or the remaining time, whichever is shorter.
   */
  public Duration cap(Duration candidate) {
    Duration remaining = remaining();
    return candidate.compareTo(remaining) <= 0 ? candidate : remaining;
  }
}
