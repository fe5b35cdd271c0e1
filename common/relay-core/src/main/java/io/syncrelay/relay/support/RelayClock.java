package io.syncrelay.relay.support;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Time source for the relay: wall-clock nanoseconds for the timestamps carried in envelopes and a
 * monotonic reading for deadlines and elapsed-time measurement.
 */
public interface RelayClock {

  /**
   * Wall-clock time as nanoseconds since the Unix epoch.
   */
  long unixNanos();

  /**
   * Monotonic nanoseconds with an arbitrary origin, see {@link System#nanoTime()}.
   */
  long monotonicNanos();

  default long unixMillis() {
    return unixNanos() / 1_000_000L;
  }

  static RelayClock system() {
    return of(Clock.systemUTC());
  }

  static RelayClock of(Clock clock) {
    Objects.requireNonNull(clock, "clock");
    return new RelayClock() {
      @Override
      public long unixNanos() {
        Instant now = clock.instant();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
      }

      @Override
      public long monotonicNanos() {
        return System.nanoTime();
      }
    };
  }
}
