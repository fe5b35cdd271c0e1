package io.syncrelay.relay.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes how long a dispatch may wait for its response.
 * <p>
 * The caller's requested wait (or {@code defaultWait} when none was given) is capped by a hard
 * ceiling that sits beneath the hosting environment's own timeout. When the environment exposes
 * its remaining time, that remainder minus a safety margin caps the budget further. The result is
 * never negative; {@link Duration#ZERO} means the deadline is too close to attempt a dispatch.
 */
public final class DeadlineBudget {

  public static final Duration DEFAULT_WAIT = Duration.ofSeconds(25);
  public static final Duration DEFAULT_CEILING = Duration.ofSeconds(28);
  public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofMillis(250);

  private final Duration defaultWait;
  private final Duration ceiling;
  private final Duration safetyMargin;

  public DeadlineBudget() {
    this(DEFAULT_WAIT, DEFAULT_CEILING, DEFAULT_SAFETY_MARGIN);
  }

  public DeadlineBudget(Duration defaultWait, Duration ceiling, Duration safetyMargin) {
    this.defaultWait = requirePositive(defaultWait, "defaultWait");
    this.ceiling = requirePositive(ceiling, "ceiling");
    this.safetyMargin = Objects.requireNonNull(safetyMargin, "safetyMargin");
    if (safetyMargin.isNegative()) {
      throw new IllegalArgumentException("safetyMargin must be >= 0");
    }
  }

  /**
   * @param requestedMs       caller requested wait in milliseconds; {@code null} or {@code <= 0} selects the default
   * @param externalRemaining time left before the hosting environment's own deadline, if known
   * @return the effective budget, {@link Duration#ZERO} when no time is left
   */
  public Duration effective(Integer requestedMs, Optional<Duration> externalRemaining) {
    Duration requested = requestedMs == null || requestedMs <= 0 ? defaultWait : Duration.ofMillis(requestedMs);
    if (requested.compareTo(ceiling) > 0) {
      requested = ceiling;
    }
    if (externalRemaining == null || externalRemaining.isEmpty()) {
      return requested;
    }
    Duration remaining = externalRemaining.get().minus(safetyMargin);
    if (remaining.isNegative() || remaining.isZero()) {
      return Duration.ZERO;
    }
    return remaining.compareTo(requested) < 0 ? remaining : requested;
  }

  public Duration defaultWait() {
    return defaultWait;
  }

  public Duration ceiling() {
    return ceiling;
  }

  public Duration safetyMargin() {
    return safetyMargin;
  }

  private static Duration requirePositive(Duration value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(field + " must be > 0");
    }
    return value;
  }
}
