package io.syncrelay.relay.support;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.syncrelay.relay.channel.PollOutcome;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instruments shared by the dispatcher and the worker.
 */
public final class RelayMetrics {

  public static final String DISPATCH_TIMER = "syncrelay.dispatch";
  public static final String POLL_COUNTER = "syncrelay.poll.messages";
  public static final String EMIT_COUNTER = "syncrelay.worker.responses";

  private final MeterRegistry registry;

  public RelayMetrics(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Metrics bound to a private registry, for callers that do not export metrics.
   */
  public static RelayMetrics detached() {
    return new RelayMetrics(new SimpleMeterRegistry());
  }

  public MeterRegistry registry() {
    return registry;
  }

  public void recordDispatch(String status, long totalMs) {
    Timer.builder(DISPATCH_TIMER)
        .tag("status", status)
        .register(registry)
        .record(Math.max(0L, totalMs), TimeUnit.MILLISECONDS);
  }

  public void recordPoll(PollOutcome outcome) {
    if (outcome == PollOutcome.EMPTY) {
      return;
    }
    Counter.builder(POLL_COUNTER)
        .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
        .register(registry)
        .increment();
  }

  public void recordEmission(boolean success) {
    Counter.builder(EMIT_COUNTER)
        .tag("result", success ? "published" : "failed")
        .register(registry)
        .increment();
  }
}
