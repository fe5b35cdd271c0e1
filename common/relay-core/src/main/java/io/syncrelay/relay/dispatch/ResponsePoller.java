package io.syncrelay.relay.dispatch;

import io.syncrelay.relay.RelayException;
import io.syncrelay.relay.RelayFailure;
import io.syncrelay.relay.channel.ChannelException;
import io.syncrelay.relay.channel.FilteredConsumer;
import io.syncrelay.relay.channel.FilteredConsumer.Step;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.envelope.EnvelopeCodec;
import io.syncrelay.relay.envelope.ResponseEnvelope;
import io.syncrelay.relay.support.RelayClock;
import io.syncrelay.relay.support.RelayMetrics;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Polls the shared outbound channel until the response carrying a given correlation identity
 * arrives or the deadline passes.
 * <p>
 * Each iteration examines one message through a {@link FilteredConsumer}: the matching response is
 * deleted and returned, malformed messages are deleted and skipped, and responses for other
 * waiters have their lease released followed by a short pause so two pollers do not hand the same
 * message back and forth in a tight loop. Read failures end the loop without retry.
 */
public final class ResponsePoller {

  private final FilteredConsumer<ResponseEnvelope> consumer;
  private final PollSettings settings;
  private final RelayClock clock;
  private final RelayMetrics metrics;

  public ResponsePoller(LeasedChannel receiveChannel,
                        EnvelopeCodec codec,
                        PollSettings settings,
                        RelayClock clock,
                        RelayMetrics metrics) {
    Objects.requireNonNull(codec, "codec");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.consumer = new FilteredConsumer<>(receiveChannel, codec::decodeResponse, clock);
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Blocks until the matching response is consumed.
   *
   * @throws RelayException with {@link RelayFailure#TIMEOUT} when the deadline passes or the thread
   *                        is interrupted, {@link RelayFailure#CHANNEL_READ_FAILURE} when a read fails
   */
  public MatchedResponse await(String correlationId, String runId, Deadline deadline) {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(deadline, "deadline");
    while (true) {
      if (deadline.isExpired() || Thread.currentThread().isInterrupted()) {
        throw new RelayException(RelayFailure.TIMEOUT, "receive message: deadline exceeded");
      }
      long readStarted = clock.monotonicNanos();
      Step<ResponseEnvelope> step;
      try {
        step = consumer.pollOnce(deadline.cap(settings.receiveWait()), settings.visibility(),
            response -> response.matches(correlationId, runId));
      } catch (ChannelException ex) {
        if (ex.isInterruption() || deadline.isExpired()) {
          throw new RelayException(RelayFailure.TIMEOUT, "receive message: deadline exceeded", ex);
        }
        throw new RelayException(RelayFailure.CHANNEL_READ_FAILURE, "receive message: " + ex.getMessage(), ex);
      }
      metrics.recordPoll(step.outcome());
      switch (step.outcome()) {
        case MATCHED:
          return new MatchedResponse(step.value(), step.polledUnixNano(), clock.unixNanos());
        case RELEASED:
          pause(settings.mismatchBackoff(), deadline);
          break;
        case EMPTY:
          long elapsed = clock.monotonicNanos() - readStarted;
          pause(settings.emptyBackoff().minusNanos(elapsed), deadline);
          break;
        case DISCARDED:
        default:
          break;
      }
    }
  }

  private void pause(Duration backoff, Deadline deadline) {
    Duration sleep = deadline.cap(backoff);
    if (sleep.isNegative() || sleep.isZero()) {
      return;
    }
    try {
      TimeUnit.NANOSECONDS.sleep(sleep.toNanos());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
