package io.syncrelay.relay.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncrelay.relay.RelayException;
import io.syncrelay.relay.RelayFailure;
import io.syncrelay.relay.channel.InMemoryLeasedChannel;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedMessage;
import io.syncrelay.relay.envelope.EnvelopeCodec;
import io.syncrelay.relay.envelope.ResponseEnvelope;
import io.syncrelay.relay.support.RelayClock;
import io.syncrelay.relay.support.RelayMetrics;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ResponsePollerTest {

  private final RelayClock clock = RelayClock.system();
  private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());
  private final InMemoryLeasedChannel receive = new InMemoryLeasedChannel("relay-receive", clock);
  private final ResponsePoller poller = new ResponsePoller(receive, codec,
      new PollSettings(Duration.ofMillis(200), Duration.ofSeconds(10), Duration.ofMillis(20), Duration.ofMillis(20)),
      clock, RelayMetrics.detached());

  @Test
  void eachWaiterTakesOnlyItsOwnResponse() {
    receive.publish(codec.encode(response("abc", "run-1")), Duration.ZERO);
    receive.publish(codec.encode(response("xyz", "run-2")), Duration.ZERO);

    MatchedResponse second = poller.await("xyz", "run-2", Deadline.after(Duration.ofSeconds(2), clock));

    assertThat(second.response().id()).isEqualTo("xyz");
    assertThat(receive.size()).isEqualTo(1);
    assertThat(receive.visibleCount()).as("foreign response released immediately").isEqualTo(1);

    MatchedResponse first = poller.await("abc", "run-1", Deadline.after(Duration.ofSeconds(2), clock));

    assertThat(first.response().id()).isEqualTo("abc");
    assertThat(first.receiveMessageUnixNano()).isLessThanOrEqualTo(first.pollEndUnixNano());
    assertThat(receive.size()).isZero();
  }

  @Test
  void receiveInstantIsTakenBeforeTheDelete() {
    AtomicLong wallClock = new AtomicLong(1_000L);
    RelayClock steppedClock = new RelayClock() {
      @Override
      public long unixNanos() {
        return wallClock.get();
      }

      @Override
      public long monotonicNanos() {
        return System.nanoTime();
      }
    };
    LeasedChannel slowDelete = mock(LeasedChannel.class);
    when(slowDelete.name()).thenReturn("relay-receive");
    when(slowDelete.receive(anyInt(), any(), any()))
        .thenReturn(List.of(new LeasedMessage("m-1", "rh-1", codec.encode(response("abc", "run-1")), null)));
    doAnswer(invocation -> wallClock.addAndGet(5_000L)).when(slowDelete).delete(any());
    ResponsePoller stepped = new ResponsePoller(slowDelete, codec,
        new PollSettings(Duration.ofMillis(200), Duration.ofSeconds(10), Duration.ofMillis(20), Duration.ofMillis(20)),
        steppedClock, RelayMetrics.detached());

    MatchedResponse matched = stepped.await("abc", "run-1", Deadline.after(Duration.ofSeconds(2), clock));

    assertThat(matched.receiveMessageUnixNano()).isEqualTo(1_000L);
    assertThat(matched.pollEndUnixNano()).isEqualTo(6_000L);
  }

  @Test
  void matchIsReturnedWhenDeleteFailsUnchecked() {
    LeasedChannel closing = mock(LeasedChannel.class);
    when(closing.name()).thenReturn("relay-receive");
    when(closing.receive(anyInt(), any(), any()))
        .thenReturn(List.of(new LeasedMessage("m-1", "rh-1", codec.encode(response("abc", "run-1")), null)));
    doAnswer(invocation -> {
      throw new IllegalStateException("channel is already closed due to channel error");
    }).when(closing).delete(any());
    ResponsePoller closingPoller = new ResponsePoller(closing, codec,
        new PollSettings(Duration.ofMillis(200), Duration.ofSeconds(10), Duration.ofMillis(20), Duration.ofMillis(20)),
        clock, RelayMetrics.detached());

    MatchedResponse matched = closingPoller.await("abc", "run-1", Deadline.after(Duration.ofSeconds(1), clock));

    assertThat(matched.response().id()).isEqualTo("abc");
    assertThat(matched.response().runId()).isEqualTo("run-1");
  }

  @Test
  void delayedResponseArrivingWithinDeadlineIsAccepted() {
    receive.publish(codec.encode(response("abc", "run-1")), Duration.ofMillis(150));

    MatchedResponse matched = poller.await("abc", "run-1", Deadline.after(Duration.ofSeconds(2), clock));

    assertThat(matched.response().runId()).isEqualTo("run-1");
  }

  @Test
  void responseOnlyForOtherWaitersEndsInTimeout() {
    receive.publish(codec.encode(response("xyz", "run-2")), Duration.ZERO);

    assertThatThrownBy(() -> poller.await("abc", "run-1", Deadline.after(Duration.ofMillis(100), clock)))
        .isInstanceOf(RelayException.class)
        .satisfies(ex -> assertThat(((RelayException) ex).failure()).isEqualTo(RelayFailure.TIMEOUT))
        .hasMessage("receive message: deadline exceeded");
    assertThat(receive.size()).isEqualTo(1);
  }

  @Test
  void expiredDeadlineFailsBeforeReading() {
    receive.publish(codec.encode(response("abc", "run-1")), Duration.ZERO);

    assertThatThrownBy(() -> poller.await("abc", "run-1", Deadline.after(Duration.ZERO, clock)))
        .isInstanceOf(RelayException.class);
    assertThat(receive.size()).isEqualTo(1);
  }

  private static ResponseEnvelope response(String id, String runId) {
    return new ResponseEnvelope(id, runId, "local-1", "relay-push", "relay-receive",
        1L, 1L, 2L, 3L, 4L, 5L, 6L, 1L);
  }
}
