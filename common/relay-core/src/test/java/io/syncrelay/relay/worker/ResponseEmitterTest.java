package io.syncrelay.relay.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncrelay.relay.RelayEndpoints;
import io.syncrelay.relay.RelayException;
import io.syncrelay.relay.RelayFailure;
import io.syncrelay.relay.channel.ChannelException;
import io.syncrelay.relay.channel.InMemoryLeasedChannel;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedMessage;
import io.syncrelay.relay.envelope.DeliveryMetadata;
import io.syncrelay.relay.envelope.EnvelopeCodec;
import io.syncrelay.relay.envelope.RequestEnvelope;
import io.syncrelay.relay.envelope.ResponseEnvelope;
import io.syncrelay.relay.support.RelayClock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ResponseEmitterTest {

  private static final RelayEndpoints ENDPOINTS = new RelayEndpoints(
      "https://sqs.eu-west-1.amazonaws.com/123/relay-push",
      "https://sqs.eu-west-1.amazonaws.com/123/relay-receive",
      "eu-west-1");

  private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());
  private final InMemoryLeasedChannel outbound = new InMemoryLeasedChannel("relay-receive");
  private final SteppingClock clock = new SteppingClock();
  private final ResponseEmitter emitter =
      new ResponseEmitter(outbound, codec, ENDPOINTS, new PassThroughRequestHandler(), clock);

  @Test
  void publishesResponseWithProvenanceAndStageTimestamps() {
    LeasedMessage delivery = delivery("abc", "run-1", new DeliveryMetadata(1_000L, 1_500L, 2L));

    ResponseEnvelope emitted = emitter.emit(delivery);

    assertThat(outbound.size()).isEqualTo(1);
    ResponseEnvelope published = codec.decodeResponse(outbound.bodies().get(0));
    assertThat(published).isEqualTo(emitted);
    assertThat(published.id()).isEqualTo("abc");
    assertThat(published.runId()).isEqualTo("run-1");
    assertThat(published.region()).isEqualTo("eu-west-1");
    assertThat(published.pushQueueName()).isEqualTo("relay-push");
    assertThat(published.receiveQueueName()).isEqualTo("relay-receive");
    assertThat(published.sendUnixNano()).isEqualTo(10L);
    assertThat(published.sendStartUnixNano()).isEqualTo(11L);
    assertThat(published.workerReceiveUnixNano()).isLessThan(published.workerDoneUnixNano());
    assertThat(published.workerDoneUnixNano()).isLessThan(published.callbackSendStartUnixNano());
    assertThat(published.sqsSentTimestampMs()).isEqualTo(1_000L);
    assertThat(published.sqsFirstReceiveTimestampMs()).isEqualTo(1_500L);
    assertThat(published.sqsApproxReceiveCount()).isEqualTo(2L);
  }

  @Test
  void pushQueueConfiguredAsArnIsReportedByName() {
    RelayEndpoints arnEndpoints = new RelayEndpoints(
        "arn:aws:sqs:eu-west-1:123456789012:relay-push",
        "https://sqs.eu-west-1.amazonaws.com/123/relay-receive",
        "eu-west-1");
    ResponseEmitter arnEmitter =
        new ResponseEmitter(outbound, codec, arnEndpoints, new PassThroughRequestHandler(), clock);

    ResponseEnvelope emitted = arnEmitter.emit(delivery("abc", "run-1", DeliveryMetadata.empty()));

    assertThat(emitted.pushQueueName()).isEqualTo("relay-push");
    assertThat(emitted.receiveQueueName()).isEqualTo("relay-receive");
  }

  @Test
  void replayedRequestProducesAnIndependentResponse() {
    LeasedMessage delivery = delivery("abc", "run-1", DeliveryMetadata.empty());

    ResponseEnvelope first = emitter.emit(delivery);
    ResponseEnvelope second = emitter.emit(delivery);

    assertThat(outbound.size()).isEqualTo(2);
    assertThat(second.id()).isEqualTo(first.id());
    assertThat(second.workerReceiveUnixNano()).isGreaterThan(first.workerReceiveUnixNano());
  }

  @Test
  void requestWithoutRunIdIsInvalidInput() {
    LeasedMessage delivery = new LeasedMessage("m-1", "rh-1", "{\"id\":\"abc\"}", null);

    assertThatThrownBy(() -> emitter.emit(delivery))
        .isInstanceOf(RelayException.class)
        .hasMessageContaining("missing runId")
        .satisfies(ex -> assertThat(((RelayException) ex).failure()).isEqualTo(RelayFailure.INVALID_INPUT));
    assertThat(outbound.size()).isZero();
  }

  @Test
  void publishFailureIsReported() {
    LeasedChannel broken = mock(LeasedChannel.class);
    when(broken.publish(anyString(), any())).thenThrow(new ChannelException("throttled"));
    ResponseEmitter failing = new ResponseEmitter(broken, codec, ENDPOINTS, new PassThroughRequestHandler(), clock);

    assertThatThrownBy(() -> failing.emit(delivery("abc", "run-1", DeliveryMetadata.empty())))
        .isInstanceOf(RelayException.class)
        .hasMessage("send callback message: throttled")
        .satisfies(ex -> assertThat(((RelayException) ex).failure()).isEqualTo(RelayFailure.PUBLISH_FAILURE));
  }

  private LeasedMessage delivery(String id, String runId, DeliveryMetadata metadata) {
    String body = codec.encode(new RequestEnvelope(id, runId, 10L, 11L, null));
    return new LeasedMessage("m-" + id, "rh-" + id, body, metadata);
  }

  private static final class SteppingClock implements RelayClock {

    private final AtomicLong ticks = new AtomicLong(1_700_000_000_000_000_000L);

    @Override
    public long unixNanos() {
      return ticks.addAndGet(1_000L);
    }

    @Override
    public long monotonicNanos() {
      return System.nanoTime();
    }
  }
}
