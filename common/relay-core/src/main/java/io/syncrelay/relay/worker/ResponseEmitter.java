package io.syncrelay.relay.worker;

import io.syncrelay.relay.RelayEndpoints;
import io.syncrelay.relay.RelayException;
import io.syncrelay.relay.RelayFailure;
import io.syncrelay.relay.channel.ChannelException;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedMessage;
import io.syncrelay.relay.envelope.DeliveryMetadata;
import io.syncrelay.relay.envelope.EnvelopeCodec;
import io.syncrelay.relay.envelope.EnvelopeDecodingException;
import io.syncrelay.relay.envelope.RequestEnvelope;
import io.syncrelay.relay.envelope.ResponseEnvelope;
import io.syncrelay.relay.support.RelayClock;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Worker side of the relay: turns one inbound delivery into exactly one response on the outbound
 * channel. Acknowledging the inbound delivery is left to the caller and must only happen after
 * {@link #emit} returns.
 */
public final class ResponseEmitter {

  private static final Logger log = LoggerFactory.getLogger(ResponseEmitter.class);

  private final LeasedChannel outbound;
  private final EnvelopeCodec codec;
  private final RelayEndpoints endpoints;
  private final RequestHandler handler;
  private final RelayClock clock;

  public ResponseEmitter(LeasedChannel outbound,
                         EnvelopeCodec codec,
                         RelayEndpoints endpoints,
                         RequestHandler handler,
                         RelayClock clock) {
    this.outbound = Objects.requireNonNull(outbound, "outbound");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Processes a delivery and publishes its response.
   *
   * @return the response that was published
   * @throws RelayException {@link RelayFailure#INVALID_INPUT} when the body is not a valid request,
   *                        {@link RelayFailure#PUBLISH_FAILURE} when the response cannot be published
   */
  public ResponseEnvelope emit(LeasedMessage delivery) {
    Objects.requireNonNull(delivery, "delivery");
    RequestEnvelope request;
    try {
      request = codec.decodeRequest(delivery.body());
    } catch (EnvelopeDecodingException ex) {
      throw new RelayException(RelayFailure.INVALID_INPUT, "unmarshal message body: " + ex.getMessage(), ex);
    }
    MDC.put("correlation_id", request.id());
    MDC.put("run_id", request.runId());
    try {
      long workerReceive = clock.unixNanos();
      handler.handle(request);
      long workerDone = clock.unixNanos();

      DeliveryMetadata metadata = delivery.metadata();
      long callbackSendStart = clock.unixNanos();
      ResponseEnvelope response = new ResponseEnvelope(
          request.id(),
          request.runId(),
          endpoints.region(),
          endpoints.pushQueueName(),
          endpoints.receiveQueueName(),
          request.sendUnixNano(),
          request.sendStartUnixNano(),
          workerReceive,
          workerDone,
          callbackSendStart,
          metadata.sentTimestampMs(),
          metadata.firstReceiveTimestampMs(),
          metadata.approximateReceiveCount());
      try {
        outbound.publish(codec.encode(response), Duration.ZERO);
      } catch (ChannelException ex) {
        throw new RelayException(RelayFailure.PUBLISH_FAILURE, "send callback message: " + ex.getMessage(), ex);
      }
      long callbackSendEnd = clock.unixNanos();
      log.info("worker processed id={} pushQueue={} workerReceiveUnixNano={} workerDoneUnixNano={} "
              + "callbackQueue={} callbackSendStartUnixNano={} callbackSendEndUnixNano={}",
          request.id(), endpoints.pushQueueName(), workerReceive, workerDone,
          endpoints.receiveQueueName(), callbackSendStart, callbackSendEnd);
      return response;
    } finally {
      MDC.remove("correlation_id");
      MDC.remove("run_id");
    }
  }
}
