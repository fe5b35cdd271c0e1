package io.syncrelay.relay.worker;

import io.syncrelay.relay.envelope.RequestEnvelope;

/**
 * Business step run by the worker between receiving a request and emitting its response.
 */
@FunctionalInterface
public interface RequestHandler {

  /**
   * Processes one request.
   *
   * @throws RuntimeException to fail the item; the delivery is then left for redelivery
   */
  void handle(RequestEnvelope request);
}
