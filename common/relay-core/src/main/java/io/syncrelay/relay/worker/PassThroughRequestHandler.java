package io.syncrelay.relay.worker;

import io.syncrelay.relay.envelope.RequestEnvelope;

/**
 * Handler that does no work, so the response only carries timing and provenance.
 */
public final class PassThroughRequestHandler implements RequestHandler {

  @Override
  public void handle(RequestEnvelope request) {
    // no-op
  }
}
