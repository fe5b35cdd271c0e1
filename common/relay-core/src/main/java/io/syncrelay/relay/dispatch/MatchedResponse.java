package io.syncrelay.relay.dispatch;

import io.syncrelay.relay.envelope.ResponseEnvelope;
import java.util.Objects;

/**
 * Response accepted by the poll loop together with the instants it was read.
 */
public record MatchedResponse(ResponseEnvelope response,
                              long receiveMessageUnixNano,
                              long pollEndUnixNano) {

  public MatchedResponse {
    Objects.requireNonNull(response, "response");
  }
}
