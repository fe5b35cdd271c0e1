package io.syncrelay.relay.dispatch;

import io.syncrelay.relay.envelope.ResponseEnvelope;

/**
 * Result envelope of a successful dispatch: the dispatcher's own timing marks next to the stage
 * timestamps and channel provenance copied verbatim from the worker's response.
 * {@code callbackSendEndUnixNano} is always 0: the worker only knows it once the response is gone.
 */
public record DispatchOutput(String runId,
                             String id,
                             String region,
                             String pushQueueName,
                             String receiveQueueName,
                             long dispatchStartUnixNano,
                             long sendUnixNano,
                             long sendStartUnixNano,
                             long sendEndUnixNano,
                             long pollStartUnixNano,
                             long pollEndUnixNano,
                             long receiveMessageUnixNano,
                             long workerReceiveUnixNano,
                             long workerDoneUnixNano,
                             long callbackSendStartUnixNano,
                             long callbackSendEndUnixNano,
                             long sqsSentTimestampMs,
                             long sqsFirstReceiveTimestampMs,
                             long sqsApproxReceiveCount) {

  static DispatchOutput assemble(String region,
                                 String pushQueueName,
                                 String receiveQueueName,
                                 LocalMarks marks,
                                 MatchedResponse matched) {
    ResponseEnvelope response = matched.response();
    return new DispatchOutput(
        marks.runId(),
        marks.id(),
        region,
        pushQueueName,
        receiveQueueName,
        marks.dispatchStartUnixNano(),
        marks.sendUnixNano(),
        marks.sendStartUnixNano(),
        marks.sendEndUnixNano(),
        marks.pollStartUnixNano(),
        matched.pollEndUnixNano(),
        matched.receiveMessageUnixNano(),
        response.workerReceiveUnixNano(),
        response.workerDoneUnixNano(),
        response.callbackSendStartUnixNano(),
        0L,
        response.sqsSentTimestampMs(),
        response.sqsFirstReceiveTimestampMs(),
        response.sqsApproxReceiveCount());
  }

  /**
   * Timing marks observed locally by the dispatcher before the poll loop returned.
   */
  record LocalMarks(String runId,
                    String id,
                    long dispatchStartUnixNano,
                    long sendUnixNano,
                    long sendStartUnixNano,
                    long sendEndUnixNano,
                    long pollStartUnixNano) {
  }
}
