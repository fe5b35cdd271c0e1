package io.syncrelay.relay.envelope;

/**
 * Response published by the worker to the outbound channel. Produced once per successfully
 * processed request; timestamps are opaque to the dispatcher and copied through verbatim.
 */
public record ResponseEnvelope(String id,
                               String runId,
                               String region,
                               String pushQueueName,
                               String receiveQueueName,
                               long sendUnixNano,
                               long sendStartUnixNano,
                               long workerReceiveUnixNano,
                               long workerDoneUnixNano,
                               long callbackSendStartUnixNano,
                               long sqsSentTimestampMs,
                               long sqsFirstReceiveTimestampMs,
                               long sqsApproxReceiveCount) {

  /**
   * Returns {@code true} when both the correlation identity and the run label match, after
   * trimming surrounding whitespace from this envelope's values.
   */
  public boolean matches(String expectedId, String expectedRunId) {
    return trimmed(id).equals(expectedId) && trimmed(runId).equals(expectedRunId);
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
