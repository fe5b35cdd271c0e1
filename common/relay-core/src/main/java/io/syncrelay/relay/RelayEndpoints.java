package io.syncrelay.relay;

import io.syncrelay.relay.channel.QueueNames;

/**
 * Identity of the queue pair the relay runs over, plus the region reported in response
 * provenance. Built once at startup and shared by reference across concurrent calls.
 *
 * @param pushQueue    inbound (request) queue URL, ARN or name
 * @param receiveQueue outbound (response) queue URL, ARN or name
 * @param region       hosting region, informational only
 */
public record RelayEndpoints(String pushQueue, String receiveQueue, String region) {

  public RelayEndpoints {
    pushQueue = trimToEmpty(pushQueue);
    receiveQueue = trimToEmpty(receiveQueue);
    region = trimToEmpty(region);
  }

  /**
   * @throws RelayException with {@link RelayFailure#CONFIGURATION_MISSING} naming the first missing queue
   */
  public void requireConfigured() {
    if (pushQueue.isEmpty()) {
      throw new RelayException(RelayFailure.CONFIGURATION_MISSING, "missing env PUSH_QUEUE_URL");
    }
    requireReceiveQueue();
  }

  /**
   * @throws RelayException with {@link RelayFailure#CONFIGURATION_MISSING} when the receive queue is missing
   */
  public void requireReceiveQueue() {
    if (receiveQueue.isEmpty()) {
      throw new RelayException(RelayFailure.CONFIGURATION_MISSING, "missing env RECEIVE_QUEUE_URL");
    }
  }

  public String pushQueueName() {
    return QueueNames.of(pushQueue);
  }

  public String receiveQueueName() {
    return QueueNames.of(receiveQueue);
  }

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
