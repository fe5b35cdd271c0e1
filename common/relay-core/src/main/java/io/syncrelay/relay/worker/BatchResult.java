package io.syncrelay.relay.worker;

import java.util.List;

/**
 * Outcome of one inbound batch.
 *
 * @param processed        deliveries whose response was published and which were deleted
 * @param failedMessageIds deliveries left on the inbound channel for redelivery
 */
public record BatchResult(int processed, List<String> failedMessageIds) {

  public BatchResult {
    failedMessageIds = failedMessageIds == null ? List.of() : List.copyOf(failedMessageIds);
  }

  public boolean hasFailures() {
    return !failedMessageIds.isEmpty();
  }
}
