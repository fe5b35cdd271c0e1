package io.syncrelay.relay.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Caller supplied options of a single dispatch. Every field is optional.
 *
 * @param runId            grouping label; a {@code run-<nanos>} label is generated when blank
 * @param delaySeconds     publish delay, clamped to {@code 0..900}
 * @param messageBodyBytes padding added to the request body, negative values become {@code 0}
 * @param maxWaitMs        requested wait for the response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchRequest(String runId,
                              Integer delaySeconds,
                              Integer messageBodyBytes,
                              Integer maxWaitMs) {

  public static final int MAX_DELAY_SECONDS = 900;

  public static DispatchRequest empty() {
    return new DispatchRequest(null, null, null, null);
  }

  /**
   * Fills defaults and clamps the numeric options.
   *
   * @param generatedRunId run label used when {@link #runId()} is blank
   * @param maxDelaySeconds largest delay the inbound channel supports
   */
  public DispatchRequest normalise(String generatedRunId, int maxDelaySeconds) {
    String run = runId == null || runId.trim().isEmpty() ? generatedRunId : runId.trim();
    int delayCeiling = Math.min(MAX_DELAY_SECONDS, Math.max(0, maxDelaySeconds));
    int delay = clamp(delaySeconds == null ? 0 : delaySeconds, 0, delayCeiling);
    int padding = messageBodyBytes == null ? 0 : Math.max(0, messageBodyBytes);
    return new DispatchRequest(run, delay, padding, maxWaitMs);
  }

  private static int clamp(int value, int min, int max) {
    if (value < min) {
      return min;
    }
    return Math.min(value, max);
  }
}
