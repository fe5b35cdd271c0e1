package io.syncrelay.relay.envelope;

import java.util.Map;

/**
 * Channel provenance of a single delivery: when the message was enqueued, when it was first
 * handed to a consumer and how many times it has been delivered so far.
 */
public record DeliveryMetadata(long sentTimestampMs,
                               long firstReceiveTimestampMs,
                               long approximateReceiveCount) {

  public static final String SENT_TIMESTAMP = "SentTimestamp";
  public static final String FIRST_RECEIVE_TIMESTAMP = "ApproximateFirstReceiveTimestamp";
  public static final String APPROXIMATE_RECEIVE_COUNT = "ApproximateReceiveCount";

  public static DeliveryMetadata empty() {
    return new DeliveryMetadata(0L, 0L, 0L);
  }

  /**
   * Builds metadata from string attributes. Missing or unparsable values become {@code 0}.
   */
  public static DeliveryMetadata fromAttributes(Map<String, String> attributes) {
    if (attributes == null || attributes.isEmpty()) {
      return empty();
    }
    return new DeliveryMetadata(
        parseOrZero(attributes.get(SENT_TIMESTAMP)),
        parseOrZero(attributes.get(FIRST_RECEIVE_TIMESTAMP)),
        parseOrZero(attributes.get(APPROXIMATE_RECEIVE_COUNT)));
  }

  static long parseOrZero(String value) {
    if (value == null || value.isBlank()) {
      return 0L;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      return 0L;
    }
  }
}
