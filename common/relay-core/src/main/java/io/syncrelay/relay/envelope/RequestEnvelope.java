package io.syncrelay.relay.envelope;

/**
 * Request published by the dispatcher to the inbound channel.
 *
 * @param id                correlation identity, the sole matching key
 * @param runId             caller supplied grouping label, checked redundantly when matching
 * @param sendUnixNano      wall-clock instant the request was issued
 * @param sendStartUnixNano wall-clock instant the publish call started
 * @param padding           optional filler used to inflate the message body
 */
public record RequestEnvelope(String id,
                              String runId,
                              long sendUnixNano,
                              long sendStartUnixNano,
                              String padding) {

  public RequestEnvelope {
    id = requireText(id, "id");
    runId = requireText(runId, "runId");
    padding = padding == null || padding.isEmpty() ? null : padding;
  }

  /**
   * Returns a string of {@code extraBytes} ASCII {@code x} characters, or {@code null} when no
   * padding is requested.
   */
  public static String padding(int extraBytes) {
    if (extraBytes <= 0) {
      return null;
    }
    return "x".repeat(extraBytes);
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }
}
