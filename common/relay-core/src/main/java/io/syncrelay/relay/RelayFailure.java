package io.syncrelay.relay;

/**
 * Failure taxonomy of the request/response relay.
 * <p>
 * Each failure knows the caller-visible status it maps to and the HTTP code used by the
 * dispatcher surface. {@link #MALFORMED_RESPONSE} is local to the poll loop and never surfaces.
 */
public enum RelayFailure {

  CONFIGURATION_MISSING("ERROR", 500),
  INVALID_INPUT("ERROR", 400),
  DEADLINE_TOO_CLOSE("TIMEOUT", 504),
  PUBLISH_FAILURE("ERROR", 502),
  CHANNEL_READ_FAILURE("ERROR", 502),
  TIMEOUT("TIMEOUT", 504),
  MALFORMED_RESPONSE("ERROR", 500);

  private final String status;
  private final int httpStatus;

  RelayFailure(String status, int httpStatus) {
    this.status = status;
    this.httpStatus = httpStatus;
  }

  public String status() {
    return status;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public boolean isTimeout() {
    return "TIMEOUT".equals(status);
  }
}
