package io.syncrelay.relay;

import java.util.Objects;

/**
 * Typed failure raised by the dispatcher and the worker emission path.
 */
public class RelayException extends RuntimeException {

  private final RelayFailure failure;

  public RelayException(RelayFailure failure, String message) {
    super(message);
    this.failure = Objects.requireNonNull(failure, "failure");
  }

  public RelayException(RelayFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = Objects.requireNonNull(failure, "failure");
  }

  public RelayFailure failure() {
    return failure;
  }
}
