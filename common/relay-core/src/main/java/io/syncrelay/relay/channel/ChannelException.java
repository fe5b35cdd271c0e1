package io.syncrelay.relay.channel;

/**
 * Failure of a {@link LeasedChannel} operation.
 */
public class ChannelException extends RuntimeException {

  public ChannelException(String message) {
    super(message);
  }

  public ChannelException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns {@code true} when the operation was aborted because the calling thread was interrupted.
   */
  public boolean isInterruption() {
    Throwable current = getCause();
    while (current != null) {
      if (current instanceof InterruptedException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
