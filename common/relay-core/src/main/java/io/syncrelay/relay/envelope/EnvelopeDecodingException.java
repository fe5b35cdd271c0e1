package io.syncrelay.relay.envelope;

/**
 * Raised when a channel message cannot be parsed into a relay envelope.
 */
public class EnvelopeDecodingException extends IllegalArgumentException {

  public EnvelopeDecodingException(String message) {
    super(message);
  }

  public EnvelopeDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
