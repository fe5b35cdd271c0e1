package io.syncrelay.relay.channel;

import io.syncrelay.relay.envelope.DeliveryMetadata;
import java.util.Objects;

/**
 * A single delivery handed out by a {@link LeasedChannel}. The receipt handle identifies this
 * particular lease; a redelivery of the same message carries a different handle.
 */
public record LeasedMessage(String messageId,
                            String receiptHandle,
                            String body,
                            DeliveryMetadata metadata) {

  public LeasedMessage {
    messageId = Objects.requireNonNull(messageId, "messageId");
    receiptHandle = Objects.requireNonNull(receiptHandle, "receiptHandle");
    body = body == null ? "" : body;
    metadata = metadata == null ? DeliveryMetadata.empty() : metadata;
  }
}
