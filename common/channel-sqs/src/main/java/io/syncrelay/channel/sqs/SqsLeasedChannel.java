package io.syncrelay.channel.sqs;

import io.syncrelay.relay.channel.ChannelException;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedMessage;
import io.syncrelay.relay.channel.QueueNames;
import io.syncrelay.relay.envelope.DeliveryMetadata;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

/**
 * {@link LeasedChannel} over an Amazon SQS standard queue.
 * <p>
 * Every call carries an API call timeout so a blocked HTTP exchange cannot outlive the caller's
 * deadline: publishes are bounded by the timeout handed in, receives by the long wait plus
 * {@code callSlack}.
 */
public final class SqsLeasedChannel implements LeasedChannel {

  static final int MAX_WAIT_SECONDS = 20;
  static final int MAX_BATCH = 10;

  private final SqsClient sqs;
  private final String queueUrl;
  private final String name;
  private final Duration callTimeout;
  private final Duration callSlack;

  /**
   * @param sqs         shared client
   * @param queueUrl    queue URL
   * @param callTimeout upper bound of calls that do not wait server side
   * @param callSlack   added to the long wait to bound receive calls
   */
  public SqsLeasedChannel(SqsClient sqs, String queueUrl, Duration callTimeout, Duration callSlack) {
    this.sqs = Objects.requireNonNull(sqs, "sqs");
    Objects.requireNonNull(queueUrl, "queueUrl");
    if (queueUrl.isBlank()) {
      throw new IllegalArgumentException("queueUrl must not be blank");
    }
    this.queueUrl = queueUrl.trim();
    this.name = QueueNames.of(this.queueUrl);
    this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
    this.callSlack = Objects.requireNonNull(callSlack, "callSlack");
  }

  @Override
  public String name() {
    return name;
  }

  public String queueUrl() {
    return queueUrl;
  }

  @Override
  public String publish(String body, Duration delay) {
    return publish(body, delay, callTimeout);
  }

  @Override
  public String publish(String body, Duration delay, Duration timeout) {
    Objects.requireNonNull(body, "body");
    int delaySeconds = delay == null ? 0 : (int) Math.max(0L, Math.min(delay.toSeconds(), DEFAULT_MAX_DELAY.toSeconds()));
    SendMessageRequest.Builder request = SendMessageRequest.builder()
        .queueUrl(queueUrl)
        .messageBody(body)
        .overrideConfiguration(timeoutOf(timeout == null ? callTimeout : timeout));
    if (delaySeconds > 0) {
      request.delaySeconds(delaySeconds);
    }
    try {
      SendMessageResponse response = sqs.sendMessage(request.build());
      return response.messageId();
    } catch (SdkException ex) {
      throw failure("send message to " + name, ex);
    }
  }

  @Override
  public List<LeasedMessage> receive(int maxMessages, Duration wait, Duration visibility) {
    if (maxMessages < 1) {
      throw new IllegalArgumentException("maxMessages must be >= 1");
    }
    Objects.requireNonNull(wait, "wait");
    Objects.requireNonNull(visibility, "visibility");
    int waitSeconds = (int) Math.max(0L, Math.min(MAX_WAIT_SECONDS, wait.toSeconds()));
    ReceiveMessageRequest request = ReceiveMessageRequest.builder()
        .queueUrl(queueUrl)
        .maxNumberOfMessages(Math.min(MAX_BATCH, maxMessages))
        .waitTimeSeconds(waitSeconds)
        .visibilityTimeout((int) Math.max(0L, visibility.toSeconds()))
        .messageSystemAttributeNames(
            MessageSystemAttributeName.SENT_TIMESTAMP,
            MessageSystemAttributeName.APPROXIMATE_FIRST_RECEIVE_TIMESTAMP,
            MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT)
        .overrideConfiguration(timeoutOf(Duration.ofSeconds(waitSeconds).plus(callSlack)))
        .build();
    ReceiveMessageResponse response;
    try {
      response = sqs.receiveMessage(request);
    } catch (SdkException ex) {
      throw failure("receive message from " + name, ex);
    }
    if (!response.hasMessages() || response.messages().isEmpty()) {
      return List.of();
    }
    List<LeasedMessage> leased = new ArrayList<>(response.messages().size());
    for (Message message : response.messages()) {
      leased.add(new LeasedMessage(message.messageId(), message.receiptHandle(), message.body(),
          metadata(message.attributes())));
    }
    return leased;
  }

  @Override
  public void delete(LeasedMessage message) {
    Objects.requireNonNull(message, "message");
    try {
      sqs.deleteMessage(DeleteMessageRequest.builder()
          .queueUrl(queueUrl)
          .receiptHandle(message.receiptHandle())
          .overrideConfiguration(timeoutOf(callTimeout))
          .build());
    } catch (SdkException ex) {
      throw failure("delete message " + message.messageId() + " from " + name, ex);
    }
  }

  @Override
  public void release(LeasedMessage message) {
    Objects.requireNonNull(message, "message");
    try {
      sqs.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
          .queueUrl(queueUrl)
          .receiptHandle(message.receiptHandle())
          .visibilityTimeout(0)
          .overrideConfiguration(timeoutOf(callTimeout))
          .build());
    } catch (SdkException ex) {
      throw failure("release message " + message.messageId() + " on " + name, ex);
    }
  }

  static DeliveryMetadata metadata(Map<MessageSystemAttributeName, String> attributes) {
    if (attributes == null || attributes.isEmpty()) {
      return DeliveryMetadata.empty();
    }
    return DeliveryMetadata.fromAttributes(Map.of(
        DeliveryMetadata.SENT_TIMESTAMP,
        attributes.getOrDefault(MessageSystemAttributeName.SENT_TIMESTAMP, ""),
        DeliveryMetadata.FIRST_RECEIVE_TIMESTAMP,
        attributes.getOrDefault(MessageSystemAttributeName.APPROXIMATE_FIRST_RECEIVE_TIMESTAMP, ""),
        DeliveryMetadata.APPROXIMATE_RECEIVE_COUNT,
        attributes.getOrDefault(MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT, "")));
  }

  private static AwsRequestOverrideConfiguration timeoutOf(Duration timeout) {
    Duration bounded = timeout.isNegative() || timeout.isZero() ? Duration.ofMillis(1) : timeout;
    return AwsRequestOverrideConfiguration.builder().apiCallTimeout(bounded).build();
  }

  private static ChannelException failure(String action, SdkException ex) {
    if (ex instanceof AbortedException || Thread.currentThread().isInterrupted()) {
      InterruptedException interrupted = new InterruptedException(action + " interrupted");
      interrupted.initCause(ex);
      return new ChannelException(action + " interrupted", interrupted);
    }
    return new ChannelException(action + ": " + ex.getMessage(), ex);
  }
}
