package io.syncrelay.channel.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import io.syncrelay.relay.channel.ChannelException;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedMessage;
import io.syncrelay.relay.envelope.DeliveryMetadata;
import io.syncrelay.relay.support.RelayClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * {@link LeasedChannel} over a RabbitMQ queue.
 * <p>
 * RabbitMQ has no visibility timeout, so a lease is an unacknowledged {@code basicGet} delivery held
 * on a dedicated AMQP channel: {@link #delete} acks it, {@link #release} nacks it with requeue. Leases
 * older than the requested visibility are nacked the next time this instance reads, which gives the
 * same redelivery guarantee as an expiring lease as long as some reader keeps polling. The long wait
 * is emulated by re-polling every {@code pollInterval}.
 * <p>
 * Delayed publishing uses the {@code x-delay} header and therefore needs a delayed-message exchange;
 * without one configured, delays are rejected. A publish bounded by a timeout runs the send on a
 * daemon thread and gives up waiting once the timeout passes, so a send blocked by broker flow
 * control cannot outlive the caller's deadline.
 */
public final class RabbitLeasedChannel implements LeasedChannel {

  private static final Logger log = LoggerFactory.getLogger(RabbitLeasedChannel.class);

  static final String DELAY_HEADER = "x-delay";
  static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

  private final ConnectionFactory connectionFactory;
  private final RabbitTemplate rabbitTemplate;
  private final String queue;
  private final String delayedExchange;
  private final Duration pollInterval;
  private final RelayClock clock;
  private final Map<String, Lease> leases = new ConcurrentHashMap<>();
  private final ExecutorService publisher;

  public RabbitLeasedChannel(ConnectionFactory connectionFactory,
                             RabbitTemplate rabbitTemplate,
                             String queue,
                             String delayedExchange,
                             Duration pollInterval,
                             RelayClock clock) {
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.rabbitTemplate = Objects.requireNonNull(rabbitTemplate, "rabbitTemplate");
    Objects.requireNonNull(queue, "queue");
    if (queue.isBlank()) {
      throw new IllegalArgumentException("queue must not be blank");
    }
    this.queue = queue;
    this.delayedExchange = delayedExchange == null || delayedExchange.isBlank() ? null : delayedExchange;
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.publisher = Executors.newCachedThreadPool(new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "rabbit-publish-" + queue);
        thread.setDaemon(true);
        return thread;
      }
    });
  }

  @Override
  public String name() {
    return queue;
  }

  @Override
  public String publish(String body, Duration delay) {
    Objects.requireNonNull(body, "body");
    long delayMs = delay == null ? 0L : Math.max(0L, delay.toMillis());
    MessageProperties props = new MessageProperties();
    String messageId = UUID.randomUUID().toString();
    props.setMessageId(messageId);
    props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
    props.setContentEncoding(StandardCharsets.UTF_8.name());
    props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
    props.setTimestamp(new Date(clock.unixMillis()));
    String exchange = "";
    if (delayMs > 0) {
      if (delayedExchange == null) {
        throw new ChannelException("delayed publish to " + queue + " requires a delayed-message exchange");
      }
      props.setHeader(DELAY_HEADER, delayMs);
      exchange = delayedExchange;
    }
    try {
      rabbitTemplate.send(exchange, queue, new Message(body.getBytes(StandardCharsets.UTF_8), props));
    } catch (AmqpException | ShutdownSignalException ex) {
      throw new ChannelException("publish to " + queue + " failed", ex);
    }
    return messageId;
  }

  @Override
  public String publish(String body, Duration delay, Duration timeout) {
    Objects.requireNonNull(body, "body");
    if (timeout == null) {
      return publish(body, delay);
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new ChannelException("publish to " + queue + " timed out before sending");
    }
    Future<String> send = publisher.submit(() -> publish(body, delay));
    try {
      return send.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      send.cancel(true);
      throw new ChannelException("publish to " + queue + " timed out after " + timeout.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      send.cancel(true);
      Thread.currentThread().interrupt();
      throw new ChannelException("publish to " + queue + " interrupted", ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof ChannelException channelException) {
        throw channelException;
      }
      throw new ChannelException("publish to " + queue + " failed", ex.getCause());
    }
  }

  @Override
  public List<LeasedMessage> receive(int maxMessages, Duration wait, Duration visibility) {
    if (maxMessages < 1) {
      throw new IllegalArgumentException("maxMessages must be >= 1");
    }
    Objects.requireNonNull(wait, "wait");
    Objects.requireNonNull(visibility, "visibility");
    expireLeases();
    long deadline = clock.monotonicNanos() + Math.max(0L, wait.toNanos());
    while (true) {
      List<LeasedMessage> batch = drain(maxMessages, visibility);
      if (!batch.isEmpty()) {
        return batch;
      }
      long remaining = deadline - clock.monotonicNanos();
      if (remaining <= 0) {
        return List.of();
      }
      try {
        TimeUnit.NANOSECONDS.sleep(Math.min(remaining, pollInterval.toNanos()));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new ChannelException("receive from " + queue + " interrupted", ex);
      }
    }
  }

  @Override
  public void delete(LeasedMessage message) {
    settle(message, true);
  }

  @Override
  public void release(LeasedMessage message) {
    settle(message, false);
  }

  @Override
  public Duration maxDelay() {
    return delayedExchange == null ? Duration.ZERO : DEFAULT_MAX_DELAY;
  }

  /**
   * Number of deliveries currently leased through this instance.
   */
  int outstandingLeases() {
    return leases.size();
  }

  private List<LeasedMessage> drain(int maxMessages, Duration visibility) {
    List<LeasedMessage> batch = new ArrayList<>(maxMessages);
    while (batch.size() < maxMessages) {
      LeasedMessage next = getOne(visibility);
      if (next == null) {
        break;
      }
      batch.add(next);
    }
    return batch;
  }

  private LeasedMessage getOne(Duration visibility) {
    Connection connection;
    Channel channel = null;
    try {
      connection = connectionFactory.createConnection();
      channel = connection.createChannel(false);
      GetResponse response = channel.basicGet(queue, false);
      if (response == null) {
        close(channel);
        return null;
      }
      String receiptHandle = UUID.randomUUID().toString();
      long expiresAt = clock.monotonicNanos() + visibility.toNanos();
      leases.put(receiptHandle, new Lease(channel, response.getEnvelope().getDeliveryTag(), expiresAt));
      return toMessage(response, receiptHandle);
    } catch (IOException | AmqpException | ShutdownSignalException ex) {
      close(channel);
      throw new ChannelException("receive from " + queue + " failed", ex);
    }
  }

  private LeasedMessage toMessage(GetResponse response, String receiptHandle) {
    AMQP.BasicProperties props = response.getProps();
    String messageId = props != null && props.getMessageId() != null
        ? props.getMessageId()
        : queue + "-" + response.getEnvelope().getDeliveryTag();
    long sentMs = props != null && props.getTimestamp() != null ? props.getTimestamp().getTime() : 0L;
    boolean redelivered = response.getEnvelope().isRedeliver();
    long receiveCount = receiveCount(props, redelivered);
    long firstReceiveMs = receiveCount <= 1 ? clock.unixMillis() : 0L;
    String body = response.getBody() == null ? "" : new String(response.getBody(), StandardCharsets.UTF_8);
    return new LeasedMessage(messageId, receiptHandle, body,
        new DeliveryMetadata(sentMs, firstReceiveMs, receiveCount));
  }

  static long receiveCount(AMQP.BasicProperties props, boolean redelivered) {
    Map<String, Object> headers = props == null ? null : props.getHeaders();
    Object count = headers == null ? null : headers.get(DELIVERY_COUNT_HEADER);
    if (count instanceof Number number) {
      // quorum queues count previous deliveries
      return number.longValue() + 1;
    }
    return redelivered ? 2L : 1L;
  }

  private void settle(LeasedMessage message, boolean consume) {
    Objects.requireNonNull(message, "message");
    Lease lease = leases.remove(message.receiptHandle());
    if (lease == null) {
      throw new ChannelException("receipt handle for " + message.messageId() + " is not leased on " + queue);
    }
    try {
      if (consume) {
        lease.channel().basicAck(lease.deliveryTag(), false);
      } else {
        lease.channel().basicNack(lease.deliveryTag(), false, true);
      }
    } catch (IOException | AmqpException | ShutdownSignalException ex) {
      throw new ChannelException((consume ? "ack" : "nack") + " on " + queue + " failed", ex);
    } finally {
      close(lease.channel());
    }
  }

  private void expireLeases() {
    long now = clock.monotonicNanos();
    leases.forEach((handle, lease) -> {
      if (lease.expiresAtNanos() - now > 0) {
        return;
      }
      if (!leases.remove(handle, lease)) {
        return;
      }
      log.debug("lease {} on {} expired, requeueing", handle, queue);
      try {
        lease.channel().basicNack(lease.deliveryTag(), false, true);
      } catch (IOException | AmqpException | ShutdownSignalException ex) {
        log.warn("requeue of expired lease on {} failed: {}", queue, ex.getMessage());
      } finally {
        close(lease.channel());
      }
    });
  }

  private void close(Channel channel) {
    if (channel == null) {
      return;
    }
    try {
      if (channel.isOpen()) {
        channel.close();
      }
    } catch (IOException | TimeoutException | AmqpException | ShutdownSignalException ex) {
      log.debug("closing channel for {} failed: {}", queue, ex.getMessage());
    }
  }

  private record Lease(Channel channel, long deliveryTag, long expiresAtNanos) {
  }
}
