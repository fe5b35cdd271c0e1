package io.syncrelay.relay.channel;

import java.time.Duration;
import java.util.List;

/**
 * Opens {@link LeasedChannel}s by queue identifier (a URL for SQS, a queue name for RabbitMQ).
 */
@FunctionalInterface
public interface LeasedChannelFactory {

  LeasedChannel open(String queue);

  /**
   * Channel standing in for a queue whose identifier was not configured. Every operation fails, so
   * callers are expected to check the configuration before touching it.
   *
   * @param setting name of the missing setting, used in error messages
   */
  static LeasedChannel unconfigured(String setting) {
    return new LeasedChannel() {
      @Override
      public String name() {
        return "";
      }

      @Override
      public String publish(String body, Duration delay) {
        throw new ChannelException("missing env " + setting);
      }

      @Override
      public List<LeasedMessage> receive(int maxMessages, Duration wait, Duration visibility) {
        throw new ChannelException("missing env " + setting);
      }

      @Override
      public void delete(LeasedMessage message) {
        throw new ChannelException("missing env " + setting);
      }

      @Override
      public void release(LeasedMessage message) {
        throw new ChannelException("missing env " + setting);
      }
    };
  }
}
