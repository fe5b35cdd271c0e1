package io.syncrelay.channel.rabbit;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "syncrelay.channel.rabbit")
public class RabbitChannelProperties {

  /**
   * Exchange of type {@code x-delayed-message} used for delayed publishes. Delays are dropped
   * when unset.
   */
  private String delayedExchange;

  /**
   * Spacing of {@code basicGet} calls while emulating a long wait.
   */
  private Duration pollInterval = Duration.ofMillis(100);

  public String getDelayedExchange() {
    return delayedExchange;
  }

  public void setDelayedExchange(String delayedExchange) {
    this.delayedExchange = delayedExchange;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }
}
