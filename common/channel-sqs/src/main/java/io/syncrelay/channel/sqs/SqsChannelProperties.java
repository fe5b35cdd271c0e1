package io.syncrelay.channel.sqs;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "syncrelay.channel.sqs")
public class SqsChannelProperties {

  /**
   * AWS region of the queues. Blank falls back to the SDK's default region chain.
   */
  private String region;

  /**
   * Endpoint override, for LocalStack or ElasticMQ.
   */
  private String endpoint;

  /**
   * Upper bound of calls that do not long-poll.
   */
  private Duration callTimeout = Duration.ofSeconds(5);

  /**
   * Added to the long wait when bounding a receive call.
   */
  private Duration callSlack = Duration.ofSeconds(2);

  public String getRegion() {
    return region;
  }

  public void setRegion(String region) {
    this.region = region;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public void setEndpoint(String endpoint) {
    this.endpoint = endpoint;
  }

  public Duration getCallTimeout() {
    return callTimeout;
  }

  public void setCallTimeout(Duration callTimeout) {
    this.callTimeout = callTimeout;
  }

  public Duration getCallSlack() {
    return callSlack;
  }

  public void setCallSlack(Duration callSlack) {
    this.callSlack = callSlack;
  }
}
