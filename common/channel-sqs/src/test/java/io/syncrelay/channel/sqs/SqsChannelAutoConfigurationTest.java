package io.syncrelay.channel.sqs;

import static org.assertj.core.api.Assertions.assertThat;

import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedChannelFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;

class SqsChannelAutoConfigurationTest {

  private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(SqsChannelAutoConfiguration.class));

  @Test
  void sqsIsTheDefaultChannelType() {
    contextRunner
        .withPropertyValues("syncrelay.channel.sqs.region=eu-west-1")
        .run(context -> {
          assertThat(context).hasSingleBean(SqsClient.class);
          assertThat(context.getBean(SqsClient.class).serviceClientConfiguration().region())
              .isEqualTo(Region.EU_WEST_1);
          LeasedChannel channel = context.getBean(LeasedChannelFactory.class)
              .open("https://sqs.eu-west-1.amazonaws.com/123456789012/relay-push");
          assertThat(channel).isInstanceOf(SqsLeasedChannel.class);
          assertThat(channel.name()).isEqualTo("relay-push");
        });
  }

  @Test
  void endpointOverrideIsApplied() {
    contextRunner
        .withPropertyValues("syncrelay.channel.type=sqs",
            "syncrelay.channel.sqs.region=us-east-1",
            "syncrelay.channel.sqs.endpoint=http://localhost:4566")
        .run(context -> assertThat(context.getBean(SqsClient.class).serviceClientConfiguration().endpointOverride())
            .hasValueSatisfying(uri -> assertThat(uri.getPort()).isEqualTo(4566)));
  }

  @Test
  void staysOffForOtherChannelTypes() {
    contextRunner
        .withPropertyValues("syncrelay.channel.type=rabbit")
        .run(context -> {
          assertThat(context).doesNotHaveBean(SqsClient.class);
          assertThat(context).doesNotHaveBean(LeasedChannelFactory.class);
        });
  }
}
