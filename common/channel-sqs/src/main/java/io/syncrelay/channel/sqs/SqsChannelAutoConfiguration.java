package io.syncrelay.channel.sqs;

import io.syncrelay.relay.channel.LeasedChannelFactory;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

/**
 * Opens relay channels on Amazon SQS. This is the default channel type.
 */
@AutoConfiguration
@ConditionalOnClass(SqsClient.class)
@ConditionalOnProperty(prefix = "syncrelay.channel", name = "type", havingValue = "sqs", matchIfMissing = true)
@EnableConfigurationProperties(SqsChannelProperties.class)
public class SqsChannelAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(SqsChannelAutoConfiguration.class);

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  SqsClient sqsClient(SqsChannelProperties properties) {
    SqsClientBuilder builder = SqsClient.builder();
    if (hasText(properties.getRegion())) {
      builder.region(Region.of(properties.getRegion().trim()));
    }
    if (hasText(properties.getEndpoint())) {
      builder.endpointOverride(URI.create(properties.getEndpoint().trim()));
    }
    log.info("SQS client (region={}, endpoint={})",
        hasText(properties.getRegion()) ? properties.getRegion() : "<default chain>",
        hasText(properties.getEndpoint()) ? properties.getEndpoint() : "<aws>");
    return builder.build();
  }

  @Bean
  LeasedChannelFactory sqsLeasedChannelFactory(SqsClient sqsClient, SqsChannelProperties properties) {
    return queueUrl -> new SqsLeasedChannel(sqsClient, queueUrl, properties.getCallTimeout(), properties.getCallSlack());
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
