package io.syncrelay.channel.rabbit;

import io.syncrelay.relay.channel.LeasedChannelFactory;
import io.syncrelay.relay.support.RelayClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Opens relay channels on RabbitMQ when {@code syncrelay.channel.type=rabbit}. Connection settings
 * come from the standard {@code spring.rabbitmq.*} properties.
 */
@AutoConfiguration(after = RabbitAutoConfiguration.class)
@ConditionalOnClass(RabbitTemplate.class)
@ConditionalOnProperty(prefix = "syncrelay.channel", name = "type", havingValue = "rabbit")
@EnableConfigurationProperties(RabbitChannelProperties.class)
public class RabbitChannelAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(RabbitChannelAutoConfiguration.class);

  @Bean
  LeasedChannelFactory rabbitLeasedChannelFactory(ConnectionFactory connectionFactory,
                                                  RabbitTemplate rabbitTemplate,
                                                  RabbitChannelProperties properties) {
    log.info("Relay channels on RabbitMQ (delayedExchange={}, pollInterval={})",
        properties.getDelayedExchange(), properties.getPollInterval());
    return queue -> new RabbitLeasedChannel(connectionFactory, rabbitTemplate, queue,
        properties.getDelayedExchange(), properties.getPollInterval(), RelayClock.system());
  }
}
