package io.syncrelay.dispatcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.syncrelay.relay.RelayEndpoints;
import io.syncrelay.relay.channel.InMemoryChannelFactory;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedChannelFactory;
import io.syncrelay.relay.dispatch.Dispatcher;
import io.syncrelay.relay.envelope.EnvelopeCodec;
import io.syncrelay.relay.support.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DispatcherProperties.class)
class DispatcherConfig {
    private static final Logger log = LoggerFactory.getLogger(DispatcherConfig.class);

    @Bean
    RelayEndpoints relayEndpoints(DispatcherProperties properties) {
        RelayEndpoints endpoints = new RelayEndpoints(
                properties.getQueues().getPush(),
                properties.getQueues().getReceive(),
                properties.getRegion());
        if (endpoints.pushQueue().isEmpty() || endpoints.receiveQueue().isEmpty()) {
            log.warn("Queue pair incomplete (push='{}', receive='{}'); dispatches will fail until configured",
                    endpoints.pushQueue(), endpoints.receiveQueue());
        } else {
            log.info("Relaying {} -> {} (region={})",
                    endpoints.pushQueueName(), endpoints.receiveQueueName(), endpoints.region());
        }
        return endpoints;
    }

    @Bean
    EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
        return new EnvelopeCodec(objectMapper);
    }

    @Bean
    RelayMetrics relayMetrics(MeterRegistry meterRegistry) {
        return new RelayMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "syncrelay.channel", name = "type", havingValue = "in-memory")
    LeasedChannelFactory inMemoryChannelFactory() {
        log.info("Relay channels held in memory; only workers in this JVM can answer");
        return new InMemoryChannelFactory();
    }

    @Bean
    Dispatcher dispatcher(DispatcherProperties properties,
                          RelayEndpoints endpoints,
                          LeasedChannelFactory channelFactory,
                          EnvelopeCodec codec,
                          RelayMetrics metrics) {
        return Dispatcher.builder()
                .endpoints(endpoints)
                .pushChannel(open(channelFactory, endpoints.pushQueue(), "PUSH_QUEUE_URL"))
                .receiveChannel(open(channelFactory, endpoints.receiveQueue(), "RECEIVE_QUEUE_URL"))
                .codec(codec)
                .budget(properties.getDeadline().toBudget())
                .pollSettings(properties.getPoll().toSettings())
                .metrics(metrics)
                .build();
    }

    private static LeasedChannel open(LeasedChannelFactory factory, String queue, String setting) {
        return queue.isEmpty() ? LeasedChannelFactory.unconfigured(setting) : factory.open(queue);
    }
}
