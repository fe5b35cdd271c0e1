package io.syncrelay.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.syncrelay.relay.RelayEndpoints;
import io.syncrelay.relay.channel.InMemoryChannelFactory;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedChannelFactory;
import io.syncrelay.relay.envelope.EnvelopeCodec;
import io.syncrelay.relay.support.RelayClock;
import io.syncrelay.relay.support.RelayMetrics;
import io.syncrelay.relay.worker.BatchProcessor;
import io.syncrelay.relay.worker.PassThroughRequestHandler;
import io.syncrelay.relay.worker.RequestHandler;
import io.syncrelay.relay.worker.ResponseEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(WorkerProperties.class)
class WorkerConfig {
    private static final Logger log = LoggerFactory.getLogger(WorkerConfig.class);

    @Bean
    RelayEndpoints relayEndpoints(WorkerProperties properties) {
        RelayEndpoints endpoints = new RelayEndpoints(
                properties.getQueues().getPush(),
                properties.getQueues().getReceive(),
                properties.getRegion());
        if (endpoints.pushQueue().isEmpty() || endpoints.receiveQueue().isEmpty()) {
            log.warn("Queue pair incomplete (push='{}', receive='{}'); the worker will not consume",
                    endpoints.pushQueue(), endpoints.receiveQueue());
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
        log.info("Relay channels held in memory; only dispatchers in this JVM can reach this worker");
        return new InMemoryChannelFactory();
    }

    @Bean
    ResponseEmitter responseEmitter(LeasedChannelFactory channelFactory,
                                    RelayEndpoints endpoints,
                                    EnvelopeCodec codec,
                                    ObjectProvider<RequestHandler> handler) {
        return new ResponseEmitter(
                open(channelFactory, endpoints.receiveQueue(), "RECEIVE_QUEUE_URL"),
                codec,
                endpoints,
                handler.getIfAvailable(PassThroughRequestHandler::new),
                RelayClock.system());
    }

    @Bean
    BatchProcessor batchProcessor(LeasedChannelFactory channelFactory,
                                  RelayEndpoints endpoints,
                                  ResponseEmitter emitter,
                                  RelayMetrics metrics) {
        return new BatchProcessor(open(channelFactory, endpoints.pushQueue(), "PUSH_QUEUE_URL"), emitter, metrics);
    }

    @Bean
    InboundDeliveryLoop inboundDeliveryLoop(LeasedChannelFactory channelFactory,
                                            RelayEndpoints endpoints,
                                            BatchProcessor processor,
                                            WorkerProperties properties) {
        WorkerProperties.Inbound inbound = properties.getInbound();
        boolean configured = !endpoints.pushQueue().isEmpty() && !endpoints.receiveQueue().isEmpty();
        return new InboundDeliveryLoop(open(channelFactory, endpoints.pushQueue(), "PUSH_QUEUE_URL"), processor,
                inbound, inbound.isEnabled() && configured);
    }

    private static LeasedChannel open(LeasedChannelFactory factory, String queue, String setting) {
        return queue.isEmpty() ? LeasedChannelFactory.unconfigured(setting) : factory.open(queue);
    }
}
