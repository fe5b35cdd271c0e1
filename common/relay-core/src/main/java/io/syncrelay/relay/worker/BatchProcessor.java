package io.syncrelay.relay.worker;

import io.syncrelay.relay.RelayException;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedMessage;
import io.syncrelay.relay.support.RelayMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes a batch of inbound deliveries item by item.
 * <p>
 * A delivery is deleted from the inbound channel only after its response has been published.
 * Failed deliveries stay leased until the visibility timeout lapses, at which point the channel
 * hands them out again; that redelivery is the only retry the relay performs.
 */
public final class BatchProcessor {

  private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

  private final LeasedChannel inbound;
  private final ResponseEmitter emitter;
  private final RelayMetrics metrics;

  public BatchProcessor(LeasedChannel inbound, ResponseEmitter emitter, RelayMetrics metrics) {
    this.inbound = Objects.requireNonNull(inbound, "inbound");
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public BatchResult process(List<LeasedMessage> deliveries) {
    if (deliveries == null || deliveries.isEmpty()) {
      return new BatchResult(0, List.of());
    }
    int processed = 0;
    List<String> failed = new ArrayList<>();
    for (LeasedMessage delivery : deliveries) {
      try {
        emitter.emit(delivery);
      } catch (RelayException ex) {
        log.warn("delivery {} failed with {}: {}", delivery.messageId(), ex.failure(), ex.getMessage());
        metrics.recordEmission(false);
        failed.add(delivery.messageId());
        continue;
      } catch (RuntimeException ex) {
        log.warn("delivery {} failed in request handler", delivery.messageId(), ex);
        metrics.recordEmission(false);
        failed.add(delivery.messageId());
        continue;
      }
      metrics.recordEmission(true);
      try {
        inbound.delete(delivery);
        processed++;
      } catch (RuntimeException ex) {
        // Response is already out; a redelivery produces a second, orphaned response.
        log.warn("could not delete delivery {} from {}: {}", delivery.messageId(), inbound.name(), ex.getMessage());
        failed.add(delivery.messageId());
      }
    }
    return new BatchResult(processed, failed);
  }
}
