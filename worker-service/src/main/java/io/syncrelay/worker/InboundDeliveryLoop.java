package io.syncrelay.worker;

import io.syncrelay.relay.channel.ChannelException;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.channel.LeasedMessage;
import io.syncrelay.relay.worker.BatchProcessor;
import io.syncrelay.relay.worker.BatchResult;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Long-polls the inbound channel on a dedicated daemon thread and hands every batch to the
 * {@link BatchProcessor}. Started when the application context is ready and stopped on shutdown.
 */
public final class InboundDeliveryLoop implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(InboundDeliveryLoop.class);

    private final LeasedChannel inbound;
    private final BatchProcessor processor;
    private final WorkerProperties.Inbound settings;
    private final boolean autoStartup;
    private volatile boolean running;
    private volatile Thread thread;

    public InboundDeliveryLoop(LeasedChannel inbound,
                               BatchProcessor processor,
                               WorkerProperties.Inbound settings,
                               boolean autoStartup) {
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread worker = new Thread(this::run, "inbound-delivery-" + inbound.name());
        worker.setDaemon(true);
        thread = worker;
        worker.start();
        log.info("Inbound delivery loop started (queue={}, batchSize={}, wait={}, visibility={})",
                inbound.name(), settings.getBatchSize(), settings.getWait(), settings.getVisibility());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread worker = thread;
        thread = null;
        if (worker != null) {
            worker.interrupt();
            try {
                worker.join(settings.getVisibility().toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Inbound delivery loop stopped (queue={})", inbound.name());
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    private void run() {
        while (running) {
            List<LeasedMessage> batch;
            try {
                batch = inbound.receive(settings.getBatchSize(), settings.getWait(), settings.getVisibility());
            } catch (ChannelException ex) {
                if (!running || ex.isInterruption()) {
                    return;
                }
                log.warn("Receive from {} failed: {}", inbound.name(), ex.getMessage());
                if (!pause(settings.getErrorBackoff())) {
                    return;
                }
                continue;
            } catch (RuntimeException ex) {
                log.warn("Receive from {} failed unexpectedly", inbound.name(), ex);
                if (!pause(settings.getErrorBackoff())) {
                    return;
                }
                continue;
            }
            if (batch.isEmpty()) {
                continue;
            }
            BatchResult result;
            try {
                result = processor.process(batch);
            } catch (RuntimeException ex) {
                log.warn("Batch of {} from {} aborted; undeleted deliveries return after their lease",
                        batch.size(), inbound.name(), ex);
                if (!pause(settings.getErrorBackoff())) {
                    return;
                }
                continue;
            }
            if (result.hasFailures()) {
                log.warn("Batch from {}: {} processed, {} left for redelivery {}",
                        inbound.name(), result.processed(), result.failedMessageIds().size(), result.failedMessageIds());
            } else {
                log.debug("Batch from {}: {} processed", inbound.name(), result.processed());
            }
        }
    }

    private boolean pause(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
