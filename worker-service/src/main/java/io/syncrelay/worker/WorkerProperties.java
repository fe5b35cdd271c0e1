package io.syncrelay.worker;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "syncrelay")
public class WorkerProperties {
    private String region;

    @Valid
    private final Queues queues = new Queues();

    @Valid
    private final Inbound inbound = new Inbound();

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public Queues getQueues() {
        return queues;
    }

    public Inbound getInbound() {
        return inbound;
    }

    public static class Queues {
        /**
         * Queue the worker consumes requests from.
         */
        private String push;

        /**
         * Queue responses are published to.
         */
        private String receive;

        public String getPush() {
            return push;
        }

        public void setPush(String push) {
            this.push = push;
        }

        public String getReceive() {
            return receive;
        }

        public void setReceive(String receive) {
            this.receive = receive;
        }
    }

    public static class Inbound {
        private boolean enabled = true;

        @Min(1)
        @Max(10)
        private int batchSize = 10;

        @NotNull
        private Duration wait = Duration.ofSeconds(20);

        /**
         * Lease taken on each request; a failed item is handed out again once it lapses.
         */
        @NotNull
        private Duration visibility = Duration.ofSeconds(30);

        /**
         * Pause after a failed read before polling again.
         */
        @NotNull
        private Duration errorBackoff = Duration.ofSeconds(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getWait() {
            return wait;
        }

        public void setWait(Duration wait) {
            this.wait = wait;
        }

        public Duration getVisibility() {
            return visibility;
        }

        public void setVisibility(Duration visibility) {
            this.visibility = visibility;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }
    }
}
