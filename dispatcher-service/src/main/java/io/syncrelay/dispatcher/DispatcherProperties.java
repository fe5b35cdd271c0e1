package io.syncrelay.dispatcher;

import io.syncrelay.relay.dispatch.DeadlineBudget;
import io.syncrelay.relay.dispatch.PollSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "syncrelay")
public class DispatcherProperties {
    /**
     * Region reported in response provenance.
     */
    private String region;

    @Valid
    private final Queues queues = new Queues();

    @Valid
    private final Deadline deadline = new Deadline();

    @Valid
    private final Poll poll = new Poll();

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public Queues getQueues() {
        return queues;
    }

    public Deadline getDeadline() {
        return deadline;
    }

    public Poll getPoll() {
        return poll;
    }

    public static class Queues {
        /**
         * Request queue. Left blank, every dispatch fails with a configuration error.
         */
        private String push;

        /**
         * Shared response queue.
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

    public static class Deadline {
        @NotNull
        private Duration defaultWait = DeadlineBudget.DEFAULT_WAIT;

        @NotNull
        private Duration ceiling = DeadlineBudget.DEFAULT_CEILING;

        @NotNull
        private Duration safetyMargin = DeadlineBudget.DEFAULT_SAFETY_MARGIN;

        public Duration getDefaultWait() {
            return defaultWait;
        }

        public void setDefaultWait(Duration defaultWait) {
            this.defaultWait = defaultWait;
        }

        public Duration getCeiling() {
            return ceiling;
        }

        public void setCeiling(Duration ceiling) {
            this.ceiling = ceiling;
        }

        public Duration getSafetyMargin() {
            return safetyMargin;
        }

        public void setSafetyMargin(Duration safetyMargin) {
            this.safetyMargin = safetyMargin;
        }

        DeadlineBudget toBudget() {
            return new DeadlineBudget(defaultWait, ceiling, safetyMargin);
        }
    }

    public static class Poll {
        @NotNull
        private Duration receiveWait = PollSettings.DEFAULT_RECEIVE_WAIT;

        @NotNull
        private Duration visibility = PollSettings.DEFAULT_VISIBILITY;

        @NotNull
        private Duration mismatchBackoff = PollSettings.DEFAULT_MISMATCH_BACKOFF;

        @NotNull
        private Duration emptyBackoff = PollSettings.DEFAULT_EMPTY_BACKOFF;

        public Duration getReceiveWait() {
            return receiveWait;
        }

        public void setReceiveWait(Duration receiveWait) {
            this.receiveWait = receiveWait;
        }

        public Duration getVisibility() {
            return visibility;
        }

        public void setVisibility(Duration visibility) {
            this.visibility = visibility;
        }

        public Duration getMismatchBackoff() {
            return mismatchBackoff;
        }

        public void setMismatchBackoff(Duration mismatchBackoff) {
            this.mismatchBackoff = mismatchBackoff;
        }

        public Duration getEmptyBackoff() {
            return emptyBackoff;
        }

        public void setEmptyBackoff(Duration emptyBackoff) {
            this.emptyBackoff = emptyBackoff;
        }

        PollSettings toSettings() {
            return new PollSettings(receiveWait, visibility, mismatchBackoff, emptyBackoff);
        }
    }
}
