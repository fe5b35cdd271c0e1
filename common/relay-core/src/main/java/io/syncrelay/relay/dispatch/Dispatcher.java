package io.syncrelay.relay.dispatch;

import io.syncrelay.relay.RelayEndpoints;
import io.syncrelay.relay.RelayException;
import io.syncrelay.relay.RelayFailure;
import io.syncrelay.relay.channel.ChannelException;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.dispatch.DispatchOutput.LocalMarks;
import io.syncrelay.relay.envelope.EnvelopeCodec;
import io.syncrelay.relay.envelope.RequestEnvelope;
import io.syncrelay.relay.support.RelayClock;
import io.syncrelay.relay.support.RelayMetrics;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Turns the asynchronous queue pair into a synchronous call.
 * <p>
 * A dispatch tags the request with a fresh correlation identity, publishes it to the push channel
 * and then polls the shared receive channel until the response carrying that identity arrives or
 * the deadline passes. The dispatcher never retries: every failure is reported once with its
 * {@link RelayFailure} so callers can tell a known failure from an unknown outcome
 * ({@link DispatchStatus#TIMEOUT}). Requests already published are not retracted on timeout; their
 * responses are left for the channel's retention policy to expire.
 * <p>
 * Instances hold no per-call state and are safe to share between concurrent callers.
 */
public final class Dispatcher {

  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  private final RelayEndpoints endpoints;
  private final LeasedChannel pushChannel;
  private final EnvelopeCodec codec;
  private final DeadlineBudget budget;
  private final ResponsePoller poller;
  private final CorrelationIds correlationIds;
  private final RelayClock clock;
  private final RelayMetrics metrics;

  private Dispatcher(Builder builder) {
    this.endpoints = Objects.requireNonNull(builder.endpoints, "endpoints");
    this.pushChannel = Objects.requireNonNull(builder.pushChannel, "pushChannel");
    LeasedChannel receiveChannel = Objects.requireNonNull(builder.receiveChannel, "receiveChannel");
    this.codec = Objects.requireNonNull(builder.codec, "codec");
    this.budget = builder.budget != null ? builder.budget : new DeadlineBudget();
    this.correlationIds = builder.correlationIds != null ? builder.correlationIds : new CorrelationIds();
    this.clock = builder.clock != null ? builder.clock : RelayClock.system();
    this.metrics = builder.metrics != null ? builder.metrics : RelayMetrics.detached();
    PollSettings pollSettings = builder.pollSettings != null ? builder.pollSettings : PollSettings.defaults();
    this.poller = new ResponsePoller(receiveChannel, codec, pollSettings, clock, metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dispatches without an externally imposed deadline.
   */
  public DispatchResult dispatch(DispatchRequest request) {
    return dispatch(request, Optional.empty());
  }

  /**
   * Issues one request and waits for its correlated response.
   *
   * @param request           caller options, {@code null} for all defaults
   * @param externalRemaining time left before the hosting environment gives up on this call, if known
   * @return the outcome; never {@code null} and never thrown
   */
  public DispatchResult dispatch(DispatchRequest request, Optional<Duration> externalRemaining) {
    long started = clock.monotonicNanos();
    try {
      DispatchOutput output = execute(request == null ? DispatchRequest.empty() : request, externalRemaining);
      long totalMs = elapsedMs(started);
      metrics.recordDispatch(DispatchStatus.OK.name(), totalMs);
      log.info("dispatch ok id={} runId={} totalMs={}", output.id(), output.runId(), totalMs);
      return DispatchResult.ok(totalMs, output);
    } catch (RelayException ex) {
      long totalMs = elapsedMs(started);
      RelayFailure failure = ex.failure();
      metrics.recordDispatch(failure.status(), totalMs);
      if (failure.isTimeout()) {
        log.info("dispatch {} after {} ms: {}", failure, totalMs, ex.getMessage());
      } else {
        log.warn("dispatch {} after {} ms: {}", failure, totalMs, ex.getMessage(), ex.getCause());
      }
      return DispatchResult.failed(failure, totalMs, ex.getMessage());
    } finally {
      MDC.remove("correlation_id");
      MDC.remove("run_id");
    }
  }

  private DispatchOutput execute(DispatchRequest request, Optional<Duration> externalRemaining) {
    endpoints.requireConfigured();
    DispatchRequest normalised = request.normalise(
        "run-" + clock.unixNanos(), (int) Math.min(Integer.MAX_VALUE, pushChannel.maxDelay().toSeconds()));
    Duration wait = budget.effective(normalised.maxWaitMs(), externalRemaining);
    if (wait.isZero()) {
      throw new RelayException(RelayFailure.DEADLINE_TOO_CLOSE, "deadline too close");
    }
    Deadline deadline = Deadline.after(wait, clock);

    String id = correlationIds.next();
    String runId = normalised.runId();
    MDC.put("correlation_id", id);
    MDC.put("run_id", runId);

    long dispatchStart = clock.unixNanos();
    long sendUnixNano = clock.unixNanos();
    long sendStart = clock.unixNanos();
    String body = codec.encode(new RequestEnvelope(
        id, runId, sendUnixNano, sendStart, RequestEnvelope.padding(normalised.messageBodyBytes())));
    publish(body, Duration.ofSeconds(normalised.delaySeconds()), deadline);
    long sendEnd = clock.unixNanos();

    long pollStart = clock.unixNanos();
    MatchedResponse matched = poller.await(id, runId, deadline);
    LocalMarks marks = new LocalMarks(runId, id, dispatchStart, sendUnixNano, sendStart, sendEnd, pollStart);
    return DispatchOutput.assemble(
        endpoints.region(), endpoints.pushQueueName(), endpoints.receiveQueueName(), marks, matched);
  }

  private void publish(String body, Duration delay, Deadline deadline) {
    if (deadline.isExpired()) {
      throw new RelayException(RelayFailure.TIMEOUT, "send message: deadline exceeded");
    }
    try {
      String messageId = pushChannel.publish(body, delay, deadline.remaining());
      if (log.isDebugEnabled()) {
        log.debug("published request messageId={} to {} delay={}s", messageId, pushChannel.name(), delay.toSeconds());
      }
    } catch (ChannelException ex) {
      if (ex.isInterruption() || deadline.isExpired()) {
        throw new RelayException(RelayFailure.TIMEOUT, "send message: deadline exceeded", ex);
      }
      throw new RelayException(RelayFailure.PUBLISH_FAILURE, "send message: " + ex.getMessage(), ex);
    }
  }

  private long elapsedMs(long startedNanos) {
    return Math.max(0L, (clock.monotonicNanos() - startedNanos) / 1_000_000L);
  }

  /**
   * Builder for {@link Dispatcher}. Endpoints, both channels and the codec are required; the
   * remaining collaborators fall back to production defaults.
   */
  public static final class Builder {

    private RelayEndpoints endpoints;
    private LeasedChannel pushChannel;
    private LeasedChannel receiveChannel;
    private EnvelopeCodec codec;
    private DeadlineBudget budget;
    private PollSettings pollSettings;
    private CorrelationIds correlationIds;
    private RelayClock clock;
    private RelayMetrics metrics;

    private Builder() {
    }

    public Builder endpoints(RelayEndpoints endpoints) {
      this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
      return this;
    }

    public Builder pushChannel(LeasedChannel pushChannel) {
      this.pushChannel = Objects.requireNonNull(pushChannel, "pushChannel");
      return this;
    }

    public Builder receiveChannel(LeasedChannel receiveChannel) {
      this.receiveChannel = Objects.requireNonNull(receiveChannel, "receiveChannel");
      return this;
    }

    public Builder codec(EnvelopeCodec codec) {
      this.codec = Objects.requireNonNull(codec, "codec");
      return this;
    }

    public Builder budget(DeadlineBudget budget) {
      this.budget = Objects.requireNonNull(budget, "budget");
      return this;
    }

    public Builder pollSettings(PollSettings pollSettings) {
      this.pollSettings = Objects.requireNonNull(pollSettings, "pollSettings");
      return this;
    }

    public Builder correlationIds(CorrelationIds correlationIds) {
      this.correlationIds = Objects.requireNonNull(correlationIds, "correlationIds");
      return this;
    }

    public Builder clock(RelayClock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder metrics(RelayMetrics metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Dispatcher build() {
      return new Dispatcher(this);
    }
  }
}
