package io.syncrelay.relay.dispatch;

import io.syncrelay.relay.RelayEndpoints;
import io.syncrelay.relay.channel.ChannelException;
import io.syncrelay.relay.channel.LeasedChannel;
import io.syncrelay.relay.envelope.EnvelopeCodec;
import io.syncrelay.relay.support.RelayClock;
import io.syncrelay.relay.support.RelayMetrics;
import io.syncrelay.relay.worker.BatchProcessor;
import io.syncrelay.relay.worker.PassThroughRequestHandler;
import io.syncrelay.relay.worker.ResponseEmitter;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Background worker answering every request on the push channel, for dispatcher tests.
 */
final class EchoWorker implements AutoCloseable {

  private final LeasedChannel push;
  private final BatchProcessor processor;
  private final Thread thread;
  private volatile boolean running = true;

  EchoWorker(LeasedChannel push, LeasedChannel receive, EnvelopeCodec codec, RelayEndpoints endpoints) {
    this.push = push;
    ResponseEmitter emitter = new ResponseEmitter(receive, codec, endpoints, new PassThroughRequestHandler(),
        RelayClock.system());
    this.processor = new BatchProcessor(push, emitter, RelayMetrics.detached());
    this.thread = new Thread(this::run, "echo-worker");
    this.thread.setDaemon(true);
  }

  EchoWorker start() {
    thread.start();
    return this;
  }

  private void run() {
    while (running) {
      try {
        processor.process(push.receive(10, Duration.ofMillis(50), Duration.ofSeconds(30)));
      } catch (ChannelException ex) {
        return;
      }
    }
  }

  @Override
  public void close() throws InterruptedException {
    running = false;
    thread.interrupt();
    thread.join(TimeUnit.SECONDS.toMillis(2));
  }
}
