package io.syncrelay.relay.channel;

/**
 * What a single {@link FilteredConsumer#pollOnce} step did with the message it read.
 */
public enum PollOutcome {
  /** Nothing arrived before the read wait elapsed. */
  EMPTY,
  /** The message matched and was deleted. */
  MATCHED,
  /** The message belonged to another waiter and its lease was released. */
  RELEASED,
  /** The message could not be parsed and was deleted. */
  DISCARDED
}
