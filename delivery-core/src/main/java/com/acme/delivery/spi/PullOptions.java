package com.acme.delivery.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for a durable pull subscription.
 *
 * @param explicitAck every message must be acked individually
 * @param ackWait time before an unacked message becomes eligible for redelivery
 * @param manualAck the client acks, never the library
 * @param deliverNewOnly a new durable starts at the tail of the stream
 * @param instantReplay redeliveries are replayed as fast as possible
 * @param sampleRate percentage of acks sampled for broker metrics
 * @param filterSubject subject pattern the durable is restricted to
 * @param durableName stable identity of the broker-side cursor
 */
public record PullOptions(
    boolean explicitAck,
    Duration ackWait,
    boolean manualAck,
    boolean deliverNewOnly,
    boolean instantReplay,
    int sampleRate,
    String filterSubject,
    String durableName) {

  public PullOptions {
    Objects.requireNonNull(ackWait, "ackWait");
    Objects.requireNonNull(filterSubject, "filterSubject");
    Objects.requireNonNull(durableName, "durableName");
  }

  /** The options every consumer subscription uses: explicit manual ack, new messages only. */
  public static PullOptions durable(String filterSubject, String durableName, Duration ackWait) {
    return new PullOptions(true, ackWait, true, true, true, 100, filterSubject, durableName);
  }
}
