package com.acme.delivery.spi;

import java.time.Duration;

/** A durable, pull-based subscription with explicit acknowledgement. */
public interface PullSubscription extends AutoCloseable {

    /** Ask the broker for up to {@code batch} more messages. Does not block. */
    void pull(int batch);

    /**
     * Wait for the next delivered message.
     *
     * @return the message, or {@code null} if none arrived within {@code wait} or the subscription
     *     was closed
     */
    StreamMessage next(Duration wait) throws InterruptedException;

    boolean isClosed();

    /** Stop receiving. Messages already delivered but not acked are redelivered later. */
    @Override
    void close();
}
