package com.acme.delivery.spi;

/** Event-stream broker consumed by the stream consumer runner and the stream publisher. */
public interface StreamBroker {

    boolean streamExists(String stream);

    PullSubscription pullSubscribe(String subject, PullOptions options);

    /**
     * Publish a payload. Publishing the same {@code msgId} twice within the broker's duplicate
     * window stores the message once.
     */
    void publish(String subject, String payload, String msgId);
}
