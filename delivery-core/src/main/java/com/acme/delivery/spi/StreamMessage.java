package com.acme.delivery.spi;

/** A message delivered by a pull subscription. */
public interface StreamMessage {

    String subject();

    /** JSON payload. */
    String payload();

    /** Acknowledge the message so the broker does not redeliver it. */
    void ack();
}
