package com.acme.delivery.spi;

import java.util.List;

/**
 * List and hash storage behind a work queue. Every payload is serialized text. Implementations
 * must make {@link #append} and {@link #moveDeadLetters} atomic relative to other clients and
 * {@link #pop} a single-item atomic dequeue.
 */
public interface JobStore {

    /** Append items to the tail of the queue in order, as one atomic operation. */
    void append(String queue, List<String> items);

    /** Remove and return the head of the queue, or {@code null} when empty. */
    String pop(String queue);

    long length(String queue);

    void putDeadLetter(String deadLetter, String key, String payload);

    void removeDeadLetter(String deadLetter, String key);

    List<String> deadLetters(String deadLetter);

    /**
     * Push every dead-letter payload onto the queue tail and clear the dead-letter store, as one
     * atomic operation.
     *
     * @return number of payloads moved
     */
    int moveDeadLetters(String deadLetter, String queue);
}
