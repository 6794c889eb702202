package com.acme.delivery.worker;

import io.micronaut.runtime.Micronaut;

/**
 * Worker Application - consumes the configured Redis streams through the registered stream
 * handlers and drains work queues. Can run multiple instances; each durable consumer group is
 * shared by all of them.
 */
public class WorkerApplication {
    public static void main(String[] args) {
        Micronaut.run(WorkerApplication.class, args);
    }
}
