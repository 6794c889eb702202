package com.acme.delivery.queue;

/** Works a single job taken off a queue. Throw {@code RetryException} to have it retried. */
@FunctionalInterface
public interface JobHandler<T> {
  void handle(T job) throws Exception;
}
