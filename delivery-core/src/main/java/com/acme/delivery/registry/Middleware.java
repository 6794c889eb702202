package com.acme.delivery.registry;

/**
 * Runs around a handler. Call {@code next.proceed()} to continue down the chain; returning
 * without calling it stops the message there, which is how validation middleware rejects a
 * message without reaching the handler.
 */
@FunctionalInterface
public interface Middleware {

  void handle(Message message, Next next) throws Exception;

  @FunctionalInterface
  interface Next {
    void proceed() throws Exception;
  }
}
