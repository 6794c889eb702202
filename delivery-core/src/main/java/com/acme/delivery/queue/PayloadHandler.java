package com.acme.delivery.queue;

/** Works a job in its serialized form, before decoding. */
@FunctionalInterface
public interface PayloadHandler {
  void handle(String payload) throws Exception;
}
