package com.acme.delivery.registry;

@FunctionalInterface
public interface MessageHandler {
  void handle(Message message) throws Exception;
}
