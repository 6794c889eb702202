package com.acme.delivery.registry;

/**
 * Implemented by consumer types that declare their own stream group and handlers.
 *
 * <pre>
 * public class UserEvents implements ConsumerRegistrar {
 *   public void register(HandlerRegistry.Builder registry) {
 *     registry.group("users", UserEvents.class)
 *         .handler("created", UserCreated.class, UserEvents::onCreated);
 *   }
 * }
 * </pre>
 */
@FunctionalInterface
public interface ConsumerRegistrar {
  void register(HandlerRegistry.Builder registry);
}
