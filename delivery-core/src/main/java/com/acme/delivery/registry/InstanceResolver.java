package com.acme.delivery.registry;

/**
 * Supplies the instance a group of handlers is bound to. Typically backed by the application's
 * bean context; the registry never constructs consumers itself.
 */
@FunctionalInterface
public interface InstanceResolver {
  <C> C resolve(Class<C> type);
}
