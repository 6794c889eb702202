package com.acme.delivery.worker.sample;

import com.acme.delivery.registry.ConsumerRegistrar;
import com.acme.delivery.registry.HandlerRegistry;
import com.acme.delivery.registry.Message;
import com.acme.delivery.registry.Middleware;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes the {@code users} stream.
 *
 * <ul>
 *   <li>{@code users.created}: registers the user; messages without an email are dropped
 *   <li>{@code users.*.deleted}: forgets the user, whoever deleted it
 * </ul>
 */
@Singleton
public class UserEvents implements ConsumerRegistrar {
  private static final Logger LOG = LoggerFactory.getLogger(UserEvents.class);

  static final Middleware AUDIT =
      (message, next) -> {
        LOG.debug("users event {}", message.subject());
        next.proceed();
      };

  static final Middleware REQUIRE_EMAIL =
      (message, next) -> {
        JsonNode email = message.tree().get("email");
        if (email == null || email.asText().isBlank()) {
          LOG.warn("Dropping {} without email", message.subject());
          return;
        }
        next.proceed();
      };

  private final UserService users;

  public UserEvents(UserService users) {
    this.users = users;
  }

  @Override
  public void register(HandlerRegistry.Builder registry) {
    registry
        .group("users", UserEvents.class, AUDIT)
        .handler("created", UserCreated.class, UserEvents::onCreated, REQUIRE_EMAIL)
        .handler("*.deleted", UserEvents::onAnyDeleted);
  }

  void onCreated(UserCreated event) {
    users.register(event);
  }

  void onAnyDeleted(Message message) {
    users.forget(message.tree().path("id").asText());
  }
}
