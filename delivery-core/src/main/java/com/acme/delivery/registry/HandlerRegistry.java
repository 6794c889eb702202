package com.acme.delivery.registry;

import com.acme.delivery.core.Subjects;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream handlers, each bound to its consumer instance and tagged with its group (stream) and
 * subject. Assembled once at startup through {@link #builder(InstanceResolver)} and immutable
 * afterwards.
 *
 * <pre>
 * HandlerRegistry registry = HandlerRegistry.builder(beanContext::getBean)
 *     .group("users", UserEvents.class, audit)
 *         .handler("created", UserCreated.class, UserEvents::onCreated, validate)
 *         .handler("*.deleted", UserEvents::onDeleted)
 *         .and()
 *     .build();
 * </pre>
 */
public final class HandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

  private static final Pattern GROUP_TAG = Pattern.compile("[a-z][a-z0-9_-]*");

  private final List<BoundHandler> handlers;

  private HandlerRegistry(List<BoundHandler> handlers) {
    this.handlers = List.copyOf(handlers);
  }

  public static Builder builder(InstanceResolver resolver) {
    return new Builder(resolver);
  }

  /** All handlers in registration order. */
  public List<BoundHandler> handlers() {
    return handlers;
  }

  /** Distinct groups in registration order. */
  public Set<String> groups() {
    Set<String> groups = new LinkedHashSet<>();
    handlers.forEach(h -> groups.add(h.group()));
    return groups;
  }

  public Optional<BoundHandler> find(String group, String subject) {
    return handlers.stream()
        .filter(h -> h.group().equals(group) && h.subject().equals(subject))
        .findFirst();
  }

  public boolean isEmpty() {
    return handlers.isEmpty();
  }

  /** Collects group and handler declarations; instances are resolved in {@link #build()}. */
  public static final class Builder {
    private final InstanceResolver resolver;
    private final List<GroupBuilder<?>> groups = new ArrayList<>();
    private final Set<String> topics = new HashSet<>();

    private Builder(InstanceResolver resolver) {
      this.resolver = resolver;
    }

    /**
     * Declare that {@code type} consumes the stream {@code tag}.
     *
     * @param tag stream name; lowercase letters, digits, '-' and '_'
     * @param middleware run before every handler of the group, in order
     */
    public <C> GroupBuilder<C> group(String tag, Class<C> type, Middleware... middleware) {
      if (tag == null || !GROUP_TAG.matcher(tag).matches()) {
        throw new IllegalArgumentException("Invalid stream name: " + tag);
      }
      GroupBuilder<C> group = new GroupBuilder<>(this, tag, type, Arrays.asList(middleware));
      groups.add(group);
      return group;
    }

    /** Let each registrar declare its own group and handlers. */
    public Builder register(Iterable<? extends ConsumerRegistrar> registrars) {
      for (ConsumerRegistrar registrar : registrars) {
        registrar.register(this);
      }
      return this;
    }

    public Builder register(ConsumerRegistrar... registrars) {
      return register(Arrays.asList(registrars));
    }

    /**
     * Resolve one instance per group and bind every handler to it.
     *
     * @throws IllegalStateException if the resolver cannot supply an instance
     */
    public HandlerRegistry build() {
      List<BoundHandler> bound = new ArrayList<>();
      for (GroupBuilder<?> group : groups) {
        group.bind(resolver, bound);
      }
      log.info("Handler registry built: {} handler(s) across {} stream(s)", bound.size(),
          bound.stream().map(BoundHandler::group).distinct().count());
      return new HandlerRegistry(bound);
    }

    private void claim(String group, String subject) {
      String topic = Subjects.topic(group, subject);
      if (!topics.add(topic)) {
        String error = "Handler already registered for subject: " + topic;
        log.error(error);
        throw new IllegalStateException(error);
      }
    }
  }

  /** Handlers declared on one consumer type. */
  public static final class GroupBuilder<C> {
    private final Builder parent;
    private final String tag;
    private final Class<C> type;
    private final List<Middleware> middleware;
    private final List<Declaration<C>> declarations = new ArrayList<>();

    private GroupBuilder(Builder parent, String tag, Class<C> type, List<Middleware> middleware) {
      this.parent = parent;
      this.tag = tag;
      this.type = type;
      this.middleware = List.copyOf(middleware);
    }

    /** Handle {@code subject} with a method receiving the raw message. */
    public GroupBuilder<C> handler(String subject, HandlerMethod<C> method, Middleware... middleware) {
      Subjects.requireValidPattern(subject);
      parent.claim(tag, subject);
      declarations.add(new Declaration<>(subject, method, Arrays.asList(middleware)));
      log.debug("Registered handler {}.{} on {}", tag, subject, type.getSimpleName());
      return this;
    }

    /** Handle {@code subject} with a method receiving the payload decoded as {@code payloadType}. */
    public <P> GroupBuilder<C> handler(
        String subject, Class<P> payloadType, TypedHandlerMethod<C, P> method, Middleware... middleware) {
      return handler(
          subject, (consumer, message) -> method.invoke(consumer, message.decode(payloadType)), middleware);
    }

    /** Back to the registry builder to declare another group. */
    public Builder and() {
      return parent;
    }

    public HandlerRegistry build() {
      return parent.build();
    }

    private void bind(InstanceResolver resolver, List<BoundHandler> out) {
      if (declarations.isEmpty()) {
        log.warn("Stream {} declared by {} has no handlers", tag, type.getSimpleName());
        return;
      }
      C instance = resolver.resolve(type);
      if (instance == null) {
        throw new IllegalStateException("No instance available for consumer " + type.getName());
      }
      for (Declaration<C> declaration : declarations) {
        HandlerMethod<C> method = declaration.method();
        out.add(
            new BoundHandler(
                tag,
                declaration.subject(),
                middleware,
                declaration.middleware(),
                message -> method.invoke(instance, message)));
      }
    }
  }

  /** A handler method taking the raw message. */
  @FunctionalInterface
  public interface HandlerMethod<C> {
    void invoke(C consumer, Message message) throws Exception;
  }

  /** A handler method taking the decoded payload. */
  @FunctionalInterface
  public interface TypedHandlerMethod<C, P> {
    void invoke(C consumer, P payload) throws Exception;
  }

  private record Declaration<C>(String subject, HandlerMethod<C> method, List<Middleware> middleware) {}
}
