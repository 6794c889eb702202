package com.acme.delivery.registry;

import com.acme.delivery.core.Subjects;
import java.util.ArrayList;
import java.util.List;

/**
 * A handler bound to its consumer instance, with the middleware declared for its group and for
 * itself.
 *
 * @param group stream the handler consumes from
 * @param subject subject pattern under the stream
 * @param groupMiddleware middleware declared on the group, run first
 * @param handlerMiddleware middleware declared on the handler
 * @param handler the bound handler
 */
public record BoundHandler(
    String group,
    String subject,
    List<Middleware> groupMiddleware,
    List<Middleware> handlerMiddleware,
    MessageHandler handler) {

  public BoundHandler {
    groupMiddleware = List.copyOf(groupMiddleware);
    handlerMiddleware = List.copyOf(handlerMiddleware);
  }

  /** Example: users + *.created -> users.*.created */
  public String topic() {
    return Subjects.topic(group, subject);
  }

  /** Group middleware followed by handler middleware. */
  public List<Middleware> middleware() {
    List<Middleware> all = new ArrayList<>(groupMiddleware.size() + handlerMiddleware.size());
    all.addAll(groupMiddleware);
    all.addAll(handlerMiddleware);
    return List.copyOf(all);
  }

  /** The handler wrapped in its full middleware chain. */
  public MessageHandler chain() {
    return MiddlewareChain.collapse(handler, middleware());
  }
}
