package com.acme.delivery.registry;

import java.util.List;

/** Composes middleware and a handler into a single handler. */
public final class MiddlewareChain {

  private MiddlewareChain() {}

  /**
   * Collapse {@code middleware} and {@code handler} into one handler. Middleware run in list
   * order; the handler runs last.
   */
  public static MessageHandler collapse(MessageHandler handler, List<Middleware> middleware) {
    List<Middleware> chain = List.copyOf(middleware);
    if (chain.isEmpty()) {
      return handler;
    }
    return message -> invoke(chain, 0, handler, message);
  }

  private static void invoke(
      List<Middleware> chain, int index, MessageHandler handler, Message message) throws Exception {
    if (index == chain.size()) {
      handler.handle(message);
      return;
    }
    chain.get(index).handle(message, () -> invoke(chain, index + 1, handler, message));
  }
}
