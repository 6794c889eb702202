package com.acme.delivery.registry;

import com.acme.delivery.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A decoded-on-demand message flowing through middleware into a handler.
 *
 * @param subject full subject the message was published on
 * @param payload JSON payload
 */
public record Message(String subject, String payload) {

  public <P> P decode(Class<P> type) {
    return Jsons.fromJson(payload, type);
  }

  public JsonNode tree() {
    return Jsons.tree(payload);
  }
}
