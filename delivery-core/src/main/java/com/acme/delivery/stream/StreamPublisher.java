package com.acme.delivery.stream;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.spi.StreamBroker;
import java.util.Locale;
import java.util.UUID;

/** Publishes JSON messages under one stream. Each message carries a fresh dedup token. */
public class StreamPublisher<T> {
  private final String name;
  private final StreamBroker broker;

  public StreamPublisher(String name, StreamBroker broker) {
    this.name = name.toLowerCase(Locale.ROOT);
    this.broker = broker;
  }

  /**
   * Publish {@code data} on {@code <stream>.<path>}.
   *
   * @return the dedup token the message was published with
   */
  public String add(String path, T data) {
    String msgId = UUID.randomUUID().toString();
    broker.publish(name + "." + path, Jsons.toJson(data), msgId);
    return msgId;
  }
}
