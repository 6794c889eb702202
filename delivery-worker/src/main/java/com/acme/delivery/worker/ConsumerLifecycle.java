package com.acme.delivery.worker;

import com.acme.delivery.config.ConsumerConfig;
import com.acme.delivery.spi.StreamBroker;
import com.acme.delivery.stream.StreamConsumers;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the stream consumers once the application context is up and stops them on shutdown.
 * A missing stream fails startup.
 */
@Singleton
@Requires(beans = StreamBroker.class)
@Requires(property = "consumers.enabled", value = "true", defaultValue = "true")
public class ConsumerLifecycle implements ApplicationEventListener<StartupEvent> {
  private static final Logger LOG = LoggerFactory.getLogger(ConsumerLifecycle.class);

  private final StreamConsumers consumers;
  private final StreamBroker broker;
  private final ConsumerConfig config;

  public ConsumerLifecycle(StreamConsumers consumers, StreamBroker broker, ConsumerConfig config) {
    this.consumers = consumers;
    this.broker = broker;
    this.config = config;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    LOG.info("Starting stream consumers for {} topic(s) on {} stream(s)",
        consumers.topics().size(), consumers.streams().size());
    consumers.start(broker, config);
  }

  @PreDestroy
  public void stop() {
    consumers.close();
  }
}
