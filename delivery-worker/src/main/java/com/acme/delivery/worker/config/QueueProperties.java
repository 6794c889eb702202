package com.acme.delivery.worker.config;

import com.acme.delivery.config.QueueConfig;
import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;

/** One entry under {@code queues.<name>} in application.yml. */
@EachProperty("queues")
public class QueueProperties extends QueueConfig {

  public QueueProperties(@Parameter String name) {
    super(name);
  }
}
