package com.acme.delivery.config;

import java.time.Duration;

/**
 * Configuration for stream consumers. Pure POJO - no framework dependencies.
 */
public class ConsumerConfig {

  public static final int MAX_BATCH_SIZE = 1000;

  private String namespace;
  private int batchSize = 100;
  private Duration timeout = Duration.ofMinutes(1);
  private boolean redeliverOnError = false;
  private Duration shutdownTimeout = Duration.ofSeconds(30);

  /** Namespace of all durable consumers of this application. */
  public String getNamespace() {
    return namespace;
  }

  public void setNamespace(String namespace) {
    this.namespace = namespace;
  }

  /** Messages requested per pull. Tune to how fast the subscribers keep up. */
  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  /** Ack-wait: how long the broker waits for an ack before redelivering. */
  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  /**
   * When true, only a {@code PermanentException} acks a failed message; every other error leaves
   * it for redelivery. When false (default), only a {@code RetryException} is redelivered.
   */
  public boolean isRedeliverOnError() {
    return redeliverOnError;
  }

  public void setRedeliverOnError(boolean redeliverOnError) {
    this.redeliverOnError = redeliverOnError;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public void setShutdownTimeout(Duration shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
  }

  public ConsumerConfig validate() {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("consumer namespace is required");
    }
    if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
      throw new IllegalArgumentException(
          "batch size must be between 1 and " + MAX_BATCH_SIZE + ", got " + batchSize);
    }
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("ack-wait timeout must be positive");
    }
    if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("shutdown timeout must be >= 0");
    }
    return this;
  }
}
