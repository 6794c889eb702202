package com.acme.delivery.config;

import java.time.Duration;

/**
 * Configuration of one work queue. Pure POJO - no framework dependencies.
 */
public class QueueConfig {

  private String name;
  private int retries = 3;
  private Duration backoff = Duration.ofSeconds(10);
  private int pollRetries = 1;
  private Duration pollInterval = Duration.ofSeconds(3);

  public QueueConfig() {}

  public QueueConfig(String name) {
    this.name = name;
  }

  public QueueConfig(String name, int retries, Duration backoff) {
    this.name = name;
    this.retries = retries;
    this.backoff = backoff;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  /** Retries after the first attempt of a job. 0 runs each job once. */
  public int getRetries() {
    return retries;
  }

  public void setRetries(int retries) {
    this.retries = retries;
  }

  /** Delay before the first retry of a job. */
  public Duration getBackoff() {
    return backoff;
  }

  public void setBackoff(Duration backoff) {
    this.backoff = backoff;
  }

  /** How many times an idle worker re-polls an empty queue before it stops. */
  public int getPollRetries() {
    return pollRetries;
  }

  public void setPollRetries(int pollRetries) {
    this.pollRetries = pollRetries;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  /** Name of the hash holding in-flight and exhausted jobs. Example: jobs -> jobs:dead-letter */
  public String getDeadLetterName() {
    return name + ":dead-letter";
  }

  public QueueConfig validate() {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("queue name is required");
    }
    if (retries < 0 || pollRetries < 0) {
      throw new IllegalArgumentException("retries must be >= 0");
    }
    if (backoff == null || backoff.isNegative() || pollInterval == null || pollInterval.isNegative()) {
      throw new IllegalArgumentException("backoff durations must be >= 0");
    }
    return this;
  }
}
