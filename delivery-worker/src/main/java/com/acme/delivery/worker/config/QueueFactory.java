package com.acme.delivery.worker.config;

import com.acme.delivery.config.QueueConfig;
import com.acme.delivery.queue.WorkQueue;
import com.acme.delivery.retry.RetryRunner;
import com.acme.delivery.spi.JobStore;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates work queues on the shared job store. A queue takes its settings from
 * {@code queues.<name>.*} and falls back to the defaults otherwise.
 */
@Singleton
@Requires(beans = JobStore.class)
public class QueueFactory {
  private static final Logger LOG = LoggerFactory.getLogger(QueueFactory.class);

  private final JobStore store;
  private final RetryRunner retryRunner;
  private final Map<String, QueueConfig> configured;

  public QueueFactory(JobStore store, RetryRunner retryRunner, List<QueueProperties> queues) {
    this.store = store;
    this.retryRunner = retryRunner;
    this.configured =
        queues.stream().collect(Collectors.toMap(QueueConfig::getName, Function.identity()));
  }

  public <T> WorkQueue<T> create(String name, Class<T> type) {
    QueueConfig config = configured.get(name);
    if (config == null) {
      LOG.debug("No settings for queue {}, using defaults", name);
      config = new QueueConfig(name);
    }
    return new WorkQueue<>(config.validate(), store, type, retryRunner);
  }
}
