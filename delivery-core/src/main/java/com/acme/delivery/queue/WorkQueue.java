package com.acme.delivery.queue;

import com.acme.delivery.config.QueueConfig;
import com.acme.delivery.core.Jsons;
import com.acme.delivery.core.QueueException;
import com.acme.delivery.core.RetryException;
import com.acme.delivery.retry.RetryOutcome;
import com.acme.delivery.retry.RetryRunner;
import com.acme.delivery.spi.JobStore;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * FIFO job queue over a {@link JobStore}. Jobs are worked in order by one or more drain loops.
 *
 * <p>Every job is copied into the queue's dead-letter hash under a random backup key the moment it
 * is popped, before any handler runs. The copy is deleted when the handler succeeds and kept when
 * the handler fails terminally or exhausts its retries, so {@link #requeue()} can put it back.
 *
 * <p>The instance holds no mutable state; everything lives in the store, so several processes can
 * work the same queue.
 */
public class WorkQueue<T> {
  private static final Logger LOG = LoggerFactory.getLogger(WorkQueue.class);
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  private final QueueConfig config;
  private final JobStore store;
  private final Class<T> type;
  private final RetryRunner retryRunner;

  public WorkQueue(QueueConfig config, JobStore store, Class<T> type) {
    this(config, store, type, new RetryRunner());
  }

  public WorkQueue(QueueConfig config, JobStore store, Class<T> type, RetryRunner retryRunner) {
    this.config = config.validate();
    this.store = store;
    this.type = type;
    this.retryRunner = retryRunner;
  }

  public String getName() {
    return config.getName();
  }

  /**
   * Fill the queue with a batch of jobs. Nothing is written while jobs are still left, so a
   * second worker does not re-seed a queue that another one is draining.
   *
   * @return true if the jobs were written
   */
  public boolean fill(List<T> jobs) {
    long length = length();
    if (length > 0) {
      LOG.debug("Queue {} still has {} job(s), skipping fill", config.getName(), length);
      return false;
    }
    append(jobs);
    return true;
  }

  /**
   * Fill the queue from a stream of chunks. Each chunk is appended atomically, whatever the
   * current length of the queue.
   */
  public boolean fill(Stream<List<T>> chunks) {
    try (chunks) {
      chunks.forEach(this::append);
    }
    return true;
  }

  /** Number of jobs left on the queue. */
  public long length() {
    return store.length(config.getName());
  }

  /**
   * Put every dead-lettered job back on the queue.
   *
   * @return true if there were dead-lettered jobs
   */
  public boolean requeue() {
    int moved = store.moveDeadLetters(config.getDeadLetterName(), config.getName());
    if (moved > 0) {
      LOG.info("Requeued {} dead-lettered job(s) on {}", moved, config.getName());
    }
    return moved > 0;
  }

  /** Jobs currently in flight or left behind after failing. */
  public List<T> deadLetters() {
    return store.deadLetters(config.getDeadLetterName()).stream()
        .map(payload -> Jsons.fromJson(payload, type))
        .toList();
  }

  public void work(JobHandler<T> handler) {
    work(handler, null, 1);
  }

  public void work(JobHandler<T> handler, Logger logger) {
    work(handler, logger, 1);
  }

  /**
   * Work every job on the queue and return once the queue stays empty. An idle loop re-polls
   * {@code pollRetries} times, {@code pollInterval} apart, so followers can wait for a leader to
   * fill the queue.
   *
   * @param handler works one job
   * @param logger optional logger that records every job and every failure
   * @param parallelism number of drain loops running at the same time
   * @throws QueueException if the store fails
   */
  public void work(JobHandler<T> handler, Logger logger, int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
    }
    PayloadHandler payloadHandler =
        logger != null
            ? wrapHandler(config.getName(), logger, handler)
            : payload -> handler.handle(Jsons.fromJson(payload, type));

    ExecutorService pool = Executors.newFixedThreadPool(parallelism, new WorkerThreads(config.getName()));
    try {
      List<Future<?>> loops = new ArrayList<>(parallelism);
      for (int i = 0; i < parallelism; i++) {
        loops.add(
            pool.submit(
                () -> {
                  drain(payloadHandler);
                  return null;
                }));
      }

      QueueException failure = null;
      for (Future<?> loop : loops) {
        try {
          loop.get();
        } catch (ExecutionException e) {
          if (failure == null) {
            failure = new QueueException("Worker on queue " + config.getName() + " failed", e.getCause());
          } else {
            failure.addSuppressed(e.getCause());
          }
        }
      }
      if (failure != null) {
        throw failure;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueueException("Interrupted while working queue " + config.getName(), e);
    } finally {
      pool.shutdownNow();
    }
  }

  /**
   * Wrap a handler so each job is logged before it runs and each failure is logged with the job
   * before being rethrown.
   */
  public PayloadHandler wrapHandler(String queue, Logger logger, JobHandler<T> handler) {
    return payload -> {
      try (MDC.MDCCloseable ignored = MDC.putCloseable("job_queue", queue)) {
        T job = null;
        try {
          job = Jsons.fromJson(payload, type);
          logger.info("Working job {}", job);
          handler.handle(job);
        } catch (Exception e) {
          // an undecodable payload is logged as received
          logger.error("Job failed: {}", job != null ? job : payload, e);
          throw e;
        }
      }
    };
  }

  private void drain(PayloadHandler handler) throws Exception {
    retryRunner.run(
        config.getPollRetries(),
        config.getPollInterval(),
        attempt -> {
          while (true) {
            String payload = store.pop(config.getName());
            if (payload == null) {
              throw RetryException.emptyQueue();
            }
            process(payload, handler);
          }
        });
    LOG.debug("Queue {} is empty, worker stopping", config.getName());
  }

  private void process(String payload, PayloadHandler handler) throws InterruptedException {
    String key = backupKey();
    store.putDeadLetter(config.getDeadLetterName(), key, payload);

    RetryOutcome outcome;
    try {
      outcome = retryRunner.run(config.getRetries(), config.getBackoff(), attempt -> handler.handle(payload));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw e;
    } catch (Exception e) {
      LOG.warn(
          "Job on {} failed, kept as dead letter {}: {}",
          config.getName(),
          key,
          payload,
          e);
      return;
    }

    if (outcome.isCompleted()) {
      store.removeDeadLetter(config.getDeadLetterName(), key);
    } else {
      LOG.warn(
          "Job on {} exhausted {} retries, kept as dead letter {}: {}",
          config.getName(),
          config.getRetries(),
          key,
          payload);
    }
  }

  /** 32 hex characters, unrelated to the payload. */
  static String backupKey() {
    byte[] bytes = new byte[16];
    RANDOM.nextBytes(bytes);
    return HEX.formatHex(bytes);
  }

  private void append(List<T> jobs) {
    if (jobs.isEmpty()) {
      return;
    }
    store.append(config.getName(), jobs.stream().map(Jsons::toJson).toList());
  }

  private static final class WorkerThreads implements java.util.concurrent.ThreadFactory {
    private final String queue;
    private final AtomicInteger counter = new AtomicInteger();

    WorkerThreads(String queue) {
      this.queue = queue;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, queue + "-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
