package com.acme.delivery.worker.sample;

import com.acme.delivery.queue.WorkQueue;
import com.acme.delivery.spi.JobStore;
import com.acme.delivery.worker.config.QueueFactory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends welcome emails through the {@code welcome-emails} work queue. Each run seeds the queue with
 * the users registered since the last run, unless another instance is still draining it, then
 * works it.
 */
@Singleton
@Requires(beans = JobStore.class)
public class WelcomeEmails {
  private static final Logger LOG = LoggerFactory.getLogger(WelcomeEmails.class);
  static final String QUEUE = "welcome-emails";

  private final UserService users;
  private final WorkQueue<WelcomeEmail> queue;
  private final int parallelism;

  public WelcomeEmails(
      UserService users,
      QueueFactory queues,
      @Property(name = "welcome-emails.parallelism", defaultValue = "2") int parallelism) {
    this.users = users;
    this.queue = queues.create(QUEUE, WelcomeEmail.class);
    this.parallelism = parallelism;
  }

  @Scheduled(fixedDelay = "${welcome-emails.interval:1m}", initialDelay = "${welcome-emails.interval:1m}")
  public void run() {
    if (queue.length() == 0) {
      List<WelcomeEmail> pending = users.takePendingWelcomes();
      if (!pending.isEmpty() && !queue.fill(pending)) {
        // another instance seeded the queue first; these go with the next run
        users.restorePendingWelcomes(pending);
      }
    }
    queue.work(this::send, LOG, parallelism);
  }

  void send(WelcomeEmail email) {
    if (!users.isRegistered(email.userId())) {
      LOG.info("User {} is gone, skipping welcome email", email.userId());
      return;
    }
    LOG.info("Sending welcome email to {}", email.email());
  }
}
