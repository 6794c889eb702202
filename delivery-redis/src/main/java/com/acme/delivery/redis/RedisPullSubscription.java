package com.acme.delivery.redis;

import com.acme.delivery.core.Subjects;
import com.acme.delivery.spi.PullOptions;
import com.acme.delivery.spi.PullSubscription;
import com.acme.delivery.spi.StreamMessage;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.redisson.api.AutoClaimResult;
import org.redisson.api.RStream;
import org.redisson.api.StreamGroup;
import org.redisson.api.StreamMessageId;
import org.redisson.api.stream.StreamCreateGroupArgs;
import org.redisson.api.stream.StreamReadGroupArgs;
import org.redisson.client.RedisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A durable pull subscription backed by a Redis consumer group.
 *
 * <p>A fetch thread reads new entries with XREADGROUP, but only as many as have been pulled for.
 * Entries whose subject does not match the filter are acked right away. Entries left unacked for
 * longer than the ack-wait are claimed back with XAUTOCLAIM and delivered again without waiting
 * for credit.
 */
class RedisPullSubscription implements PullSubscription {
  private static final Logger LOG = LoggerFactory.getLogger(RedisPullSubscription.class);

  private static final Duration BLOCK = Duration.ofSeconds(1);
  private static final Duration ERROR_PAUSE = Duration.ofSeconds(1);
  private static final StreamMessageId START = new StreamMessageId(0, 0);
  private static final int REDELIVER_BATCH = 100;

  private final RStream<String, String> stream;
  private final PullOptions options;
  private final String group;
  private final String consumer;
  private final LinkedBlockingQueue<Entry> delivered = new LinkedBlockingQueue<>();
  private final Object creditLock = new Object();
  private final Thread fetcher;

  private int credits;
  private long nextSweep;
  private volatile boolean closed;

  RedisPullSubscription(RStream<String, String> stream, PullOptions options) {
    this.stream = stream;
    this.options = options;
    this.group = options.durableName();
    this.consumer = options.durableName();
    ensureGroup();
    this.nextSweep = System.currentTimeMillis() + options.ackWait().toMillis();
    this.fetcher = new Thread(this::fetchLoop, "stream-fetch-" + group);
    this.fetcher.setDaemon(true);
    this.fetcher.start();
  }

  private void ensureGroup() {
    for (StreamGroup existing : stream.listGroups()) {
      if (existing.getName().equals(group)) {
        return;
      }
    }
    StreamMessageId start = options.deliverNewOnly() ? StreamMessageId.NEWEST : START;
    try {
      stream.createGroup(StreamCreateGroupArgs.name(group).id(start));
      LOG.info("Created consumer group {} on {}", group, stream.getName());
    } catch (RedisException e) {
      if (e.getMessage() == null || !e.getMessage().contains("BUSYGROUP")) {
        throw e;
      }
      LOG.debug("Consumer group {} created concurrently", group);
    }
  }

  @Override
  public void pull(int batch) {
    if (batch < 1) {
      throw new IllegalArgumentException("batch must be positive");
    }
    synchronized (creditLock) {
      credits += batch;
      creditLock.notifyAll();
    }
  }

  @Override
  public StreamMessage next(Duration wait) throws InterruptedException {
    if (closed) {
      return null;
    }
    return delivered.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    synchronized (creditLock) {
      creditLock.notifyAll();
    }
    try {
      fetcher.join(BLOCK.multipliedBy(3).toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOG.debug("Subscription {} closed, {} delivered message(s) left unacked", group, delivered.size());
    delivered.clear();
  }

  private void fetchLoop() {
    while (!closed) {
      try {
        if (System.currentTimeMillis() >= nextSweep) {
          reclaim();
          nextSweep = System.currentTimeMillis() + options.ackWait().toMillis();
        }
        int wanted = awaitCredits();
        if (wanted > 0) {
          read(wanted);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (RuntimeException e) {
        if (closed) {
          return;
        }
        LOG.error("Fetching from {} for {} failed", stream.getName(), group, e);
        try {
          Thread.sleep(ERROR_PAUSE.toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  /** Wait up to one block interval for credit, returning the credit available. */
  private int awaitCredits() throws InterruptedException {
    synchronized (creditLock) {
      if (credits == 0 && !closed) {
        creditLock.wait(BLOCK.toMillis());
      }
      return closed ? 0 : credits;
    }
  }

  /** Redeliveries were pulled for once already and take no new credit. */
  private void reclaim() {
    AutoClaimResult<String, String> claimed =
        stream.autoClaim(
            group, consumer, options.ackWait().toMillis(), TimeUnit.MILLISECONDS, START, REDELIVER_BATCH);
    int count = 0;
    for (Map.Entry<StreamMessageId, Map<String, String>> entry : claimed.getMessages().entrySet()) {
      if (accept(entry.getKey(), entry.getValue(), true)) {
        count++;
      }
    }
    if (count > 0) {
      LOG.debug("Redelivering {} message(s) on {} after ack-wait", count, group);
    }
  }

  private void read(int wanted) {
    Map<StreamMessageId, Map<String, String>> entries =
        stream.readGroup(group, consumer, StreamReadGroupArgs.neverDelivered().count(wanted).timeout(BLOCK));
    if (entries == null) {
      return;
    }
    for (Map.Entry<StreamMessageId, Map<String, String>> entry : entries.entrySet()) {
      accept(entry.getKey(), entry.getValue(), false);
    }
  }

  private boolean accept(StreamMessageId id, Map<String, String> fields, boolean redelivery) {
    String subject = fields.get(RedisStreamBroker.SUBJECT);
    if (subject == null || !Subjects.matches(options.filterSubject(), subject)) {
      stream.ack(group, id);
      return false;
    }
    if (!redelivery) {
      synchronized (creditLock) {
        credits--;
      }
    }
    delivered.add(new Entry(id, subject, fields.get(RedisStreamBroker.DATA)));
    return true;
  }

  private final class Entry implements StreamMessage {
    private final StreamMessageId id;
    private final String subject;
    private final String payload;

    Entry(StreamMessageId id, String subject, String payload) {
      this.id = id;
      this.subject = subject;
      this.payload = payload;
    }

    @Override
    public String subject() {
      return subject;
    }

    @Override
    public String payload() {
      return payload;
    }

    @Override
    public void ack() {
      stream.ack(group, id);
    }
  }
}
