package com.acme.delivery.stream;

import com.acme.delivery.config.ConsumerConfig;
import com.acme.delivery.core.Jsons;
import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.RetryException;
import com.acme.delivery.core.StreamNotFoundException;
import com.acme.delivery.core.Subjects;
import com.acme.delivery.registry.BoundHandler;
import com.acme.delivery.registry.HandlerRegistry;
import com.acme.delivery.registry.Message;
import com.acme.delivery.registry.MessageHandler;
import com.acme.delivery.spi.PullOptions;
import com.acme.delivery.spi.PullSubscription;
import com.acme.delivery.spi.StreamBroker;
import com.acme.delivery.spi.StreamMessage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs every handler of a {@link HandlerRegistry} against a stream broker.
 *
 * <p>Each registered {@code stream.subject} gets its own durable pull subscription and its own
 * consumer thread, so subjects never block each other while messages of one subject are handled
 * strictly in delivery order.
 *
 * <p>A message is acked when its handler returns. A {@link RetryException} leaves it unacked so
 * the broker redelivers it once the ack-wait expires. Any other failure is logged and the message
 * is acked anyway, unless {@link ConsumerConfig#isRedeliverOnError()} is set, in which case only a
 * {@link PermanentException} is acked.
 */
public class StreamConsumers implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(StreamConsumers.class);
  private static final Duration RECEIVE_WAIT = Duration.ofSeconds(1);

  private final Set<String> streams = new LinkedHashSet<>();
  private final Map<String, MessageHandler> subscribers = new LinkedHashMap<>();
  private final Map<String, AtomicLong> terminalFailures = new ConcurrentHashMap<>();
  private final List<Subscriber> running = new ArrayList<>();

  private ConsumerConfig config;
  private ExecutorService executor;

  public StreamConsumers(HandlerRegistry registry) {
    for (BoundHandler handler : registry.handlers()) {
      streams.add(handler.group());
      subscribers.put(handler.topic(), handler.chain());
      terminalFailures.put(handler.topic(), new AtomicLong());
    }
  }

  /** Streams the registry consumes from. */
  public Set<String> streams() {
    return Collections.unmodifiableSet(streams);
  }

  /** Topics ({@code stream.subject}) with a subscription. */
  public Set<String> topics() {
    return Collections.unmodifiableSet(subscribers.keySet());
  }

  /**
   * Check every stream exists, then subscribe to every topic and start consuming.
   *
   * @throws StreamNotFoundException if a stream is missing; nothing is subscribed in that case
   */
  public synchronized void start(StreamBroker broker, ConsumerConfig cfg) {
    if (executor != null) {
      throw new IllegalStateException("Consumers already started");
    }
    this.config = cfg.validate();

    for (String stream : streams) {
      if (!broker.streamExists(stream)) {
        throw new StreamNotFoundException(stream);
      }
    }
    if (subscribers.isEmpty()) {
      LOG.warn("No stream handlers registered, nothing to consume");
      return;
    }

    executor = Executors.newFixedThreadPool(subscribers.size(), new ConsumerThreads());
    try {
      for (Map.Entry<String, MessageHandler> entry : subscribers.entrySet()) {
        String topic = entry.getKey();
        String stream = Subjects.streamOf(topic);
        PullOptions options =
            PullOptions.durable(topic, DurableNames.of(stream, cfg.getNamespace(), topic), cfg.getTimeout());

        PullSubscription subscription = broker.pullSubscribe(topic, options);
        Subscriber subscriber = new Subscriber(topic, subscription, entry.getValue());
        running.add(subscriber);
        executor.execute(subscriber);
        subscriber.window.open();
        LOG.info("Consuming {} as {} (batch={}, ack-wait={})",
            topic, options.durableName(), cfg.getBatchSize(), cfg.getTimeout());
      }
    } catch (RuntimeException e) {
      LOG.error("Failed to start stream consumers, closing {} subscription(s)", running.size(), e);
      close();
      throw e;
    }
  }

  /** Terminal (acked) handler failures per topic since start. */
  public Map<String, Long> terminalFailures() {
    Map<String, Long> snapshot = new LinkedHashMap<>();
    terminalFailures.forEach((topic, count) -> snapshot.put(topic, count.get()));
    return snapshot;
  }

  /**
   * Stop pulling, close subscriptions and wait for in-flight handlers. Messages received but not
   * acked are redelivered by the broker after the ack-wait.
   */
  @Override
  public synchronized void close() {
    if (executor == null) {
      return;
    }
    LOG.info("Stopping {} stream consumer(s)", running.size());
    for (Subscriber subscriber : running) {
      subscriber.stop();
    }
    executor.shutdown();
    try {
      Duration timeout = config.getShutdownTimeout();
      if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warn("Stream consumers still busy after {}, interrupting", timeout);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    running.clear();
    executor = null;
  }

  /** Log the decoded message, run the handler chain and log a failure before rethrowing it. */
  static MessageHandler wrapHandler(String topic, MessageHandler handler) {
    return message -> {
      try (MDC.MDCCloseable ignored = MDC.putCloseable("topic", topic)) {
        try {
          LOG.info("Received {} on {}", Jsons.tree(message.payload()), message.subject());
          handler.handle(message);
        } catch (RetryException e) {
          LOG.warn("Retry requested for {} on {}: {}", message.payload(), message.subject(), e.getMessage());
          throw e;
        } catch (Throwable e) {
          LOG.error("Handler failed for {} on {}", message.payload(), message.subject(), e);
          throw e;
        }
      }
    };
  }

  /** One sequential consumer per topic. */
  private final class Subscriber implements Runnable {
    private final String topic;
    private final PullSubscription subscription;
    private final MessageHandler handler;
    private final PullWindow window;
    private volatile boolean stopping;

    Subscriber(String topic, PullSubscription subscription, MessageHandler handler) {
      this.topic = topic;
      this.subscription = subscription;
      this.handler = wrapHandler(topic, handler);
      this.window = new PullWindow(config.getBatchSize(), subscription);
    }

    @Override
    public void run() {
      while (!stopping) {
        StreamMessage message;
        try {
          message = subscription.next(RECEIVE_WAIT);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        } catch (RuntimeException e) {
          if (subscription.isClosed()) {
            break;
          }
          LOG.error("Subscription {} failed to receive", topic, e);
          if (!pause()) {
            break;
          }
          continue;
        }
        if (message == null) {
          if (subscription.isClosed()) {
            break;
          }
          continue;
        }
        try {
          dispatch(message);
        } catch (RuntimeException e) {
          // ack or pull failed; the broker redelivers whatever was not acked
          LOG.error("Subscription {} failed to settle message on {}", topic, message.subject(), e);
        }
      }
      LOG.debug("Consumer for {} stopped", topic);
    }

    private void dispatch(StreamMessage delivered) {
      Message message = new Message(delivered.subject(), delivered.payload());
      try {
        handler.handle(message);
      } catch (RetryException e) {
        return;
      } catch (Throwable e) {
        // Errors included; the subscription keeps consuming
        if (config.isRedeliverOnError() && !(e instanceof PermanentException)) {
          return;
        }
        terminalFailures.get(topic).incrementAndGet();
      }
      delivered.ack();
      window.handled();
    }

    private boolean pause() {
      try {
        Thread.sleep(RECEIVE_WAIT.toMillis());
        return true;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }

    void stop() {
      stopping = true;
      window.close();
      subscription.close();
    }
  }

  private static final class ConsumerThreads implements java.util.concurrent.ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "stream-consumer-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
