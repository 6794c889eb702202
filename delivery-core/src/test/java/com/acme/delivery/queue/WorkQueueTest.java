package com.acme.delivery.queue;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.delivery.config.QueueConfig;
import com.acme.delivery.core.Jsons;
import com.acme.delivery.core.QueueException;
import com.acme.delivery.core.RetryException;
import com.acme.delivery.retry.RetryRunner;
import com.acme.delivery.spi.JobStore;
import com.acme.delivery.support.InMemoryJobStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

class WorkQueueTest {

  record EmailJob(String to, Instant sendAt) {}

  private static final Instant AT = Instant.parse("2024-03-01T10:15:30Z");

  private InMemoryJobStore store;
  private QueueConfig config;
  private WorkQueue<EmailJob> queue;

  @BeforeEach
  void setUp() {
    store = new InMemoryJobStore();
    config = new QueueConfig("emails", 2, Duration.ofMillis(10));
    config.setPollRetries(0);
    config.setPollInterval(Duration.ZERO);
    queue = new WorkQueue<>(config, store, EmailJob.class, new RetryRunner(Duration.ofMinutes(5), d -> {}));
  }

  private static List<EmailJob> jobs(int count) {
    return IntStream.range(0, count).mapToObj(i -> new EmailJob("user" + i + "@acme.com", AT)).toList();
  }

  @Nested
  @DisplayName("Filling")
  class FillTests {

    @Test
    @DisplayName("fill - writes a batch to an empty queue in order")
    void testFillEmptyQueue() {
      assertThat(queue.fill(jobs(3))).isTrue();

      assertThat(queue.length()).isEqualTo(3);
      assertThat(store.items("emails"))
          .extracting(payload -> Jsons.fromJson(payload, EmailJob.class).to())
          .containsExactly("user0@acme.com", "user1@acme.com", "user2@acme.com");
    }

    @Test
    @DisplayName("fill - is a no-op on a queue that still has jobs")
    void testFillNonEmptyQueue() {
      queue.fill(jobs(2));

      assertThat(queue.fill(jobs(5))).isFalse();
      assertThat(queue.length()).isEqualTo(2);
    }

    @Test
    @DisplayName("fill - successive batches on a drained queue add up")
    void testFillAfterDrain() {
      queue.fill(jobs(2));
      queue.work(job -> {});
      queue.fill(jobs(4));

      assertThat(queue.length()).isEqualTo(4);
    }

    @Test
    @DisplayName("fill - streamed chunks are appended even when the queue has jobs")
    void testFillStream() {
      queue.fill(jobs(1));

      boolean filled = queue.fill(Stream.of(jobs(2), jobs(3), List.of()));

      assertThat(filled).isTrue();
      assertThat(queue.length()).isEqualTo(6);
    }

    @Test
    @DisplayName("fill - dates survive the round trip through the store")
    void testDatesRestored() {
      queue.fill(List.of(new EmailJob("a@acme.com", AT)));
      List<EmailJob> seen = new ArrayList<>();

      queue.work(seen::add);

      assertThat(seen).containsExactly(new EmailJob("a@acme.com", AT));
    }
  }

  @Nested
  @DisplayName("Working")
  class WorkTests {

    @Test
    @DisplayName("work - processes every job exactly once across parallel workers")
    void testParallelWorkExactlyOnce() {
      queue.fill(jobs(200));
      Map<String, AtomicInteger> seen = new ConcurrentHashMap<>();

      queue.work(job -> seen.computeIfAbsent(job.to(), k -> new AtomicInteger()).incrementAndGet(), null, 4);

      assertThat(seen).hasSize(200);
      assertThat(seen.values()).allSatisfy(count -> assertThat(count).hasValue(1));
      assertThat(queue.length()).isZero();
      assertThat(queue.deadLetters()).isEmpty();
    }

    @Test
    @DisplayName("work - backs up each job before the handler runs and deletes it on success")
    void testDeadLetterLifecycleOnSuccess() {
      queue.fill(jobs(1));
      List<Integer> deadLettersDuringHandler = new ArrayList<>();

      queue.work(job -> deadLettersDuringHandler.add(store.deadLetters("emails:dead-letter").size()));

      assertThat(deadLettersDuringHandler).containsExactly(1);
      assertThat(store.deadLetterWrites()).hasSize(1);
      assertThat(store.deadLetterDeletes()).hasSize(1);
      assertThat(queue.deadLetters()).isEmpty();
    }

    @Test
    @DisplayName("work - a job that always asks for retry runs retries + 1 times and stays dead-lettered")
    void testRetryExhaustion() {
      queue.fill(jobs(1));
      AtomicInteger attempts = new AtomicInteger();

      queue.work(
          job -> {
            attempts.incrementAndGet();
            throw new RetryException("mail server busy");
          });

      assertThat(attempts).hasValue(config.getRetries() + 1);
      assertThat(queue.deadLetters()).containsExactly(new EmailJob("user0@acme.com", AT));
      assertThat(store.deadLetterDeletes()).isEmpty();
    }

    @Test
    @DisplayName("work - a terminal failure keeps the job and moves on to the next one")
    void testTerminalFailureContinues() {
      queue.fill(jobs(3));
      List<String> handled = Collections.synchronizedList(new ArrayList<>());

      queue.work(
          job -> {
            if (job.to().startsWith("user1")) {
              throw new IllegalStateException("bad address");
            }
            handled.add(job.to());
          });

      assertThat(handled).containsExactly("user0@acme.com", "user2@acme.com");
      assertThat(queue.deadLetters()).extracting(EmailJob::to).containsExactly("user1@acme.com");
      assertThat(queue.length()).isZero();
    }

    @Test
    @DisplayName("work - retries with backoff and succeeds on the third attempt")
    void testRetryThenSucceedWithRealBackoff() {
      QueueConfig jobs = new QueueConfig("jobs", 2, Duration.ofMillis(100));
      jobs.setPollRetries(0);
      WorkQueue<EmailJob> real = new WorkQueue<>(jobs, store, EmailJob.class);
      real.fill(List.of(new EmailJob("x@acme.com", AT)));
      AtomicInteger attempts = new AtomicInteger();

      long started = System.nanoTime();
      real.work(
          job -> {
            if (attempts.incrementAndGet() < 3) {
              throw new RetryException();
            }
          });
      Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

      assertThat(attempts).hasValue(3);
      assertThat(store.deadLetterWrites()).hasSize(1);
      assertThat(store.deadLetterDeletes()).hasSize(1);
      assertThat(real.deadLetters()).isEmpty();
      assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(200));
    }

    @Test
    @DisplayName("work - an idle worker re-polls before stopping so a leader can fill the queue")
    void testIdleWorkerWaitsForFill() {
      QueueConfig follower = new QueueConfig("emails", 0, Duration.ZERO);
      follower.setPollRetries(1);
      follower.setPollInterval(Duration.ofMillis(50));
      List<Duration> polls = new ArrayList<>();
      RetryRunner runner =
          new RetryRunner(
              Duration.ofMinutes(5),
              d -> {
                polls.add(d);
                queue.fill(jobs(2));
              });
      WorkQueue<EmailJob> worker = new WorkQueue<>(follower, store, EmailJob.class, runner);
      List<EmailJob> seen = new ArrayList<>();

      worker.work(seen::add);

      assertThat(polls).containsExactly(Duration.ofMillis(50));
      assertThat(seen).hasSize(2);
    }

    @Test
    @DisplayName("work - stops quietly on an empty queue")
    void testEmptyQueue() {
      assertThatCode(() -> queue.work(job -> fail("no jobs expected"))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("work - rejects parallelism below one")
    void testInvalidParallelism() {
      assertThatThrownBy(() -> queue.work(job -> {}, null, 0))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("work - store failures surface as QueueException")
    void testStoreFailure() {
      JobStore broken = mock(JobStore.class);
      when(broken.pop("emails")).thenThrow(new IllegalStateException("connection reset"));
      WorkQueue<EmailJob> failing =
          new WorkQueue<>(config, broken, EmailJob.class, new RetryRunner(Duration.ofMinutes(5), d -> {}));

      assertThatThrownBy(() -> failing.work(job -> {}, null, 2))
          .isInstanceOf(QueueException.class)
          .hasRootCauseMessage("connection reset");
    }
  }

  @Nested
  @DisplayName("Requeue")
  class RequeueTests {

    @Test
    @DisplayName("requeue - moves every dead letter back and empties the dead-letter store")
    void testRequeue() {
      queue.fill(jobs(3));
      queue.work(
          job -> {
            throw new RetryException();
          });
      assertThat(queue.deadLetters()).hasSize(3);
      long before = queue.length();

      assertThat(queue.requeue()).isTrue();

      assertThat(queue.deadLetters()).isEmpty();
      assertThat(queue.length()).isEqualTo(before + 3);
    }

    @Test
    @DisplayName("requeue - reports nothing to do on an empty dead-letter store")
    void testRequeueEmpty() {
      queue.fill(jobs(1));

      assertThat(queue.requeue()).isFalse();
      assertThat(queue.length()).isEqualTo(1);
    }

    @Test
    @DisplayName("requeue - requeued jobs are worked again")
    void testRequeuedJobsAreWorked() {
      queue.fill(jobs(2));
      AtomicInteger failuresLeft = new AtomicInteger(1);
      List<String> handled = new ArrayList<>();
      JobHandler<EmailJob> flaky =
          job -> {
            if (job.to().startsWith("user1") && failuresLeft.getAndDecrement() > 0) {
              throw new IllegalStateException("transient outage");
            }
            handled.add(job.to());
          };

      queue.work(flaky);
      queue.requeue();
      queue.work(flaky);

      assertThat(handled).containsExactly("user0@acme.com", "user1@acme.com");
      assertThat(queue.deadLetters()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Logging wrapper")
  class WrapHandlerTests {

    @Test
    @DisplayName("wrapHandler - logs the decoded job before running it")
    void testLogsJob() throws Exception {
      Logger logger = mock(Logger.class);
      List<EmailJob> seen = new ArrayList<>();

      queue.wrapHandler("emails", logger, seen::add).handle(Jsons.toJson(new EmailJob("a@acme.com", AT)));

      verify(logger).info(anyString(), eq(new EmailJob("a@acme.com", AT)));
      assertThat(seen).hasSize(1);
    }

    @Test
    @DisplayName("wrapHandler - logs failures with the job and rethrows them unchanged")
    void testLogsAndRethrows() {
      Logger logger = mock(Logger.class);
      RetryException retry = new RetryException("later");
      PayloadHandler wrapped =
          queue.wrapHandler(
              "emails",
              logger,
              job -> {
                throw retry;
              });

      assertThatThrownBy(() -> wrapped.handle(Jsons.toJson(new EmailJob("a@acme.com", AT)))).isSameAs(retry);
      verify(logger).error(anyString(), eq(new EmailJob("a@acme.com", AT)), eq(retry));
    }

    @Test
    @DisplayName("wrapHandler - logs a payload that cannot be decoded and rethrows")
    void testLogsUndecodablePayload() {
      Logger logger = mock(Logger.class);
      List<EmailJob> seen = new ArrayList<>();
      PayloadHandler wrapped = queue.wrapHandler("emails", logger, seen::add);

      assertThatThrownBy(() -> wrapped.handle("not json")).isInstanceOf(IllegalArgumentException.class);
      verify(logger).error(anyString(), eq("not json"), any(IllegalArgumentException.class));
      assertThat(seen).isEmpty();
    }

    @Test
    @DisplayName("work - with a logger every job goes through the wrapper")
    void testWorkUsesLogger() {
      Logger logger = mock(Logger.class);
      queue.fill(jobs(2));

      queue.work(job -> {}, logger);

      verify(logger, times(2)).info(anyString(), any(EmailJob.class));
    }
  }

  @Test
  @DisplayName("backupKey - is 32 lowercase hex characters and random")
  void testBackupKey() {
    String first = WorkQueue.backupKey();
    String second = WorkQueue.backupKey();

    assertThat(first).matches("[0-9a-f]{32}");
    assertThat(first).isNotEqualTo(second);
  }

  @Test
  @DisplayName("dead-letter store name derives from the queue name")
  void testDeadLetterName() {
    assertThat(config.getDeadLetterName()).isEqualTo("emails:dead-letter");
  }
}
