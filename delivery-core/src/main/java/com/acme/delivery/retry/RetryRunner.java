package com.acme.delivery.retry;

import com.acme.delivery.core.RetryException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with exponential backoff. Only {@link RetryException} triggers another attempt;
 * any other exception propagates from the failing attempt untouched.
 *
 * <p>With {@code retries = n} the work is attempted at most {@code n + 1} times. Before attempt
 * {@code k + 1} the runner sleeps {@code backoff * 2^(k-1)}, capped at {@link #getMaxBackoff()}.
 * When the last attempt also asks for a retry the call returns {@link RetryOutcome#EXHAUSTED}
 * instead of throwing, so callers decide whether exhaustion is fatal.
 */
public class RetryRunner {
  private static final Logger LOG = LoggerFactory.getLogger(RetryRunner.class);

  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(5);

  private final Duration maxBackoff;
  private final Sleeper sleeper;

  public RetryRunner() {
    this(DEFAULT_MAX_BACKOFF, Sleeper.THREAD);
  }

  public RetryRunner(Duration maxBackoff, Sleeper sleeper) {
    if (maxBackoff == null || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("maxBackoff must be >= 0");
    }
    this.maxBackoff = maxBackoff;
    this.sleeper = sleeper;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  /**
   * Run {@code attempt} until it completes, fails terminally or runs out of retries.
   *
   * @param retries number of retries after the first attempt; 0 runs a single attempt
   * @param backoff delay before the first retry
   * @param attempt the work to run
   * @return {@link RetryOutcome#COMPLETED} or {@link RetryOutcome#EXHAUSTED}
   * @throws Exception the first non-retry exception raised by {@code attempt}
   */
  public RetryOutcome run(int retries, Duration backoff, Attempt attempt) throws Exception {
    if (retries < 0) {
      throw new IllegalArgumentException("retries must be >= 0, got " + retries);
    }
    int current = 1;
    while (true) {
      try {
        attempt.run(current);
        return RetryOutcome.COMPLETED;
      } catch (RetryException e) {
        if (current > retries) {
          LOG.debug("Giving up after {} attempt(s): {}", current, e.getMessage());
          return RetryOutcome.EXHAUSTED;
        }
        Duration delay = delayFor(backoff, current);
        LOG.debug("Attempt {} requested a retry, backing off {}", current, delay);
        sleeper.sleep(delay);
        current++;
      }
    }
  }

  /** Delay before the attempt following {@code attempt}. Never decreases as attempts grow. */
  Duration delayFor(Duration backoff, int attempt) {
    if (backoff == null || backoff.isZero() || backoff.isNegative()) {
      return Duration.ZERO;
    }
    int shift = Math.min(attempt - 1, 30);
    long millis = backoff.toMillis();
    long scaled = millis > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : millis << shift;
    long cap = Math.max(maxBackoff.toMillis(), millis);
    return Duration.ofMillis(Math.min(scaled, cap));
  }

  /** Pause between attempts. Replaceable in tests. */
  @FunctionalInterface
  public interface Sleeper {
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
  }
}
