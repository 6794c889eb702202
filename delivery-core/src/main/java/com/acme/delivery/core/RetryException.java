package com.acme.delivery.core;

/**
 * Signals that the current unit of work should be retried. Any other exception thrown from a job
 * or message handler is treated as terminal for that item.
 */
public class RetryException extends RuntimeException {
  public RetryException() {
    super("retry requested");
  }

  public RetryException(String message) {
    super(message);
  }

  public RetryException(String message, Throwable e) {
    super(message, e);
  }

  /** Used for high-frequency control flow such as empty-queue polling; carries no stack trace. */
  protected RetryException(String message, boolean writableStackTrace) {
    super(message, null, false, writableStackTrace);
  }

  /** Shared signal for an empty queue poll. */
  public static RetryException emptyQueue() {
    return new RetryException("queue is empty", false);
  }
}
