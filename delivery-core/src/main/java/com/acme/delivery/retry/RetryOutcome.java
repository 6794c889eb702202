package com.acme.delivery.retry;

/** How a {@link RetryRunner} call finished. */
public enum RetryOutcome {
  /** An attempt returned normally. */
  COMPLETED,
  /** Every allowed attempt asked to be retried. */
  EXHAUSTED;

  public boolean isCompleted() {
    return this == COMPLETED;
  }
}
