package com.acme.delivery.stream;

import com.acme.delivery.spi.PullSubscription;

/**
 * Counts messages handled since the last pull and requests the next batch once a full batch has
 * been handled. Only the subscription's consumer thread calls {@link #handled()}.
 */
final class PullWindow {
  private final int batch;
  private final PullSubscription subscription;
  private int count;
  private volatile boolean open = true;

  PullWindow(int batch, PullSubscription subscription) {
    this.batch = batch;
    this.subscription = subscription;
  }

  /** First pull of a new subscription. */
  void open() {
    subscription.pull(batch);
  }

  void handled() {
    count++;
    if (count == batch) {
      count = 0;
      if (open) {
        subscription.pull(batch);
      }
    }
  }

  /** No more pulls after this. */
  void close() {
    open = false;
  }

  int count() {
    return count;
  }
}
