package com.acme.delivery.core;

/** Failure of the backing store while draining or filling a work queue. */
public class QueueException extends RuntimeException {
  public QueueException(String message) {
    super(message);
  }

  public QueueException(String message, Throwable e) {
    super(message, e);
  }
}
