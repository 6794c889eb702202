package com.acme.delivery.retry;

/** A single try of a unit of work. Attempt numbers start at 1. */
@FunctionalInterface
public interface Attempt {
  void run(int attempt) throws Exception;
}
