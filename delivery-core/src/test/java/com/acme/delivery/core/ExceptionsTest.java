package com.acme.delivery.core;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for core exception classes */
class ExceptionsTest {

  @Nested
  @DisplayName("RetryException Tests")
  class RetryExceptionTests {

    @Test
    @DisplayName("Should be distinct from PermanentException")
    void testDistinct() {
      assertThat(new RetryException()).isNotInstanceOf(PermanentException.class);
      assertThat(new RetryException("later")).hasMessage("later");
    }

    @Test
    @DisplayName("Empty queue signal carries no stack trace")
    void testEmptyQueueSignal() {
      RetryException signal = RetryException.emptyQueue();

      assertThat(signal).isInstanceOf(RetryException.class);
      assertThat(signal.getStackTrace()).isEmpty();
    }
  }

  @Nested
  @DisplayName("StreamNotFoundException Tests")
  class StreamNotFoundExceptionTests {

    @Test
    @DisplayName("Should name the missing stream")
    void testStreamName() {
      StreamNotFoundException exception = new StreamNotFoundException("users");

      assertThat(exception.getStream()).isEqualTo("users");
      assertThat(exception).hasMessageContaining("users");
    }
  }

  @Test
  @DisplayName("QueueException keeps its cause")
  void testQueueExceptionCause() {
    IllegalStateException cause = new IllegalStateException("down");

    assertThat(new QueueException("failed", cause)).hasCause(cause);
  }
}
