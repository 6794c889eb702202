package com.acme.delivery.core;

/** Raised at startup when a registered stream does not exist on the broker. */
public class StreamNotFoundException extends RuntimeException {
  private final String stream;

  public StreamNotFoundException(String stream) {
    super("Stream does not exist: " + stream);
    this.stream = stream;
  }

  public StreamNotFoundException(String stream, Throwable e) {
    super("Stream does not exist: " + stream, e);
    this.stream = stream;
  }

  public String getStream() {
    return stream;
  }
}
