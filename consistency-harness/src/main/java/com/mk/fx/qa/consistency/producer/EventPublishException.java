package com.mk.fx.qa.consistency.producer;

/** Raised by an {@link EventSink} that could not hand an event to its destination. */
public class EventPublishException extends RuntimeException {

  public EventPublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
