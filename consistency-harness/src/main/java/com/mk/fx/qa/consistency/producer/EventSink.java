package com.mk.fx.qa.consistency.producer;

import com.mk.fx.qa.consistency.model.SyntheticEvent;

/**
 * Accepts an event for asynchronous delivery. Retries, if any, are the sink's business.
 *
 * <p>A rejected event is reported by returning {@code false}; a failure to reach the destination
 * may instead be raised as {@link EventPublishException}. Either way the producer counts an error
 * and moves on.
 */
@FunctionalInterface
public interface EventSink {

  boolean publish(SyntheticEvent event, String sinkIdentifier);
}
