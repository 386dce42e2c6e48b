package com.mk.fx.qa.consistency.producer;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Parameters of one event production run. Validated on construction so a bad definition fails
 * before any event is produced.
 *
 * @param eventsPerSecond steady-state target rate, positive
 * @param durationSeconds nominal run length, positive; the run emits {@code eventsPerSecond *
 *     durationSeconds} events
 * @param rampUpSeconds linear ramp-up window, between zero and {@code durationSeconds}
 * @param eventType type tag stamped on every event
 * @param sinkIdentifier destination name handed to the sink, e.g. an event bus
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProducerConfig(
    int eventsPerSecond,
    int durationSeconds,
    int rampUpSeconds,
    String eventType,
    String sinkIdentifier) {

  public ProducerConfig {
    if (eventsPerSecond <= 0) {
      throw new IllegalArgumentException("eventsPerSecond must be > 0, was " + eventsPerSecond);
    }
    if (durationSeconds <= 0) {
      throw new IllegalArgumentException("durationSeconds must be > 0, was " + durationSeconds);
    }
    if (rampUpSeconds < 0 || rampUpSeconds > durationSeconds) {
      throw new IllegalArgumentException(
          "rampUpSeconds must be between 0 and durationSeconds ("
              + durationSeconds
              + "), was "
              + rampUpSeconds);
    }
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("eventType is required");
    }
    if (sinkIdentifier == null || sinkIdentifier.isBlank()) {
      throw new IllegalArgumentException("sinkIdentifier is required");
    }
  }

  public long totalEvents() {
    return (long) eventsPerSecond * durationSeconds;
  }
}
