package com.mk.fx.qa.consistency.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;
import java.util.Objects;

/**
 * Event emitted by the producer. Immutable; ownership passes to the sink on a successful publish.
 *
 * @param id unique event id
 * @param correlationId unique id used to trace the event through to the read side
 * @param testRunId groups the events of one production run
 * @param producedAt monotonic timestamp ({@link System#nanoTime()}) at creation
 * @param producedAtIso wall-clock creation time, {@code yyyy-MM-dd'T'HH:mm:ss.SSS'Z'}
 * @param type event type tag
 * @param payload opaque domain data
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SyntheticEvent(
    String id,
    String correlationId,
    String testRunId,
    long producedAt,
    String producedAtIso,
    String type,
    Map<String, Object> payload) {

  public SyntheticEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(testRunId, "testRunId");
    Objects.requireNonNull(type, "type");
    payload = payload != null ? Map.copyOf(payload) : Map.of();
  }
}
