package com.mk.fx.qa.consistency.probe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.model.ProbeState;
import java.util.Objects;

/**
 * Record of one probe invocation.
 *
 * @param correlationId correlation id sent with the write
 * @param placementId identifier returned by the write; null when the write failed
 * @param writeLatencyMs write issued to write acknowledged
 * @param consistencyLatencyMs write issued to predicate satisfied or polling given up
 * @param consistent the predicate held before the poll budget ran out
 * @param withinSlo consistent and {@code consistencyLatencyMs <= slo}
 * @param pollCount reads issued
 * @param state terminal state
 * @param error why the write failed, null otherwise
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsistencyResult(
    String correlationId,
    String placementId,
    double writeLatencyMs,
    double consistencyLatencyMs,
    boolean consistent,
    boolean withinSlo,
    int pollCount,
    ProbeState state,
    String error) {

  public ConsistencyResult {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(state, "state");
    if (!state.isTerminal()) {
      throw new IllegalArgumentException("Result requires a terminal state, was " + state);
    }
    if (writeLatencyMs < 0 || consistencyLatencyMs < writeLatencyMs) {
      throw new IllegalArgumentException(
          "Expected consistencyLatencyMs >= writeLatencyMs >= 0 but was "
              + consistencyLatencyMs
              + " / "
              + writeLatencyMs);
    }
  }

  static ConsistencyResult writeFailed(String correlationId, double latencyMs, String error) {
    return new ConsistencyResult(
        correlationId, null, latencyMs, latencyMs, false, false, 0, ProbeState.WRITE_FAILED, error);
  }
}
