package com.mk.fx.qa.consistency.producer;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of one production run.
 *
 * @param testRunId id shared by every event of the run
 * @param totalEvents events the sink accepted
 * @param attempted publish attempts, always {@code eventsPerSecond * durationSeconds}
 * @param targetRate configured steady-state rate
 * @param actualRate {@code totalEvents / durationSeconds}
 * @param durationSeconds measured wall time of the run
 * @param errors publish attempts the sink rejected or failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProducerReport(
    String testRunId,
    long totalEvents,
    long attempted,
    int targetRate,
    double actualRate,
    double durationSeconds,
    long errors) {}
