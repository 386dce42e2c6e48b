package com.mk.fx.qa.consistency.scenario;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.metrics.LatencySummary;
import com.mk.fx.qa.consistency.model.ScenarioType;

/**
 * Cold start or warm latency outcome; passes when the p99 of successful reads stays under {@code
 * maxP99LatencyMs}. {@code latency} is absent when no read succeeded.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LatencyReport(
    ScenarioType scenario,
    int requests,
    int successful,
    LatencySummary latency,
    double maxP99LatencyMs,
    double totalDurationMs,
    String note,
    boolean passed)
    implements ScenarioReport {}
