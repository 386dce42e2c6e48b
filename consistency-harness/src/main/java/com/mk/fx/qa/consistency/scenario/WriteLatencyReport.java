package com.mk.fx.qa.consistency.scenario;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.metrics.LatencySummary;
import com.mk.fx.qa.consistency.model.ScenarioType;

/** Write acknowledgement latency over the probes whose write was accepted. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WriteLatencyReport(
    ScenarioType scenario,
    int probes,
    int writesAccepted,
    LatencySummary writeLatency,
    double maxP99LatencyMs,
    String note,
    boolean passed)
    implements ScenarioReport {}
