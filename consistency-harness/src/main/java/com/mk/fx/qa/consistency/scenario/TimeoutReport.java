package com.mk.fx.qa.consistency.scenario;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.model.ScenarioType;

/** Timeout handling outcome. Passes when at least one request surfaced as a timeout. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimeoutReport(
    ScenarioType scenario,
    int requests,
    long requestTimeoutMs,
    int timeouts,
    int successes,
    int otherErrors,
    boolean passed)
    implements ScenarioReport {}
