package com.mk.fx.qa.consistency.scenario;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.model.ScenarioType;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResilienceReport(
    ScenarioType scenario,
    int requests,
    long successes,
    double successRate,
    double minSuccessRate,
    Map<Integer, Long> statusDistribution,
    Map<String, Long> transportErrors,
    boolean passed)
    implements ScenarioReport {}
