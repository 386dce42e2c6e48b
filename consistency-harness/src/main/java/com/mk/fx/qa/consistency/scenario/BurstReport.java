package com.mk.fx.qa.consistency.scenario;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.metrics.LatencySummary;
import com.mk.fx.qa.consistency.model.ScenarioType;
import java.util.Map;

/**
 * Backpressure burst outcome. Passes when fewer than {@code maxServerErrors} responses were 5xx:
 * under overload the system should reject with 429 rather than fail.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BurstReport(
    ScenarioType scenario,
    int requests,
    long successful,
    long rateLimited,
    long clientErrors,
    long serverErrors,
    long transportFailures,
    int abandoned,
    Map<Integer, Long> statusDistribution,
    Map<String, Long> transportErrors,
    LatencySummary latency,
    int maxServerErrors,
    boolean passed)
    implements ScenarioReport {}
