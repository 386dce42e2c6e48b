package com.mk.fx.qa.consistency.scenario;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.metrics.AggregateStats;
import com.mk.fx.qa.consistency.model.ScenarioType;

/**
 * Consistency SLO sweep outcome. Passes when {@code slo_percentage >= threshold_percentage}.
 * Probes that threw or were cut off by the batch deadline are not part of {@code stats}; they are
 * counted in {@code failed} and {@code abandoned}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConsistencyReport(
    ScenarioType scenario,
    int probes,
    double sloSeconds,
    double thresholdPercentage,
    @JsonUnwrapped AggregateStats stats,
    int failed,
    int abandoned,
    boolean passed)
    implements ScenarioReport {}
