package com.mk.fx.qa.consistency.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Optional;

/**
 * Aggregate of one consistency run. A new instance is built per aggregation.
 *
 * @param total probe results that completed
 * @param consistentCount results whose predicate held before the deadline
 * @param withinSloCount consistent results within the SLO window
 * @param sloPercentage {@code withinSloCount * 100 / total}
 * @param latency percentiles over consistent results, null when there were none
 * @param note explains an absent latency block
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregateStats(
    int total,
    int consistentCount,
    int withinSloCount,
    double sloPercentage,
    @JsonUnwrapped LatencySummary latency,
    String note) {

  @JsonIgnore
  public Optional<LatencySummary> latencyData() {
    return Optional.ofNullable(latency);
  }
}
