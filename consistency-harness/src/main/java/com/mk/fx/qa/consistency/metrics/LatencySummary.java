package com.mk.fx.qa.consistency.metrics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Nearest-rank percentiles and extremes over a non-empty latency sample.
 *
 * @param samples number of samples the summary was computed from
 * @param p50LatencyMs {@code sorted[n/2]}
 * @param p90LatencyMs {@code sorted[floor(n*0.9)]}
 * @param p99LatencyMs {@code sorted[floor(n*0.99)]} when {@code n > 100}, otherwise the maximum
 * @param maxLatencyMs largest sample
 * @param minLatencyMs smallest sample
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LatencySummary(
    int samples,
    double p50LatencyMs,
    double p90LatencyMs,
    double p99LatencyMs,
    double maxLatencyMs,
    double minLatencyMs) {}
