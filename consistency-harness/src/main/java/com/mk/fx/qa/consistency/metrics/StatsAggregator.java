package com.mk.fx.qa.consistency.metrics;

import com.mk.fx.qa.consistency.probe.ConsistencyResult;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure reductions over latency samples and probe results.
 *
 * <p>Percentiles are nearest-rank by direct index into the sorted sample, never interpolated, so
 * the reported numbers stay reproducible across runs and implementations.
 */
public final class StatsAggregator {

  static final String NO_RESULTS = "No results";
  static final String NO_CONSISTENT_EVENTS = "No events reached consistency";

  private StatsAggregator() {
    throw new UnsupportedOperationException("StatsAggregator cannot be instantiated");
  }

  /**
   * Summarises the samples.
   *
   * @param samplesMs latency samples in milliseconds, possibly empty
   * @return the summary, or empty when there are no samples
   */
  public static Optional<LatencySummary> summarize(Collection<Double> samplesMs) {
    Objects.requireNonNull(samplesMs, "samplesMs");
    if (samplesMs.isEmpty()) {
      return Optional.empty();
    }
    double[] sorted = samplesMs.stream().mapToDouble(Double::doubleValue).sorted().toArray();
    int n = sorted.length;
    double p99 = n > 100 ? sorted[(int) Math.floor(n * 0.99)] : sorted[n - 1];
    return Optional.of(
        new LatencySummary(
            n, sorted[n / 2], sorted[(int) Math.floor(n * 0.9)], p99, sorted[n - 1], sorted[0]));
  }

  /**
   * Aggregates probe results. Latency percentiles cover consistent results only; when none reached
   * consistency the latency block is absent and a note says so.
   */
  public static AggregateStats aggregate(List<ConsistencyResult> results) {
    Objects.requireNonNull(results, "results");
    if (results.isEmpty()) {
      return new AggregateStats(0, 0, 0, 0.0, null, NO_RESULTS);
    }
    int total = results.size();
    int consistent = (int) results.stream().filter(ConsistencyResult::consistent).count();
    int withinSlo = (int) results.stream().filter(ConsistencyResult::withinSlo).count();
    double sloPercentage = withinSlo * 100.0 / total;

    var latencies =
        results.stream()
            .filter(ConsistencyResult::consistent)
            .map(ConsistencyResult::consistencyLatencyMs)
            .toList();
    return summarize(latencies)
        .map(summary -> new AggregateStats(total, consistent, withinSlo, sloPercentage, summary, null))
        .orElseGet(
            () ->
                new AggregateStats(
                    total, consistent, withinSlo, sloPercentage, null, NO_CONSISTENT_EVENTS));
  }
}
