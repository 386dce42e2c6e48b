package com.mk.fx.qa.consistency.probe;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by the probes of one run.
 *
 * @param sloSeconds consistency SLO; also bounds polling
 * @param pollInterval pause before each read
 * @param predicate consistency check applied to each read response
 */
public record ProbeSettings(double sloSeconds, Duration pollInterval, ConsistencyPredicate predicate) {

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

  public ProbeSettings {
    if (!(sloSeconds > 0)) {
      throw new IllegalArgumentException("sloSeconds must be > 0, was " + sloSeconds);
    }
    Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    Objects.requireNonNull(predicate, "predicate");
  }

  public double sloMillis() {
    return sloSeconds * 1000.0;
  }

  /**
   * Poll budget: {@code ceil(slo / pollInterval)}, i.e. {@code ceil(sloSeconds * 10)} at 100 ms.
   * Both sides are taken in whole nanoseconds so the division is exact.
   */
  public int maxPolls() {
    long sloNanos = Math.round(sloSeconds * 1_000_000_000.0);
    long intervalNanos = pollInterval.toNanos();
    long polls = (sloNanos + intervalNanos - 1) / intervalNanos;
    return (int) Math.min(Integer.MAX_VALUE, polls);
  }
}
