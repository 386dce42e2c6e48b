package com.mk.fx.qa.consistency.producer;

import com.mk.fx.qa.consistency.utils.LoadUtils;
import java.time.Duration;
import java.util.Objects;

/**
 * Computes the pause between two emissions for a target rate with a linear ramp-up.
 *
 * <p>While {@code elapsed < rampUpSeconds} the effective rate is {@code eventsPerSecond * elapsed /
 * rampUpSeconds}, floored at one event per second; afterwards it is {@code eventsPerSecond}. The
 * delay is the reciprocal of the effective rate, so it is always positive and at most one second.
 * Stateless: the result depends only on the arguments.
 */
public final class RateScheduler {

  static final double MIN_RATE_PER_SEC = 1.0;

  /** Shortest delay handed out; rates beyond one event per nanosecond are clamped here. */
  static final Duration MIN_DELAY = Duration.ofNanos(1);

  private RateScheduler() {
    throw new UnsupportedOperationException("RateScheduler cannot be instantiated");
  }

  public static double effectiveRate(double elapsedSeconds, ProducerConfig config) {
    Objects.requireNonNull(config, "config");
    double elapsed = Math.max(0.0, elapsedSeconds);
    if (elapsed < config.rampUpSeconds()) {
      return Math.max(
          MIN_RATE_PER_SEC, config.eventsPerSecond() * (elapsed / config.rampUpSeconds()));
    }
    return config.eventsPerSecond();
  }

  public static double nextDelaySeconds(double elapsedSeconds, ProducerConfig config) {
    return 1.0 / effectiveRate(elapsedSeconds, config);
  }

  public static Duration nextDelay(double elapsedSeconds, ProducerConfig config) {
    var delay = LoadUtils.ofSeconds(nextDelaySeconds(elapsedSeconds, config));
    return delay.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : delay;
  }
}
