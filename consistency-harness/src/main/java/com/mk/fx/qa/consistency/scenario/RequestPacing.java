package com.mk.fx.qa.consistency.scenario;

import java.time.Duration;
import java.util.Objects;

/**
 * A run of sequential requests separated by a fixed pause.
 *
 * @param requests number of requests; positive
 * @param spacing pause after each request; zero for none
 */
public record RequestPacing(int requests, Duration spacing) {

  public RequestPacing {
    if (requests <= 0) {
      throw new IllegalArgumentException("requests must be > 0, was " + requests);
    }
    Objects.requireNonNull(spacing, "spacing");
    if (spacing.isNegative()) {
      throw new IllegalArgumentException("spacing must not be negative");
    }
  }
}
