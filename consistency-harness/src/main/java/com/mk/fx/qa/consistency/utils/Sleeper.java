package com.mk.fx.qa.consistency.utils;

import java.time.Duration;

/**
 * Suspends the calling worker. Pacing, polling and gap delays all go through this so tests can
 * substitute a recording or no-op implementation.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = LoadUtils::sleep;

  void sleep(Duration duration) throws InterruptedException;
}
