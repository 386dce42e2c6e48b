package com.mk.fx.qa.consistency.utils;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  public static Duration toDuration(Duration duration) {
    return duration != null ? duration : Duration.ZERO;
  }

  /** Milliseconds elapsed since a {@link System#nanoTime()} reading, with sub-millisecond precision. */
  public static double elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }

  public static double elapsedSeconds(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }

  /** Converts fractional seconds to a duration, rounding to the nearest nanosecond. */
  public static Duration ofSeconds(double seconds) {
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
  }

  /** Sleeps for the duration; zero or negative durations return immediately. */
  public static void sleep(Duration duration) throws InterruptedException {
    var nanos = toDuration(duration).toNanos();
    if (nanos > 0) {
      TimeUnit.NANOSECONDS.sleep(nanos);
    }
  }
}
