package com.mk.fx.qa.consistency.metrics;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe classifier for request outcomes. HTTP statuses fall into success, rate-limited,
 * client-error and server-error buckets; requests that never got a response are counted as
 * transport failures and broken down by root cause.
 */
public final class OutcomeTracker {

  /** Status recorded for a request that produced no HTTP response. */
  public static final int NO_RESPONSE = 0;

  private final AtomicLong success = new AtomicLong();
  private final AtomicLong rateLimited = new AtomicLong();
  private final AtomicLong clientErrors = new AtomicLong();
  private final AtomicLong serverErrors = new AtomicLong();
  private final AtomicLong transportFailures = new AtomicLong();
  private final Map<Integer, AtomicLong> statusCodes = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> transportBreakdown = new ConcurrentHashMap<>();

  public void recordStatus(int statusCode) {
    statusCodes.computeIfAbsent(statusCode, k -> new AtomicLong()).incrementAndGet();
    if (statusCode >= 200 && statusCode < 300) {
      success.incrementAndGet();
    } else if (statusCode == 429) {
      rateLimited.incrementAndGet();
    } else if (statusCode >= 500) {
      serverErrors.incrementAndGet();
    } else {
      clientErrors.incrementAndGet();
    }
  }

  public void recordTransportFailure(Throwable t) {
    statusCodes.computeIfAbsent(NO_RESPONSE, k -> new AtomicLong()).incrementAndGet();
    transportFailures.incrementAndGet();
    transportBreakdown.computeIfAbsent(classifyError(t), k -> new AtomicLong()).incrementAndGet();
  }

  public long success() {
    return success.get();
  }

  public long rateLimited() {
    return rateLimited.get();
  }

  public long clientErrors() {
    return clientErrors.get();
  }

  public long serverErrors() {
    return serverErrors.get();
  }

  public long transportFailures() {
    return transportFailures.get();
  }

  /** Status code distribution, ordered by code; {@value #NO_RESPONSE} counts transport failures. */
  public Map<Integer, Long> statusDistribution() {
    Map<Integer, Long> map = new TreeMap<>();
    statusCodes.forEach((code, count) -> map.put(code, count.get()));
    return map;
  }

  public Map<String, Long> transportBreakdown() {
    Map<String, Long> map = new HashMap<>();
    for (var e : transportBreakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }

  /** Maps the root cause of a transport failure to a stable category name. */
  public static String classifyError(Throwable t) {
    if (t == null) return "UNKNOWN";
    Throwable rootCause = t;
    while (rootCause.getCause() != null) {
      rootCause = rootCause.getCause();
    }
    var clsName = rootCause.getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "HttpTimeoutException", "HttpConnectTimeoutException" -> "HTTP_TIMEOUT";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }
}
