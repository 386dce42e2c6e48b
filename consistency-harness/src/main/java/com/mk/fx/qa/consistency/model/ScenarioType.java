package com.mk.fx.qa.consistency.model;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

public enum ScenarioType {
  BACKPRESSURE_BURST,
  TIMEOUT_HANDLING,
  RETRY_RESILIENCE,
  IDEMPOTENT_SEQUENTIAL,
  IDEMPOTENT_CONCURRENT,
  UNIQUE_REQUESTS,
  COLD_START,
  WARM_LATENCY,
  CONSISTENCY_SLO,
  WRITE_LATENCY,
  EVENT_PRODUCTION;

  public static ScenarioType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.name().equalsIgnoreCase(value != null ? value.replace('-', '_') : null))
        .findFirst()
        .orElseThrow(() -> new UnknownScenarioException(value));
  }

  public static Set<String> asStrings() {
    return Arrays.stream(values()).map(Enum::name).collect(Collectors.toUnmodifiableSet());
  }

  /** Base name of the report file, e.g. {@code consistency_slo}. */
  public String reportName() {
    return name().toLowerCase();
  }
}
