package com.mk.fx.qa.consistency.model;

import java.util.Arrays;
import java.util.List;

/** Raised when a scenario name matches no {@link ScenarioType}. */
public class UnknownScenarioException extends IllegalArgumentException {

  private final String requested;

  public UnknownScenarioException(String requested) {
    super("Unsupported scenario: " + requested + ", supported: " + supportedNames());
    this.requested = requested;
  }

  public String getRequested() {
    return requested;
  }

  /** Supported names in declaration order. */
  public static List<String> supportedNames() {
    return Arrays.stream(ScenarioType.values()).map(Enum::name).toList();
  }
}
