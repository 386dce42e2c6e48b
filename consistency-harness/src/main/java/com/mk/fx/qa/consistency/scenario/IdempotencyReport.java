package com.mk.fx.qa.consistency.scenario;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.model.ScenarioType;
import java.util.List;

/**
 * Outcome of the duplicate-write and unique-write scenarios.
 *
 * @param idempotencyKey token shared by every write; null for unique requests
 * @param successful writes answered with 200 or 201
 * @param resourceIds distinct identifiers seen, in first-seen order
 * @param duplicateResourcesDetected more than one identifier was created for one token
 * @param note diagnostic, e.g. why the scenario failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdempotencyReport(
    ScenarioType scenario,
    String idempotencyKey,
    int requests,
    int successful,
    int failed,
    List<String> resourceIds,
    boolean duplicateResourcesDetected,
    String note,
    boolean passed)
    implements ScenarioReport {

  @JsonProperty
  public int distinctIds() {
    return resourceIds.size();
  }
}
