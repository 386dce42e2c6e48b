package com.mk.fx.qa.consistency.scenario;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.consistency.model.ScenarioType;
import com.mk.fx.qa.consistency.producer.ProducerReport;

/** Event production outcome; passes when the sink accepted every event. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProductionReport(
    ScenarioType scenario, @JsonUnwrapped ProducerReport production, boolean passed)
    implements ScenarioReport {}
