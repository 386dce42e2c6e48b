package com.mk.fx.qa.consistency.scenario;

import com.mk.fx.qa.consistency.model.ScenarioType;

/** Common shape of every scenario's outcome: what ran and whether its criterion held. */
public interface ScenarioReport {

  ScenarioType scenario();

  boolean passed();
}
