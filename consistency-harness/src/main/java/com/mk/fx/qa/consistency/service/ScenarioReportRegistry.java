package com.mk.fx.qa.consistency.service;

import com.mk.fx.qa.consistency.model.ScenarioType;
import com.mk.fx.qa.consistency.scenario.ScenarioReport;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Thread-safe store of the latest report per scenario. */
@Component
public class ScenarioReportRegistry {

  private final Map<ScenarioType, ScenarioReport> reports = new ConcurrentHashMap<>();

  /** Saves the report, replacing any earlier one of the same scenario. */
  public void saveReport(ScenarioReport report) {
    reports.put(report.scenario(), report);
  }

  public Optional<ScenarioReport> getReport(ScenarioType scenario) {
    return Optional.ofNullable(reports.get(scenario));
  }
}
