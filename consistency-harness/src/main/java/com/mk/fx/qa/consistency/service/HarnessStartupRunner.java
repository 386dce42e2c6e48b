package com.mk.fx.qa.consistency.service;

import com.mk.fx.qa.consistency.cfg.HarnessProperties;
import com.mk.fx.qa.consistency.model.ScenarioType;
import com.mk.fx.qa.consistency.scenario.ScenarioReport;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Runs the scenarios listed in {@code harness.run-on-startup} once the application is up. */
@Slf4j
@Component
@RequiredArgsConstructor
public class HarnessStartupRunner implements ApplicationRunner {

  private final HarnessProperties properties;
  private final HarnessService harnessService;

  @Override
  public void run(ApplicationArguments args) throws InterruptedException {
    var requested = properties.getRunOnStartup();
    if (requested == null || requested.isEmpty()) {
      log.debug("No scenarios configured to run on startup");
      return;
    }

    // all names resolved before the first run
    List<ScenarioType> scenarios = requested.stream().map(ScenarioType::fromValue).toList();
    log.info("Running {} startup scenarios: {}", scenarios.size(), scenarios);

    List<ScenarioReport> reports = new ArrayList<>();
    for (var scenario : scenarios) {
      reports.add(harnessService.run(scenario));
    }

    var failed =
        reports.stream().filter(report -> !report.passed()).map(ScenarioReport::scenario).toList();
    if (failed.isEmpty()) {
      log.info("All {} startup scenarios passed", reports.size());
    } else {
      log.warn("{}/{} startup scenarios failed: {}", failed.size(), reports.size(), failed);
    }
  }
}
