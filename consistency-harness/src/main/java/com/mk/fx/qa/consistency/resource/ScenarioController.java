package com.mk.fx.qa.consistency.resource;

import com.mk.fx.qa.consistency.model.ScenarioType;
import com.mk.fx.qa.consistency.service.HarnessService;
import com.mk.fx.qa.consistency.service.ScenarioReportRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Scenarios",
    description = "Endpoints for running harness scenarios and reading their reports")
@RestController
@RequestMapping("/api/scenarios")
@RequiredArgsConstructor
public class ScenarioController {

  private final HarnessService harnessService;
  private final ScenarioReportRegistry reportRegistry;
  private final ApiResponseFactory responseFactory;

  @Operation(summary = "Supported scenarios", description = "Lists all runnable scenarios.")
  @GetMapping
  public ResponseEntity<Set<String>> getSupportedScenarios() {
    return ResponseEntity.ok(harnessService.getSupportedScenarios());
  }

  @Operation(
      summary = "Run a scenario",
      description =
          "Runs the scenario against the configured system under test and returns its report."
              + " A failed SLO is reported in the body with passed=false, not as an error status.")
  @PostMapping("/{scenario}")
  public ResponseEntity<?> runScenario(@PathVariable String scenario) {
    var type = ScenarioType.fromValue(scenario);
    log.info("Received run request for scenario {}", type);
    try {
      return ResponseEntity.ok(harnessService.run(type));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Scenario {} interrupted", type);
      return responseFactory.unavailable("Scenario " + type + " was interrupted");
    }
  }

  @Operation(summary = "Scenario report", description = "Returns the last report of a scenario.")
  @GetMapping("/{scenario}/report")
  public ResponseEntity<?> getReport(@PathVariable String scenario) {
    var type = ScenarioType.fromValue(scenario);
    return reportRegistry
        .getReport(type)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Report not found for scenario {}", type);
              return responseFactory.notFound("No report for scenario: " + type);
            });
  }
}
