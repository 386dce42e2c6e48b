package com.mk.fx.qa.consistency.resource;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.qa.consistency.metrics.AggregateStats;
import com.mk.fx.qa.consistency.metrics.LatencySummary;
import com.mk.fx.qa.consistency.model.ScenarioType;
import com.mk.fx.qa.consistency.rest.TransportException;
import com.mk.fx.qa.consistency.scenario.BurstReport;
import com.mk.fx.qa.consistency.scenario.ConsistencyReport;
import com.mk.fx.qa.consistency.service.HarnessService;
import com.mk.fx.qa.consistency.service.ScenarioReportRegistry;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ScenarioController.class)
@Import({ApiResponseFactory.class, GlobalExceptionHandler.class})
class ScenarioControllerTest {

  @Autowired MockMvc mvc;

  @MockBean HarnessService harnessService;
  @MockBean ScenarioReportRegistry reportRegistry;

  @Test
  void getSupportedScenarios_listsNames() throws Exception {
    when(harnessService.getSupportedScenarios()).thenReturn(Set.of("CONSISTENCY_SLO"));

    mvc.perform(get("/api/scenarios"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("CONSISTENCY_SLO"));
  }

  @Test
  void runScenario_returnsReportEvenWhenSloMissed() throws Exception {
    var stats =
        new AggregateStats(
            50, 48, 48, 96.0, new LatencySummary(48, 100.0, 200.0, 300.0, 300.0, 50.0), null);
    when(harnessService.run(ScenarioType.CONSISTENCY_SLO))
        .thenReturn(
            new ConsistencyReport(
                ScenarioType.CONSISTENCY_SLO, 50, 5.0, 97.0, stats, 0, 0, false));

    mvc.perform(post("/api/scenarios/consistency-slo"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.scenario").value("CONSISTENCY_SLO"))
        .andExpect(jsonPath("$.slo_percentage").value(96.0))
        .andExpect(jsonPath("$.p99_latency_ms").value(300.0))
        .andExpect(jsonPath("$.passed").value(false));
  }

  @Test
  void runScenario_unknownName_isBadRequestListingSupportedScenarios() throws Exception {
    mvc.perform(post("/api/scenarios/soak"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Unknown Scenario"))
        .andExpect(jsonPath("$.details").value(containsString("soak")))
        .andExpect(jsonPath("$.details").value(containsString("CONSISTENCY_SLO")));
    verify(harnessService, never()).run(any());
  }

  @Test
  void runScenario_invalidConfiguration_isBadRequest() throws Exception {
    when(harnessService.run(ScenarioType.EVENT_PRODUCTION))
        .thenThrow(new IllegalArgumentException("rampUpSeconds must be between 0 and 10"));

    mvc.perform(post("/api/scenarios/event_production"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid Configuration"))
        .andExpect(jsonPath("$.details").value("rampUpSeconds must be between 0 and 10"));
  }

  @Test
  void runScenario_systemUnderTestUnreachable_isBadGateway() throws Exception {
    when(harnessService.run(ScenarioType.WARM_LATENCY))
        .thenThrow(new TransportException("Connection refused", null));

    mvc.perform(post("/api/scenarios/warm_latency"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("System Under Test Unreachable"))
        .andExpect(jsonPath("$.details").value("Connection refused"));
  }

  @Test
  void getReport_returnsStoredReport() throws Exception {
    when(reportRegistry.getReport(ScenarioType.BACKPRESSURE_BURST))
        .thenReturn(
            Optional.of(
                new BurstReport(
                    ScenarioType.BACKPRESSURE_BURST,
                    100,
                    70,
                    25,
                    0,
                    5,
                    0,
                    0,
                    Map.of(201, 70L, 429, 25L, 503, 5L),
                    Map.of(),
                    null,
                    10,
                    true)));

    mvc.perform(get("/api/scenarios/backpressure_burst/report"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rate_limited").value(25))
        .andExpect(jsonPath("$.server_errors").value(5))
        .andExpect(jsonPath("$.status_distribution['429']").value(25))
        .andExpect(jsonPath("$.passed").value(true));
  }

  @Test
  void getReport_missing_isNotFound() throws Exception {
    when(reportRegistry.getReport(ScenarioType.COLD_START)).thenReturn(Optional.empty());

    mvc.perform(get("/api/scenarios/cold_start/report"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Not Found"));
  }
}
