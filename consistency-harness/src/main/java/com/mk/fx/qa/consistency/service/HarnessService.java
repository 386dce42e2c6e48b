package com.mk.fx.qa.consistency.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.consistency.cfg.HarnessProperties;
import com.mk.fx.qa.consistency.model.ScenarioType;
import com.mk.fx.qa.consistency.probe.ProbeSettings;
import com.mk.fx.qa.consistency.producer.EventProducer;
import com.mk.fx.qa.consistency.producer.ProducerConfig;
import com.mk.fx.qa.consistency.report.ReportWriter;
import com.mk.fx.qa.consistency.rest.LoadHttpClient;
import com.mk.fx.qa.consistency.rest.RequestClient;
import com.mk.fx.qa.consistency.scenario.RequestPacing;
import com.mk.fx.qa.consistency.scenario.ScenarioReport;
import com.mk.fx.qa.consistency.scenario.ScenarioRunner;
import jakarta.annotation.PostConstruct;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs scenarios with the configured parameters, writes each report to disk and keeps the latest
 * report per scenario.
 *
 * <p>Scenarios run one at a time; concurrent callers queue on a fair lock.
 */
@Slf4j
@Service
public class HarnessService {

  private final HarnessProperties properties;
  private final ScenarioRunner runner;
  private final ProbeSettings probeSettings;
  private final EventProducer eventProducer;
  private final ReportWriter reportWriter;
  private final ScenarioReportRegistry registry;
  private final ReentrantLock runLock = new ReentrantLock(true);

  public HarnessService(
      HarnessProperties properties,
      ScenarioRunner runner,
      ProbeSettings probeSettings,
      EventProducer eventProducer,
      ReportWriter reportWriter,
      ScenarioReportRegistry registry) {
    this.properties = properties;
    this.runner = runner;
    this.probeSettings = probeSettings;
    this.eventProducer = eventProducer;
    this.reportWriter = reportWriter;
    this.registry = registry;
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "HarnessService initialised against {} (maxConcurrency={}, batchDeadline={}, reports={})",
        properties.getBaseUrl(),
        properties.getBatch().getMaxConcurrency(),
        properties.getBatch().getDeadline(),
        reportWriter.directory().toAbsolutePath());
  }

  public Set<String> getSupportedScenarios() {
    return ScenarioType.asStrings();
  }

  /**
   * Runs one scenario synchronously, then writes and stores its report.
   *
   * @param scenario the scenario to run
   * @return the scenario's report, passed or not
   * @throws IllegalArgumentException if the configured parameters are invalid
   * @throws InterruptedException if interrupted while waiting for or during the run
   */
  public ScenarioReport run(ScenarioType scenario) throws InterruptedException {
    runLock.lockInterruptibly();
    try {
      log.info("Scenario {} starting", scenario);
      var startNanos = System.nanoTime();
      var report = execute(scenario);
      log.info(
          "Scenario {} completed in {} ms: {}",
          scenario,
          (System.nanoTime() - startNanos) / 1_000_000,
          report.passed() ? "PASSED" : "FAILED");
      reportWriter.write(report);
      registry.saveReport(report);
      return report;
    } finally {
      runLock.unlock();
    }
  }

  private ScenarioReport execute(ScenarioType scenario) throws InterruptedException {
    return switch (scenario) {
      case BACKPRESSURE_BURST -> {
        var burst = properties.getBurst();
        yield runner.backpressureBurst(burst.getRequests(), burst.getMaxServerErrors());
      }
      case TIMEOUT_HANDLING -> {
        var timeout = properties.getTimeout();
        yield runner.timeoutHandling(
            shortTimeoutClient(), timeout.getRequestTimeout(), timeout.getRequests());
      }
      case RETRY_RESILIENCE -> {
        var resilience = properties.getResilience();
        yield runner.retryResilience(
            new RequestPacing(resilience.getRequests(), resilience.getSpacing()),
            resilience.getMinSuccessRate());
      }
      case IDEMPOTENT_SEQUENTIAL -> {
        var idempotency = properties.getIdempotency();
        yield runner.idempotentSequential(
            new RequestPacing(idempotency.getSequentialRequests(), idempotency.getSpacing()));
      }
      case IDEMPOTENT_CONCURRENT -> runner.idempotentConcurrent(
          properties.getIdempotency().getConcurrentRequests());
      case UNIQUE_REQUESTS -> runner.uniqueRequests(
          properties.getIdempotency().getUniqueRequests());
      case COLD_START -> {
        var coldStart = properties.getColdStart();
        yield runner.coldStart(
            coldStart.getIdle(), coldStart.getBurst(), coldStart.getMaxP99LatencyMs());
      }
      case WARM_LATENCY -> {
        var warm = properties.getWarm();
        yield runner.warmLatency(
            new RequestPacing(warm.getWarmUpRequests(), warm.getWarmUpSpacing()),
            new RequestPacing(warm.getMeasuredRequests(), warm.getMeasuredSpacing()),
            warm.getMaxP99LatencyMs());
      }
      case CONSISTENCY_SLO -> {
        var consistency = properties.getConsistency();
        yield runner.consistencySlo(
            probeSettings, consistency.getProbes(), consistency.getThresholdPercentage());
      }
      case WRITE_LATENCY -> {
        var writeLatency = properties.getWriteLatency();
        yield runner.writeLatency(
            probeSettings, writeLatency.getProbes(), writeLatency.getMaxP99LatencyMs());
      }
      case EVENT_PRODUCTION -> runner.eventProduction(eventProducer, producerConfig());
    };
  }

  @VisibleForTesting
  ProducerConfig producerConfig() {
    var producer = properties.getProducer();
    return new ProducerConfig(
        producer.getEventsPerSecond(),
        producer.getDurationSeconds(),
        producer.getRampUpSeconds(),
        producer.getEventType(),
        producer.getSinkIdentifier());
  }

  /** A client sharing the base URL and headers but with the timeout scenario's request timeout. */
  @VisibleForTesting
  RequestClient shortTimeoutClient() {
    return new LoadHttpClient(
        properties.getBaseUrl(),
        properties.getConnectTimeout(),
        properties.getTimeout().getRequestTimeout(),
        properties.getHeaders());
  }
}
