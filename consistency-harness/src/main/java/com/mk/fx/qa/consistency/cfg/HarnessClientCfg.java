package com.mk.fx.qa.consistency.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.consistency.model.TargetEndpoints;
import com.mk.fx.qa.consistency.probe.ConsistencyPredicate;
import com.mk.fx.qa.consistency.probe.ProbeSettings;
import com.mk.fx.qa.consistency.producer.EventProducer;
import com.mk.fx.qa.consistency.producer.HttpEventSink;
import com.mk.fx.qa.consistency.producer.PayloadTemplate;
import com.mk.fx.qa.consistency.report.ReportWriter;
import com.mk.fx.qa.consistency.rest.LoadHttpClient;
import com.mk.fx.qa.consistency.rest.RequestClient;
import com.mk.fx.qa.consistency.scenario.ScenarioRunner;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the engine against the configured system under test. */
@Configuration
public class HarnessClientCfg {

  @Bean
  public RequestClient requestClient(HarnessProperties properties) {
    return new LoadHttpClient(
        properties.getBaseUrl(),
        properties.getConnectTimeout(),
        properties.getRequestTimeout(),
        properties.getHeaders());
  }

  @Bean
  public TargetEndpoints targetEndpoints(HarnessProperties properties) {
    var target = properties.getTarget();
    return new TargetEndpoints(
        target.getWritePath(),
        target.getReadPath(),
        target.getListPath(),
        target.getListQuery(),
        target.getWriteBody(),
        target.getCorrelationField(),
        target.getIdPointer(),
        target.getIdempotencyHeader());
  }

  @Bean
  public ProbeSettings probeSettings(HarnessProperties properties) {
    var consistency = properties.getConsistency();
    return new ProbeSettings(
        consistency.getSloSeconds(),
        consistency.getPollInterval(),
        ConsistencyPredicate.fieldPopulated(properties.getTarget().getConsistencyPointer()));
  }

  @Bean
  public ScenarioRunner scenarioRunner(
      RequestClient requestClient, TargetEndpoints targetEndpoints, HarnessProperties properties) {
    return new ScenarioRunner(
        requestClient,
        targetEndpoints,
        properties.getBatch().getMaxConcurrency(),
        properties.getBatch().getDeadline());
  }

  @Bean
  public EventProducer eventProducer(RequestClient requestClient, HarnessProperties properties) {
    var producer = properties.getProducer();
    return new EventProducer(
        new HttpEventSink(requestClient, producer.getIngestPath(), producer.getSource()),
        new PayloadTemplate(producer.getPayloadTemplate()));
  }

  @Bean
  public ReportWriter reportWriter(ObjectMapper objectMapper, HarnessProperties properties) {
    return new ReportWriter(objectMapper, Path.of(properties.getReportsDirectory()));
  }
}
