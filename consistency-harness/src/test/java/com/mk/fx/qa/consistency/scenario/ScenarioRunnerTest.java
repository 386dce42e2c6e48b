package com.mk.fx.qa.consistency.scenario;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.consistency.model.ScenarioType;
import com.mk.fx.qa.consistency.model.TargetEndpoints;
import com.mk.fx.qa.consistency.probe.ConsistencyPredicate;
import com.mk.fx.qa.consistency.probe.ProbeSettings;
import com.mk.fx.qa.consistency.producer.EventProducer;
import com.mk.fx.qa.consistency.producer.ProducerConfig;
import com.mk.fx.qa.consistency.rest.HttpMethod;
import com.mk.fx.qa.consistency.rest.RequestClient;
import com.mk.fx.qa.consistency.rest.RequestTimeoutException;
import com.mk.fx.qa.consistency.rest.RestResponseData;
import com.mk.fx.qa.consistency.rest.TransportException;
import com.mk.fx.qa.consistency.utils.Sleeper;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ScenarioRunnerTest {

  private static final TargetEndpoints TARGET =
      new TargetEndpoints(
          "/v1/placements",
          "/v1/placements/{id}",
          "/v1/placements",
          Map.of("limit", "1"),
          Map.of("video_id", "v-1"),
          "_correlation_id",
          "/data/id",
          "Idempotency-Key");
  private static final Sleeper NO_SLEEP = duration -> {};
  private static final ProbeSettings SETTINGS =
      new ProbeSettings(
          5.0, Duration.ofMillis(100), ConsistencyPredicate.fieldPopulated("/data/file_url"));

  private static ScenarioRunner runner(RequestClient client) {
    return new ScenarioRunner(client, TARGET, 8, Duration.ofSeconds(30), NO_SLEEP);
  }

  private static RestResponseData created(String id) {
    return RestResponseData.of(201, "{\"data\":{\"id\":\"" + id + "\"}}", 3);
  }

  private static RestResponseData ready(String id) {
    return RestResponseData.of(
        200, "{\"data\":{\"id\":\"" + id + "\",\"file_url\":\"s3://" + id + "\"}}", 2);
  }

  /** Accepts every write but answers the first {@code rejected} with 500; reads are consistent. */
  private static RequestClient consistentSut(int rejected) {
    var writes = new AtomicInteger();
    return request -> {
      if (request.getMethod() == HttpMethod.POST) {
        return writes.incrementAndGet() <= rejected
            ? RestResponseData.of(500, "", 3)
            : created(UUID.randomUUID().toString());
      }
      var path = request.getPath();
      return ready(path.substring(path.lastIndexOf('/') + 1));
    };
  }

  @Test
  void consistencySlo_fortyEightOfFifty_isNinetySixPercent() throws Exception {
    var atNinetyFive = runner(consistentSut(2)).consistencySlo(SETTINGS, 50, 95.0);
    var atNinetySeven = runner(consistentSut(2)).consistencySlo(SETTINGS, 50, 97.0);

    assertEquals(96.0, atNinetyFive.stats().sloPercentage(), 1e-9);
    assertEquals(50, atNinetyFive.stats().total());
    assertEquals(48, atNinetyFive.stats().consistentCount());
    assertEquals(48, atNinetyFive.stats().withinSloCount());
    assertTrue(atNinetyFive.passed());
    assertEquals(ScenarioType.CONSISTENCY_SLO, atNinetyFive.scenario());

    assertEquals(96.0, atNinetySeven.stats().sloPercentage(), 1e-9);
    assertFalse(atNinetySeven.passed());
  }

  @Test
  void consistencySlo_batchDeadline_abandonsHungProbes_andStillReports() throws Exception {
    var writes = new AtomicInteger();
    RequestClient client =
        request -> {
          if (request.getMethod() == HttpMethod.POST && writes.incrementAndGet() <= 2) {
            try {
              TimeUnit.SECONDS.sleep(30);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              throw new TransportException("interrupted", e);
            }
          }
          return request.getMethod() == HttpMethod.POST ? created("p") : ready("p");
        };
    var runner = new ScenarioRunner(client, TARGET, 0, Duration.ofMillis(500), NO_SLEEP);

    var report = runner.consistencySlo(SETTINGS, 6, 95.0);

    assertEquals(2, report.abandoned());
    assertEquals(4, report.stats().total());
    assertEquals(100.0, report.stats().sloPercentage());
    assertTrue(report.passed());
  }

  @Test
  void idempotentConcurrent_correctSut_yieldsExactlyOneIdentifier() throws Exception {
    Map<String, String> byKey = new ConcurrentHashMap<>();
    RequestClient client =
        request -> {
          var key = request.getHeaders().get("Idempotency-Key");
          var fresh = new AtomicInteger();
          var id =
              byKey.computeIfAbsent(
                  key,
                  k -> {
                    fresh.incrementAndGet();
                    return UUID.randomUUID().toString();
                  });
          return fresh.get() > 0 ? created(id) : RestResponseData.of(200, ready(id).getBody(), 1);
        };

    var report = runner(client).idempotentConcurrent(10);

    assertEquals(10, report.successful());
    assertEquals(1, report.distinctIds());
    assertFalse(report.duplicateResourcesDetected());
    assertNull(report.note());
    assertTrue(report.passed());
    assertEquals(1, byKey.size());
  }

  @Test
  void idempotentConcurrent_duplicatingSut_isFlaggedButNotFailed() throws Exception {
    RequestClient client = request -> created(UUID.randomUUID().toString());

    var report = runner(client).idempotentConcurrent(10);

    assertEquals(10, report.distinctIds());
    assertTrue(report.duplicateResourcesDetected());
    assertNotNull(report.note());
    assertTrue(report.passed());
  }

  @Test
  void idempotentSequential_duplicatesAreAHardFailure() throws Exception {
    RequestClient duplicating = request -> created(UUID.randomUUID().toString());
    RequestClient correct = request -> created("p-1");

    var failing = runner(duplicating).idempotentSequential(new RequestPacing(5, Duration.ZERO));
    var passing = runner(correct).idempotentSequential(new RequestPacing(5, Duration.ZERO));

    assertFalse(failing.passed());
    assertTrue(failing.duplicateResourcesDetected());
    assertEquals(5, failing.distinctIds());
    assertTrue(passing.passed());
    assertEquals(1, passing.distinctIds());
    assertEquals(5, passing.successful());
  }

  @Test
  void idempotentSequential_failedRequest_failsScenario() throws Exception {
    var calls = new AtomicInteger();
    RequestClient client =
        request -> calls.incrementAndGet() == 3 ? RestResponseData.of(503, "", 1) : created("p-1");

    var report = runner(client).idempotentSequential(new RequestPacing(5, Duration.ZERO));

    assertFalse(report.passed());
    assertEquals(4, report.successful());
    assertEquals(1, report.failed());
  }

  @Test
  void uniqueRequests_distinctIdsMustMatchCreated() {
    var unique = runner(request -> created(UUID.randomUUID().toString())).uniqueRequests(5);
    var collapsed = runner(request -> created("same")).uniqueRequests(5);

    assertTrue(unique.passed());
    assertEquals(5, unique.distinctIds());
    assertNull(unique.idempotencyKey());
    assertFalse(collapsed.passed());
    assertEquals(1, collapsed.distinctIds());
  }

  @Test
  void backpressureBurst_classifiesResponses_andPassesBelowServerErrorThreshold()
      throws Exception {
    var calls = new AtomicInteger();
    RequestClient client =
        request -> {
          int n = calls.incrementAndGet();
          if (n <= 5) throw new TransportException("refused", new ConnectException("refused"));
          if (n <= 10) return RestResponseData.of(503, "", 1);
          if (n <= 40) return RestResponseData.of(429, "", 1);
          return created("p-" + n);
        };

    var report = runner(client).backpressureBurst(100, 10);

    assertEquals(100, report.requests());
    assertEquals(60, report.successful());
    assertEquals(30, report.rateLimited());
    assertEquals(5, report.serverErrors());
    assertEquals(5, report.transportFailures());
    assertEquals(0, report.clientErrors());
    assertEquals(5L, report.statusDistribution().get(0));
    assertEquals(5L, report.transportErrors().get("CONNECTION_REFUSED"));
    assertEquals(95, report.latency().samples());
    assertTrue(report.passed());
  }

  @Test
  void backpressureBurst_tooManyServerErrors_fails() throws Exception {
    var report = runner(request -> RestResponseData.of(500, "", 1)).backpressureBurst(20, 10);

    assertEquals(20, report.serverErrors());
    assertFalse(report.passed());
  }

  @Test
  void timeoutHandling_countsTimeoutsSeparately() {
    var calls = new AtomicInteger();
    RequestClient shortTimeout =
        request -> {
          int n = calls.incrementAndGet();
          if (n == 1) return RestResponseData.of(200, "[]", 0);
          if (n == 2) throw new TransportException("reset", new ConnectException("reset"));
          throw new RequestTimeoutException("timed out", new HttpTimeoutException("timed out"));
        };

    var report =
        runner(request -> RestResponseData.of(200, "", 1))
            .timeoutHandling(shortTimeout, Duration.ofMillis(1), 10);

    assertEquals(8, report.timeouts());
    assertEquals(1, report.successes());
    assertEquals(1, report.otherErrors());
    assertEquals(1, report.requestTimeoutMs());
    assertTrue(report.passed());
  }

  @Test
  void timeoutHandling_noTimeouts_fails() {
    RequestClient fast = request -> RestResponseData.of(200, "[]", 0);
    var report = runner(fast).timeoutHandling(fast, Duration.ofMillis(1), 3);
    assertEquals(0, report.timeouts());
    assertFalse(report.passed());
  }

  @Test
  void retryResilience_successRateAgainstMinimum() throws Exception {
    var calls = new AtomicInteger();
    RequestClient oneFailure =
        request -> RestResponseData.of(calls.incrementAndGet() == 7 ? 502 : 200, "[]", 1);
    var threeFailures = new AtomicInteger();
    RequestClient flaky =
        request ->
            RestResponseData.of(threeFailures.incrementAndGet() % 6 == 0 ? 500 : 200, "[]", 1);

    var passing =
        runner(oneFailure).retryResilience(new RequestPacing(20, Duration.ofMillis(100)), 0.9);
    var failing =
        runner(flaky).retryResilience(new RequestPacing(20, Duration.ofMillis(100)), 0.9);

    assertEquals(0.95, passing.successRate(), 1e-9);
    assertTrue(passing.passed());
    assertEquals(1L, passing.statusDistribution().get(502));
    assertEquals(17, failing.successes());
    assertFalse(failing.passed());
  }

  @Test
  void coldStart_withoutSuccessfulResponses_hasNoDataAndFails() throws Exception {
    var report =
        runner(request -> RestResponseData.of(503, "", 1))
            .coldStart(Duration.ofSeconds(30), 20, 3000);

    assertEquals(0, report.successful());
    assertNull(report.latency());
    assertNotNull(report.note());
    assertFalse(report.passed());
  }

  @Test
  void coldStart_fastResponses_pass() throws Exception {
    var report =
        runner(request -> RestResponseData.of(200, "[]", 1))
            .coldStart(Duration.ofSeconds(30), 20, 3000);

    assertEquals(20, report.successful());
    assertEquals(20, report.latency().samples());
    assertTrue(report.passed());
  }

  @Test
  void warmLatency_slowMeasuredReads_fail() throws Exception {
    RequestClient slow =
        request -> {
          try {
            TimeUnit.MILLISECONDS.sleep(30);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return RestResponseData.of(200, "[]", 30);
        };

    var passing =
        runner(slow)
            .warmLatency(
                new RequestPacing(2, Duration.ofMillis(100)),
                new RequestPacing(5, Duration.ofMillis(50)),
                500);
    var failing =
        runner(slow)
            .warmLatency(
                new RequestPacing(2, Duration.ofMillis(100)),
                new RequestPacing(5, Duration.ofMillis(50)),
                10);

    assertEquals(ScenarioType.WARM_LATENCY, passing.scenario());
    assertEquals(5, passing.successful());
    assertTrue(passing.passed());
    assertFalse(failing.passed());
  }

  @Test
  void writeLatency_summarisesAcceptedWritesOnly() throws Exception {
    var report = runner(consistentSut(3)).writeLatency(SETTINGS, 20, 500);

    assertEquals(20, report.probes());
    assertEquals(17, report.writesAccepted());
    assertEquals(17, report.writeLatency().samples());
    assertTrue(report.passed());
  }

  @Test
  void eventProduction_passesOnlyWithoutErrors() throws Exception {
    var runner = runner(request -> RestResponseData.of(200, "", 1));
    var config = new ProducerConfig(50, 1, 0, "placement.created", "bus");

    var clean = runner.eventProduction(new EventProducer((e, s) -> true, Map::of), config);
    var calls = new AtomicInteger();
    var lossy =
        runner.eventProduction(
            new EventProducer((e, s) -> calls.incrementAndGet() != 10, Map::of), config);

    assertTrue(clean.passed());
    assertEquals(50, clean.production().totalEvents());
    assertFalse(lossy.passed());
    assertEquals(1, lossy.production().errors());
  }

  @Test
  void invalidArguments_failBeforeAnyRequest() {
    var calls = new AtomicInteger();
    var runner =
        runner(
            request -> {
              calls.incrementAndGet();
              return RestResponseData.of(200, "", 1);
            });

    assertThrows(IllegalArgumentException.class, () -> runner.backpressureBurst(0, 10));
    assertThrows(IllegalArgumentException.class, () -> runner.consistencySlo(SETTINGS, 0, 95));
    assertThrows(IllegalArgumentException.class, () -> new RequestPacing(0, Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ScenarioRunner(request -> null, TARGET, 1, Duration.ZERO));
    assertEquals(0, calls.get());
  }
}
