package com.mk.fx.qa.consistency.scenario;

import com.mk.fx.qa.consistency.executors.BatchExecutor;
import com.mk.fx.qa.consistency.executors.BatchResult;
import com.mk.fx.qa.consistency.metrics.LatencySummary;
import com.mk.fx.qa.consistency.metrics.OutcomeTracker;
import com.mk.fx.qa.consistency.metrics.StatsAggregator;
import com.mk.fx.qa.consistency.model.ProbeState;
import com.mk.fx.qa.consistency.model.ScenarioType;
import com.mk.fx.qa.consistency.model.TargetEndpoints;
import com.mk.fx.qa.consistency.probe.ConsistencyProbe;
import com.mk.fx.qa.consistency.probe.ConsistencyResult;
import com.mk.fx.qa.consistency.probe.ProbeSettings;
import com.mk.fx.qa.consistency.producer.EventProducer;
import com.mk.fx.qa.consistency.producer.ProducerConfig;
import com.mk.fx.qa.consistency.rest.Request;
import com.mk.fx.qa.consistency.rest.RequestClient;
import com.mk.fx.qa.consistency.rest.RequestTimeoutException;
import com.mk.fx.qa.consistency.rest.RestResponseData;
import com.mk.fx.qa.consistency.rest.TransportException;
import com.mk.fx.qa.consistency.utils.LoadUtils;
import com.mk.fx.qa.consistency.utils.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Orchestrates the harness scenarios against one system under test.
 *
 * <p>Concurrent scenarios fan out through {@link BatchExecutor}: a unit that throws is excluded
 * and the batch carries on, and units still pending at the batch deadline are abandoned. Every
 * scenario returns a report with an explicit {@code passed} flag; a missed threshold is logged
 * at WARN and never thrown. Only invalid arguments raise, before any request is sent.
 */
@Slf4j
public class ScenarioRunner {

  private static final int CREATED = 201;
  private static final int OK = 200;

  private final RequestClient client;
  private final TargetEndpoints target;
  private final int maxConcurrency;
  private final Duration batchDeadline;
  private final Sleeper sleeper;

  public ScenarioRunner(
      RequestClient client, TargetEndpoints target, int maxConcurrency, Duration batchDeadline) {
    this(client, target, maxConcurrency, batchDeadline, Sleeper.SYSTEM);
  }

  /**
   * @param maxConcurrency worker cap for concurrent scenarios; {@code <= 0} runs one worker per unit
   * @param batchDeadline wall-clock bound for each concurrent batch
   * @param sleeper used for idle waits, request spacing and probe polling
   */
  public ScenarioRunner(
      RequestClient client,
      TargetEndpoints target,
      int maxConcurrency,
      Duration batchDeadline,
      Sleeper sleeper) {
    this.client = Objects.requireNonNull(client, "client");
    this.target = Objects.requireNonNull(target, "target");
    this.batchDeadline = Objects.requireNonNull(batchDeadline, "batchDeadline");
    if (batchDeadline.isZero() || batchDeadline.isNegative()) {
      throw new IllegalArgumentException("batchDeadline must be positive");
    }
    this.maxConcurrency = maxConcurrency;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Fires {@code requests} writes at once with no pacing and classifies the responses.
   *
   * @param maxServerErrors the scenario passes while 5xx responses stay below this
   */
  public BurstReport backpressureBurst(int requests, int maxServerErrors)
      throws InterruptedException {
    requirePositive(requests, "requests");
    var batch =
        BatchExecutor.execute(
            "burst",
            nCopies(requests, () -> timedCall(target.writeRequest(null, null))),
            maxConcurrency,
            batchDeadline);

    var tracker = new OutcomeTracker();
    List<Double> latencies = new ArrayList<>();
    for (var outcome : batch.completed()) {
      if (outcome.failure() != null) {
        tracker.recordTransportFailure(outcome.failure());
      } else {
        tracker.recordStatus(outcome.status());
        latencies.add(outcome.latencyMs());
      }
    }

    var passed = tracker.serverErrors() < maxServerErrors;
    var report =
        new BurstReport(
            ScenarioType.BACKPRESSURE_BURST,
            requests,
            tracker.success(),
            tracker.rateLimited(),
            tracker.clientErrors(),
            tracker.serverErrors(),
            tracker.transportFailures(),
            batch.abandoned(),
            tracker.statusDistribution(),
            tracker.transportBreakdown(),
            StatsAggregator.summarize(latencies).orElse(null),
            maxServerErrors,
            passed);
    logOutcome(
        report,
        "successful={}, rateLimited={}, serverErrors={}, transportFailures={}",
        report.successful(),
        report.rateLimited(),
        report.serverErrors(),
        report.transportFailures());
    return report;
  }

  /**
   * Issues sequential reads through a client configured with a very short request timeout and
   * checks that timeouts surface as their own outcome.
   */
  public TimeoutReport timeoutHandling(
      RequestClient shortTimeoutClient, Duration requestTimeout, int requests) {
    Objects.requireNonNull(shortTimeoutClient, "shortTimeoutClient");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    requirePositive(requests, "requests");

    var timeouts = 0;
    var successes = 0;
    var otherErrors = 0;
    for (int i = 0; i < requests; i++) {
      try {
        shortTimeoutClient.execute(target.listRequest());
        successes++;
      } catch (RequestTimeoutException e) {
        timeouts++;
      } catch (TransportException e) {
        otherErrors++;
        log.debug("Timeout scenario request {} failed: {}", i + 1, e.getMessage());
      }
    }

    var report =
        new TimeoutReport(
            ScenarioType.TIMEOUT_HANDLING,
            requests,
            requestTimeout.toMillis(),
            timeouts,
            successes,
            otherErrors,
            timeouts > 0);
    logOutcome(
        report, "timeouts={}, successes={}, otherErrors={}", timeouts, successes, otherErrors);
    return report;
  }

  /** Sequential spaced reads; passes when the share of 200 responses reaches the minimum. */
  public ResilienceReport retryResilience(RequestPacing pacing, double minSuccessRate)
      throws InterruptedException {
    Objects.requireNonNull(pacing, "pacing");
    var tracker = new OutcomeTracker();
    long ok = 0;
    for (int i = 0; i < pacing.requests(); i++) {
      var outcome = timedCall(target.listRequest());
      if (outcome.failure() != null) {
        tracker.recordTransportFailure(outcome.failure());
      } else {
        tracker.recordStatus(outcome.status());
        if (outcome.status() == OK) ok++;
      }
      sleeper.sleep(pacing.spacing());
    }

    var successRate = (double) ok / pacing.requests();
    var report =
        new ResilienceReport(
            ScenarioType.RETRY_RESILIENCE,
            pacing.requests(),
            ok,
            successRate,
            minSuccessRate,
            tracker.statusDistribution(),
            tracker.transportBreakdown(),
            successRate >= minSuccessRate);
    logOutcome(report, "successRate={}", String.format("%.1f%%", successRate * 100));
    return report;
  }

  /**
   * Repeats one logical write with a settled idempotency token, one request at a time. Passes only
   * when every write succeeded and at most one resource identifier came back.
   */
  public IdempotencyReport idempotentSequential(RequestPacing pacing)
      throws InterruptedException {
    Objects.requireNonNull(pacing, "pacing");
    var idempotencyKey = UUID.randomUUID().toString();
    List<ResponseOutcome> outcomes = new ArrayList<>();
    for (int i = 0; i < pacing.requests(); i++) {
      var outcome = timedCall(target.writeRequest(null, idempotencyKey));
      log.debug("Idempotent write attempt {}: status {}", i + 1, outcome.status());
      outcomes.add(outcome);
      sleeper.sleep(pacing.spacing());
    }

    var successful = countAccepted(outcomes);
    var ids = distinctIds(outcomes);
    var duplicates = ids.size() > 1;
    String note = null;
    if (successful < pacing.requests()) {
      note = "Some requests failed";
    } else if (duplicates) {
      note = "Sequential duplicates created " + ids.size() + " resources";
    } else if (ids.isEmpty()) {
      note = "No resource identifiers returned";
    }
    var report =
        new IdempotencyReport(
            ScenarioType.IDEMPOTENT_SEQUENTIAL,
            idempotencyKey,
            pacing.requests(),
            successful,
            pacing.requests() - successful,
            ids,
            duplicates,
            note,
            successful == pacing.requests() && !duplicates);
    logOutcome(report, "successful={}, distinctIds={}", successful, ids.size());
    return report;
  }

  /**
   * Fires the same logical write concurrently with one idempotency token. Duplicate resources are
   * flagged in the report and logged, but only a run with no accepted write fails.
   */
  public IdempotencyReport idempotentConcurrent(int requests) throws InterruptedException {
    requirePositive(requests, "requests");
    var idempotencyKey = UUID.randomUUID().toString();
    var batch =
        BatchExecutor.execute(
            "idempotent",
            nCopies(requests, () -> timedCall(target.writeRequest(null, idempotencyKey))),
            maxConcurrency,
            batchDeadline);

    var successful = countAccepted(batch.completed());
    var ids = distinctIds(batch.completed());
    var duplicates = ids.size() > 1;
    if (duplicates) {
      log.warn(
          "Idempotency key {} produced {} distinct resources {}",
          idempotencyKey,
          ids.size(),
          ids);
    }
    var report =
        new IdempotencyReport(
            ScenarioType.IDEMPOTENT_CONCURRENT,
            idempotencyKey,
            requests,
            successful,
            requests - successful,
            ids,
            duplicates,
            duplicates ? "Multiple resources created; idempotency not enforced" : null,
            successful > 0);
    logOutcome(report, "successful={}, distinctIds={}", successful, ids.size());
    return report;
  }

  /** Sequential writes without a token; each created resource must get its own identifier. */
  public IdempotencyReport uniqueRequests(int requests) {
    requirePositive(requests, "requests");
    var created = 0;
    var successful = 0;
    var ids = new LinkedHashSet<String>();
    for (int i = 0; i < requests; i++) {
      var outcome = timedCall(target.writeRequest(null, null));
      if (outcome.accepted()) successful++;
      if (outcome.status() == CREATED) {
        created++;
        outcome.response().flatMap(target::extractId).ifPresent(ids::add);
      }
    }

    var passed = ids.size() == created;
    var report =
        new IdempotencyReport(
            ScenarioType.UNIQUE_REQUESTS,
            null,
            requests,
            successful,
            requests - successful,
            List.copyOf(ids),
            !passed,
            passed ? null : created + " created responses carried " + ids.size() + " distinct ids",
            passed);
    logOutcome(report, "created={}, distinctIds={}", created, ids.size());
    return report;
  }

  /**
   * Waits for the system to idle, then fires a concurrent burst of reads and summarises the
   * latency of the 200 responses.
   */
  public LatencyReport coldStart(Duration idle, int burst, double maxP99LatencyMs)
      throws InterruptedException {
    Objects.requireNonNull(idle, "idle");
    requirePositive(burst, "burst");
    log.info("Cold start scenario idling for {} before a burst of {}", idle, burst);
    sleeper.sleep(idle);

    var startNanos = System.nanoTime();
    var batch =
        BatchExecutor.execute(
            "cold-start",
            nCopies(burst, () -> timedCall(target.listRequest())),
            maxConcurrency,
            batchDeadline);
    var totalDurationMs = LoadUtils.elapsedMillis(startNanos);

    var latencies =
        batch.completed().stream()
            .filter(outcome -> outcome.status() == OK)
            .map(ResponseOutcome::latencyMs)
            .toList();
    return latencyReport(
        ScenarioType.COLD_START, burst, latencies, maxP99LatencyMs, totalDurationMs);
  }

  /** Warms the system with spaced reads, then measures spaced reads. */
  public LatencyReport warmLatency(
      RequestPacing warmUp, RequestPacing measured, double maxP99LatencyMs)
      throws InterruptedException {
    Objects.requireNonNull(warmUp, "warmUp");
    Objects.requireNonNull(measured, "measured");
    for (int i = 0; i < warmUp.requests(); i++) {
      var outcome = timedCall(target.listRequest());
      if (outcome.failure() != null) {
        log.debug("Warm-up request {} failed: {}", i + 1, outcome.failure().getMessage());
      }
      sleeper.sleep(warmUp.spacing());
    }

    var startNanos = System.nanoTime();
    List<Double> latencies = new ArrayList<>();
    for (int i = 0; i < measured.requests(); i++) {
      var outcome = timedCall(target.listRequest());
      if (outcome.status() == OK) {
        latencies.add(outcome.latencyMs());
      }
      sleeper.sleep(measured.spacing());
    }
    return latencyReport(
        ScenarioType.WARM_LATENCY,
        measured.requests(),
        latencies,
        maxP99LatencyMs,
        LoadUtils.elapsedMillis(startNanos));
  }

  /**
   * Runs {@code probes} consistency probes concurrently and checks that the share within the SLO
   * reaches {@code thresholdPercentage}.
   */
  public ConsistencyReport consistencySlo(
      ProbeSettings settings, int probes, double thresholdPercentage)
      throws InterruptedException {
    var batch = runProbes("consistency", settings, probes);
    var stats = StatsAggregator.aggregate(batch.completed());
    var passed = stats.sloPercentage() >= thresholdPercentage;
    var report =
        new ConsistencyReport(
            ScenarioType.CONSISTENCY_SLO,
            probes,
            settings.sloSeconds(),
            thresholdPercentage,
            stats,
            batch.failed(),
            batch.abandoned(),
            passed);
    logOutcome(
        report,
        "consistent={}/{}, withinSlo={}, sloPercentage={}%",
        stats.consistentCount(),
        stats.total(),
        stats.withinSloCount(),
        String.format("%.1f", stats.sloPercentage()));
    return report;
  }

  /** Runs probes and checks the p99 of write acknowledgement latency. */
  public WriteLatencyReport writeLatency(ProbeSettings settings, int probes, double maxP99LatencyMs)
      throws InterruptedException {
    var batch = runProbes("write-latency", settings, probes);
    var writeLatencies =
        batch.completed().stream()
            .filter(result -> result.state() != ProbeState.WRITE_FAILED)
            .map(ConsistencyResult::writeLatencyMs)
            .toList();
    var summary = StatsAggregator.summarize(writeLatencies);
    var passed = summary.map(s -> s.p99LatencyMs() < maxP99LatencyMs).orElse(false);
    var report =
        new WriteLatencyReport(
            ScenarioType.WRITE_LATENCY,
            probes,
            writeLatencies.size(),
            summary.orElse(null),
            maxP99LatencyMs,
            summary.isPresent() ? null : "No writes were accepted",
            passed);
    logOutcome(
        report,
        "writesAccepted={}, p99={}",
        writeLatencies.size(),
        summary.map(LatencySummary::p99LatencyMs).orElse(null));
    return report;
  }

  /** Runs one event production pass; passes when the sink accepted every event. */
  public ProductionReport eventProduction(EventProducer producer, ProducerConfig config)
      throws InterruptedException {
    Objects.requireNonNull(producer, "producer");
    var production = producer.run(config);
    var report =
        new ProductionReport(ScenarioType.EVENT_PRODUCTION, production, production.errors() == 0);
    logOutcome(
        report, "published={}, errors={}", production.totalEvents(), production.errors());
    return report;
  }

  private BatchResult<ConsistencyResult> runProbes(
      String batchName, ProbeSettings settings, int probes) throws InterruptedException {
    Objects.requireNonNull(settings, "settings");
    requirePositive(probes, "probes");
    var probe = new ConsistencyProbe(client, target, settings, sleeper);
    return BatchExecutor.execute(
        batchName, nCopies(probes, probe::run), maxConcurrency, batchDeadline);
  }

  private LatencyReport latencyReport(
      ScenarioType scenario,
      int requests,
      List<Double> latencies,
      double maxP99LatencyMs,
      double totalDurationMs) {
    var summary = StatsAggregator.summarize(latencies);
    var passed = summary.map(s -> s.p99LatencyMs() < maxP99LatencyMs).orElse(false);
    var report =
        new LatencyReport(
            scenario,
            requests,
            latencies.size(),
            summary.orElse(null),
            maxP99LatencyMs,
            totalDurationMs,
            summary.isPresent() ? null : "No successful responses",
            passed);
    logOutcome(
        report,
        "successful={}/{}, p50={}, p99={}",
        latencies.size(),
        requests,
        summary.map(LatencySummary::p50LatencyMs).orElse(null),
        summary.map(LatencySummary::p99LatencyMs).orElse(null));
    return report;
  }

  private ResponseOutcome timedCall(Request request) {
    var startNanos = System.nanoTime();
    try {
      var response = client.execute(request);
      return new ResponseOutcome(
          response.getStatusCode(), LoadUtils.elapsedMillis(startNanos), response, null);
    } catch (TransportException e) {
      return new ResponseOutcome(
          OutcomeTracker.NO_RESPONSE, LoadUtils.elapsedMillis(startNanos), null, e);
    }
  }

  private int countAccepted(List<ResponseOutcome> outcomes) {
    return (int) outcomes.stream().filter(ResponseOutcome::accepted).count();
  }

  private List<String> distinctIds(List<ResponseOutcome> outcomes) {
    var ids = new LinkedHashSet<String>();
    for (var outcome : outcomes) {
      if (outcome.accepted()) {
        outcome.response().flatMap(target::extractId).ifPresent(ids::add);
      }
    }
    return List.copyOf(ids);
  }

  private static <T> List<Callable<T>> nCopies(int count, Callable<T> task) {
    return IntStream.range(0, count).mapToObj(i -> task).toList();
  }

  private static void requirePositive(int value, String name) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be > 0, was " + value);
    }
  }

  private static void logOutcome(ScenarioReport report, String details, Object... args) {
    var message = "Scenario {} {}: " + details;
    var fullArgs = new Object[args.length + 2];
    fullArgs[0] = report.scenario().reportName();
    fullArgs[1] = report.passed() ? "passed" : "FAILED";
    System.arraycopy(args, 0, fullArgs, 2, args.length);
    if (report.passed()) {
      log.info(message, fullArgs);
    } else {
      log.warn(message, fullArgs);
    }
  }

  /** One request's outcome: a status and response, or the transport failure that replaced them. */
  private record ResponseOutcome(
      int status, double latencyMs, RestResponseData responseData, TransportException failure) {

    boolean accepted() {
      return status == OK || status == CREATED;
    }

    Optional<RestResponseData> response() {
      return Optional.ofNullable(responseData);
    }
  }
}
