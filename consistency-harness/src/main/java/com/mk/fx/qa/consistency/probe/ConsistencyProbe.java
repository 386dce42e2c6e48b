package com.mk.fx.qa.consistency.probe;

import com.mk.fx.qa.consistency.model.ProbeState;
import com.mk.fx.qa.consistency.model.TargetEndpoints;
import com.mk.fx.qa.consistency.rest.RequestClient;
import com.mk.fx.qa.consistency.rest.RestResponseData;
import com.mk.fx.qa.consistency.rest.TransportException;
import com.mk.fx.qa.consistency.utils.LoadUtils;
import com.mk.fx.qa.consistency.utils.Sleeper;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Measures the time from a write being issued until a subsequent read shows the write as fully
 * processed.
 *
 * <p>One {@link #run()} issues a create call tagged with a fresh correlation id, then polls the
 * read endpoint every {@link ProbeSettings#pollInterval()} for at most {@link
 * ProbeSettings#maxPolls()} reads. A probe instance holds no per-run state and may be shared by
 * concurrent callers.
 */
@Slf4j
public class ConsistencyProbe {

  private final RequestClient client;
  private final TargetEndpoints target;
  private final ProbeSettings settings;
  private final Sleeper sleeper;

  public ConsistencyProbe(RequestClient client, TargetEndpoints target, ProbeSettings settings) {
    this(client, target, settings, Sleeper.SYSTEM);
  }

  public ConsistencyProbe(
      RequestClient client, TargetEndpoints target, ProbeSettings settings, Sleeper sleeper) {
    this.client = Objects.requireNonNull(client, "client");
    this.target = Objects.requireNonNull(target, "target");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Runs one write-then-poll probe.
   *
   * @return the probe's result; never null
   * @throws InterruptedException if interrupted while waiting between polls
   */
  public ConsistencyResult run() throws InterruptedException {
    var correlationId = UUID.randomUUID().toString();
    var startNanos = System.nanoTime();

    log.debug("Probe {} {}", correlationId, ProbeState.WRITING);
    RestResponseData writeResponse;
    try {
      writeResponse = client.execute(target.writeRequest(correlationId, null));
    } catch (TransportException e) {
      return writeFailed(correlationId, startNanos, e.getMessage());
    }
    var writeLatencyMs = LoadUtils.elapsedMillis(startNanos);

    if (!writeResponse.isSuccessful()) {
      return writeFailed(correlationId, startNanos, "HTTP " + writeResponse.getStatusCode());
    }
    var placementId = target.extractId(writeResponse).orElse(null);
    if (placementId == null) {
      return writeFailed(correlationId, startNanos, "Write response carried no identifier");
    }

    log.debug("Probe {} {} placement {}", correlationId, ProbeState.POLLING, placementId);
    var maxPolls = settings.maxPolls();
    var pollCount = 0;
    while (pollCount < maxPolls) {
      sleeper.sleep(settings.pollInterval());
      pollCount++;
      if (isConsistent(correlationId, placementId)) {
        var latencyMs = LoadUtils.elapsedMillis(startNanos);
        var withinSlo = latencyMs <= settings.sloMillis();
        log.debug(
            "Probe {} {} after {} polls in {} ms (withinSlo={})",
            correlationId,
            ProbeState.CONSISTENT,
            pollCount,
            Math.round(latencyMs),
            withinSlo);
        return new ConsistencyResult(
            correlationId,
            placementId,
            writeLatencyMs,
            latencyMs,
            true,
            withinSlo,
            pollCount,
            ProbeState.CONSISTENT,
            null);
      }
    }

    var latencyMs = LoadUtils.elapsedMillis(startNanos);
    log.debug(
        "Probe {} {} after {} polls ({} ms)",
        correlationId,
        ProbeState.TIMED_OUT,
        pollCount,
        Math.round(latencyMs));
    return new ConsistencyResult(
        correlationId,
        placementId,
        writeLatencyMs,
        latencyMs,
        false,
        false,
        pollCount,
        ProbeState.TIMED_OUT,
        null);
  }

  private boolean isConsistent(String correlationId, String placementId) {
    try {
      return settings.predicate().isConsistent(client.execute(target.readRequest(placementId)));
    } catch (TransportException e) {
      // a failed read counts as a poll; the next one may succeed
      log.debug("Probe {} read failed: {}", correlationId, e.getMessage());
      return false;
    }
  }

  private ConsistencyResult writeFailed(String correlationId, long startNanos, String error) {
    log.debug("Probe {} {}: {}", correlationId, ProbeState.WRITE_FAILED, error);
    return ConsistencyResult.writeFailed(correlationId, LoadUtils.elapsedMillis(startNanos), error);
  }
}
