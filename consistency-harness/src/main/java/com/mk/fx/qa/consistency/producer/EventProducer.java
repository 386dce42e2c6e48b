package com.mk.fx.qa.consistency.producer;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.consistency.model.SyntheticEvent;
import com.mk.fx.qa.consistency.utils.LoadUtils;
import com.mk.fx.qa.consistency.utils.Sleeper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Emits synthetic events into an {@link EventSink} at a controlled, ramping rate.
 *
 * <p>A single driver loop paces itself with {@link RateScheduler} and sleeps between emissions.
 * The run is count-based: it stops after {@code eventsPerSecond * durationSeconds} attempts, so a
 * slow sink stretches the run and shows up as a lower {@code actualRate}. Failed publishes are
 * counted and dropped; they neither retry nor slow the pace.
 */
@Slf4j
public class EventProducer {

  static final DateTimeFormatter ISO_MILLIS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private static final int PROGRESS_EVERY_SECONDS = 10;

  private final EventSink sink;
  private final Supplier<Map<String, Object>> payloadFactory;
  private final Sleeper sleeper;
  private final Clock clock;

  public EventProducer(EventSink sink, Supplier<Map<String, Object>> payloadFactory) {
    this(sink, payloadFactory, Sleeper.SYSTEM, Clock.systemUTC());
  }

  @VisibleForTesting
  EventProducer(
      EventSink sink, Supplier<Map<String, Object>> payloadFactory, Sleeper sleeper, Clock clock) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.payloadFactory = Objects.requireNonNull(payloadFactory, "payloadFactory");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs one production pass on the calling thread.
   *
   * @param config run parameters
   * @return the production report
   * @throws InterruptedException if the driver is interrupted while pacing
   */
  public ProducerReport run(ProducerConfig config) throws InterruptedException {
    Objects.requireNonNull(config, "config");
    var testRunId = "perf_" + clock.instant().getEpochSecond();
    var totalEvents = config.totalEvents();
    var progressEvery = (long) config.eventsPerSecond() * PROGRESS_EVERY_SECONDS;

    log.info(
        "Run {} starting: rate={}/s, duration={}s, rampUp={}s, totalEvents={}, sink={}",
        testRunId,
        config.eventsPerSecond(),
        config.durationSeconds(),
        config.rampUpSeconds(),
        totalEvents,
        config.sinkIdentifier());

    long published = 0;
    long errors = 0;
    long eventsSent = 0;
    var startNanos = System.nanoTime();

    while (eventsSent < totalEvents) {
      var delay = RateScheduler.nextDelay(LoadUtils.elapsedSeconds(startNanos), config);

      var event = createEvent(testRunId, config.eventType());
      if (publish(event, config.sinkIdentifier())) {
        published++;
      } else {
        errors++;
      }
      eventsSent++;

      sleeper.sleep(delay);

      if (eventsSent % progressEvery == 0) {
        log.info("Run {} sent {}/{} events ({} errors)", testRunId, eventsSent, totalEvents, errors);
      }
    }

    var durationSeconds = Math.max(0.001, LoadUtils.elapsedSeconds(startNanos));
    var report =
        new ProducerReport(
            testRunId,
            published,
            eventsSent,
            config.eventsPerSecond(),
            published / durationSeconds,
            durationSeconds,
            errors);

    log.info(
        "Run {} finished: published={}, errors={}, rate actual/target={}/{}, duration={}s",
        testRunId,
        published,
        errors,
        String.format("%.2f", report.actualRate()),
        config.eventsPerSecond(),
        String.format("%.2f", durationSeconds));
    return report;
  }

  /**
   * Runs one production pass on a dedicated daemon thread. The future completes exceptionally
   * with a {@link CompletionException} if the driver is interrupted.
   */
  public CompletableFuture<ProducerReport> runAsync(ProducerConfig config) {
    Objects.requireNonNull(config, "config");
    ExecutorService driver =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable);
              thread.setName("event-producer-" + config.eventType() + "-" + thread.getId());
              thread.setDaemon(true);
              return thread;
            });
    var future =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return run(config);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
              }
            },
            driver);
    future.whenComplete((report, error) -> driver.shutdown());
    return future;
  }

  private boolean publish(SyntheticEvent event, String sinkIdentifier) {
    try {
      var accepted = sink.publish(event, sinkIdentifier);
      if (!accepted) {
        log.debug("Sink {} rejected event {}", sinkIdentifier, event.id());
      }
      return accepted;
    } catch (RuntimeException ex) {
      log.warn("Error publishing event {} to {}: {}", event.id(), sinkIdentifier, ex.getMessage());
      return false;
    }
  }

  private SyntheticEvent createEvent(String testRunId, String eventType) {
    return new SyntheticEvent(
        UUID.randomUUID().toString(),
        UUID.randomUUID().toString(),
        testRunId,
        System.nanoTime(),
        ISO_MILLIS.format(Instant.now(clock)),
        eventType,
        payloadFactory.get());
  }
}
