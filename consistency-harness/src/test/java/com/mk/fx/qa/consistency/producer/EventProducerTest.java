package com.mk.fx.qa.consistency.producer;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.consistency.model.SyntheticEvent;
import com.mk.fx.qa.consistency.utils.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class EventProducerTest {

  private static final Clock FIXED =
      Clock.fixed(Instant.parse("2024-05-01T10:15:30.123Z"), ZoneOffset.UTC);
  private static final Sleeper NO_SLEEP = duration -> {};

  @Test
  void run_tenPerSecondForTwoSeconds_publishesTwentyEvents() throws Exception {
    List<SyntheticEvent> published = new CopyOnWriteArrayList<>();
    var producer =
        new EventProducer(
            (event, sink) -> published.add(event), () -> Map.of("video_id", "v-1"));

    var report = producer.run(new ProducerConfig(10, 2, 0, "placement.created", "bus"));

    assertEquals(20, report.totalEvents());
    assertEquals(20, report.attempted());
    assertEquals(0, report.errors());
    assertEquals(10, report.targetRate());
    assertTrue(report.durationSeconds() >= 1.9, "duration " + report.durationSeconds());
    assertTrue(report.actualRate() > 0 && report.actualRate() <= 10.5);
    assertTrue(report.testRunId().startsWith("perf_"));
    assertEquals(20, published.size());
    assertEquals(20, new HashSet<>(published.stream().map(SyntheticEvent::id).toList()).size());
  }

  @Test
  void run_alwaysFailingSink_countsEveryAttemptAsError() throws Exception {
    var attempts = new AtomicInteger();
    var producer =
        new EventProducer(
            (event, sink) -> {
              attempts.incrementAndGet();
              return false;
            },
            Map::of,
            NO_SLEEP,
            FIXED);

    var report = producer.run(new ProducerConfig(5, 4, 0, "placement.created", "bus"));

    assertEquals(20, report.errors());
    assertEquals(0, report.totalEvents());
    assertEquals(0.0, report.actualRate());
    assertEquals(20, attempts.get());
  }

  @Test
  void run_throwingSink_isCaughtAndCounted() throws Exception {
    var calls = new AtomicInteger();
    EventSink flaky =
        (event, sink) -> {
          if (calls.incrementAndGet() % 2 == 0) {
            throw new EventPublishException("bus down", new RuntimeException("503"));
          }
          return true;
        };
    var producer = new EventProducer(flaky, Map::of, NO_SLEEP, FIXED);

    var report = producer.run(new ProducerConfig(5, 2, 0, "placement.created", "bus"));

    assertEquals(5, report.totalEvents());
    assertEquals(5, report.errors());
  }

  @Test
  void run_stampsEventsWithRunTypeAndIsoTime() throws Exception {
    List<SyntheticEvent> published = new ArrayList<>();
    List<String> sinks = new ArrayList<>();
    var producer =
        new EventProducer(
            (event, sink) -> {
              published.add(event);
              sinks.add(sink);
              return true;
            },
            () -> Map.of("video_id", "v-1"),
            NO_SLEEP,
            FIXED);

    var report = producer.run(new ProducerConfig(1, 3, 0, "placement.created", "perf-bus"));

    assertEquals("perf_" + FIXED.instant().getEpochSecond(), report.testRunId());
    for (var event : published) {
      assertEquals(report.testRunId(), event.testRunId());
      assertEquals("placement.created", event.type());
      assertEquals("2024-05-01T10:15:30.123Z", event.producedAtIso());
      assertEquals("v-1", event.payload().get("video_id"));
      assertNotEquals(event.id(), event.correlationId());
    }
    assertEquals(List.of("perf-bus", "perf-bus", "perf-bus"), sinks);
  }

  @Test
  void run_rampUp_startsSlowAndSettlesAtTargetDelay() throws Exception {
    List<Duration> delays = new ArrayList<>();
    // the recording sleeper does not advance time, so every delay is taken at elapsed ~0
    var producer =
        new EventProducer((event, sink) -> true, Map::of, delays::add, FIXED);

    producer.run(new ProducerConfig(4, 2, 2, "placement.created", "bus"));

    assertEquals(8, delays.size());
    delays.forEach(delay -> assertEquals(Duration.ofSeconds(1), delay));

    delays.clear();
    producer.run(new ProducerConfig(4, 2, 0, "placement.created", "bus"));
    delays.forEach(delay -> assertEquals(Duration.ofMillis(250), delay));
  }

  @Test
  void runAsync_completesWithReport() throws Exception {
    var producer = new EventProducer((event, sink) -> true, Map::of, NO_SLEEP, FIXED);

    var report =
        producer
            .runAsync(new ProducerConfig(10, 1, 0, "placement.created", "bus"))
            .get(5, TimeUnit.SECONDS);

    assertEquals(10, report.totalEvents());
    assertEquals(0, report.errors());
  }
}
