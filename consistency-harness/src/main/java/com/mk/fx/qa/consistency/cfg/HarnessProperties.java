package com.mk.fx.qa.consistency.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Harness settings bound from {@code harness.*}. Defaults mirror the calibration runs. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "harness")
public class HarnessProperties {

  /** Base URL of the system under test. */
  @NotBlank private String baseUrl = "http://localhost:8000";

  @NotNull private Duration connectTimeout = Duration.ofSeconds(10);

  @NotNull private Duration requestTimeout = Duration.ofSeconds(30);

  /** Headers sent with every request. */
  private Map<String, String> headers = new LinkedHashMap<>();

  /** Directory receiving {@code <scenario>_report.json} files. */
  @NotBlank private String reportsDirectory = "reports";

  /** Scenarios run once when the application starts, in order. */
  private List<String> runOnStartup = new ArrayList<>();

  @Valid private Batch batch = new Batch();
  @Valid private Target target = new Target();
  @Valid private Consistency consistency = new Consistency();
  @Valid private WriteLatency writeLatency = new WriteLatency();
  @Valid private Burst burst = new Burst();
  @Valid private Timeout timeout = new Timeout();
  @Valid private Resilience resilience = new Resilience();
  @Valid private Idempotency idempotency = new Idempotency();
  @Valid private ColdStart coldStart = new ColdStart();
  @Valid private Warm warm = new Warm();
  @Valid private Producer producer = new Producer();

  @Data
  public static class Batch {
    /** Worker cap for concurrent scenarios; 0 runs one worker per unit. */
    @PositiveOrZero private int maxConcurrency = 0;

    @NotNull private Duration deadline = Duration.ofMinutes(5);
  }

  @Data
  public static class Target {
    @NotBlank private String writePath = "/v1/placements";

    /** Read path; {@code {id}} is replaced by the created resource's identifier. */
    @NotBlank private String readPath = "/v1/placements/{id}";

    @NotBlank private String listPath = "/v1/placements";

    private Map<String, String> listQuery = new LinkedHashMap<>(Map.of("limit", "1"));

    private Map<String, Object> writeBody = new LinkedHashMap<>();

    private String correlationField = "_correlation_id";

    @NotBlank private String idPointer = "/data/id";

    /** Field populated once asynchronous processing of a write has finished. */
    @NotBlank private String consistencyPointer = "/data/file_url";

    @NotBlank private String idempotencyHeader = "Idempotency-Key";
  }

  @Data
  public static class Consistency {
    @DecimalMin(value = "0", inclusive = false)
    private double sloSeconds = 5.0;

    @NotNull private Duration pollInterval = Duration.ofMillis(100);

    @Positive private int probes = 50;

    @DecimalMin("0")
    @DecimalMax("100")
    private double thresholdPercentage = 95.0;
  }

  @Data
  public static class WriteLatency {
    @Positive private int probes = 20;

    @Positive private double maxP99LatencyMs = 500;
  }

  @Data
  public static class Burst {
    @Positive private int requests = 100;

    @Min(1)
    private int maxServerErrors = 10;
  }

  @Data
  public static class Timeout {
    @NotNull private Duration requestTimeout = Duration.ofMillis(1);

    @Positive private int requests = 10;
  }

  @Data
  public static class Resilience {
    @Positive private int requests = 20;

    @NotNull private Duration spacing = Duration.ofMillis(100);

    @DecimalMin("0")
    @DecimalMax("1")
    private double minSuccessRate = 0.9;
  }

  @Data
  public static class Idempotency {
    @Positive private int sequentialRequests = 5;

    @NotNull private Duration spacing = Duration.ofMillis(100);

    @Positive private int concurrentRequests = 10;

    @Positive private int uniqueRequests = 5;
  }

  @Data
  public static class ColdStart {
    @NotNull private Duration idle = Duration.ofSeconds(30);

    @Positive private int burst = 20;

    @Positive private double maxP99LatencyMs = 3000;
  }

  @Data
  public static class Warm {
    @Positive private int warmUpRequests = 10;

    @NotNull private Duration warmUpSpacing = Duration.ofMillis(100);

    @Positive private int measuredRequests = 50;

    @NotNull private Duration measuredSpacing = Duration.ofMillis(50);

    @Positive private double maxP99LatencyMs = 500;
  }

  @Data
  public static class Producer {
    @Positive private int eventsPerSecond = 100;

    @Positive private int durationSeconds = 300;

    @PositiveOrZero private int rampUpSeconds = 60;

    @NotBlank private String eventType = "placement.created";

    @NotBlank private String sinkIdentifier = "nedlia-events";

    @NotBlank private String ingestPath = "/v1/events";

    @NotBlank private String source = "nedlia.perf-test";

    /** Payload template; {@code {{uuid}}} values become fresh UUIDs per event. */
    private Map<String, Object> payloadTemplate = new LinkedHashMap<>();
  }
}
