package com.mk.fx.qa.consistency.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.consistency.scenario.ScenarioReport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes scenario reports as pretty-printed JSON files named {@code <scenario>_report.json}. A
 * failed write is logged and reported as an empty result; the report itself is unaffected.
 */
@Slf4j
public class ReportWriter {

  static final String SUFFIX = "_report.json";

  private final ObjectMapper mapper;
  private final Path directory;

  public ReportWriter(ObjectMapper mapper, Path directory) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /**
   * Writes the report, creating the directory when needed.
   *
   * @return the written file, or empty when writing failed
   */
  public Optional<Path> write(ScenarioReport report) {
    Objects.requireNonNull(report, "report");
    var file = directory.resolve(report.scenario().reportName() + SUFFIX);
    try {
      Files.createDirectories(directory);
      mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
      log.info("Report for {} written to {}", report.scenario(), file.toAbsolutePath());
      return Optional.of(file);
    } catch (IOException e) {
      log.error("Failed to write report for {} to {}: {}", report.scenario(), file, e.getMessage());
      return Optional.empty();
    }
  }

  public Path directory() {
    return directory;
  }
}
