package com.mk.fx.qa.consistency.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a batch of independent tasks on a bounded pool and collects their results.
 *
 * <p>Threading: creates a fixed pool per batch, sized to {@code maxConcurrency} or to the batch
 * when the cap is not positive. The pool is torn down before returning, whatever the outcome.
 * Tasks that throw are counted as failed, tasks cut off by the deadline as abandoned; neither
 * contributes a result.
 */
@Slf4j
public final class BatchExecutor {

  private BatchExecutor() {
    throw new UnsupportedOperationException("BatchExecutor cannot be instantiated");
  }

  /**
   * Runs all tasks and waits for them up to {@code deadline}.
   *
   * @param batchName label used for thread names and logs
   * @param tasks tasks to run
   * @param maxConcurrency pool size cap; {@code <= 0} runs every task at once
   * @param deadline overall wait bound for the batch
   * @return completed results plus failure and abandonment counts
   * @throws InterruptedException if interrupted while waiting for the batch
   */
  public static <T> BatchResult<T> execute(
      String batchName, List<? extends Callable<T>> tasks, int maxConcurrency, Duration deadline)
      throws InterruptedException {
    Objects.requireNonNull(batchName, "batchName");
    Objects.requireNonNull(tasks, "tasks");
    Objects.requireNonNull(deadline, "deadline");
    if (tasks.isEmpty()) {
      return new BatchResult<>(List.of(), 0, 0);
    }

    var poolSize = maxConcurrency > 0 ? Math.min(maxConcurrency, tasks.size()) : tasks.size();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("batch-" + batchName + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    log.info(
        "Batch {} starting {} tasks with concurrency {} (deadline {})",
        batchName,
        tasks.size(),
        poolSize,
        deadline);

    var executor = newFixedThreadPool(poolSize, threadFactory);
    List<T> completed = new ArrayList<>();
    var failed = 0;
    var abandoned = 0;
    try {
      var futures = executor.invokeAll(tasks, deadline.toNanos(), TimeUnit.NANOSECONDS);
      for (var future : futures) {
        try {
          completed.add(future.get());
        } catch (CancellationException cancelled) {
          abandoned++;
        } catch (ExecutionException failure) {
          failed++;
          log.warn("Batch {} task failed: {}", batchName, rootMessage(failure));
        }
      }
    } finally {
      executor.shutdownNow();
      try {
        executor.awaitTermination(30, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw interrupted;
      }
    }

    if (abandoned > 0) {
      log.warn("Batch {} abandoned {} tasks after deadline {}", batchName, abandoned, deadline);
    }
    log.info(
        "Batch {} finished: completed={}, failed={}, abandoned={}",
        batchName,
        completed.size(),
        failed,
        abandoned);
    return new BatchResult<>(completed, failed, abandoned);
  }

  private static String rootMessage(ExecutionException failure) {
    var cause = failure.getCause() != null ? failure.getCause() : failure;
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }
}
