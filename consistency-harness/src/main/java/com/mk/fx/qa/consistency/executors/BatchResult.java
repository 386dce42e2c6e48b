package com.mk.fx.qa.consistency.executors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one {@link BatchExecutor} run.
 *
 * @param completed results of the tasks that returned normally, in submission order
 * @param failed tasks that threw
 * @param abandoned tasks still running, or never started, when the deadline passed
 */
public record BatchResult<T>(List<T> completed, int failed, int abandoned) {

  public BatchResult {
    completed = Collections.unmodifiableList(new ArrayList<>(completed));
  }

  public int submitted() {
    return completed.size() + failed + abandoned;
  }
}
