/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** Outcome of one evaluation. A failed result lists every partition that did not complete. */
@Getter
@ToString
public class ExecutionResult {

  private final String planId;
  private final Path output;
  private final long rowsWritten;
  private final ImmutableList<FailedPartition> failures;

  public ExecutionResult(
      String planId, Path output, long rowsWritten, List<FailedPartition> failures) {
    this.planId = planId;
    this.output = output;
    this.rowsWritten = rowsWritten;
    this.failures = ImmutableList.copyOf(failures);
  }

  public static ExecutionResult success(String planId, Path output, long rowsWritten) {
    return new ExecutionResult(planId, output, rowsWritten, List.of());
  }

  public boolean isSuccess() {
    return failures.isEmpty();
  }
}
