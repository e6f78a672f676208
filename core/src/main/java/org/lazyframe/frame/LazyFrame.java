/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.frame;

import java.util.List;
import java.util.Map;
import org.lazyframe.executor.ComputeOptions;
import org.lazyframe.executor.ExecutionBackend;
import org.lazyframe.executor.ExecutionPlan;
import org.lazyframe.executor.ExecutionResult;

/** A table whose rows are only produced when it is evaluated. */
public interface LazyFrame {

  /** Output column names in order. */
  List<String> getColNames();

  /**
   * Evaluates the pipeline over the first {@code sampleSize} records.
   *
   * @param format whether registered formatters run
   * @return at most {@code returnSize} rows as ordered name to value maps
   */
  List<Map<String, Object>> preview(int sampleSize, int returnSize, boolean format);

  /** Freezes the current pipeline into a plan for a backend. */
  ExecutionPlan plan(ComputeOptions options);

  /**
   * Plans and runs a full evaluation.
   *
   * @throws org.lazyframe.exception.SchemaException if the options or the selection are invalid
   * @throws org.lazyframe.exception.OperationException if the backend fails and errors are raised
   */
  ExecutionResult compute(ComputeOptions options, ExecutionBackend backend);
}
