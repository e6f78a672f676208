/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

/**
 * Runs frozen execution plans. Implementations stream the plan's table sources, apply its
 * operators on parallel workers and write the output file, header first.
 *
 * <p>With {@link ComputeOptions#isRaiseOnError()} a failure aborts the run with an {@link
 * org.lazyframe.exception.OperationException} carrying the cause. Without it, failed partitions
 * are reported in the returned result and the remaining rows are still written.
 */
public interface ExecutionBackend {

  ExecutionResult execute(ExecutionPlan plan);
}
