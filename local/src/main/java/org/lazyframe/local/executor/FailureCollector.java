/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.exception.OperationException;
import org.lazyframe.executor.FailedPartition;

/**
 * Runs batch work and decides what a failure means: with {@code raiseOnError} the evaluation
 * aborts, otherwise the batch is skipped and recorded as a {@link FailedPartition}.
 */
@Log4j2
class FailureCollector {

  private final boolean raiseOnError;
  private final ConcurrentLinkedQueue<FailedPartition> failures = new ConcurrentLinkedQueue<>();

  FailureCollector(boolean raiseOnError) {
    this.raiseOnError = raiseOnError;
  }

  /** Result of {@code work}, or null if it failed and failures are being collected. */
  <T> T guard(Batch batch, Supplier<T> work) {
    try {
      return work.get();
    } catch (RuntimeException e) {
      String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      if (raiseOnError) {
        throw new OperationException(
            String.format(
                "Error in partition %s (original error: %s)", batch.partitionId(), message),
            e);
      }
      log.warn(
          "Partition {} failed on rows {}..{}: {}",
          batch.partitionId(),
          batch.firstRowId(),
          batch.lastRowId(),
          message);
      failures.add(
          new FailedPartition(batch.partitionId(), batch.firstRowId(), batch.lastRowId(), message));
      return null;
    }
  }

  /** Failures grouped by stage, in row order. */
  List<FailedPartition> getFailures() {
    return failures.stream()
        .sorted(
            Comparator.comparing((FailedPartition f) -> stageOf(f.partitionId()))
                .thenComparingLong(FailedPartition::firstRowId))
        .collect(ImmutableList.toImmutableList());
  }

  private static String stageOf(String partitionId) {
    int slash = partitionId.indexOf('/');
    return slash < 0 ? partitionId : partitionId.substring(0, slash);
  }
}
