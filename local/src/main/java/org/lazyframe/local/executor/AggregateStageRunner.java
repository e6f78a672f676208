/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.executor.ExecutionPlan;
import org.lazyframe.executor.RowTransform;
import org.lazyframe.executor.TableSource;
import org.lazyframe.input.SequencedRow;
import org.lazyframe.planner.aggregate.GroupAggregatePlan;
import org.lazyframe.planner.aggregate.GroupAggregator;
import org.lazyframe.planner.distributed.stage.ComputeStage;
import org.lazyframe.planner.distributed.stage.ExchangeType;
import org.lazyframe.planner.logical.GroupKey;

/**
 * Group-by and whole-table aggregation. The scan stage spills carried rows to hash partitions on
 * their group key; the aggregate stage then reduces every partition in memory on the worker pool
 * and writes groups partition by partition. A whole-table aggregate gathers into one partition.
 */
@Log4j2
class AggregateStageRunner implements StageRunner {

  private final ParallelScanner scanner;
  private final ExecutorService pool;
  private final FailureCollector failures;
  private final Path spillDirectory;
  private final int partitionCount;

  AggregateStageRunner(
      ParallelScanner scanner,
      ExecutorService pool,
      FailureCollector failures,
      Path spillDirectory,
      int partitionCount) {
    this.scanner = scanner;
    this.pool = pool;
    this.failures = failures;
    this.spillDirectory = spillDirectory;
    this.partitionCount = partitionCount;
  }

  @Override
  public void run(ExecutionPlan plan, CsvOutputWriter writer) {
    GroupAggregatePlan groupPlan = plan.getGroupAggregate();
    ComputeStage scan = plan.getStages().getLeafStages().get(0);
    TableSource source = plan.getSources().get(scan.getTableIndex());
    boolean gather = scan.getOutputPartitioning().getExchangeType() == ExchangeType.GATHER;
    int count = gather ? 1 : partitionCount;

    try (HashPartitions partitions =
        new HashPartitions(
            spillDirectory, scan.getStageId(), count, row -> keyOf(groupPlan, row))) {
      scanner.scan(
          source,
          scan.getStageId(),
          batch -> carried(source.transform(), groupPlan::carry, batch),
          partitions::addAll,
          false);

      String stageId = plan.getStages().getStage("aggregate").getStageId();
      List<Future<List<Object[]>>> reduced = new ArrayList<>(count);
      for (int p = 0; p < count; p++) {
        SpillFile file = partitions.get(p);
        Batch partition = new Batch(stageId + "/partition-" + p, List.of());
        reduced.add(pool.submit(() -> failures.guard(partition, () -> reduce(groupPlan, file))));
      }
      for (Future<List<Object[]>> future : reduced) {
        List<Object[]> rows = ParallelScanner.await(future);
        if (rows != null) {
          writer.writeAll(rows);
        }
      }
      log.debug("Aggregated {} partition(s) of {}", count, source.path());
    }
  }

  private static List<Object[]> reduce(GroupAggregatePlan plan, SpillFile file) {
    GroupAggregator aggregator = new GroupAggregator(plan);
    file.readAll().forEach(aggregator::add);
    return aggregator.emit();
  }

  private static Object keyOf(GroupAggregatePlan plan, Object[] carried) {
    List<Object> key = new ArrayList<>(plan.keys().size());
    for (GroupKey groupKey : plan.keys()) {
      key.add(groupKey.extract(carried));
    }
    return key;
  }

  /** Evaluates a batch and projects the surviving rows with {@code carry}. */
  static List<Object[]> carried(
      RowTransform transform, UnaryOperator<Object[]> carry, Batch batch) {
    List<Object[]> out = new ArrayList<>(batch.rows().size());
    for (SequencedRow record : batch.rows()) {
      Object[] row = transform.apply(record.values());
      if (row != null) {
        out.add(carry.apply(row));
      }
    }
    return out;
  }
}
