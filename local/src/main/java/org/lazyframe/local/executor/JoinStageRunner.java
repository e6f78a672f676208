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
import java.util.function.Function;
import java.util.function.UnaryOperator;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.executor.ExecutionPlan;
import org.lazyframe.executor.TableSource;
import org.lazyframe.planner.distributed.stage.ComputeStage;
import org.lazyframe.planner.distributed.stage.StagedPlan;
import org.lazyframe.planner.join.JoinExecutor;
import org.lazyframe.planner.join.JoinPlan;

/**
 * Partitioned hash join. Both sides are scanned into hash partitions on their join keys, key
 * functions applied, build side first; then every partition pair is joined in memory on the
 * worker pool and written in partition order. Rows with equal keys share a partition, so the
 * per-partition joins add up to the full join.
 */
@Log4j2
class JoinStageRunner implements StageRunner {

  private final ParallelScanner scanner;
  private final ExecutorService pool;
  private final FailureCollector failures;
  private final Path spillDirectory;
  private final int partitionCount;

  JoinStageRunner(
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
    JoinPlan joinPlan = plan.getJoin();
    StagedPlan stages = plan.getStages();
    ComputeStage build = stages.getStage(stages.getStage("join-build").getSourceStageIds().get(0));
    ComputeStage probe =
        stages.getLeafStages().stream()
            .filter(s -> s != build)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Join plan has no probe scan"));
    boolean preserveOrder = plan.getOptions().isPreserveOrder();

    HashPartitions[] sides = new HashPartitions[2];
    try {
      for (ComputeStage scan : List.of(build, probe)) {
        int side = scan.getTableIndex();
        Function<Object[], Object> key = side == 0 ? joinPlan::leftKey : joinPlan::rightKey;
        sides[side] = new HashPartitions(spillDirectory, scan.getStageId(), partitionCount, key);
        TableSource source = plan.getSources().get(side);
        UnaryOperator<Object[]> carry = side == 0 ? joinPlan::carryLeft : joinPlan::carryRight;
        scanner.scan(
            source,
            scan.getStageId(),
            batch -> AggregateStageRunner.carried(source.transform(), carry, batch),
            sides[side]::addAll,
            preserveOrder);
      }

      String stageId = stages.getStage("join-probe").getStageId();
      List<Future<List<Object[]>>> joined = new ArrayList<>(partitionCount);
      for (int p = 0; p < partitionCount; p++) {
        SpillFile left = sides[0].get(p);
        SpillFile right = sides[1].get(p);
        Batch partition = new Batch(stageId + "/partition-" + p, List.of());
        joined.add(
            pool.submit(
                () ->
                    failures.guard(
                        partition,
                        () -> JoinExecutor.join(joinPlan, left.readAll(), right.readAll()))));
      }
      for (Future<List<Object[]>> future : joined) {
        List<Object[]> rows = ParallelScanner.await(future);
        if (rows != null) {
          writer.writeAll(rows);
        }
      }
      log.debug("Joined {} partition pair(s), build side {}", partitionCount, build.getStageId());
    } finally {
      for (HashPartitions partitions : sides) {
        if (partitions != null) {
          partitions.close();
        }
      }
    }
  }
}
