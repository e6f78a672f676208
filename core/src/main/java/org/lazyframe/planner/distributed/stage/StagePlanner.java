/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.stage;

import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.planner.aggregate.GroupAggregatePlan;
import org.lazyframe.planner.distributed.stage.ComputeStage.Kind;
import org.lazyframe.planner.join.JoinPlan;
import org.lazyframe.planner.logical.GroupKey;

/** Builds the stage graph of each plan shape. */
@Log4j2
public final class StagePlanner {

  private static final String OUTPUT = "output";

  private StagePlanner() {}

  /** scan, then output. */
  public static StagedPlan rowStages(String planId) {
    return build(
        planId,
        List.of(
            new ComputeStage("scan-0", Kind.SCAN, 0, PartitioningScheme.gather(), List.of()),
            output("scan-0")));
  }

  /**
   * Whole-table aggregates gather every row into one aggregator; grouped plans hash-partition the
   * carried rows on their key positions first.
   */
  public static StagedPlan aggregateStages(String planId, GroupAggregatePlan plan) {
    PartitioningScheme scanOutput =
        plan.isWholeTable()
            ? PartitioningScheme.gather()
            : PartitioningScheme.hashRepartition(
                plan.keys().stream()
                    .map(GroupKey::slot)
                    .distinct()
                    .collect(Collectors.toList()));
    return build(
        planId,
        List.of(
            new ComputeStage("scan-0", Kind.SCAN, 0, scanOutput, List.of()),
            new ComputeStage(
                "aggregate", Kind.AGGREGATE, -1, PartitioningScheme.gather(), List.of("scan-0")),
            output("aggregate")));
  }

  /**
   * The build side is scanned and partitioned first; the probe side is scanned and matched
   * partition by partition once the build stage is complete.
   */
  public static StagedPlan joinStages(String planId, JoinPlan plan) {
    int build = plan.buildLeft() ? 0 : 1;
    int probe = 1 - build;
    List<Integer> buildKeys = build == 0 ? plan.leftKeys() : plan.rightKeys();
    List<Integer> probeKeys = probe == 0 ? plan.leftKeys() : plan.rightKeys();
    String buildScan = "scan-" + build;
    String probeScan = "scan-" + probe;
    return build(
        planId,
        List.of(
            new ComputeStage(
                buildScan,
                Kind.SCAN,
                build,
                PartitioningScheme.hashRepartition(buildKeys),
                List.of()),
            new ComputeStage(
                "join-build",
                Kind.JOIN_BUILD,
                build,
                PartitioningScheme.none(),
                List.of(buildScan)),
            new ComputeStage(
                probeScan,
                Kind.SCAN,
                probe,
                PartitioningScheme.hashRepartition(probeKeys),
                List.of()),
            new ComputeStage(
                "join-probe",
                Kind.JOIN_PROBE,
                probe,
                PartitioningScheme.gather(),
                List.of("join-build", probeScan)),
            output("join-probe")));
  }

  private static ComputeStage output(String source) {
    return new ComputeStage(OUTPUT, Kind.OUTPUT, -1, PartitioningScheme.none(), List.of(source));
  }

  private static StagedPlan build(String planId, List<ComputeStage> stages) {
    StagedPlan staged = new StagedPlan(planId, stages);
    List<String> errors = staged.validate();
    if (!errors.isEmpty()) {
      throw new IllegalStateException("Invalid stage graph " + planId + ": " + errors);
    }
    log.debug("Stage graph {}", staged);
    return staged;
  }
}
