/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.stage;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * One step of a staged plan. It starts once every stage in {@link #getSourceStageIds()} has
 * completed, and its {@link #getOutputPartitioning()} says how its rows are exchanged.
 */
@Getter
public class ComputeStage {

  /** What a stage does with its rows. */
  public enum Kind {
    /** Read a table, evaluate its rows and pass them on. */
    SCAN,
    /** Group carried rows and compute aggregates. */
    AGGREGATE,
    /** Hash the smaller side of a join. */
    JOIN_BUILD,
    /** Match the other side of a join against the build side. */
    JOIN_PROBE,
    /** Write rows to the output file. */
    OUTPUT
  }

  private final String stageId;
  private final Kind kind;
  /** Index of the table this stage scans, or -1. */
  private final int tableIndex;
  private final PartitioningScheme outputPartitioning;
  private final ImmutableList<String> sourceStageIds;

  public ComputeStage(
      String stageId,
      Kind kind,
      int tableIndex,
      PartitioningScheme outputPartitioning,
      List<String> sourceStageIds) {
    this.stageId = stageId;
    this.kind = kind;
    this.tableIndex = tableIndex;
    this.outputPartitioning = outputPartitioning;
    this.sourceStageIds = ImmutableList.copyOf(sourceStageIds);
  }

  /** Leaf stages read a table and wait on no other stage. */
  public boolean isLeaf() {
    return sourceStageIds.isEmpty();
  }

  @Override
  public String toString() {
    return kind + "(" + stageId + ") <- " + sourceStageIds + " => " + outputPartitioning;
  }
}
