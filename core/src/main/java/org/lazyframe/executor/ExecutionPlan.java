/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.lazyframe.planner.aggregate.GroupAggregatePlan;
import org.lazyframe.planner.distributed.stage.StagedPlan;
import org.lazyframe.planner.join.JoinPlan;

/**
 * Frozen, backend-consumable description of one evaluation. Row plans project {@code
 * outputSlots} of each evaluated row; aggregate plans carry a {@link GroupAggregatePlan}; join
 * plans carry a {@link JoinPlan} and two sources, left first.
 */
@Getter
@Builder
@ToString(exclude = {"sources", "groupAggregate", "join"})
public class ExecutionPlan {

  private final String planId;
  private final PlanKind kind;
  @Singular private final List<TableSource> sources;
  @Singular private final List<String> outputNames;
  /** Slots written per row, in output order. Row plans only. */
  @Singular private final List<Integer> outputSlots;
  private final GroupAggregatePlan groupAggregate;
  private final JoinPlan join;
  private final StagedPlan stages;
  private final ComputeOptions options;
}
