/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.stage;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Ordered stage graph of one execution plan. A stage may only read from stages listed before it,
 * so list order is a valid run order and a join build always runs ahead of its probe. The last
 * stage writes the output.
 */
@Getter
public class StagedPlan {

  private final String planId;
  private final ImmutableList<ComputeStage> stages;

  public StagedPlan(String planId, List<ComputeStage> stages) {
    this.planId = planId;
    this.stages = ImmutableList.copyOf(stages);
  }

  public ComputeStage getRootStage() {
    if (stages.isEmpty()) {
      throw new IllegalStateException("Plan " + planId + " has no stages");
    }
    return Iterables.getLast(stages);
  }

  /** Stages that read a table directly rather than another stage. */
  public List<ComputeStage> getLeafStages() {
    return stages.stream().filter(ComputeStage::isLeaf).collect(Collectors.toList());
  }

  public ComputeStage getStage(String stageId) {
    for (ComputeStage stage : stages) {
      if (stage.getStageId().equals(stageId)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("No stage '" + stageId + "' in plan " + planId);
  }

  /** Whether {@code upstream} is reachable from {@code stageId} through its inputs. */
  public boolean dependsOn(String stageId, String upstream) {
    for (String input : getStage(stageId).getSourceStageIds()) {
      if (input.equals(upstream) || dependsOn(input, upstream)) {
        return true;
      }
    }
    return false;
  }

  /** Lists what is wrong with this graph; an empty list means it can run. */
  public List<String> validate() {
    List<String> problems = new ArrayList<>();
    if (planId == null || planId.isEmpty()) {
      problems.add("Plan ID is required");
    }
    if (stages.isEmpty()) {
      problems.add("Plan must have at least one stage");
    }
    Map<String, ComputeStage> listed = new LinkedHashMap<>();
    for (ComputeStage stage : stages) {
      String id = stage.getStageId();
      stage.getSourceStageIds().stream()
          .filter(input -> !listed.containsKey(input))
          .forEach(
              input ->
                  problems.add(
                      "Stage '" + id + "' depends on a stage not listed before it: " + input));
      if (listed.putIfAbsent(id, stage) != null) {
        problems.add("Duplicate stage id: " + id);
      }
    }
    return problems;
  }

  @Override
  public String toString() {
    return planId + stages;
  }
}
