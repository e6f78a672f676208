/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.frame;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.common.setting.LazyFrameSettings;
import org.lazyframe.exception.SchemaException;
import org.lazyframe.executor.ComputeOptions;
import org.lazyframe.executor.ExecutionBackend;
import org.lazyframe.executor.ExecutionPlan;
import org.lazyframe.executor.ExecutionResult;
import org.lazyframe.executor.PlanKind;
import org.lazyframe.executor.RowTransform;
import org.lazyframe.executor.preview.PreviewDryRun;
import org.lazyframe.planner.distributed.stage.StagePlanner;
import org.lazyframe.planner.join.JoinPlan;
import org.lazyframe.planner.join.JoinPlanner;
import org.lazyframe.planner.join.JoinSpec;

/**
 * The join of two {@link DataFrame}s. Only selection, preview and evaluation are supported. Both
 * inputs stay live: changes made to them afterwards show up in the join.
 */
@Log4j2
public class JoinedDataFrame implements LazyFrame {

  @Getter private final JoinSpec spec;
  /** Input on the left of the output schema, which is the second argument of a right join. */
  @Getter private final DataFrame left;

  @Getter private final DataFrame right;

  JoinedDataFrame(JoinSpec spec, DataFrame left, DataFrame right) {
    this.spec = spec;
    this.left = left;
    this.right = right;
  }

  @Override
  public List<String> getColNames() {
    return JoinPlanner.outputSchema(spec);
  }

  @Override
  public List<Map<String, Object>> preview(int sampleSize, int returnSize, boolean format) {
    if (sampleSize < 0 || returnSize < 0) {
      throw new SchemaException("Arguments passed to preview must be non-negative integers.");
    }
    JoinPlan plan = JoinPlanner.plan(spec, null);
    return PreviewDryRun.join(
        left.getSource().sample(sampleSize),
        left.getCatalog().getSourceWidth(),
        RowTransform.freeze(left.getCatalog(), left.getDescriptor(), false),
        right.getSource().sample(sampleSize),
        right.getCatalog().getSourceWidth(),
        RowTransform.freeze(right.getCatalog(), right.getDescriptor(), false),
        format ? plan : plan.withoutFormatters(),
        returnSize);
  }

  /** Preview with the configured sizes, formatters off. */
  public List<Map<String, Object>> preview() {
    return preview(
        left.getSettings().get(LazyFrameSettings.PREVIEW_SAMPLE_SIZE),
        left.getSettings().get(LazyFrameSettings.PREVIEW_RETURN_SIZE),
        false);
  }

  @Override
  public ExecutionPlan plan(ComputeOptions options) {
    options.validate(left.getSettings().get(LazyFrameSettings.MAX_WORKERS));
    ImmutableList<String> select = options.resolveSelection(getColNames());
    JoinPlan joinPlan = JoinPlanner.plan(spec, select);
    String planId = FrameSupport.newPlanId();
    ExecutionPlan plan =
        ExecutionPlan.builder()
            .planId(planId)
            .kind(PlanKind.JOIN)
            .source(left.tableSource(false))
            .source(right.tableSource(false))
            .outputNames(joinPlan.outputNames())
            .join(joinPlan)
            .stages(StagePlanner.joinStages(planId, joinPlan))
            .options(options)
            .build();
    log.info(
        "Created {} join plan {} over {} and {}",
        spec.type(),
        planId,
        left.getPath(),
        right.getPath());
    return plan;
  }

  @Override
  public ExecutionResult compute(ComputeOptions options, ExecutionBackend backend) {
    return FrameSupport.execute(backend, plan(options));
  }

  @Override
  public String toString() {
    return "JoinedDataFrame{type=" + spec.type() + ", columns=" + getColNames() + '}';
  }
}
