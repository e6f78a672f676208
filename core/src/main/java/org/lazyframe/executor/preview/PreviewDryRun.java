/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor.preview;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.exception.OperationException;
import org.lazyframe.executor.RowTransform;
import org.lazyframe.executor.operator.CollectingSinkOperator;
import org.lazyframe.executor.operator.GroupAggregateOperator;
import org.lazyframe.executor.operator.LimitOperator;
import org.lazyframe.executor.operator.ListSourceOperator;
import org.lazyframe.executor.operator.ProjectionOperator;
import org.lazyframe.executor.operator.RowTransformOperator;
import org.lazyframe.input.SequencedRow;
import org.lazyframe.planner.aggregate.GroupAggregatePlan;
import org.lazyframe.planner.distributed.operator.Operator;
import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.pipeline.PipelineDriver;
import org.lazyframe.planner.join.JoinExecutor;
import org.lazyframe.planner.join.JoinPlan;

/**
 * Runs a pipeline over a small sample of records in the calling thread, so errors from user
 * functions and schema mistakes surface before a full evaluation. Each run drives source,
 * transform, optional aggregate, projection and limit operators into a collecting sink.
 */
@Log4j2
public final class PreviewDryRun {

  private PreviewDryRun() {}

  /** Preview of a plain table: the given slots of every row that passes the filters. */
  public static List<Map<String, Object>> rows(
      List<SequencedRow> sample,
      int width,
      RowTransform transform,
      List<String> names,
      List<Integer> slots,
      int returnSize) {
    List<Operator> operators =
        List.of(
            new RowTransformOperator(transform, context("transform")),
            new ProjectionOperator(slots, context("projection")),
            new LimitOperator(returnSize, context("limit")));
    return toMaps(names, drive(sample, width, operators));
  }

  /** Preview of a grouped or whole-table aggregate over the sample rows. */
  public static List<Map<String, Object>> aggregate(
      List<SequencedRow> sample,
      int width,
      RowTransform transform,
      GroupAggregatePlan plan,
      int returnSize) {
    List<Operator> operators =
        List.of(
            new RowTransformOperator(transform, context("transform")),
            new GroupAggregateOperator(plan, context("aggregate")),
            new LimitOperator(returnSize, context("limit")));
    return toMaps(plan.outputNames(), drive(sample, width, operators));
  }

  /** Preview of a join of the two samples, each side evaluated first. */
  public static List<Map<String, Object>> join(
      List<SequencedRow> leftSample,
      int leftWidth,
      RowTransform leftTransform,
      List<SequencedRow> rightSample,
      int rightWidth,
      RowTransform rightTransform,
      JoinPlan plan,
      int returnSize) {
    List<Object[]> left =
        drive(
            leftSample,
            leftWidth,
            List.of(
                new RowTransformOperator(leftTransform, context("left-transform")),
                new ProjectionOperator(plan.leftCarried(), context("left-carry"))));
    List<Object[]> right =
        drive(
            rightSample,
            rightWidth,
            List.of(
                new RowTransformOperator(rightTransform, context("right-transform")),
                new ProjectionOperator(plan.rightCarried(), context("right-carry"))));
    List<Object[]> joined = JoinExecutor.join(plan, left, right);
    return toMaps(plan.outputNames(), joined.subList(0, Math.min(returnSize, joined.size())));
  }

  /**
   * Runs {@code preview} and rethrows any failure as an {@link OperationException} whose message
   * is {@code message} followed by the original error.
   */
  public static <T> T errorPredetect(String message, Supplier<T> preview) {
    try {
      return preview.get();
    } catch (RuntimeException e) {
      log.debug("Preview failed: {}", message, e);
      throw new OperationException(
          String.format("%s (original error: %s)", message, e.getMessage()), e);
    }
  }

  private static List<Object[]> drive(
      List<SequencedRow> sample, int width, List<Operator> operators) {
    CollectingSinkOperator sink = new CollectingSinkOperator(context("sink"));
    new PipelineDriver(new ListSourceOperator(sample, width, context("source")), operators, sink)
        .run();
    return sink.getRows();
  }

  private static List<Map<String, Object>> toMaps(List<String> names, List<Object[]> rows) {
    List<Map<String, Object>> maps = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (int i = 0; i < names.size(); i++) {
        map.put(names.get(i), row[i]);
      }
      maps.add(map);
    }
    return ImmutableList.copyOf(maps);
  }

  private static OperatorContext context(String operatorId) {
    return OperatorContext.standalone("preview-" + operatorId);
  }
}
