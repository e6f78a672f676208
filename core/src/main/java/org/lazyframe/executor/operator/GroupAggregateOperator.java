/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor.operator;

import org.lazyframe.planner.aggregate.GroupAggregatePlan;
import org.lazyframe.planner.aggregate.GroupAggregator;
import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.page.Page;
import org.lazyframe.planner.distributed.page.PageBuilder;

/**
 * Folds every evaluated row into its group and emits nothing until input ends. The single output
 * page has one row per group; its row ids are group ordinals.
 */
public class GroupAggregateOperator extends BufferedOperator {

  private final GroupAggregatePlan plan;
  private final GroupAggregator aggregator;

  public GroupAggregateOperator(GroupAggregatePlan plan, OperatorContext context) {
    super(context);
    this.plan = plan;
    this.aggregator = new GroupAggregator(plan);
  }

  @Override
  protected Page process(Page page) {
    for (int row = 0; row < page.getRowCount(); row++) {
      aggregator.add(plan.carry(page.getRow(row)));
    }
    return null;
  }

  @Override
  protected Page flush() {
    PageBuilder groups = new PageBuilder(plan.outputOrder().size());
    long ordinal = 0;
    for (Object[] row : aggregator.emit()) {
      groups.appendRow(ordinal++, row);
    }
    return groups.build();
  }
}
