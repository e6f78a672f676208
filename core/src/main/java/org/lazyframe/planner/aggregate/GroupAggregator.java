/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.aggregate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.lazyframe.planner.logical.AggregateSpec;
import org.lazyframe.planner.logical.GroupKey;

/**
 * Accumulates carried rows per group and emits one output row per group, in first-seen group
 * order. A whole-table aggregate emits exactly one row, even over no input.
 */
public class GroupAggregator {

  private final GroupAggregatePlan plan;
  private final Map<List<Object>, List<List<Object>>> groups = new LinkedHashMap<>();

  public GroupAggregator(GroupAggregatePlan plan) {
    this.plan = plan;
  }

  /** Adds one row in the carried layout. */
  public void add(Object[] carried) {
    List<Object> key = new ArrayList<>(plan.keys().size());
    for (GroupKey groupKey : plan.keys()) {
      key.add(groupKey.extract(carried));
    }
    List<List<Object>> values = groups.computeIfAbsent(key, k -> newValueLists());
    List<AggregateSpec> aggregates = plan.aggregates();
    for (int i = 0; i < aggregates.size(); i++) {
      values.get(i).add(carried[aggregates.get(i).sourceSlot()]);
    }
  }

  public int groupCount() {
    return groups.size();
  }

  /** Output rows in output-column order. */
  public List<Object[]> emit() {
    if (groups.isEmpty() && plan.isWholeTable()) {
      groups.put(List.of(), newValueLists());
    }
    List<Object[]> rows = new ArrayList<>(groups.size());
    groups.forEach((key, values) -> rows.add(project(emitted(key, values))));
    return rows;
  }

  private Object[] emitted(List<Object> key, List<List<Object>> values) {
    List<GroupKey> keys = plan.keys();
    List<AggregateSpec> aggregates = plan.aggregates();
    Object[] row = new Object[keys.size() + aggregates.size()];
    for (int i = 0; i < keys.size(); i++) {
      Function<Object, Object> formatter = plan.formatters().get(keys.get(i).slot());
      Object value = key.get(i);
      row[i] = formatter == null || value == null ? value : formatter.apply(value);
    }
    for (int i = 0; i < aggregates.size(); i++) {
      row[keys.size() + i] = aggregates.get(i).function().aggregate(values.get(i));
    }
    return row;
  }

  private Object[] project(Object[] emitted) {
    List<Integer> order = plan.outputOrder();
    Object[] out = new Object[order.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = emitted[order.get(i)];
    }
    return out;
  }

  private List<List<Object>> newValueLists() {
    List<List<Object>> lists = new ArrayList<>(plan.aggregates().size());
    for (int i = 0; i < plan.aggregates().size(); i++) {
      lists.add(new ArrayList<>());
    }
    return lists;
  }
}
