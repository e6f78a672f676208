/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.aggregate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.function.Function;
import org.lazyframe.planner.logical.AggregateSpec;
import org.lazyframe.planner.logical.GroupKey;

/**
 * Index mapping of a group-by/aggregate evaluation. Rows entering the group stage carry only
 * {@code carriedSlots}; keys, aggregate sources and formatters are expressed as positions in that
 * carried layout. A group emits its keys followed by the selected aggregates, and {@code
 * outputOrder} maps every output column onto that emitted row.
 *
 * @param carriedSlots sorted distinct source slots kept through the group stage
 * @param keys group keys, slots re-keyed to carried positions
 * @param aggregates selected aggregates in declaration order, sources re-keyed
 * @param formatters formatters keyed by carried position, applied to emitted key values
 * @param outputNames output column names in output order
 * @param outputOrder emitted-row position of every output column
 */
public record GroupAggregatePlan(
    ImmutableList<Integer> carriedSlots,
    ImmutableList<GroupKey> keys,
    ImmutableList<AggregateSpec> aggregates,
    ImmutableMap<Integer, Function<Object, Object>> formatters,
    ImmutableList<String> outputNames,
    ImmutableList<Integer> outputOrder) {

  /** Projects an evaluated row onto the carried layout. */
  public Object[] carry(Object[] row) {
    Object[] carried = new Object[carriedSlots.size()];
    for (int i = 0; i < carried.length; i++) {
      carried[i] = row[carriedSlots.get(i)];
    }
    return carried;
  }

  /** The same plan emitting raw key values. */
  public GroupAggregatePlan withoutFormatters() {
    return new GroupAggregatePlan(
        carriedSlots, keys, aggregates, ImmutableMap.of(), outputNames, outputOrder);
  }

  public boolean isWholeTable() {
    return keys.isEmpty();
  }
}
