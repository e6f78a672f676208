/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Filters, group-by keys and aggregates attached to one table. */
public class RowPipelineDescriptor {

  private final List<FilterSpec> filters = new ArrayList<>();
  private final List<GroupKey> groupKeys = new ArrayList<>();
  private final List<AggregateSpec> aggregates = new ArrayList<>();

  public void addFilter(FilterSpec filter) {
    filters.add(filter);
  }

  /** Replaces the group-by keys. */
  public void setGroupKeys(List<GroupKey> keys) {
    groupKeys.clear();
    groupKeys.addAll(keys);
  }

  public void addAggregate(AggregateSpec aggregate) {
    aggregates.add(aggregate);
  }

  public List<FilterSpec> getFilters() {
    return ImmutableList.copyOf(filters);
  }

  public List<GroupKey> getGroupKeys() {
    return ImmutableList.copyOf(groupKeys);
  }

  public List<AggregateSpec> getAggregates() {
    return ImmutableList.copyOf(aggregates);
  }

  public boolean isGrouped() {
    return !groupKeys.isEmpty();
  }

  /** Aggregates without group-by keys reduce the whole table to one row. */
  public boolean isWholeTableAggregate() {
    return groupKeys.isEmpty() && !aggregates.isEmpty();
  }

  public boolean hasAggregation() {
    return isGrouped() || !aggregates.isEmpty();
  }
}
