/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.aggregate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.exception.SchemaException;
import org.lazyframe.planner.logical.AggregateSpec;
import org.lazyframe.planner.logical.GroupKey;
import org.lazyframe.planner.logical.RowPipelineDescriptor;

/** Computes the output schema and index remapping of a table carrying group-by/aggregate specs. */
@Log4j2
public final class GroupAggregateIndexer {

  private GroupAggregateIndexer() {}

  /**
   * Output schema after grouping: names of the live group keys in key order, then the aggregate
   * names in declaration order. A key whose column was deleted still groups but cannot be output.
   */
  public static ImmutableList<String> virtualSchema(
      ColumnCatalog catalog, RowPipelineDescriptor descriptor) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (GroupKey key : descriptor.getGroupKeys()) {
      if (!catalog.isDeleted(key.slot())) {
        names.add(catalog.nameOf(key.slot()));
      }
    }
    descriptor.getAggregates().forEach(a -> names.add(a.newName()));
    return names.build();
  }

  /**
   * Plans the group stage.
   *
   * @param select output names, or null/empty for the whole virtual schema
   * @throws SchemaException if a selected name is not in the virtual schema
   */
  public static GroupAggregatePlan plan(
      ColumnCatalog catalog, RowPipelineDescriptor descriptor, List<String> select) {
    List<GroupKey> keys = descriptor.getGroupKeys();
    List<AggregateSpec> aggregates = descriptor.getAggregates();
    ImmutableList<String> schema = virtualSchema(catalog, descriptor);
    List<String> output = select == null || select.isEmpty() ? schema : select;

    List<String> missing = new ArrayList<>();
    for (String name : output) {
      if (!schema.contains(name)) {
        missing.add(name);
      }
    }
    if (!missing.isEmpty()) {
      throw new SchemaException("Input includes non-existent column name(s): " + missing);
    }

    List<AggregateSpec> selected = new ArrayList<>();
    for (AggregateSpec aggregate : aggregates) {
      if (output.contains(aggregate.newName())) {
        selected.add(aggregate);
      }
    }

    TreeSet<Integer> carried = new TreeSet<>();
    keys.forEach(k -> carried.add(k.slot()));
    selected.forEach(a -> carried.add(a.sourceSlot()));
    ImmutableList<Integer> carriedSlots = ImmutableList.copyOf(carried);

    ImmutableList<GroupKey> shiftedKeys =
        keys.stream()
            .map(k -> k.withSlot(carriedSlots.indexOf(k.slot())))
            .collect(ImmutableList.toImmutableList());
    ImmutableList<AggregateSpec> shiftedAggregates =
        selected.stream()
            .map(a -> a.withSourceSlot(carriedSlots.indexOf(a.sourceSlot())))
            .collect(ImmutableList.toImmutableList());

    Map<Integer, Function<Object, Object>> formatters = new TreeMap<>();
    catalog
        .getFormatters()
        .forEach(
            (slot, formatter) -> {
              int position = carriedSlots.indexOf(slot);
              if (position >= 0) {
                formatters.put(position, formatter);
              }
            });

    List<String> emitted = new ArrayList<>();
    keys.forEach(
        k -> emitted.add(catalog.isDeleted(k.slot()) ? null : catalog.nameOf(k.slot())));
    selected.forEach(a -> emitted.add(a.newName()));
    ImmutableList<Integer> outputOrder =
        output.stream().map(emitted::indexOf).collect(ImmutableList.toImmutableList());

    log.debug(
        "Planned group stage: carriedSlots={}, outputOrder={}", carriedSlots, outputOrder);
    return new GroupAggregatePlan(
        carriedSlots,
        shiftedKeys,
        shiftedAggregates,
        ImmutableMap.copyOf(formatters),
        ImmutableList.copyOf(output),
        outputOrder);
  }
}
