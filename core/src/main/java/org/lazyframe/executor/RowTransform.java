/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.planner.logical.ColumnOperation;
import org.lazyframe.planner.logical.FinalizedPipeline;
import org.lazyframe.planner.logical.FilterSpec;
import org.lazyframe.planner.logical.RowPipelineDescriptor;

/**
 * Frozen per-row evaluation of one table: parse, operations, filters, then formatters when
 * enabled. Safe to share between workers.
 */
public final class RowTransform {

  private final List<Function<String, Object>> parsers;
  private final int slotCount;
  private final FinalizedPipeline pipeline;
  private final ImmutableList<FilterSpec> filters;
  private final boolean formatted;

  private RowTransform(
      List<Function<String, Object>> parsers,
      int slotCount,
      FinalizedPipeline pipeline,
      ImmutableList<FilterSpec> filters,
      boolean formatted) {
    this.parsers = Collections.unmodifiableList(parsers);
    this.slotCount = slotCount;
    this.pipeline = pipeline;
    this.filters = filters;
    this.formatted = formatted;
  }

  /**
   * Freezes the current state of a table.
   *
   * @param formatted whether the catalog's formatters run at the end of each row
   */
  public static RowTransform freeze(
      ColumnCatalog catalog, RowPipelineDescriptor descriptor, boolean formatted) {
    FinalizedPipeline pipeline = catalog.getOperations().finalizeWith(catalog.getFormatters());
    return new RowTransform(
        catalog.getParsers(),
        catalog.getSlotCount(),
        pipeline,
        ImmutableList.copyOf(descriptor.getFilters()),
        formatted);
  }

  public int getSlotCount() {
    return slotCount;
  }

  /**
   * Evaluates one record.
   *
   * @return the evaluated row indexed by slot, or null if a filter rejected it
   */
  public Object[] apply(String[] record) {
    Object[] row = new Object[slotCount];
    for (int slot = 0; slot < parsers.size(); slot++) {
      String text = slot < record.length ? record[slot] : null;
      Function<String, Object> parser = parsers.get(slot);
      row[slot] = parser == null || text == null ? text : parser.apply(text);
    }
    for (ColumnOperation operation : pipeline.operations()) {
      operation.apply(row);
    }
    for (FilterSpec filter : filters) {
      if (!filter.test(row)) {
        return null;
      }
    }
    if (formatted) {
      for (ColumnOperation formatter : pipeline.formatters()) {
        if (row[formatter.outputSlot()] != null) {
          formatter.apply(row);
        }
      }
    }
    return row;
  }
}
