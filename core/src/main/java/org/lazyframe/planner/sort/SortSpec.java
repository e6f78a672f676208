/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.sort;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.exception.SchemaException;

/** Ordered sort keys parsed from an order list such as {@code ["+", "Dept", "-", "Salary"]}. */
public record SortSpec(ImmutableList<SortKey> keys) {

  private static final String MALFORMED = "The order list is not in the correct format.";

  /**
   * Parses an order list alternating a direction marker ({@code +} ascending, {@code -}
   * descending) and a column name. Sorting reads the raw file, so every column must be one of the
   * file's columns.
   *
   * @throws SchemaException if the list is empty, does not alternate, or names an unknown or
   *     derived column
   */
  public static SortSpec parse(List<String> order, ColumnCatalog catalog) {
    if (order == null || order.isEmpty() || order.size() % 2 != 0) {
      throw new SchemaException(MALFORMED);
    }
    ImmutableList.Builder<SortKey> keys = ImmutableList.builder();
    for (int i = 0; i < order.size(); i += 2) {
      String direction = order.get(i);
      String column = order.get(i + 1);
      if (!"+".equals(direction) && !"-".equals(direction)) {
        throw new SchemaException(MALFORMED);
      }
      if (column == null || !catalog.contains(column)) {
        throw new SchemaException(MALFORMED + " Unknown column: " + column);
      }
      int slot = catalog.resolve(column);
      if (!catalog.isFileBacked(slot)) {
        throw new SchemaException(
            MALFORMED + " Column " + column + " is not a column of the input file.");
      }
      keys.add(new SortKey(column, slot, "-".equals(direction), false));
    }
    return new SortSpec(keys.build());
  }
}
