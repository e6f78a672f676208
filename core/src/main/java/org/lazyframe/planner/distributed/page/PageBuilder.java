/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.page;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/** Collects rows and their sequence ids until a {@link Page} is cut from them. */
public class PageBuilder {

  private final int width;
  private final List<Object[]> rows = new ArrayList<>();
  private final List<Long> rowIds = new ArrayList<>();

  public PageBuilder(int width) {
    Preconditions.checkArgument(width >= 0, "Row width must be non-negative: %s", width);
    this.width = width;
  }

  /**
   * Adds one row.
   *
   * @throws IllegalArgumentException if the row is not {@code width} values wide
   */
  public PageBuilder appendRow(long rowId, Object[] row) {
    Preconditions.checkArgument(
        row.length == width, "Row of %s values does not fit page width %s", row.length, width);
    rows.add(row);
    rowIds.add(rowId);
    return this;
  }

  public int getRowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Cuts a page from the collected rows; the builder starts over empty. */
  public Page build() {
    Page page =
        new RowPage(
            rows.toArray(new Object[0][]),
            rowIds.stream().mapToLong(Long::longValue).toArray(),
            width);
    rows.clear();
    rowIds.clear();
    return page;
  }
}
