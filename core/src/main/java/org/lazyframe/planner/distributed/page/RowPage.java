/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.page;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/** {@link Page} over an array of evaluated rows and a parallel array of their sequence ids. */
public class RowPage implements Page {

  private final Object[][] rows;
  private final long[] rowIds;
  private final int width;

  public RowPage(Object[][] rows, long[] rowIds, int width) {
    Preconditions.checkArgument(
        rows.length == rowIds.length,
        "Row count %s does not match row id count %s",
        rows.length,
        rowIds.length);
    this.rows = rows;
    this.rowIds = rowIds;
    this.width = width;
  }

  @Override
  public int getRowCount() {
    return rows.length;
  }

  @Override
  public int getWidth() {
    return width;
  }

  @Override
  public Object getValue(int row, int column) {
    Preconditions.checkElementIndex(column, width, "column");
    return getRow(row)[column];
  }

  @Override
  public Object[] getRow(int row) {
    return rows[Preconditions.checkElementIndex(row, rows.length, "row")];
  }

  @Override
  public long getRowId(int row) {
    return rowIds[Preconditions.checkElementIndex(row, rows.length, "row")];
  }

  @Override
  public Page slice(int from, int length) {
    Preconditions.checkPositionIndexes(from, from + length, rows.length);
    return new RowPage(
        Arrays.copyOfRange(rows, from, from + length),
        Arrays.copyOfRange(rowIds, from, from + length),
        width);
  }
}
