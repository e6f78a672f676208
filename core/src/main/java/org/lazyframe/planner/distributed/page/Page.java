/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.page;

/**
 * Rows moving between operators. Every row remembers the sequence id of the input record it was
 * evaluated from, so a failing batch can be reported by row range.
 */
public interface Page {

  int getRowCount();

  /** Values per row. */
  int getWidth();

  /** Cell {@code column} of row {@code row}; null cells are null. */
  Object getValue(int row, int column);

  /** Row {@code row}, shared with the page. */
  Object[] getRow(int row);

  long getRowId(int row);

  /** Rows {@code from} to {@code from + length}, exclusive, with their ids. */
  Page slice(int from, int length);

  static Page empty(int width) {
    return new RowPage(new Object[0][], new long[0], width);
  }
}
